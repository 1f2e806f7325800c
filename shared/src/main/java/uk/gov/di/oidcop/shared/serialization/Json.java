package uk.gov.di.oidcop.shared.serialization;

import java.lang.reflect.Type;

public interface Json {
    <T> T readValue(String body, Class<T> klass) throws JsonException;

    <T> T readValue(String body, Type type) throws JsonException;

    String writeValueAsString(Object object);

    class JsonException extends Exception {
        public JsonException(Exception e) {
            super(e);
        }

        public JsonException(String message) {
            super(message);
        }
    }
}
