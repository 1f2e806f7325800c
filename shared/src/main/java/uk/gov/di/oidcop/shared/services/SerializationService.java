package uk.gov.di.oidcop.shared.services;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.serialization.Json;

import java.lang.reflect.Type;

import static java.util.Objects.isNull;

public class SerializationService implements Json {

    private static SerializationService INSTANCE;
    private static final Logger LOG = LogManager.getLogger(SerializationService.class);

    private final Gson gsonWithUnderscores;

    public SerializationService() {
        gsonWithUnderscores =
                new GsonBuilder()
                        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                        .excludeFieldsWithoutExposeAnnotation()
                        .disableHtmlEscaping()
                        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
                        .create();
    }

    @Override
    public <T> T readValue(String jsonString, Class<T> clazz) throws JsonException {
        return readValue(jsonString, (Type) clazz);
    }

    @Override
    public <T> T readValue(String jsonString, Type type) throws JsonException {
        if (isNull(jsonString) || jsonString.isBlank()) {
            throw new JsonException("Cannot deserialize empty JSON");
        }
        try {
            T value = gsonWithUnderscores.fromJson(jsonString, type);
            if (isNull(value)) {
                throw new JsonException("JSON deserialized to null");
            }
            return value;
        } catch (JsonParseException | IllegalArgumentException e) {
            LOG.error("Error during JSON deserialization", e);
            throw new JsonException(e);
        }
    }

    @Override
    public String writeValueAsString(Object object) {
        return gsonWithUnderscores.toJson(object);
    }

    public static SerializationService getInstance() {
        if (isNull(INSTANCE)) {
            INSTANCE = new SerializationService();
        }
        return INSTANCE;
    }
}
