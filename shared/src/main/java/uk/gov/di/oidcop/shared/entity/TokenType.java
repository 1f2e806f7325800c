package uk.gov.di.oidcop.shared.entity;

import java.util.Arrays;
import java.util.Optional;

public enum TokenType {
    AUTHORIZATION_CODE("authorization_code"),
    ACCESS_TOKEN("access_token"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    TokenType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<TokenType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
