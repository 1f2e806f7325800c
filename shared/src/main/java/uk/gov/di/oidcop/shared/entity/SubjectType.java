package uk.gov.di.oidcop.shared.entity;

import java.util.Arrays;
import java.util.Optional;

public enum SubjectType {
    PUBLIC("public"),
    PAIRWISE("pairwise"),
    EPHEMERAL("ephemeral");

    private final String value;

    SubjectType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<SubjectType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equalsIgnoreCase(value)).findFirst();
    }
}
