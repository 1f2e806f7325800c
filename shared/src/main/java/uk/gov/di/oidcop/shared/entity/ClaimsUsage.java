package uk.gov.di.oidcop.shared.entity;

public enum ClaimsUsage {
    USERINFO("userinfo"),
    ID_TOKEN("id_token"),
    INTROSPECTION("introspection");

    private final String value;

    ClaimsUsage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
