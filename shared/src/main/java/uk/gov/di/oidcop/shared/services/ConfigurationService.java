package uk.gov.di.oidcop.shared.services;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class ConfigurationService {

    public static final String FEATURE_SWITCH_OFF = "false";
    public static final String FEATURE_SWITCH_ON = "true";
    private static ConfigurationService configurationService;

    public static ConfigurationService getInstance() {
        if (configurationService == null) {
            configurationService = new ConfigurationService();
        }
        return configurationService;
    }

    public ConfigurationService() {}

    // Please keep the method names in alphabetical order so we can find stuff more easily.
    public long getAccessTokenExpiry() {
        return Long.parseLong(System.getenv().getOrDefault("ACCESS_TOKEN_EXPIRY", "180"));
    }

    public long getAuthCodeExpiry() {
        return Long.parseLong(System.getenv().getOrDefault("AUTH_CODE_EXPIRY", "300"));
    }

    public long getAuthnEventLifetime() {
        return Long.parseLong(System.getenv().getOrDefault("AUTHN_EVENT_LIFETIME", "3600"));
    }

    public Optional<List<String>> getClaimsSupported() {
        return Optional.ofNullable(System.getenv("CLAIMS_SUPPORTED"))
                .filter(s -> !s.isBlank())
                .map(
                        s ->
                                Arrays.stream(s.split(","))
                                        .map(String::trim)
                                        .filter(c -> !c.isEmpty())
                                        .collect(Collectors.toList()));
    }

    public Optional<String> getClientRegistry() {
        return Optional.ofNullable(System.getenv("CLIENT_REGISTRY")).filter(s -> !s.isBlank());
    }

    public Optional<String> getCustomScopes() {
        return Optional.ofNullable(System.getenv("CUSTOM_SCOPES")).filter(s -> !s.isBlank());
    }

    public boolean getHeadersCaseInsensitive() {
        return System.getenv()
                .getOrDefault("HEADERS_CASE_INSENSITIVE", FEATURE_SWITCH_ON)
                .equals(FEATURE_SWITCH_ON);
    }

    public Optional<String> getOidcApiBaseURL() {
        return Optional.ofNullable(System.getenv("OIDC_API_BASE_URL"));
    }

    public long getRefreshTokenExpiry() {
        return Long.parseLong(System.getenv().getOrDefault("REFRESH_TOKEN_EXPIRY", "86400"));
    }

    public Optional<String> getSubjectSalt() {
        return Optional.ofNullable(System.getenv("SUBJECT_SALT")).filter(s -> !s.isBlank());
    }

    public Optional<String> getTokenHandlerSecret() {
        return Optional.ofNullable(System.getenv("TOKEN_HANDLER_SECRET"))
                .filter(s -> !s.isBlank());
    }

    public Optional<String> getTokenSigningJwks() {
        return Optional.ofNullable(System.getenv("TOKEN_SIGNING_JWKS")).filter(s -> !s.isBlank());
    }

    public Optional<String> getUserInfoStore() {
        return Optional.ofNullable(System.getenv("USER_INFO_STORE")).filter(s -> !s.isBlank());
    }

    public boolean isAddClaimsByScopeEnabled() {
        return System.getenv()
                .getOrDefault("ADD_CLAIMS_BY_SCOPE", FEATURE_SWITCH_OFF)
                .equals(FEATURE_SWITCH_ON);
    }

    public boolean isBearerBodyEnabled() {
        return System.getenv()
                .getOrDefault("BEARER_BODY_ENABLED", FEATURE_SWITCH_ON)
                .equals(FEATURE_SWITCH_ON);
    }
}
