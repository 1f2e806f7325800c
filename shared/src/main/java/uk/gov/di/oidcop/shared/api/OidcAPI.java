package uk.gov.di.oidcop.shared.api;

import uk.gov.di.oidcop.shared.services.ConfigurationService;

import java.net.URI;

import static uk.gov.di.oidcop.shared.helpers.ConstructUriHelper.buildURI;

public class OidcAPI {

    public static final String DEFAULT_BASE_URL = "http://localhost";

    private final String oidcApiBaseUrl;

    public OidcAPI(ConfigurationService configurationService) {
        oidcApiBaseUrl = configurationService.getOidcApiBaseURL().orElse(DEFAULT_BASE_URL);
    }

    public String issuer() {
        return oidcApiBaseUrl;
    }

    public URI jwksURI() {
        return buildURI(oidcApiBaseUrl, ".well-known/jwks.json");
    }

    public URI tokenURI() {
        return buildURI(oidcApiBaseUrl, "token");
    }

    public URI userInfoURI() {
        return buildURI(oidcApiBaseUrl, "userinfo");
    }

    public URI authorizeURI() {
        return buildURI(oidcApiBaseUrl, "authorize");
    }
}
