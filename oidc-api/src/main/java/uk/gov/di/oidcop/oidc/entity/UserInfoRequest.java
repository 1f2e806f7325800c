package uk.gov.di.oidcop.oidc.entity;

import com.nimbusds.oauth2.sdk.token.BearerTokenError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** A parsed UserInfo request. Carries an error instead of a client when parsing failed. */
public record UserInfoRequest(String clientId, String accessToken, BearerTokenError error) {

    public static UserInfoRequest failed(String accessToken, BearerTokenError error) {
        return new UserInfoRequest(null, accessToken, error);
    }

    public Optional<BearerTokenError> getError() {
        return Optional.ofNullable(error);
    }

    public Map<String, String> toParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (error != null) {
            parameters.put("error", error.getCode());
            parameters.put("error_description", error.getDescription());
            return parameters;
        }
        parameters.put("client_id", clientId);
        parameters.put("access_token", accessToken);
        return parameters;
    }
}
