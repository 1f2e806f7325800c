package uk.gov.di.oidcop.oidc.entity;

import com.nimbusds.oauth2.sdk.token.BearerTokenError;
import com.nimbusds.openid.connect.sdk.claims.UserInfo;

import java.util.LinkedHashMap;
import java.util.Map;

public class UserInfoResult {

    private final UserInfo userInfo;
    private final String clientId;
    private final BearerTokenError error;

    private UserInfoResult(UserInfo userInfo, String clientId, BearerTokenError error) {
        this.userInfo = userInfo;
        this.clientId = clientId;
        this.error = error;
    }

    public static UserInfoResult success(UserInfo userInfo, String clientId) {
        return new UserInfoResult(userInfo, clientId, null);
    }

    public static UserInfoResult error(BearerTokenError error) {
        return new UserInfoResult(null, null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public UserInfo getUserInfo() {
        return userInfo;
    }

    public String getClientId() {
        return clientId;
    }

    public BearerTokenError getError() {
        return error;
    }

    /** The claims released, or exactly {@code error} and {@code error_description}. */
    public Map<String, Object> getResponseArgs() {
        if (isError()) {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("error", error.getCode());
            args.put("error_description", error.getDescription());
            return args;
        }
        return new LinkedHashMap<>(userInfo.toJSONObject());
    }
}
