package uk.gov.di.oidcop.shared.exceptions;

import com.nimbusds.oauth2.sdk.OAuth2Error;
import com.nimbusds.oauth2.sdk.token.BearerTokenError;

public final class TokenErrors {

    public static final BearerTokenError INVALID_TOKEN =
            new BearerTokenError(BearerTokenError.INVALID_TOKEN.getCode(), "Invalid Token", 401);

    public static final BearerTokenError WRONG_TYPE_OF_TOKEN =
            new BearerTokenError(
                    BearerTokenError.INVALID_TOKEN.getCode(), "Wrong type of token", 401);

    public static final BearerTokenError ACCESS_NOT_GRANTED =
            new BearerTokenError(OAuth2Error.INVALID_REQUEST_CODE, "Access not granted", 400);

    public static final BearerTokenError MISSING_TOKEN =
            new BearerTokenError(
                    OAuth2Error.INVALID_REQUEST_CODE, "No access token in request", 400);

    private TokenErrors() {}
}
