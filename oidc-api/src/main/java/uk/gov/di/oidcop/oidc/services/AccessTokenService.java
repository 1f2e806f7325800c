package uk.gov.di.oidcop.oidc.services;

import com.nimbusds.oauth2.sdk.token.AccessToken;
import com.nimbusds.oauth2.sdk.token.AccessTokenType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.oidc.entity.AccessTokenInfo;
import uk.gov.di.oidcop.shared.entity.TokenType;
import uk.gov.di.oidcop.shared.exceptions.AccessTokenException;
import uk.gov.di.oidcop.shared.exceptions.ExpiredOrRevokedTokenException;
import uk.gov.di.oidcop.shared.exceptions.StaleAuthenticationException;
import uk.gov.di.oidcop.shared.exceptions.TokenErrors;
import uk.gov.di.oidcop.shared.exceptions.TokenNotFoundException;
import uk.gov.di.oidcop.shared.exceptions.WrongTokenKindException;
import uk.gov.di.oidcop.shared.helpers.NowHelper.NowClock;
import uk.gov.di.oidcop.shared.services.SessionManager;

import java.time.Clock;

public class AccessTokenService {

    private static final Logger LOG = LogManager.getLogger(AccessTokenService.class);

    private final SessionManager sessionManager;
    private final NowClock clock;

    public AccessTokenService(SessionManager sessionManager) {
        this(sessionManager, Clock.systemUTC());
    }

    public AccessTokenService(SessionManager sessionManager, Clock clock) {
        this.sessionManager = sessionManager;
        this.clock = new NowClock(clock);
    }

    public String getAccessTokenFromAuthorizationHeader(String authorizationHeader)
            throws AccessTokenException {
        try {
            return AccessToken.parse(authorizationHeader, AccessTokenType.BEARER).getValue();
        } catch (com.nimbusds.oauth2.sdk.ParseException e) {
            LOG.warn("Unable to extract bearer token from authorization header");
            throw new AccessTokenException(
                    "Unable to extract bearer token", TokenErrors.INVALID_TOKEN);
        }
    }

    public AccessTokenInfo resolve(String accessToken) throws TokenNotFoundException {
        var resolved = sessionManager.resolveToken(accessToken);
        return new AccessTokenInfo(resolved.session(), resolved.grant(), resolved.token());
    }

    /**
     * Checks, in order, that the token exists, is an access token, is neither expired nor
     * revoked and that the authentication it rests on is still fresh.
     */
    public AccessTokenInfo validate(String accessToken) throws AccessTokenException {
        var info = resolve(accessToken);
        var token = info.token();
        var now = clock.nowEpochSecond();

        if (token.getType() != TokenType.ACCESS_TOKEN) {
            throw new WrongTokenKindException(
                    String.format("Expected access_token but got %s", token.getType().getValue()));
        }
        if (token.isRevoked()) {
            throw new ExpiredOrRevokedTokenException("Access token has been revoked");
        }
        if (token.isExpired(now)) {
            throw new ExpiredOrRevokedTokenException(
                    String.format("Access token expired at %d", token.getExpiresAt()));
        }
        var authenticationEvent = info.grant().getAuthenticationEvent();
        if (authenticationEvent == null || !authenticationEvent.isValid(now)) {
            throw new StaleAuthenticationException("Authentication is no longer valid");
        }
        return info;
    }
}
