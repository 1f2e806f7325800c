package uk.gov.di.oidcop.oidc.services;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.oauth2.sdk.ErrorObject;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.id.Subject;
import com.nimbusds.oauth2.sdk.token.BearerTokenError;
import com.nimbusds.openid.connect.sdk.UserInfoErrorResponse;
import com.nimbusds.openid.connect.sdk.UserInfoResponse;
import com.nimbusds.openid.connect.sdk.UserInfoSuccessResponse;
import com.nimbusds.openid.connect.sdk.claims.UserInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.oidc.entity.AccessTokenInfo;
import uk.gov.di.oidcop.oidc.entity.UserInfoRequest;
import uk.gov.di.oidcop.oidc.entity.UserInfoResult;
import uk.gov.di.oidcop.shared.entity.ClaimsUsage;
import uk.gov.di.oidcop.shared.entity.ClientRegistry;
import uk.gov.di.oidcop.shared.exceptions.AccessTokenException;
import uk.gov.di.oidcop.shared.exceptions.ClientNotFoundException;
import uk.gov.di.oidcop.shared.exceptions.TokenErrors;
import uk.gov.di.oidcop.shared.exceptions.TokenNotFoundException;
import uk.gov.di.oidcop.shared.helpers.NowHelper;
import uk.gov.di.oidcop.shared.services.ClaimsService;
import uk.gov.di.oidcop.shared.services.ClientService;
import uk.gov.di.oidcop.shared.services.ConfigurationService;
import uk.gov.di.oidcop.shared.services.JwtSigningService;

import java.util.Map;
import java.util.Optional;

import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.GRANT_ID;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.attachLogFieldToLogs;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.attachSessionIdToLogs;
import static uk.gov.di.oidcop.shared.helpers.RequestHeaderHelper.getOptionalHeaderValueFromHeaders;

/**
 * The UserInfo endpoint: parses the bearer credential from a request, re-validates the session
 * behind it, resolves the released claims and builds the response. Failures are returned as
 * values carrying a bearer token error.
 */
public class UserInfoService {

    private static final Logger LOG = LogManager.getLogger(UserInfoService.class);

    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String ACCESS_TOKEN_PARAM = "access_token";
    private static final String ACR_CLAIM = "acr";

    private final ConfigurationService configurationService;
    private final AccessTokenService accessTokenService;
    private final ClaimsService claimsService;
    private final ClientService clientService;
    private final JwtSigningService signingService;
    private final String issuer;

    public UserInfoService(
            ConfigurationService configurationService,
            AccessTokenService accessTokenService,
            ClaimsService claimsService,
            ClientService clientService,
            JwtSigningService signingService,
            String issuer) {
        this.configurationService = configurationService;
        this.accessTokenService = accessTokenService;
        this.claimsService = claimsService;
        this.clientService = clientService;
        this.signingService = signingService;
        this.issuer = issuer;
    }

    public UserInfoRequest parseRequest(
            Map<String, String> parameters, Map<String, String> headers) {
        var accessToken = extractAccessToken(parameters, headers);
        if (accessToken.isEmpty()) {
            LOG.warn("Access token is missing from request");
            return UserInfoRequest.failed(null, TokenErrors.MISSING_TOKEN);
        }
        try {
            var accessTokenInfo = accessTokenService.resolve(accessToken.get());
            return new UserInfoRequest(accessTokenInfo.clientID(), accessToken.get(), null);
        } catch (TokenNotFoundException e) {
            LOG.warn("Unable to resolve access token: {}", e.getMessage());
            return UserInfoRequest.failed(accessToken.get(), TokenErrors.INVALID_TOKEN);
        }
    }

    public UserInfoResult processRequest(UserInfoRequest request) {
        if (request.getError().isPresent()) {
            return UserInfoResult.error(request.error());
        }
        AccessTokenInfo accessTokenInfo;
        try {
            accessTokenInfo = accessTokenService.validate(request.accessToken());
        } catch (AccessTokenException e) {
            LOG.warn("{}: {}", e.getClass().getSimpleName(), e.getMessage());
            return UserInfoResult.error(toBearerTokenError(e.getError()));
        }

        var session = accessTokenInfo.session();
        var grant = accessTokenInfo.grant();
        attachSessionIdToLogs(session.getSessionId());
        attachLogFieldToLogs(GRANT_ID, grant.getGrantId());

        var claimNames = claimsService.getClaimsForGrant(grant, ClaimsUsage.USERINFO);
        var claimValues = claimsService.getUserClaims(session.getUserId(), claimNames);

        var userInfo = new UserInfo(new Subject(session.getSubject()));
        claimValues.entrySet().stream()
                .filter(e -> !UserInfo.SUB_CLAIM_NAME.equals(e.getKey()))
                .forEach(e -> userInfo.setClaim(e.getKey(), e.getValue()));

        if (acrRequested(accessTokenInfo) && claimsService.isClaimSupported(ACR_CLAIM)) {
            userInfo.setClaim(ACR_CLAIM, grant.getAuthenticationEvent().getAcr());
        }

        LOG.info("Released {} claims to client", userInfo.toJSONObject().size());
        return UserInfoResult.success(userInfo, session.getClientId());
    }

    public UserInfoResponse doResponse(UserInfoRequest request, UserInfoResult result) {
        if (result.isError()) {
            return new UserInfoErrorResponse(result.getError());
        }
        ClientRegistry client;
        try {
            client = getClient(result.getClientId());
        } catch (ClientNotFoundException e) {
            LOG.warn("Client not found: {}", e.getMessage());
            return new UserInfoErrorResponse(TokenErrors.INVALID_TOKEN);
        }
        var signingAlgorithm =
                Optional.ofNullable(client.getUserinfoSignedResponseAlg())
                        .filter(alg -> !alg.isBlank());
        if (signingAlgorithm.isEmpty()) {
            return new UserInfoSuccessResponse(result.getUserInfo());
        }

        var algorithm = JWSAlgorithm.parse(signingAlgorithm.get());
        if (!signingService.getSupportedAlgorithms().contains(algorithm)) {
            LOG.error("No signing key available for userinfo algorithm {}", algorithm);
            return new UserInfoErrorResponse(
                    new BearerTokenError("server_error", "Unable to sign response", 500));
        }
        try {
            var claims =
                    new JWTClaimsSet.Builder(result.getUserInfo().toJWTClaimsSet())
                            .issuer(issuer)
                            .audience(result.getClientId())
                            .issueTime(NowHelper.now())
                            .build();
            LOG.info("Signing userinfo response with {}", algorithm);
            return new UserInfoSuccessResponse(signingService.sign(claims, algorithm));
        } catch (ParseException e) {
            LOG.error("Unable to convert userinfo to JWT claims", e);
            throw new RuntimeException(e);
        }
    }

    private ClientRegistry getClient(String clientId) throws ClientNotFoundException {
        return clientService
                .getClient(clientId)
                .orElseThrow(() -> new ClientNotFoundException(clientId));
    }

    private Optional<String> extractAccessToken(
            Map<String, String> parameters, Map<String, String> headers) {
        var authorizationHeader =
                getOptionalHeaderValueFromHeaders(
                        headers,
                        AUTHORIZATION_HEADER,
                        configurationService.getHeadersCaseInsensitive());
        if (authorizationHeader.isPresent()) {
            try {
                return Optional.of(
                        accessTokenService.getAccessTokenFromAuthorizationHeader(
                                authorizationHeader.get()));
            } catch (AccessTokenException e) {
                return Optional.of(authorizationHeader.get());
            }
        }
        if (configurationService.isBearerBodyEnabled() && parameters != null) {
            return Optional.ofNullable(parameters.get(ACCESS_TOKEN_PARAM))
                    .filter(t -> !t.isBlank());
        }
        return Optional.empty();
    }

    private static boolean acrRequested(AccessTokenInfo accessTokenInfo) {
        return accessTokenInfo
                .grant()
                .getClaimsRequest()
                .map(r -> r.getUserInfoClaimsRequest())
                .map(r -> r.get(ACR_CLAIM) != null)
                .orElse(false);
    }

    private static BearerTokenError toBearerTokenError(ErrorObject error) {
        if (error instanceof BearerTokenError) {
            return (BearerTokenError) error;
        }
        return new BearerTokenError(
                error.getCode(), error.getDescription(), error.getHTTPStatusCode());
    }
}
