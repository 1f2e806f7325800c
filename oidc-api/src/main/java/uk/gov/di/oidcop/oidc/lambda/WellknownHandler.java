package uk.gov.di.oidcop.oidc.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.id.Issuer;
import com.nimbusds.openid.connect.sdk.SubjectType;
import com.nimbusds.openid.connect.sdk.claims.ClaimType;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import org.apache.http.HttpHeaders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import uk.gov.di.oidcop.shared.api.OidcAPI;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.serialization.Json;
import uk.gov.di.oidcop.shared.services.ClaimsService;
import uk.gov.di.oidcop.shared.services.ConfigurationService;
import uk.gov.di.oidcop.shared.services.InMemoryClientService;
import uk.gov.di.oidcop.shared.services.InMemoryUserInfoStore;
import uk.gov.di.oidcop.shared.services.JwtSigningService;
import uk.gov.di.oidcop.shared.services.LocalJwksSigningService;
import uk.gov.di.oidcop.shared.services.ScopeRegistry;
import uk.gov.di.oidcop.shared.services.SerializationService;
import uk.gov.di.oidcop.shared.services.SessionManager;
import uk.gov.di.oidcop.shared.services.TokenHandlers;

import java.util.List;
import java.util.Map;

import static uk.gov.di.oidcop.shared.helpers.ApiGatewayResponseHelper.generateApiGatewayProxyResponse;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.AWS_REQUEST_ID;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.attachLogFieldToLogs;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.attachTraceId;

public class WellknownHandler
        implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final Logger LOG = LogManager.getLogger(WellknownHandler.class);

    private final String providerMetadata;

    public WellknownHandler(
            OidcAPI oidcApi, ClaimsService claimsService, JwtSigningService signingService) {
        providerMetadata = constructProviderMetadata(oidcApi, claimsService, signingService);
    }

    public WellknownHandler() {
        this(ConfigurationService.getInstance());
    }

    public WellknownHandler(ConfigurationService configurationService) {
        this(
                new OidcAPI(configurationService),
                claimsServiceFromConfiguration(configurationService),
                signingServiceFromConfiguration(configurationService));
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(
            APIGatewayProxyRequestEvent input, Context context) {
        ThreadContext.clearMap();
        attachTraceId();
        attachLogFieldToLogs(AWS_REQUEST_ID, context.getAwsRequestId());
        LOG.info("Wellknown request received");
        return generateApiGatewayProxyResponse(
                200,
                providerMetadata,
                Map.of(
                        HttpHeaders.CACHE_CONTROL,
                        "max-age=86400",
                        HttpHeaders.CONTENT_TYPE,
                        "application/json"),
                null);
    }

    private static String constructProviderMetadata(
            OidcAPI oidcApi, ClaimsService claimsService, JwtSigningService signingService) {
        var oidcMetadata =
                new OIDCProviderMetadata(
                        new Issuer(oidcApi.issuer()),
                        List.of(SubjectType.PUBLIC, SubjectType.PAIRWISE),
                        oidcApi.jwksURI());
        oidcMetadata.setAuthorizationEndpointURI(oidcApi.authorizeURI());
        oidcMetadata.setTokenEndpointURI(oidcApi.tokenURI());
        oidcMetadata.setUserInfoEndpointURI(oidcApi.userInfoURI());
        oidcMetadata.setScopes(Scope.parse(claimsService.getScopesSupported()));
        oidcMetadata.setResponseTypes(List.of(new ResponseType("code")));
        oidcMetadata.setGrantTypes(List.of(GrantType.AUTHORIZATION_CODE));
        oidcMetadata.setClaimTypes(List.of(ClaimType.NORMAL));
        oidcMetadata.setClaims(claimsService.getClaimsSupported());
        oidcMetadata.setSupportsClaimsParams(true);
        oidcMetadata.setUserInfoJWSAlgs(signingService.getSupportedAlgorithms());
        oidcMetadata.setIDTokenJWSAlgs(signingService.getSupportedAlgorithms());
        return oidcMetadata.toString();
    }

    private static ClaimsService claimsServiceFromConfiguration(
            ConfigurationService configurationService) {
        Json objectMapper = SerializationService.getInstance();
        try {
            var clientService =
                    InMemoryClientService.fromConfiguration(configurationService, objectMapper);
            return new ClaimsService(
                    configurationService,
                    ScopeRegistry.fromConfiguration(configurationService, objectMapper),
                    new SessionManager(
                            configurationService,
                            new TokenHandlers(configurationService),
                            clientService),
                    InMemoryUserInfoStore.fromConfiguration(configurationService, objectMapper));
        } catch (ConfigurationException e) {
            LOG.error("Unable to configure WellknownHandler", e);
            throw new RuntimeException(e);
        }
    }

    private static JwtSigningService signingServiceFromConfiguration(
            ConfigurationService configurationService) {
        try {
            return LocalJwksSigningService.fromConfiguration(configurationService);
        } catch (ConfigurationException e) {
            LOG.error("Unable to load signing keys", e);
            throw new RuntimeException(e);
        }
    }
}
