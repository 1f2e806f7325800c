package uk.gov.di.oidcop.oidc.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.nimbusds.openid.connect.sdk.UserInfoSuccessResponse;
import org.apache.http.HttpHeaders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import uk.gov.di.oidcop.oidc.services.AccessTokenService;
import uk.gov.di.oidcop.oidc.services.UserInfoService;
import uk.gov.di.oidcop.shared.api.OidcAPI;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.serialization.Json;
import uk.gov.di.oidcop.shared.services.ClaimsService;
import uk.gov.di.oidcop.shared.services.ConfigurationService;
import uk.gov.di.oidcop.shared.services.InMemoryClientService;
import uk.gov.di.oidcop.shared.services.InMemoryUserInfoStore;
import uk.gov.di.oidcop.shared.services.LocalJwksSigningService;
import uk.gov.di.oidcop.shared.services.ScopeRegistry;
import uk.gov.di.oidcop.shared.services.SerializationService;
import uk.gov.di.oidcop.shared.services.SessionManager;
import uk.gov.di.oidcop.shared.services.TokenHandlers;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static uk.gov.di.oidcop.shared.helpers.ApiGatewayResponseHelper.generateApiGatewayProxyResponse;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.AWS_REQUEST_ID;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.CLIENT_ID;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.attachLogFieldToLogs;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.attachTraceId;
import static uk.gov.di.oidcop.shared.helpers.RequestBodyHelper.parseRequestBody;

public class UserInfoHandler
        implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final Logger LOG = LogManager.getLogger(UserInfoHandler.class);
    private static final String APPLICATION_JSON = "application/json";
    private static final String APPLICATION_JWT = "application/jwt";

    private final UserInfoService userInfoService;
    private final Json objectMapper;

    public UserInfoHandler(UserInfoService userInfoService, Json objectMapper) {
        this.userInfoService = userInfoService;
        this.objectMapper = objectMapper;
    }

    public UserInfoHandler() {
        this(ConfigurationService.getInstance());
    }

    public UserInfoHandler(ConfigurationService configurationService) {
        this.objectMapper = SerializationService.getInstance();
        try {
            var clientService =
                    InMemoryClientService.fromConfiguration(configurationService, objectMapper);
            var sessionManager =
                    new SessionManager(
                            configurationService,
                            new TokenHandlers(configurationService),
                            clientService);
            var claimsService =
                    new ClaimsService(
                            configurationService,
                            ScopeRegistry.fromConfiguration(configurationService, objectMapper),
                            sessionManager,
                            InMemoryUserInfoStore.fromConfiguration(
                                    configurationService, objectMapper));
            this.userInfoService =
                    new UserInfoService(
                            configurationService,
                            new AccessTokenService(sessionManager),
                            claimsService,
                            clientService,
                            LocalJwksSigningService.fromConfiguration(configurationService),
                            new OidcAPI(configurationService).issuer());
        } catch (ConfigurationException e) {
            LOG.error("Unable to configure UserInfoHandler", e);
            throw new RuntimeException(e);
        }
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(
            APIGatewayProxyRequestEvent input, Context context) {
        ThreadContext.clearMap();
        attachTraceId();
        attachLogFieldToLogs(AWS_REQUEST_ID, context.getAwsRequestId());
        return userInfoRequestHandler(input);
    }

    public APIGatewayProxyResponseEvent userInfoRequestHandler(APIGatewayProxyRequestEvent input) {
        LOG.info("Request received to the UserInfoHandler");

        Map<String, String> parameters = new HashMap<>(parseRequestBody(input.getBody()));
        Optional.ofNullable(input.getQueryStringParameters()).ifPresent(parameters::putAll);

        var request = userInfoService.parseRequest(parameters, input.getHeaders());
        Optional.ofNullable(request.clientId())
                .ifPresent(id -> attachLogFieldToLogs(CLIENT_ID, id));

        var result = userInfoService.processRequest(request);
        var response = userInfoService.doResponse(request, result);

        if (!response.indicatesSuccess()) {
            var errorResponse = response.toErrorResponse();
            var error = errorResponse.getErrorObject();
            LOG.warn("Sending back UserInfo error response: {}", error.getCode());
            Map<String, String> body = new LinkedHashMap<>();
            body.put("error", error.getCode());
            body.put("error_description", error.getDescription());
            return generateApiGatewayProxyResponse(
                    error.getHTTPStatusCode(),
                    objectMapper.writeValueAsString(body),
                    Map.of(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON),
                    errorResponse.toHTTPResponse().getHeaderMap());
        }

        UserInfoSuccessResponse successResponse = response.toSuccessResponse();
        LOG.info("Successfully processed UserInfo request. Sending back UserInfo response");
        if (successResponse.getUserInfoJWT() != null) {
            return generateApiGatewayProxyResponse(
                    200,
                    successResponse.getUserInfoJWT().serialize(),
                    Map.of(HttpHeaders.CONTENT_TYPE, APPLICATION_JWT),
                    null);
        }
        return generateApiGatewayProxyResponse(
                200,
                successResponse.getUserInfo().toJSONString(),
                Map.of(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON),
                null);
    }
}
