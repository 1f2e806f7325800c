package uk.gov.di.oidcop.oidc.services;

import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.openid.connect.sdk.AuthenticationRequest;
import com.nimbusds.openid.connect.sdk.Nonce;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.gov.di.oidcop.shared.entity.AuthenticationEvent;
import uk.gov.di.oidcop.shared.entity.ClientRegistry;
import uk.gov.di.oidcop.shared.entity.SubjectType;
import uk.gov.di.oidcop.shared.entity.TokenType;
import uk.gov.di.oidcop.shared.exceptions.AccessTokenException;
import uk.gov.di.oidcop.shared.exceptions.ExpiredOrRevokedTokenException;
import uk.gov.di.oidcop.shared.exceptions.StaleAuthenticationException;
import uk.gov.di.oidcop.shared.exceptions.TokenErrors;
import uk.gov.di.oidcop.shared.exceptions.TokenNotFoundException;
import uk.gov.di.oidcop.shared.exceptions.WrongTokenKindException;
import uk.gov.di.oidcop.shared.services.ConfigurationService;
import uk.gov.di.oidcop.shared.services.InMemoryClientService;
import uk.gov.di.oidcop.shared.services.SessionManager;
import uk.gov.di.oidcop.shared.services.TokenHandlers;
import uk.gov.di.oidcop.sharedtest.helper.TestClockHelper;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessTokenServiceTest {

    private static final String USER_ID = "diana";
    private static final String CLIENT_ID = "client_1";
    private static final URI REDIRECT_URI = URI.create("https://example.com/cb");
    private static final long NOW = TestClockHelper.fixedEpochSecond();

    private final ConfigurationService configurationService = mock(ConfigurationService.class);
    private SessionManager sessionManager;
    private AccessTokenService accessTokenService;

    @BeforeEach
    void setUp() throws Exception {
        when(configurationService.getSubjectSalt()).thenReturn(Optional.of("salt"));
        when(configurationService.getAuthnEventLifetime()).thenReturn(3600L);
        when(configurationService.getAuthCodeExpiry()).thenReturn(300L);
        when(configurationService.getAccessTokenExpiry()).thenReturn(180L);
        when(configurationService.getRefreshTokenExpiry()).thenReturn(86400L);
        var clientService = new InMemoryClientService();
        clientService.addClient(
                new ClientRegistry()
                        .withClientID(CLIENT_ID)
                        .withRedirectUrls(List.of(REDIRECT_URI.toString())));
        sessionManager =
                new SessionManager(
                        configurationService,
                        new TokenHandlers(
                                "a-token-handler-secret-of-at-least-256-bits"
                                        .getBytes(StandardCharsets.UTF_8)),
                        clientService,
                        TestClockHelper.getInstance());
        accessTokenService = new AccessTokenService(sessionManager, TestClockHelper.getInstance());
    }

    @Test
    void shouldExtractTokenFromBearerHeader() throws Exception {
        assertThat(
                accessTokenService.getAccessTokenFromAuthorizationHeader("Bearer abc.def.ghi"),
                equalTo("abc.def.ghi"));
    }

    @Test
    void shouldRejectHeaderWithoutBearerScheme() {
        var exception =
                assertThrows(
                        AccessTokenException.class,
                        () -> accessTokenService.getAccessTokenFromAuthorizationHeader("Basic xyz"));

        assertThat(exception.getError(), equalTo(TokenErrors.INVALID_TOKEN));
    }

    @Test
    void shouldValidateActiveAccessToken() throws Exception {
        var sessionId = createSession(sessionManager.newAuthenticationEvent("acr"));
        var token = sessionManager.mintToken(sessionId, TokenType.ACCESS_TOKEN, null);

        var info = accessTokenService.validate(token.getValue());

        assertThat(info.token(), sameInstance(token));
        assertThat(info.clientID(), equalTo(CLIENT_ID));
        assertThat(info.session().getSessionId(), equalTo(sessionId));
    }

    @Test
    void shouldRejectUnknownToken() {
        assertThrows(TokenNotFoundException.class, () -> accessTokenService.validate("not-a-token"));
    }

    @Test
    void shouldRejectRefreshTokenAsWrongKindEvenWhenExpired() throws Exception {
        var sessionId = createSession(sessionManager.newAuthenticationEvent("acr"));
        var refreshToken =
                sessionManager.mintToken(sessionId, TokenType.REFRESH_TOKEN, NOW + 1, null);
        var laterService =
                new AccessTokenService(
                        sessionManager, TestClockHelper.secondsAfterFixedInstant(10));

        var exception =
                assertThrows(
                        WrongTokenKindException.class,
                        () -> laterService.validate(refreshToken.getValue()));

        assertThat(exception.getError(), equalTo(TokenErrors.WRONG_TYPE_OF_TOKEN));
    }

    @Test
    void shouldRejectExpiredAccessToken() throws Exception {
        var sessionId = createSession(sessionManager.newAuthenticationEvent("acr"));
        var token = sessionManager.mintToken(sessionId, TokenType.ACCESS_TOKEN, null);
        var laterService =
                new AccessTokenService(
                        sessionManager, TestClockHelper.secondsAfterFixedInstant(180));

        var exception =
                assertThrows(
                        ExpiredOrRevokedTokenException.class,
                        () -> laterService.validate(token.getValue()));

        assertThat(exception.getError(), equalTo(TokenErrors.INVALID_TOKEN));
    }

    @Test
    void shouldRejectRevokedAccessToken() throws Exception {
        var sessionId = createSession(sessionManager.newAuthenticationEvent("acr"));
        var token = sessionManager.mintToken(sessionId, TokenType.ACCESS_TOKEN, null);
        sessionManager.revokeToken(token.getValue(), false);

        assertThrows(
                ExpiredOrRevokedTokenException.class,
                () -> accessTokenService.validate(token.getValue()));
    }

    @Test
    void shouldRejectTokenWhenAuthenticationIsStale() throws Exception {
        var staleEvent = new AuthenticationEvent("acr", NOW - 3600, NOW);
        var sessionId = createSession(staleEvent);
        var token = sessionManager.mintToken(sessionId, TokenType.ACCESS_TOKEN, null);

        var exception =
                assertThrows(
                        StaleAuthenticationException.class,
                        () -> accessTokenService.validate(token.getValue()));

        assertThat(exception.getError(), equalTo(TokenErrors.ACCESS_NOT_GRANTED));
    }

    private String createSession(AuthenticationEvent event) throws Exception {
        var request =
                new AuthenticationRequest.Builder(
                                ResponseType.CODE,
                                new Scope("openid"),
                                new ClientID(CLIENT_ID),
                                REDIRECT_URI)
                        .state(new State())
                        .nonce(new Nonce())
                        .build();
        return sessionManager.createSession(
                event, request, USER_ID, CLIENT_ID, SubjectType.PUBLIC);
    }
}
