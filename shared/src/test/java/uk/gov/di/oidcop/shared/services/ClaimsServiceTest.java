package uk.gov.di.oidcop.shared.services;

import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.openid.connect.sdk.AuthenticationRequest;
import com.nimbusds.openid.connect.sdk.Nonce;
import com.nimbusds.openid.connect.sdk.OIDCClaimsRequest;
import com.nimbusds.openid.connect.sdk.claims.ClaimsSetRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.gov.di.oidcop.shared.entity.ClaimsUsage;
import uk.gov.di.oidcop.shared.entity.CustomScopeValue;
import uk.gov.di.oidcop.shared.entity.SubjectType;
import uk.gov.di.oidcop.sharedtest.helper.TestClockHelper;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ClaimsServiceTest {

    private static final String USER_ID = "diana";
    private static final String CLIENT_ID = "client_1";
    private static final String RESEARCH_AND_SCHOLARSHIP = "research_and_scholarship";
    private static final List<String> RESEARCH_AND_SCHOLARSHIP_CLAIMS =
            List.of(
                    "name",
                    "given_name",
                    "family_name",
                    "email",
                    "email_verified",
                    "sub",
                    "eduperson_scoped_affiliation");

    private final ConfigurationService configurationService = mock(ConfigurationService.class);
    private final InMemoryUserInfoStore userInfoStore = new InMemoryUserInfoStore();
    private final ScopeRegistry scopeRegistry =
            new ScopeRegistry(
                    List.of(
                            new CustomScopeValue(
                                    RESEARCH_AND_SCHOLARSHIP, RESEARCH_AND_SCHOLARSHIP_CLAIMS)));
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() throws Exception {
        when(configurationService.getAuthnEventLifetime()).thenReturn(3600L);
        when(configurationService.getSubjectSalt()).thenReturn(Optional.of("salt"));
        sessionManager =
                new SessionManager(
                        configurationService,
                        new TokenHandlers(
                                "a-token-handler-secret-of-at-least-256-bits"
                                        .getBytes(StandardCharsets.UTF_8)),
                        new InMemoryClientService(),
                        TestClockHelper.getInstance());
        userInfoStore.addUser(
                USER_ID, Map.of("email", "diana@example.org", "given_name", "Diana"));
    }

    @Test
    void shouldReturnOnlySubForOpenidWithoutAddingClaimsByScope() throws Exception {
        var claimsService = claimsService(false);
        var sessionId = session(request(new Scope("openid", "email", "profile"), null));

        var claims = claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO);

        assertThat(claims, contains("sub"));
    }

    @Test
    void shouldAddCustomScopeClaimsWhenAddingClaimsByScope() throws Exception {
        var claimsService = claimsService(true);
        var sessionId = session(request(new Scope("openid", RESEARCH_AND_SCHOLARSHIP), null));

        var claims = claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO);

        assertThat(
                claims,
                contains(
                        "sub",
                        "name",
                        "given_name",
                        "family_name",
                        "email",
                        "email_verified",
                        "eduperson_scoped_affiliation"));
    }

    @Test
    void shouldAddClaimsAskedForThroughClaimsRequest() throws Exception {
        var claimsService = claimsService(false);
        var claimsRequest =
                new OIDCClaimsRequest()
                        .withUserInfoClaimsRequest(
                                new ClaimsSetRequest().add("email").add("shoe_size"))
                        .withIDTokenClaimsRequest(new ClaimsSetRequest().add("phone_number"));
        var sessionId = session(request(new Scope("openid"), claimsRequest));

        assertThat(
                claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO),
                contains("sub", "email"));
        assertThat(
                claimsService.getClaims(sessionId, null, ClaimsUsage.ID_TOKEN),
                contains("sub", "phone_number"));
        assertThat(
                claimsService.getClaims(sessionId, null, ClaimsUsage.INTROSPECTION),
                contains("sub"));
    }

    @Test
    void shouldRestrictToConfiguredClaimsSupported() throws Exception {
        when(configurationService.getClaimsSupported())
                .thenReturn(Optional.of(List.of("sub", "email")));
        var claimsService = claimsService(true);
        var sessionId = session(request(new Scope("openid", "profile", "email"), null));

        var claims = claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO);

        assertThat(claims, contains("sub", "email"));
        assertThat(claimsService.getClaimsSupported(), contains("sub", "email"));
    }

    @Test
    void shouldDefaultClaimsSupportedToEveryScopeClaim() {
        var claimsService = claimsService(false);

        assertThat(
                claimsService.getClaimsSupported(),
                hasItem("eduperson_scoped_affiliation"));
        assertThat(claimsService.getClaimsSupported(), hasItem("address"));
        assertThat(claimsService.getClaimsSupported(), hasItem("phone_number"));
        assertThat(claimsService.getClaimsSupported(), hasItem("sub"));
    }

    @Test
    void shouldCacheClaimsOnGrantUntilPolicyChanges() throws Exception {
        var claimsService = claimsService(false);
        var sessionId = session(request(new Scope("openid", "email"), null));

        var first = claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO);
        var second = claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO);
        assertThat(second, sameInstance(first));

        claimsService.setAddClaimsByScope(true);
        var third = claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO);

        assertThat(third, not(sameInstance(first)));
        assertThat(third, contains("sub", "email", "email_verified"));
    }

    @Test
    void shouldRecomputeClaimsWhenGrantScopeChanges() throws Exception {
        var claimsService = claimsService(true);
        var sessionId = session(request(new Scope("openid"), null));
        assertThat(
                claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO), contains("sub"));

        sessionManager.getGrant(sessionId).setScope(new Scope("openid", "phone"));

        assertThat(
                claimsService.getClaims(sessionId, null, ClaimsUsage.USERINFO),
                contains("sub", "phone_number", "phone_number_verified"));
    }

    @Test
    void shouldResolveExplicitScopesAgainstSession() throws Exception {
        var claimsService = claimsService(true);
        var sessionId = session(request(new Scope("openid"), null));

        var claims =
                claimsService.getClaims(
                        sessionId, List.of("openid", "email"), ClaimsUsage.ID_TOKEN);

        assertThat(claims, containsInAnyOrder("sub", "email", "email_verified"));
    }

    @Test
    void shouldFetchUserClaimValues() {
        var claimsService = claimsService(false);

        assertThat(
                claimsService.getUserClaims(USER_ID, List.of("email", "family_name")),
                equalTo(Map.of("email", "diana@example.org")));
        assertTrue(claimsService.getUserClaims("unknown", List.of("email")).isEmpty());
    }

    private ClaimsService claimsService(boolean addClaimsByScope) {
        when(configurationService.isAddClaimsByScopeEnabled()).thenReturn(addClaimsByScope);
        return new ClaimsService(
                configurationService, scopeRegistry, sessionManager, userInfoStore);
    }

    private String session(AuthenticationRequest request) throws Exception {
        return sessionManager.createSession(
                sessionManager.newAuthenticationEvent("acr"),
                request,
                USER_ID,
                CLIENT_ID,
                SubjectType.PUBLIC);
    }

    private static AuthenticationRequest request(Scope scope, OIDCClaimsRequest claimsRequest) {
        return new AuthenticationRequest.Builder(
                        ResponseType.CODE,
                        scope,
                        new ClientID(CLIENT_ID),
                        URI.create("https://example.com/cb"))
                .state(new State())
                .nonce(new Nonce())
                .claims(claimsRequest)
                .build();
    }
}
