package uk.gov.di.oidcop.shared.services;

import com.nimbusds.oauth2.sdk.AuthorizationRequest;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.openid.connect.sdk.AuthenticationRequest;
import com.nimbusds.openid.connect.sdk.OIDCClaimsRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.AuthenticationEvent;
import uk.gov.di.oidcop.shared.entity.Grant;
import uk.gov.di.oidcop.shared.entity.ResolvedToken;
import uk.gov.di.oidcop.shared.entity.Session;
import uk.gov.di.oidcop.shared.entity.SessionInfo;
import uk.gov.di.oidcop.shared.entity.SubjectType;
import uk.gov.di.oidcop.shared.entity.Token;
import uk.gov.di.oidcop.shared.entity.TokenType;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.exceptions.ExpiredOrRevokedTokenException;
import uk.gov.di.oidcop.shared.exceptions.SessionNotFoundException;
import uk.gov.di.oidcop.shared.exceptions.TokenNotFoundException;
import uk.gov.di.oidcop.shared.exceptions.WrongTokenKindException;
import uk.gov.di.oidcop.shared.helpers.ClientSubjectHelper;
import uk.gov.di.oidcop.shared.helpers.IdGenerator;
import uk.gov.di.oidcop.shared.helpers.NowHelper.NowClock;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.isNull;

/**
 * Owns every session, the grants recorded under them and the reverse index from token value
 * to the session and grant that issued it.
 */
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);
    public static final String SECTOR_IDENTIFIER_URI_PARAM = "sector_identifier_uri";

    private final ConfigurationService configurationService;
    private final TokenHandlers tokenHandlers;
    private final ClientService clientService;
    private final NowClock clock;
    private final byte[] subjectSalt;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, TokenLocation> tokenIndex = new ConcurrentHashMap<>();

    public SessionManager(
            ConfigurationService configurationService,
            TokenHandlers tokenHandlers,
            ClientService clientService) {
        this(configurationService, tokenHandlers, clientService, Clock.systemUTC());
    }

    public SessionManager(
            ConfigurationService configurationService,
            TokenHandlers tokenHandlers,
            ClientService clientService,
            Clock clock) {
        this.configurationService = configurationService;
        this.tokenHandlers = tokenHandlers;
        this.clientService = clientService;
        this.clock = new NowClock(clock);
        this.subjectSalt =
                configurationService
                        .getSubjectSalt()
                        .map(s -> s.getBytes(StandardCharsets.UTF_8))
                        .orElseGet(() -> IdGenerator.randomBytes(32));
    }

    public AuthenticationEvent newAuthenticationEvent(String acr) {
        return AuthenticationEvent.create(
                acr, clock.nowEpochSecond(), configurationService.getAuthnEventLifetime());
    }

    public String createSession(
            AuthenticationEvent authenticationEvent,
            AuthorizationRequest authorizationRequest,
            String userId,
            String clientId,
            SubjectType subjectType)
            throws ConfigurationException {
        return createSession(
                authenticationEvent, authorizationRequest, userId, clientId, subjectType, null);
    }

    /**
     * Records an authorization for the given user and client. The same (user, client, subject
     * type, sector) always resolves to the same session. A request matching an existing grant
     * re-authenticates it; any other request adds a new grant which becomes current.
     */
    public String createSession(
            AuthenticationEvent authenticationEvent,
            AuthorizationRequest authorizationRequest,
            String userId,
            String clientId,
            SubjectType subjectType,
            String sectorIdentifier)
            throws ConfigurationException {
        var sector = resolveSector(subjectType, sectorIdentifier, authorizationRequest, clientId);
        var sessionId = calculateSessionId(userId, clientId, subjectType, sector);
        var subject =
                ClientSubjectHelper.calculateSubject(
                        subjectType, userId, clientId, sector, subjectSalt);

        var session =
                sessions.computeIfAbsent(
                        sessionId,
                        id -> new Session(id, userId, clientId, subjectType, sector, subject));

        var scope = isNull(authorizationRequest) ? new Scope() : authorizationRequest.getScope();
        var claimsRequest = claimsRequestFrom(authorizationRequest);

        synchronized (session) {
            var existing =
                    session.getGrants().stream()
                            .filter(g -> g.coversRequest(scope, claimsRequest))
                            .findFirst();
            if (existing.isPresent()) {
                existing.get().setAuthenticationEvent(authenticationEvent);
                session.setCurrentGrant(existing.get().getGrantId());
                LOG.info("Re-authenticated existing grant");
            } else {
                session.addGrant(
                        new Grant(
                                IdGenerator.generate(),
                                authenticationEvent,
                                scope,
                                claimsRequest));
                LOG.info("Added new grant to session");
            }
        }
        return sessionId;
    }

    public Session getSession(String sessionId) throws SessionNotFoundException {
        var session = isNull(sessionId) ? null : sessions.get(sessionId);
        if (isNull(session)) {
            throw new SessionNotFoundException("No session found");
        }
        return session;
    }

    public Grant getGrant(String sessionId) throws SessionNotFoundException {
        return getSession(sessionId)
                .getCurrentGrant()
                .orElseThrow(() -> new SessionNotFoundException("Session has no grant"));
    }

    public Grant getGrant(String sessionId, String grantId) throws SessionNotFoundException {
        return getSession(sessionId)
                .getGrant(grantId)
                .orElseThrow(() -> new SessionNotFoundException("No grant found in session"));
    }

    public SessionInfo getSessionInfo(String sessionId, boolean withGrant)
            throws SessionNotFoundException {
        var session = getSession(sessionId);
        return new SessionInfo(session, withGrant ? getGrant(sessionId) : null);
    }

    public Token mintToken(String sessionId, TokenType tokenType, String basedOn)
            throws SessionNotFoundException {
        return mintToken(
                sessionId, tokenType, clock.nowEpochSecond() + expiryFor(tokenType), basedOn);
    }

    /**
     * Mints a token into the grant holding {@code basedOn}, or the current grant when there is
     * no parent. The token is appended to its grant before it becomes resolvable.
     */
    public Token mintToken(String sessionId, TokenType tokenType, long expiresAt, String basedOn)
            throws SessionNotFoundException {
        var session = getSession(sessionId);
        synchronized (session) {
            if (sessions.get(sessionId) != session) {
                throw new SessionNotFoundException("No session found");
            }
            var grant = grantFor(session, basedOn);
            var token =
                    tokenHandlers
                            .get(tokenType)
                            .mint(sessionId, clock.nowEpochSecond(), expiresAt, basedOn);
            grant.addToken(token);
            tokenIndex.put(
                    token.getValue(), new TokenLocation(sessionId, grant.getGrantId(), token));
            LOG.info("Minted {}", tokenType.getValue());
            return token;
        }
    }

    public ResolvedToken resolveToken(String value) throws TokenNotFoundException {
        if (isNull(value) || tokenHandlers.decode(value).isEmpty()) {
            throw new TokenNotFoundException("Token could not be decoded");
        }
        var location = tokenIndex.get(value);
        if (isNull(location)) {
            throw new TokenNotFoundException("Token is not known");
        }
        var session = Optional.ofNullable(sessions.get(location.sessionId()));
        var grant = session.flatMap(s -> s.getGrant(location.grantId()));
        if (grant.isEmpty()) {
            throw new TokenNotFoundException("Token is no longer held by a session");
        }
        return new ResolvedToken(session.get(), grant.get(), location.token());
    }

    /**
     * Redeems an authorization code. Codes are single use: a second redemption revokes the code
     * and everything minted from it.
     */
    public ResolvedToken redeemAuthorizationCode(String code)
            throws TokenNotFoundException, WrongTokenKindException,
                    ExpiredOrRevokedTokenException {
        var resolved = resolveToken(code);
        var token = resolved.token();
        if (token.getType() != TokenType.AUTHORIZATION_CODE) {
            throw new WrongTokenKindException("Token is not an authorization code");
        }
        if (token.registerUsage() > 1) {
            var revoked = resolved.grant().revokeToken(code, true);
            LOG.warn("Authorization code reused, revoked {} tokens", revoked);
            throw new ExpiredOrRevokedTokenException("Authorization code already used");
        }
        if (!token.isActive(clock.nowEpochSecond())) {
            throw new ExpiredOrRevokedTokenException("Authorization code expired or revoked");
        }
        return resolved;
    }

    public int revokeToken(String value, boolean recursive) throws TokenNotFoundException {
        var resolved = resolveToken(value);
        return resolved.grant().revokeToken(value, recursive);
    }

    public int revokeGrant(String sessionId) throws SessionNotFoundException {
        return getGrant(sessionId).revokeAll();
    }

    public int revokeGrant(String sessionId, String grantId) throws SessionNotFoundException {
        return getGrant(sessionId, grantId).revokeAll();
    }

    public void deleteSession(String sessionId) throws SessionNotFoundException {
        var session = getSession(sessionId);
        synchronized (session) {
            if (!sessions.remove(sessionId, session)) {
                throw new SessionNotFoundException("No session found");
            }
            session.getGrants().stream()
                    .flatMap(g -> g.getTokens().stream())
                    .forEach(t -> tokenIndex.remove(t.getValue()));
        }
        LOG.info("Deleted session");
    }

    public String getSubject(String sessionId) throws SessionNotFoundException {
        return getSession(sessionId).getSubject();
    }

    private Grant grantFor(Session session, String basedOn) throws SessionNotFoundException {
        if (!isNull(basedOn)) {
            var location = tokenIndex.get(basedOn);
            if (!isNull(location) && location.sessionId().equals(session.getSessionId())) {
                var parentGrant = session.getGrant(location.grantId());
                if (parentGrant.isPresent()) {
                    return parentGrant.get();
                }
            }
        }
        return session.getCurrentGrant()
                .orElseThrow(() -> new SessionNotFoundException("Session has no grant"));
    }

    private long expiryFor(TokenType tokenType) {
        switch (tokenType) {
            case AUTHORIZATION_CODE:
                return configurationService.getAuthCodeExpiry();
            case REFRESH_TOKEN:
                return configurationService.getRefreshTokenExpiry();
            case ACCESS_TOKEN:
            default:
                return configurationService.getAccessTokenExpiry();
        }
    }

    private String resolveSector(
            SubjectType subjectType,
            String sectorIdentifier,
            AuthorizationRequest authorizationRequest,
            String clientId)
            throws ConfigurationException {
        if (!isNull(sectorIdentifier)) {
            return toHost(sectorIdentifier);
        }
        if (subjectType != SubjectType.PAIRWISE) {
            return null;
        }
        var fromRequest =
                Optional.ofNullable(authorizationRequest)
                        .map(r -> r.getCustomParameter(SECTOR_IDENTIFIER_URI_PARAM))
                        .filter(v -> !v.isEmpty())
                        .map(v -> v.get(0));
        if (fromRequest.isPresent()) {
            return toHost(fromRequest.get());
        }
        var client = clientService.getClient(clientId);
        if (client.isPresent()) {
            return ClientSubjectHelper.getSectorIdentifierForClient(client.get());
        }
        LOG.error("Unable to resolve sector identifier for pairwise subject");
        throw new ConfigurationException(
                "Pairwise subject requested without a sector identifier");
    }

    private static String toHost(String sectorIdentifier) throws ConfigurationException {
        return sectorIdentifier.contains("://")
                ? ClientSubjectHelper.returnHost(sectorIdentifier)
                : sectorIdentifier;
    }

    private static OIDCClaimsRequest claimsRequestFrom(AuthorizationRequest request) {
        if (request instanceof AuthenticationRequest) {
            return ((AuthenticationRequest) request).getOIDCClaims();
        }
        return null;
    }

    static String calculateSessionId(
            String userId, String clientId, SubjectType subjectType, String sector) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            for (String part :
                    List.of(
                            userId,
                            clientId,
                            subjectType.getValue(),
                            isNull(sector) ? "" : sector)) {
                md.update(part.getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
            }
            return Base64.getUrlEncoder().withoutPadding().encodeToString(md.digest());
        } catch (NoSuchAlgorithmException e) {
            LOG.error("Failed to hash", e);
            throw new RuntimeException(e);
        }
    }

    int indexedTokenCount() {
        return tokenIndex.size();
    }

    private record TokenLocation(String sessionId, String grantId, Token token) {}
}
