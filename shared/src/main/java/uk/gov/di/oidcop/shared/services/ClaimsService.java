package uk.gov.di.oidcop.shared.services;

import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.openid.connect.sdk.OIDCClaimsRequest;
import com.nimbusds.openid.connect.sdk.claims.ClaimsSetRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.ClaimsUsage;
import uk.gov.di.oidcop.shared.entity.Grant;
import uk.gov.di.oidcop.shared.exceptions.SessionNotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.isNull;

/**
 * Decides which claims are released for a session and usage, and fetches their values.
 *
 * <p>Claim names start from the base claims of the usage, gain the claims of every requested
 * scope when claims are added by scope, gain whatever the authorization request asked for
 * through its {@code claims} parameter and are finally limited to the supported claims.
 */
public class ClaimsService {

    private static final Logger LOG = LogManager.getLogger(ClaimsService.class);

    private static final Set<String> DEFAULT_BASE_CLAIMS = Set.of("sub");

    private final ScopeRegistry scopeRegistry;
    private final SessionManager sessionManager;
    private final UserInfoStore userInfoStore;
    private final Map<ClaimsUsage, Set<String>> baseClaims = new EnumMap<>(ClaimsUsage.class);
    private final Set<String> claimsSupported;
    private final AtomicLong policyVersion = new AtomicLong();
    private volatile boolean addClaimsByScope;

    public ClaimsService(
            ConfigurationService configurationService,
            ScopeRegistry scopeRegistry,
            SessionManager sessionManager,
            UserInfoStore userInfoStore) {
        this.scopeRegistry = scopeRegistry;
        this.sessionManager = sessionManager;
        this.userInfoStore = userInfoStore;
        this.addClaimsByScope = configurationService.isAddClaimsByScopeEnabled();
        for (ClaimsUsage usage : ClaimsUsage.values()) {
            baseClaims.put(usage, DEFAULT_BASE_CLAIMS);
        }
        this.claimsSupported =
                Collections.unmodifiableSet(
                        configurationService
                                .getClaimsSupported()
                                .<Set<String>>map(LinkedHashSet::new)
                                .orElseGet(scopeRegistry::getAllClaims));
    }

    public boolean isAddClaimsByScope() {
        return addClaimsByScope;
    }

    /** Changing the policy invalidates every claims set cached on a grant. */
    public void setAddClaimsByScope(boolean addClaimsByScope) {
        if (this.addClaimsByScope != addClaimsByScope) {
            this.addClaimsByScope = addClaimsByScope;
            policyVersion.incrementAndGet();
            LOG.info("Add claims by scope set to {}", addClaimsByScope);
        }
    }

    public List<String> getClaimsSupported() {
        return List.copyOf(claimsSupported);
    }

    public boolean isClaimSupported(String claimName) {
        return claimsSupported.contains(claimName);
    }

    public Set<String> getScopesSupported() {
        return scopeRegistry.getScopes();
    }

    /**
     * Resolves the claim names for the current grant of a session. When {@code scopes} is null
     * or matches the grant's scope the grant's cached set is used.
     */
    public Set<String> getClaims(String sessionId, Collection<String> scopes, ClaimsUsage usage)
            throws SessionNotFoundException {
        var grant = sessionManager.getGrant(sessionId);
        if (isNull(scopes) || Scope.parse(scopes).equals(grant.getScope())) {
            return getClaimsForGrant(grant, usage);
        }
        return resolveClaims(scopes, grant.getClaimsRequest(), usage);
    }

    public Set<String> getClaimsForGrant(Grant grant, ClaimsUsage usage) {
        var version = policyVersion.get();
        var cached = grant.getCachedClaims(usage, version);
        if (cached.isPresent()) {
            return cached.get();
        }
        var claims =
                resolveClaims(grant.getScope().toStringList(), grant.getClaimsRequest(), usage);
        return grant.cacheClaims(usage, claims, version);
    }

    public Map<String, Object> getUserClaims(String userId, Collection<String> claimNames) {
        return userInfoStore.getUserClaims(userId, claimNames);
    }

    Set<String> resolveClaims(
            Collection<String> scopes,
            Optional<OIDCClaimsRequest> claimsRequest,
            ClaimsUsage usage) {
        Set<String> claims = new LinkedHashSet<>(baseClaims.get(usage));
        if (addClaimsByScope) {
            claims.addAll(scopeRegistry.getClaimsForListOfScopes(scopes));
        }
        claimsRequest
                .map(request -> claimsSetRequestFor(request, usage))
                .ifPresent(
                        request ->
                                request.getEntries()
                                        .forEach(entry -> claims.add(entry.getClaimName())));
        claims.retainAll(claimsSupported);
        return claims;
    }

    private static ClaimsSetRequest claimsSetRequestFor(
            OIDCClaimsRequest request, ClaimsUsage usage) {
        switch (usage) {
            case USERINFO:
                return request.getUserInfoClaimsRequest();
            case ID_TOKEN:
                return request.getIDTokenClaimsRequest();
            default:
                return null;
        }
    }
}
