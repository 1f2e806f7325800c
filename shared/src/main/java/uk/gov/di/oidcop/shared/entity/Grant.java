package uk.gov.di.oidcop.shared.entity;

import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.openid.connect.sdk.OIDCClaimsRequest;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The authorization a user gave a client: the authentication event it rests on, the scope
 * and claims request it covers and every token issued under it.
 */
public class Grant {

    private final String grantId;
    private final List<Token> tokens = new CopyOnWriteArrayList<>();
    private final Map<ClaimsUsage, CachedClaims> claimsCache = new ConcurrentHashMap<>();
    private final OIDCClaimsRequest claimsRequest;
    private volatile AuthenticationEvent authenticationEvent;
    private volatile Scope scope;

    public Grant(
            String grantId,
            AuthenticationEvent authenticationEvent,
            Scope scope,
            OIDCClaimsRequest claimsRequest) {
        this.grantId = grantId;
        this.authenticationEvent = authenticationEvent;
        this.scope = scope == null ? new Scope() : new Scope(scope);
        this.claimsRequest = claimsRequest;
    }

    public String getGrantId() {
        return grantId;
    }

    public AuthenticationEvent getAuthenticationEvent() {
        return authenticationEvent;
    }

    public void setAuthenticationEvent(AuthenticationEvent authenticationEvent) {
        this.authenticationEvent = authenticationEvent;
    }

    public Scope getScope() {
        return new Scope(scope);
    }

    public void setScope(Scope scope) {
        this.scope = new Scope(scope);
        claimsCache.clear();
    }

    public Optional<OIDCClaimsRequest> getClaimsRequest() {
        return Optional.ofNullable(claimsRequest);
    }

    public boolean coversRequest(Scope requestedScope, OIDCClaimsRequest requestedClaims) {
        var requested = requestedScope == null ? new Scope() : requestedScope;
        return scope.equals(requested)
                && Objects.equals(
                        claimsRequest == null ? null : claimsRequest.toJSONObject(),
                        requestedClaims == null ? null : requestedClaims.toJSONObject());
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public void addToken(Token token) {
        tokens.add(token);
    }

    public Optional<Token> getToken(String value) {
        return tokens.stream().filter(t -> t.getValue().equals(value)).findFirst();
    }

    /**
     * Revokes the token with the given value. When {@code recursive} is set every token based
     * on it, directly or transitively, is revoked too.
     *
     * @return the number of tokens newly revoked
     */
    public int revokeToken(String value, boolean recursive) {
        var revoked = 0;
        var pending = new LinkedHashSet<String>();
        var seen = new LinkedHashSet<String>();
        pending.add(value);
        while (!pending.isEmpty()) {
            var current = pending.iterator().next();
            pending.remove(current);
            if (!seen.add(current)) {
                continue;
            }
            var token = getToken(current);
            if (token.isPresent() && token.get().revoke()) {
                revoked++;
            }
            if (recursive) {
                tokens.stream()
                        .filter(t -> t.getBasedOn().map(current::equals).orElse(false))
                        .map(Token::getValue)
                        .forEach(pending::add);
            }
        }
        return revoked;
    }

    public int revokeAll() {
        return (int) tokens.stream().filter(Token::revoke).count();
    }

    public Optional<Set<String>> getCachedClaims(ClaimsUsage usage, long policyVersion) {
        return Optional.ofNullable(claimsCache.get(usage))
                .filter(c -> c.policyVersion() == policyVersion)
                .map(CachedClaims::claimNames);
    }

    public Set<String> cacheClaims(
            ClaimsUsage usage, Set<String> claimNames, long policyVersion) {
        var cached = Collections.unmodifiableSet(new LinkedHashSet<>(claimNames));
        claimsCache.put(usage, new CachedClaims(cached, policyVersion));
        return cached;
    }

    private record CachedClaims(Set<String> claimNames, long policyVersion) {}
}
