package uk.gov.di.oidcop.shared.services;

import com.google.gson.reflect.TypeToken;
import com.nimbusds.openid.connect.sdk.OIDCScopeValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.CustomScopeValue;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.serialization.Json;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Maps scope names to the claims they release: the standard OIDC scopes plus custom ones. */
public class ScopeRegistry {

    private static final Logger LOG = LogManager.getLogger(ScopeRegistry.class);

    private final Map<String, Set<String>> scopeClaims = new LinkedHashMap<>();

    public ScopeRegistry() {
        this(List.of());
    }

    public ScopeRegistry(List<CustomScopeValue> customScopes) {
        for (OIDCScopeValue scope : OIDCScopeValue.values()) {
            var claimNames = scope.getClaimNames();
            if (claimNames == null) {
                continue;
            }
            scopeClaims.put(scope.getValue(), new LinkedHashSet<>(claimNames));
        }
        for (CustomScopeValue scope : customScopes) {
            if (scopeClaims.containsKey(scope.getValue())) {
                LOG.warn("Custom scope {} overrides a standard scope", scope.getValue());
            }
            scopeClaims.put(scope.getValue(), scope.getClaimNames());
        }
    }

    public static ScopeRegistry fromConfiguration(
            ConfigurationService configurationService, Json objectMapper)
            throws ConfigurationException {
        var customScopes = configurationService.getCustomScopes();
        if (customScopes.isEmpty()) {
            return new ScopeRegistry();
        }
        try {
            Map<String, List<String>> parsed =
                    objectMapper.readValue(
                            customScopes.get(),
                            new TypeToken<LinkedHashMap<String, List<String>>>() {}.getType());
            var values =
                    parsed.entrySet().stream()
                            .map(e -> new CustomScopeValue(e.getKey(), e.getValue()))
                            .toList();
            LOG.info("Registered {} custom scopes", values.size());
            return new ScopeRegistry(values);
        } catch (Json.JsonException e) {
            throw new ConfigurationException("Unable to parse custom scopes", e);
        }
    }

    public Set<String> getScopes() {
        return Collections.unmodifiableSet(scopeClaims.keySet());
    }

    public Set<String> getClaimsForScope(String scope) {
        return Collections.unmodifiableSet(scopeClaims.getOrDefault(scope, Set.of()));
    }

    public Set<String> getClaimsForListOfScopes(Collection<String> scopes) {
        Set<String> claims = new LinkedHashSet<>();
        for (String scope : scopes) {
            claims.addAll(scopeClaims.getOrDefault(scope, Set.of()));
        }
        return claims;
    }

    public Set<String> getAllClaims() {
        Set<String> claims = new LinkedHashSet<>();
        scopeClaims.values().forEach(claims::addAll);
        return claims;
    }
}
