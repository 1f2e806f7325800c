package uk.gov.di.oidcop.shared.entity;

import com.nimbusds.oauth2.sdk.Scope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** A scope registered by the provider on top of the standard OpenID Connect scopes. */
public class CustomScopeValue extends Scope.Value {

    private final List<String> claims;

    public CustomScopeValue(final String value, final List<String> claims) {
        super(value, Requirement.OPTIONAL);
        this.claims = List.copyOf(claims);
    }

    public Set<String> getClaimNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(claims));
    }
}
