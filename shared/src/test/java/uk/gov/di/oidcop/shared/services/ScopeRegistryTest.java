package uk.gov.di.oidcop.shared.services;

import org.junit.jupiter.api.Test;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScopeRegistryTest {

    private final ConfigurationService configurationService = mock(ConfigurationService.class);

    @Test
    void shouldRegisterStandardScopes() {
        var registry = new ScopeRegistry();

        assertThat(registry.getScopes(), hasItems("openid", "profile", "email", "address", "phone"));
        assertThat(registry.getScopes(), not(hasItem("offline_access")));
        assertThat(registry.getClaimsForScope("openid"), contains("sub"));
        assertThat(registry.getClaimsForScope("email"), contains("email", "email_verified"));
        assertThat(registry.getClaimsForScope("unknown"), empty());
    }

    @Test
    void shouldRegisterCustomScopesFromConfiguration() throws Exception {
        when(configurationService.getCustomScopes())
                .thenReturn(
                        Optional.of(
                                "{\"research_and_scholarship\": [\"name\", \"given_name\", \"eduperson_scoped_affiliation\"]}"));

        var registry =
                ScopeRegistry.fromConfiguration(configurationService, new SerializationService());

        assertThat(
                registry.getClaimsForScope("research_and_scholarship"),
                contains("name", "given_name", "eduperson_scoped_affiliation"));
        assertThat(
                registry.getClaimsForListOfScopes(List.of("openid", "research_and_scholarship")),
                contains("sub", "name", "given_name", "eduperson_scoped_affiliation"));
        assertThat(registry.getAllClaims(), hasItem("eduperson_scoped_affiliation"));
    }

    @Test
    void shouldFailOnMalformedCustomScopes() {
        when(configurationService.getCustomScopes()).thenReturn(Optional.of("[not json"));

        assertThrows(
                ConfigurationException.class,
                () ->
                        ScopeRegistry.fromConfiguration(
                                configurationService, new SerializationService()));
    }
}
