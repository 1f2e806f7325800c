package uk.gov.di.oidcop.shared.services;

import uk.gov.di.oidcop.shared.entity.ClientRegistry;

import java.util.Optional;

public interface ClientService {

    void addClient(ClientRegistry client);

    Optional<ClientRegistry> getClient(String clientId);
}
