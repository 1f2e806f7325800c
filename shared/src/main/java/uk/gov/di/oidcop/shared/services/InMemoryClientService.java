package uk.gov.di.oidcop.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.ClientRegistry;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.serialization.Json;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryClientService implements ClientService {

    private static final Logger LOG = LogManager.getLogger(InMemoryClientService.class);

    private final Map<String, ClientRegistry> clientRegistry = new ConcurrentHashMap<>();

    public InMemoryClientService() {}

    public static InMemoryClientService fromConfiguration(
            ConfigurationService configurationService, Json objectMapper)
            throws ConfigurationException {
        var service = new InMemoryClientService();
        var registry = configurationService.getClientRegistry();
        if (registry.isEmpty()) {
            LOG.warn("No client registry configured");
            return service;
        }
        try {
            for (ClientRegistry client :
                    objectMapper.readValue(registry.get(), ClientRegistry[].class)) {
                service.addClient(client);
            }
        } catch (Json.JsonException e) {
            throw new ConfigurationException("Unable to parse client registry", e);
        }
        LOG.info("Loaded {} clients", service.clientRegistry.size());
        return service;
    }

    @Override
    public void addClient(ClientRegistry client) {
        clientRegistry.put(client.getClientID(), client);
    }

    @Override
    public Optional<ClientRegistry> getClient(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clientRegistry.get(clientId));
    }
}
