package uk.gov.di.oidcop.shared.services;

import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.serialization.Json;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryUserInfoStore implements UserInfoStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryUserInfoStore.class);

    private final Map<String, Map<String, Object>> users = new ConcurrentHashMap<>();

    public InMemoryUserInfoStore() {}

    public InMemoryUserInfoStore(Map<String, Map<String, Object>> users) {
        users.forEach(this::addUser);
    }

    public static InMemoryUserInfoStore fromJson(String json, Json objectMapper)
            throws ConfigurationException {
        try {
            Map<String, Map<String, Object>> parsed =
                    objectMapper.readValue(
                            json,
                            new TypeToken<
                                    LinkedHashMap<String, LinkedHashMap<String, Object>>>() {}.getType());
            return new InMemoryUserInfoStore(parsed);
        } catch (Json.JsonException e) {
            throw new ConfigurationException("Unable to parse user info", e);
        }
    }

    public static InMemoryUserInfoStore fromConfiguration(
            ConfigurationService configurationService, Json objectMapper)
            throws ConfigurationException {
        var json = configurationService.getUserInfoStore();
        if (json.isEmpty()) {
            LOG.warn("No user info configured");
            return new InMemoryUserInfoStore();
        }
        return fromJson(json.get(), objectMapper);
    }

    public void addUser(String userId, Map<String, Object> claims) {
        users.put(userId, new LinkedHashMap<>(claims));
    }

    @Override
    public Map<String, Object> getUserClaims(String userId, Collection<String> claimNames) {
        var user = userId == null ? null : users.get(userId);
        Map<String, Object> claims = new LinkedHashMap<>();
        if (user == null) {
            LOG.warn("No user info held for requested user");
            return claims;
        }
        for (String claimName : claimNames) {
            if (user.containsKey(claimName)) {
                claims.put(claimName, user.get(claimName));
            }
        }
        return claims;
    }
}
