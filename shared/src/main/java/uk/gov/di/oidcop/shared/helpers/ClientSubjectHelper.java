package uk.gov.di.oidcop.shared.helpers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.ClientRegistry;
import uk.gov.di.oidcop.shared.entity.SubjectType;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.stream.Collectors;

public class ClientSubjectHelper {

    private static final Logger LOG = LogManager.getLogger(ClientSubjectHelper.class);

    public static String calculateSubject(
            SubjectType subjectType,
            String userId,
            String clientId,
            String sectorHost,
            byte[] salt) {
        switch (subjectType) {
            case PAIRWISE:
                return calculatePairwiseIdentifier(userId, sectorHost, salt);
            case EPHEMERAL:
                return hash(salt, "ephemeral", clientId, userId);
            case PUBLIC:
            default:
                return hash(salt, "public", userId);
        }
    }

    public static String getSectorIdentifierForClient(ClientRegistry client)
            throws ConfigurationException {
        if (!hasValidClientConfig(client)) {
            String message =
                    String.format(
                            "ClientConfig for client %s has invalid sector id.",
                            client.getClientID());
            LOG.error(message);
            throw new ConfigurationException(message);
        }
        if (client.getSectorIdentifierUri() != null) {
            return returnHost(client.getSectorIdentifierUri());
        }
        var redirectUri = client.getRedirectUrls().stream().findFirst();
        if (redirectUri.isEmpty()) {
            throw new ConfigurationException(
                    String.format("Client %s has no redirect uris", client.getClientID()));
        }
        return returnHost(redirectUri.get());
    }

    static boolean hasValidClientConfig(ClientRegistry client) {
        if (client.getRedirectUrls().size() > 1 && client.getSectorIdentifierUri() == null) {
            return client.getRedirectUrls().stream()
                            .map(ClientSubjectHelper::hostOrNull)
                            .collect(Collectors.toSet())
                            .size()
                    == 1;
        } else {
            return true;
        }
    }

    public static String returnHost(String uri) throws ConfigurationException {
        var hostname = hostOrNull(uri);
        if (hostname == null) {
            LOG.error("Not a valid sector identifier URI");
            throw new ConfigurationException("Not a valid URI: " + uri);
        }
        return hostname.startsWith("www.") ? hostname.substring(4) : hostname;
    }

    private static String hostOrNull(String uri) {
        try {
            return URI.create(uri).getHost();
        } catch (IllegalArgumentException | NullPointerException e) {
            return null;
        }
    }

    public static String calculatePairwiseIdentifier(
            String subjectID, String sectorHost, byte[] salt) {
        try {
            var md = MessageDigest.getInstance("SHA-256");

            md.update(sectorHost.getBytes(StandardCharsets.UTF_8));
            md.update(subjectID.getBytes(StandardCharsets.UTF_8));

            return toHex(md.digest(salt));
        } catch (NoSuchAlgorithmException e) {
            LOG.error("Failed to hash", e);
            throw new RuntimeException(e);
        }
    }

    private static String hash(byte[] salt, String... parts) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            for (String part : parts) {
                md.update(part.getBytes(StandardCharsets.UTF_8));
                md.update((byte) 0);
            }
            return toHex(md.digest(salt));
        } catch (NoSuchAlgorithmException e) {
            LOG.error("Failed to hash", e);
            throw new RuntimeException(e);
        }
    }

    private static String toHex(byte[] bytes) {
        var sb = new StringBuilder();
        for (byte aByte : bytes) {
            sb.append(Integer.toString((aByte & 0xff) + 0x100, 16).substring(1));
        }
        return sb.toString();
    }
}
