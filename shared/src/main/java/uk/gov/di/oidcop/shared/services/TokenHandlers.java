package uk.gov.di.oidcop.shared.services;

import com.nimbusds.jwt.SignedJWT;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oidcop.shared.entity.TokenInfo;
import uk.gov.di.oidcop.shared.entity.TokenType;
import uk.gov.di.oidcop.shared.exceptions.ConfigurationException;
import uk.gov.di.oidcop.shared.helpers.IdGenerator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** One {@link TokenHandler} per {@link TokenType}, each keyed from a shared secret. */
public class TokenHandlers {

    private static final Logger LOG = LogManager.getLogger(TokenHandlers.class);

    private final Map<TokenType, TokenHandler> handlers = new EnumMap<>(TokenType.class);

    public TokenHandlers(ConfigurationService configurationService)
            throws ConfigurationException {
        this(secretFrom(configurationService));
    }

    public TokenHandlers(byte[] secret) throws ConfigurationException {
        if (secret == null || secret.length < TokenHandler.MINIMUM_SECRET_LENGTH) {
            throw new ConfigurationException(
                    String.format(
                            "Token handler secret must be at least %d bits",
                            TokenHandler.MINIMUM_SECRET_LENGTH * 8));
        }
        for (TokenType type : TokenType.values()) {
            handlers.put(type, new TokenHandler(type, deriveKey(secret, type)));
        }
    }

    public TokenHandler get(TokenType type) {
        return handlers.get(type);
    }

    /**
     * Decodes a value without knowing its kind in advance. The kind named in the value selects
     * the handler, which then verifies it.
     */
    public Optional<TokenInfo> decode(String value) {
        return tokenTypeOf(value).map(handlers::get).flatMap(h -> h.decode(value));
    }

    private static Optional<TokenType> tokenTypeOf(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            var claims = SignedJWT.parse(value).getJWTClaimsSet();
            return TokenType.fromValue(claims.getStringClaim(TokenHandler.TOKEN_TYPE_CLAIM));
        } catch (ParseException e) {
            LOG.warn("Unable to parse token value");
            return Optional.empty();
        }
    }

    private static byte[] secretFrom(ConfigurationService configurationService) {
        return configurationService
                .getTokenHandlerSecret()
                .map(s -> s.getBytes(StandardCharsets.UTF_8))
                .orElseGet(
                        () -> {
                            LOG.warn(
                                    "No token handler secret configured, "
                                            + "tokens will not survive a restart");
                            return IdGenerator.randomBytes(TokenHandler.MINIMUM_SECRET_LENGTH);
                        });
    }

    private static byte[] deriveKey(byte[] secret, TokenType type) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            md.update(type.getValue().getBytes(StandardCharsets.UTF_8));
            return md.digest(secret);
        } catch (NoSuchAlgorithmException e) {
            LOG.error("Failed to derive token handler key", e);
            throw new RuntimeException(e);
        }
    }
}
