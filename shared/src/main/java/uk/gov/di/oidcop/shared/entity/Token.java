package uk.gov.di.oidcop.shared.entity;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single security token issued under a grant. Tokens are never removed from their grant;
 * revocation only flips the {@code revoked} flag.
 */
public class Token {

    private final TokenType type;
    private final String value;
    private final String sessionId;
    private final long issuedAt;
    private final long expiresAt;
    private final String basedOn;
    private final AtomicBoolean revoked = new AtomicBoolean(false);
    private final AtomicInteger usage = new AtomicInteger(0);

    public Token(
            TokenType type,
            String value,
            String sessionId,
            long issuedAt,
            long expiresAt,
            String basedOn) {
        if (expiresAt <= issuedAt) {
            throw new IllegalArgumentException("Token must expire after it is issued");
        }
        this.type = type;
        this.value = value;
        this.sessionId = sessionId;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.basedOn = basedOn;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getIssuedAt() {
        return issuedAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public Optional<String> getBasedOn() {
        return Optional.ofNullable(basedOn);
    }

    public boolean isRevoked() {
        return revoked.get();
    }

    /** Returns true only for the call that performed the revocation. */
    public boolean revoke() {
        return revoked.compareAndSet(false, true);
    }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }

    public boolean isActive(long now) {
        return !isRevoked() && !isExpired(now);
    }

    public int getUsage() {
        return usage.get();
    }

    public int registerUsage() {
        return usage.incrementAndGet();
    }
}
