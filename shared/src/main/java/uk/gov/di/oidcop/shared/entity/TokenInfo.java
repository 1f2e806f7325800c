package uk.gov.di.oidcop.shared.entity;

/** The verified contents of a token value, as recovered by its token handler. */
public record TokenInfo(
        TokenType type, String tokenId, String sessionId, long issuedAt, long expiresAt) {}
