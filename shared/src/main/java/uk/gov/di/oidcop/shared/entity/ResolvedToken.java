package uk.gov.di.oidcop.shared.entity;

public record ResolvedToken(Session session, Grant grant, Token token) {}
