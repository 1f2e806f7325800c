package uk.gov.di.oidcop.shared.entity;

public record SessionInfo(Session session, Grant grant) {}
