package uk.gov.di.oidcop.shared.entity;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class Session {

    private final String sessionId;
    private final String userId;
    private final String clientId;
    private final SubjectType subjectType;
    private final String sectorIdentifier;
    private final String subject;
    private final Map<String, Grant> grants = new ConcurrentHashMap<>();
    private volatile String currentGrantId;

    public Session(
            String sessionId,
            String userId,
            String clientId,
            SubjectType subjectType,
            String sectorIdentifier,
            String subject) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.clientId = clientId;
        this.subjectType = subjectType;
        this.sectorIdentifier = sectorIdentifier;
        this.subject = subject;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getClientId() {
        return clientId;
    }

    public SubjectType getSubjectType() {
        return subjectType;
    }

    public Optional<String> getSectorIdentifier() {
        return Optional.ofNullable(sectorIdentifier);
    }

    public String getSubject() {
        return subject;
    }

    public void addGrant(Grant grant) {
        grants.put(grant.getGrantId(), grant);
        currentGrantId = grant.getGrantId();
    }

    public void setCurrentGrant(String grantId) {
        this.currentGrantId = grantId;
    }

    public Optional<Grant> getCurrentGrant() {
        return Optional.ofNullable(currentGrantId).map(grants::get);
    }

    public Optional<Grant> getGrant(String grantId) {
        return Optional.ofNullable(grants.get(grantId));
    }

    public Collection<Grant> getGrants() {
        return Collections.unmodifiableCollection(grants.values());
    }
}
