package uk.gov.di.oidcop.oidc.entity;

import uk.gov.di.oidcop.shared.entity.Grant;
import uk.gov.di.oidcop.shared.entity.Session;
import uk.gov.di.oidcop.shared.entity.Token;

public record AccessTokenInfo(Session session, Grant grant, Token token) {

    public String clientID() {
        return session.getClientId();
    }
}
