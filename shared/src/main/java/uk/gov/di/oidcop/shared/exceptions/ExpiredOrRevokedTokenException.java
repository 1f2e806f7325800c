package uk.gov.di.oidcop.shared.exceptions;

public class ExpiredOrRevokedTokenException extends AccessTokenException {

    public ExpiredOrRevokedTokenException(String message) {
        super(message, TokenErrors.INVALID_TOKEN);
    }
}
