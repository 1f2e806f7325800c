package uk.gov.di.oidcop.shared.exceptions;

public class StaleAuthenticationException extends AccessTokenException {

    public StaleAuthenticationException(String message) {
        super(message, TokenErrors.ACCESS_NOT_GRANTED);
    }
}
