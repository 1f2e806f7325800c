package uk.gov.di.oidcop.shared.exceptions;

public class TokenNotFoundException extends AccessTokenException {

    public TokenNotFoundException(String message) {
        super(message, TokenErrors.INVALID_TOKEN);
    }
}
