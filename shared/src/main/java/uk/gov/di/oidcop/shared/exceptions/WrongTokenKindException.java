package uk.gov.di.oidcop.shared.exceptions;

public class WrongTokenKindException extends AccessTokenException {

    public WrongTokenKindException(String message) {
        super(message, TokenErrors.WRONG_TYPE_OF_TOKEN);
    }
}
