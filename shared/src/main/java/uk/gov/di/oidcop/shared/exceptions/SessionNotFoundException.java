package uk.gov.di.oidcop.shared.exceptions;

public class SessionNotFoundException extends Exception {

    public SessionNotFoundException(String message) {
        super(message);
    }
}
