package uk.gov.di.oidcop.shared.exceptions;

public class ClientNotFoundException extends Exception {

    public ClientNotFoundException(String message) {
        super(message);
    }
}
