package io.backbork.core;

public class TransportFailureException extends BackborkException {

    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
