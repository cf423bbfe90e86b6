package io.backbork.core;

public class InvalidDestinationException extends BackborkException {

    public InvalidDestinationException(String message) {
        super(message);
    }
}
