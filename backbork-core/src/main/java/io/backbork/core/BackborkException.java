package io.backbork.core;

/**
 * Base type of every failure raised by backbork.
 */
public class BackborkException extends RuntimeException {

    public BackborkException(String message) {
        super(message);
    }

    public BackborkException(String message, Throwable cause) {
        super(message, cause);
    }
}
