package io.backbork.core;

/**
 * I/O or driver failure inside a store.
 */
public class StoreException extends BackborkException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
