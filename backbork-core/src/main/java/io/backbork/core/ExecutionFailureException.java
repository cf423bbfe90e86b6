package io.backbork.core;

/**
 * Raised by an {@link io.backbork.ExecutionEngine} when an account operation cannot be performed.
 * The processor records it against the account and continues with the next one.
 */
public class ExecutionFailureException extends BackborkException {

    public ExecutionFailureException(String message) {
        super(message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
