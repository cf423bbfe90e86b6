package io.backbork.core;

/**
 * Result of submitting a job or schedule. {@code warning} is set when the request was accepted
 * despite a problem, e.g. a one-time job against a disabled destination.
 */
public record SubmitResult(String id, boolean schedule, String warning) {

    public boolean hasWarning() {
        return warning != null;
    }
}
