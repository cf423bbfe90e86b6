package io.backbork;

/**
 * Cooperative cancellation flag of a running job, observed at account boundaries.
 */
@FunctionalInterface
public interface CancellationToken {

    boolean isCancellationRequested();

    static CancellationToken none() {
        return () -> false;
    }
}
