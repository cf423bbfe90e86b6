package io.backbork.core;

import java.util.List;

/**
 * Outcome of one queue processing pass.
 *
 * <p>{@code skipped} means another valid lock holder is active; it is a normal outcome.
 */
public record PassResult(
        boolean skipped,
        int schedulesQueued,
        int jobsCompleted,
        int jobsFailed,
        int jobsCancelled,
        int interruptedRecovered,
        int pruned,
        List<String> accounts
) {

    public PassResult {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public static PassResult skippedResult() {
        return new PassResult(true, 0, 0, 0, 0, 0, 0, List.of());
    }

    public int jobsProcessed() {
        return jobsCompleted + jobsFailed + jobsCancelled;
    }
}
