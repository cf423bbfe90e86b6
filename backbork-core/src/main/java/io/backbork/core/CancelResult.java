package io.backbork.core;

/**
 * Result of a cancel request.
 *
 * <p>{@code REMOVED}: the job had not started and was dropped from the queue.
 * {@code REQUESTED}: the job is processing and stops after its current account.
 */
public record CancelResult(String jobId, Outcome outcome, String message) {

    public enum Outcome {
        REMOVED,
        REQUESTED
    }

    public static CancelResult removed(String jobId) {
        return new CancelResult(jobId, Outcome.REMOVED, "Queued job removed");
    }

    public static CancelResult requested(String jobId) {
        return new CancelResult(jobId, Outcome.REQUESTED,
                "Cancellation requested - job will stop after current account");
    }
}
