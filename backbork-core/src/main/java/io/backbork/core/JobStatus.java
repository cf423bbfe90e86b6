package io.backbork.core;

/**
 * Job lifecycle states.
 *
 * <p>{@code QUEUED -> PROCESSING -> COMPLETED | FAILED | CANCELLED}. Transitions are one-way;
 * a queued job that is cancelled is removed instead of reaching {@code CANCELLED}.
 */
public enum JobStatus {
    QUEUED(false),
    PROCESSING(false),
    COMPLETED(true),
    FAILED(true),
    CANCELLED(true);

    private final boolean terminal;

    JobStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
