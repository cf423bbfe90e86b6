package io.backbork.core;

/**
 * Per-account progress of a running job.
 */
public record Progress(int accountsTotal, int accountsCompleted) {

    public static Progress none() {
        return new Progress(0, 0);
    }

    public Progress {
        if (accountsTotal < 0 || accountsCompleted < 0) {
            throw new IllegalArgumentException("progress counters must not be negative");
        }
        if (accountsCompleted > accountsTotal) {
            throw new IllegalArgumentException(
                    "accountsCompleted " + accountsCompleted + " exceeds accountsTotal " + accountsTotal);
        }
    }

    public int percent() {
        if (accountsTotal == 0) {
            return 0;
        }
        return (int) (100L * accountsCompleted / accountsTotal);
    }
}
