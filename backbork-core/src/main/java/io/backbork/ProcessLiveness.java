package io.backbork;

/**
 * Checks whether the process holding the queue lock is still running.
 */
@FunctionalInterface
public interface ProcessLiveness {

    enum State {
        ALIVE,
        DEAD,
        /**
         * No usable liveness primitive; the caller falls back to lock age.
         */
        UNKNOWN
    }

    State check(long pid);

    /**
     * Liveness through {@link ProcessHandle}, available on the local host only.
     */
    static ProcessLiveness processHandles() {
        return pid -> {
            if (pid <= 0) {
                return State.DEAD;
            }
            try {
                return ProcessHandle.of(pid)
                        .map(handle -> handle.isAlive() ? State.ALIVE : State.DEAD)
                        .orElse(State.DEAD);
            } catch (SecurityException | UnsupportedOperationException e) {
                return State.UNKNOWN;
            }
        };
    }

    static ProcessLiveness unavailable() {
        return pid -> State.UNKNOWN;
    }
}
