package io.backbork.store;

import io.backbork.core.LockRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage of the single queue processing lock. Validity is decided by the caller;
 * the store only offers atomic primitives.
 */
public interface LockStore {

    Optional<LockRecord> read();

    /**
     * Create the lock if none exists.
     *
     * @return false if a lock already exists
     */
    boolean tryCreate(LockRecord lock);

    /**
     * Remove {@code expected} if it is still the current lock.
     *
     * @return false if the lock changed or vanished in the meantime
     */
    boolean removeIf(LockRecord expected);

    /**
     * Refresh the heartbeat of the lock held with {@code token}.
     *
     * @return false if the lock is no longer held with this token
     */
    boolean heartbeat(String token, Instant at);

    /**
     * Remove the lock held with {@code token}.
     */
    boolean release(String token);
}
