package io.backbork.internal;

import io.backbork.ProcessLiveness;
import io.backbork.core.LockRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueLockTest {

    private static final String HOST = "host-a";
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryStores.Lock store = new InMemoryStores.Lock();
    private final MutableClock clock = new MutableClock(T0);

    private QueueLock lock(ProcessLiveness liveness) {
        return new QueueLock(store, liveness, clock, Duration.ofHours(1), HOST, 100L);
    }

    @Test
    void shouldAcquireAndReleaseFreeLock() {
        QueueLock lock = lock(pid -> ProcessLiveness.State.ALIVE);

        Optional<QueueLock.Lease> lease = lock.tryAcquire();

        assertTrue(lease.isPresent());
        assertTrue(store.read().isPresent());
        assertEquals(100L, store.read().get().holderPid());

        lease.get().close();
        assertTrue(store.read().isEmpty());
    }

    @Test
    void liveHolderShouldBlockRegardlessOfAge() {
        store.put(new LockRecord("other", 200L, HOST, T0, T0));
        clock.advance(Duration.ofDays(3));

        assertTrue(lock(pid -> ProcessLiveness.State.ALIVE).tryAcquire().isEmpty());
        assertEquals("other", store.read().get().token());
    }

    @Test
    void deadHolderShouldBeRemovedImmediately() {
        store.put(new LockRecord("other", 200L, HOST, T0, T0));
        clock.advance(Duration.ofSeconds(5));

        Optional<QueueLock.Lease> lease = lock(pid -> ProcessLiveness.State.DEAD).tryAcquire();

        assertTrue(lease.isPresent());
        assertEquals(lease.get().token(), store.read().get().token());
    }

    @Test
    void unverifiableHolderShouldBlockUntilStaleCeiling() {
        store.put(new LockRecord("other", 200L, HOST, T0, T0));
        QueueLock lock = lock(ProcessLiveness.unavailable());

        clock.set(T0.plus(Duration.ofMinutes(59)));
        assertTrue(lock.tryAcquire().isEmpty());

        clock.set(T0.plus(Duration.ofMinutes(61)));
        assertTrue(lock.tryAcquire().isPresent());
    }

    @Test
    void heartbeatShouldPostponeStaleness() {
        store.put(new LockRecord("other", 200L, HOST, T0, T0.plus(Duration.ofMinutes(50))));
        clock.set(T0.plus(Duration.ofMinutes(90)));

        assertTrue(lock(ProcessLiveness.unavailable()).tryAcquire().isEmpty());
    }

    @Test
    void lockFromAnotherHostShouldFallBackToAge() {
        store.put(new LockRecord("other", 200L, "host-b", T0, T0));
        // would say DEAD for any pid, but pids of another host are meaningless here
        QueueLock lock = lock(pid -> ProcessLiveness.State.DEAD);

        clock.set(T0.plus(Duration.ofMinutes(30)));
        assertTrue(lock.tryAcquire().isEmpty());

        clock.set(T0.plus(Duration.ofHours(2)));
        assertTrue(lock.tryAcquire().isPresent());
    }

    @Test
    void heartbeatShouldRefreshOwnLockOnly() {
        QueueLock lock = lock(pid -> ProcessLiveness.State.ALIVE);
        QueueLock.Lease lease = lock.tryAcquire().orElseThrow();

        clock.advance(Duration.ofMinutes(10));
        assertTrue(lease.heartbeat());
        assertEquals(T0.plus(Duration.ofMinutes(10)), store.read().get().heartbeatAt());

        store.put(new LockRecord("stolen", 300L, HOST, T0, T0));
        assertFalse(lease.heartbeat());
        lease.close();
        assertEquals("stolen", store.read().get().token());
    }

    @Test
    void isLockedShouldApplySamePolicyAndCleanOrphans() {
        QueueLock alive = lock(pid -> ProcessLiveness.State.ALIVE);
        QueueLock dead = lock(pid -> ProcessLiveness.State.DEAD);
        assertFalse(alive.isLocked());

        store.put(new LockRecord("other", 200L, HOST, T0, T0));
        assertTrue(alive.isLocked());
        assertFalse(dead.isLocked());
        assertTrue(store.read().isEmpty());
    }

    @Test
    void lockWithoutPidShouldBeJudgedByAge() {
        store.put(new LockRecord("legacy", null, null, T0, null));
        QueueLock lock = lock(pid -> ProcessLiveness.State.ALIVE);

        clock.set(T0.plus(Duration.ofMinutes(10)));
        assertTrue(lock.tryAcquire().isEmpty());

        clock.set(T0.plus(Duration.ofMinutes(61)));
        assertTrue(lock.tryAcquire().isPresent());
    }
}
