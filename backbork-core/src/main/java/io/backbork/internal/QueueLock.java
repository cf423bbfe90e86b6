package io.backbork.internal;

import io.backbork.ProcessLiveness;
import io.backbork.config.BackborkProperties;
import io.backbork.core.LockRecord;
import io.backbork.store.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-flight lock of the queue processor.
 *
 * <p>An existing lock blocks acquisition while its holder is verifiably alive, however old it is.
 * A lock whose holder is verifiably dead is orphaned and removed. When liveness cannot be checked
 * (holder on another host, no pid recorded, or no liveness primitive) the lock blocks until its last
 * heartbeat is older than {@code staleAfter}.
 */
public class QueueLock {
    private static final Logger log = LoggerFactory.getLogger(QueueLock.class);

    enum Verdict {
        VALID,
        ORPHANED,
        STALE
    }

    private final LockStore store;
    private final ProcessLiveness liveness;
    private final Clock clock;
    private final Duration staleAfter;
    private final String host;
    private final long pid;

    public QueueLock(LockStore store, ProcessLiveness liveness, Clock clock, Duration staleAfter, String host, long pid) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.liveness = Objects.requireNonNull(liveness, "liveness must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter must not be null");
        if (staleAfter.isZero() || staleAfter.isNegative()) {
            throw new IllegalArgumentException("staleAfter must be a positive duration");
        }
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.pid = pid;
    }

    /**
     * Lock for the current process, identified by host name (or {@code backbork.worker-id}) and pid.
     */
    public static QueueLock forCurrentProcess(LockStore store, ProcessLiveness liveness, Clock clock, BackborkProperties props) {
        return new QueueLock(store, liveness, clock, props.getLockStaleAfter(),
                resolveHost(props.getWorkerId()), ProcessHandle.current().pid());
    }

    /**
     * Try to take the lock.
     *
     * @return the lease, or empty if another valid holder is active
     */
    public Optional<Lease> tryAcquire() {
        Optional<LockRecord> existing = store.read();
        if (existing.isPresent()) {
            LockRecord current = existing.get();
            Verdict verdict = evaluate(current);
            if (verdict == Verdict.VALID) {
                log.debug("backbork lock held token={} pid={} host={}", current.token(), current.holderPid(), current.host());
                return Optional.empty();
            }
            log.warn("backbork lock discarded verdict={} pid={} host={} lastSeen={}",
                    verdict, current.holderPid(), current.host(), current.lastSeen());
            if (!store.removeIf(current)) {
                // someone else replaced or removed it in the meantime
                return Optional.empty();
            }
        }

        Instant now = clock.instant();
        LockRecord mine = new LockRecord(UUID.randomUUID().toString(), pid, host, now, now);
        if (!store.tryCreate(mine)) {
            log.debug("backbork lock lost creation race");
            return Optional.empty();
        }
        log.debug("backbork lock acquired token={} pid={}", mine.token(), pid);
        return Optional.of(new Lease(mine.token()));
    }

    /**
     * True if a valid lock exists. Orphaned or stale locks found on the way are removed.
     */
    public boolean isLocked() {
        Optional<LockRecord> existing = store.read();
        if (existing.isEmpty()) {
            return false;
        }
        LockRecord current = existing.get();
        if (evaluate(current) == Verdict.VALID) {
            return true;
        }
        store.removeIf(current);
        return false;
    }

    Verdict evaluate(LockRecord lock) {
        ProcessLiveness.State state = ProcessLiveness.State.UNKNOWN;
        if (lock.holderPid() != null && host.equals(lock.host())) {
            state = liveness.check(lock.holderPid());
        }

        switch (state) {
            case ALIVE:
                return Verdict.VALID;
            case DEAD:
                return Verdict.ORPHANED;
            default:
                Instant lastSeen = lock.lastSeen();
                if (lastSeen == null) {
                    return Verdict.STALE;
                }
                Duration age = Duration.between(lastSeen, clock.instant());
                return age.compareTo(staleAfter) > 0 ? Verdict.STALE : Verdict.VALID;
        }
    }

    private static String resolveHost(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.warn("backbork could not resolve host name msg={}", e.getMessage());
            return "localhost";
        }
    }

    /**
     * A held lock. Closing it releases the lock.
     */
    public final class Lease implements AutoCloseable {
        private final String token;
        private boolean released;
        private boolean lost;

        private Lease(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        /**
         * Refresh the heartbeat so monitors can tell a slow pass from a stuck one.
         *
         * @return false if the lock is no longer held with this lease
         */
        public boolean heartbeat() {
            boolean ok = store.heartbeat(token, clock.instant());
            if (!ok) {
                lost = true;
                log.error("backbork lock heartbeat rejected, lock taken over token={}", token);
            }
            return ok;
        }

        /**
         * True once a heartbeat was rejected; the holder must stop starting new work.
         */
        public boolean isLost() {
            return lost;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            if (store.release(token)) {
                log.debug("backbork lock released token={}", token);
            } else {
                log.warn("backbork lock was already gone on release token={}", token);
            }
        }
    }
}
