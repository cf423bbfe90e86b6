package io.backbork.config;

import io.backbork.BackupQueue;
import io.backbork.core.PassResult;
import io.backbork.internal.QueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a processing pass every {@code backbork.trigger.process-every} on a daemon thread, bound to
 * the Spring container lifecycle. Overlap with passes started elsewhere is resolved by the queue lock.
 */
public class QueuePassLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(QueuePassLifecycle.class);

    private static final int MAX_CONSECUTIVE_FAILURES = 30;

    private final QueueProcessor processor;
    private final BackupQueue queue;
    private final BackborkProperties props;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile Thread passThread;
    private int failureCount;

    public QueuePassLifecycle(QueueProcessor processor, BackupQueue queue, BackborkProperties props) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Duration interval = Objects.requireNonNull(props.getTrigger().getProcessEvery(),
                "backbork.trigger.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("backbork.trigger.processEvery must be a positive duration");
        }

        log.info("backbork queue trigger starting processEvery={}", interval);
        Thread t = new Thread(this::passLoop);
        t.setName("backbork.queue");
        t.setDaemon(true);
        passThread = t;
        t.start();
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        Thread t = passThread;
        passThread = null;
        if (t != null) {
            // a running pass finishes its current account; the lock is released on the way out
            t.interrupt();
        }
        log.info("backbork queue trigger stopped");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /**
     * Run one pass, then trim finished history older than {@code backbork.completed-retention}.
     */
    PassResult runOnce() {
        PassResult result = processor.runPass();
        if (!result.skipped()) {
            Duration retention = props.getCompletedRetention();
            if (retention != null && !retention.isZero() && !retention.isNegative()) {
                int removed = queue.cleanupCompletedJobs(retention);
                if (removed > 0) {
                    log.debug("backbork completed history trimmed count={}", removed);
                }
            }
        }
        return result;
    }

    private void passLoop() {
        while (started.get()) {
            Duration sleep = props.getTrigger().getProcessEvery();
            try {
                runOnce();
                failureCount = 0;
            } catch (RuntimeException e) {
                failureCount++;
                log.error("backbork queue pass failed count={} msg={}", failureCount, e.getMessage(), e);
                if (failureCount >= MAX_CONSECUTIVE_FAILURES) {
                    log.error("backbork queue trigger stopped after repeated failures");
                    started.set(false);
                    break;
                }
                sleep = failureCount >= 10 ? Duration.ofSeconds(60) : backoff(failureCount);
            }

            try {
                Thread.sleep(sleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated pass failures.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
