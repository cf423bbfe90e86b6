package io.backbork.internal;

import io.backbork.AccessResolver;
import io.backbork.AuditSink;
import io.backbork.CancellationToken;
import io.backbork.DestinationRegistry;
import io.backbork.ExecutionEngine;
import io.backbork.Transport;
import io.backbork.config.BackborkProperties;
import io.backbork.core.AccountOperation;
import io.backbork.core.AccountResult;
import io.backbork.core.AccountSelection;
import io.backbork.core.AuditEventType;
import io.backbork.core.Destination;
import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;
import io.backbork.core.JobStatus;
import io.backbork.core.JobType;
import io.backbork.core.ManifestEntry;
import io.backbork.core.NotFoundException;
import io.backbork.core.PassResult;
import io.backbork.core.Progress;
import io.backbork.core.PruneResult;
import io.backbork.core.Schedule;
import io.backbork.store.BackborkStores;
import io.backbork.utils.JobIds;
import io.backbork.utils.RecurrenceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs one processing pass over the queue:
 * <ol>
 *   <li>acquire the {@link QueueLock} (a held lock means the pass is skipped)</li>
 *   <li>fail jobs left in {@code running} by a pass that died</li>
 *   <li>materialize due schedules into queued jobs</li>
 *   <li>drain the queue one job at a time, one account at a time</li>
 *   <li>prune artifacts beyond each schedule's retention</li>
 *   <li>release the lock, also when any step throws</li>
 * </ol>
 *
 * <p>Passes are meant to be started by an external periodic trigger; each pass is single-threaded
 * and runs to completion.
 */
public class QueueProcessor {
    private static final Logger log = LoggerFactory.getLogger(QueueProcessor.class);

    static final String INTERRUPTED_MESSAGE = "Interrupted: processing pass ended unexpectedly";

    private final BackborkStores stores;
    private final ExecutionEngine engine;
    private final AccessResolver accessResolver;
    private final DestinationRegistry destinations;
    private final QueueLock lock;
    private final Auditor auditor;
    private final RetentionPruner pruner;
    private final Clock clock;
    private final ZoneId zone;

    public QueueProcessor(BackborkProperties props,
                          BackborkStores stores,
                          ExecutionEngine engine,
                          Transport transport,
                          AccessResolver accessResolver,
                          DestinationRegistry destinations,
                          AuditSink auditSink,
                          QueueLock lock,
                          Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.accessResolver = Objects.requireNonNull(accessResolver, "accessResolver must not be null");
        this.destinations = Objects.requireNonNull(destinations, "destinations must not be null");
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.auditor = new Auditor(auditSink == null ? AuditSink.noop() : auditSink, clock);
        this.pruner = new RetentionPruner(stores.schedules(), stores.manifest(),
                Objects.requireNonNull(transport, "transport must not be null"), destinations, auditor);
        this.zone = props.zoneId();
    }

    /**
     * Run one pass. Returns {@link PassResult#skippedResult()} if another pass holds the lock.
     */
    public PassResult runPass() {
        Optional<QueueLock.Lease> acquired = lock.tryAcquire();
        if (acquired.isEmpty()) {
            log.info("backbork pass skipped: another pass is running");
            return PassResult.skippedResult();
        }

        try (QueueLock.Lease lease = acquired.get()) {
            Counters counters = new Counters();
            counters.interrupted = recoverInterrupted();
            counters.schedulesQueued = materializeDueSchedules();
            drainQueue(lease, counters);
            PruneResult prune = PruneResult.empty();
            if (lease.isLost()) {
                log.error("backbork pass skipping prune: processing lock was taken over");
            } else {
                prune = pruner.prune();
            }

            PassResult result = new PassResult(false,
                    counters.schedulesQueued,
                    counters.completed,
                    counters.failed,
                    counters.cancelled,
                    counters.interrupted,
                    prune.pruned(),
                    counters.accounts);
            log.info("backbork pass finished queued={} completed={} failed={} cancelled={} recovered={} pruned={}",
                    result.schedulesQueued(), result.jobsCompleted(), result.jobsFailed(),
                    result.jobsCancelled(), result.interruptedRecovered(), result.pruned());
            return result;
        }
    }

    /* ================= recovery ================= */

    private int recoverInterrupted() {
        int recovered = 0;
        for (Job job : stores.jobs().list(JobCollection.RUNNING)) {
            JobPatch patch = JobPatch.of();
            if (!job.status().isTerminal()) {
                patch.status(JobStatus.FAILED).finishedAt(clock.instant()).error(INTERRUPTED_MESSAGE);
            }
            try {
                stores.jobs().move(job.id(), JobCollection.RUNNING, JobCollection.COMPLETED, patch);
            } catch (NotFoundException e) {
                continue;
            }
            stores.cancelMarkers().clear(job.id());
            recovered++;
            log.warn("backbork job recovered from running id={} status={} startedAt={}",
                    job.id(), job.status(), job.startedAt());
            if (!patch.isEmpty()) {
                auditor.failure(AuditEventType.JOB_FAILED, job.owner(), List.of(job.id()), INTERRUPTED_MESSAGE);
            }
        }

        // a move can land before its field update; finish such records here
        for (Job job : stores.jobs().list(JobCollection.COMPLETED)) {
            if (job.status().isTerminal()) {
                continue;
            }
            stores.jobs().update(JobCollection.COMPLETED, job.id(), JobPatch.of()
                    .status(JobStatus.FAILED)
                    .finishedAt(clock.instant())
                    .error(INTERRUPTED_MESSAGE));
            recovered++;
            log.warn("backbork job recovered in completed id={} status={}", job.id(), job.status());
        }
        return recovered;
    }

    /* ================= schedules ================= */

    private int materializeDueSchedules() {
        int queued = 0;
        Instant now = clock.instant();
        for (Schedule schedule : stores.schedules().list()) {
            if (!schedule.isDue(now)) {
                continue;
            }

            AccountSelection accounts;
            try {
                accounts = resolve(schedule.accounts(), schedule.owner());
            } catch (RuntimeException e) {
                log.error("backbork schedule account resolution failed id={} owner={} msg={}",
                        schedule.id(), schedule.owner(), e.getMessage(), e);
                continue;
            }

            Destination destination = destinations.find(schedule.destinationId())
                    .orElseGet(() -> new Destination(schedule.destinationId(), schedule.destinationName(), null, false));
            Job job = Job.queued(JobIds.next(now), JobType.BACKUP, schedule.owner(), now,
                    accounts, destination, null, schedule.id(), schedule.retention());
            stores.jobs().create(JobCollection.QUEUED, job);

            Instant next = RecurrenceCalculator.nextRun(schedule, now, zone);
            stores.schedules().save(schedule.materialized(now, next));
            queued++;

            log.info("backbork schedule queued id={} job={} accounts={} nextRun={}",
                    schedule.id(), job.id(), accounts.toList(), next);
            auditor.success(AuditEventType.SCHEDULE_QUEUED, schedule.owner(), List.of(schedule.id(), job.id()),
                    "Scheduled backup queued for " + accounts.toList().size() + " account(s)");
        }
        return queued;
    }

    /* ================= queue ================= */

    private void drainQueue(QueueLock.Lease lease, Counters counters) {
        while (true) {
            if (lease.isLost()) {
                log.error("backbork pass stopping before next job: processing lock was taken over");
                return;
            }
            List<Job> queued = stores.jobs().list(JobCollection.QUEUED);
            if (queued.isEmpty()) {
                return;
            }
            Job next = queued.get(0);

            Job running;
            try {
                running = stores.jobs().move(next.id(), JobCollection.QUEUED, JobCollection.RUNNING, JobPatch.of()
                        .status(JobStatus.PROCESSING)
                        .startedAt(clock.instant()));
            } catch (NotFoundException e) {
                log.debug("backbork job vanished before start id={}", next.id());
                continue;
            }

            JobStatus status = process(running, lease, counters);
            switch (status) {
                case COMPLETED -> counters.completed++;
                case CANCELLED -> counters.cancelled++;
                default -> counters.failed++;
            }
        }
    }

    private JobStatus process(Job job, QueueLock.Lease lease, Counters counters) {
        log.info("backbork job started id={} type={} owner={}", job.id(), job.type(), job.owner());
        try {
            return execute(job, lease, counters);
        } catch (RuntimeException e) {
            log.error("backbork job failed id={} msg={}", job.id(), e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return finish(job, JobStatus.FAILED, null, error);
        }
    }

    private JobStatus execute(Job job, QueueLock.Lease lease, Counters counters) {
        Optional<Destination> found = destinations.find(job.destinationId());
        if (found.isEmpty()) {
            return finish(job, JobStatus.FAILED, null, "Destination not found: " + job.destinationId());
        }
        Destination destination = found.get();
        if (!destination.enabled()) {
            return finish(job, JobStatus.FAILED, null, "Destination is disabled: " + destination.displayName());
        }

        AccountSelection selection = resolve(job.accounts(), job.owner());
        List<String> accounts = selection.isEmpty() ? List.of() : selection.accounts();
        if (accounts.isEmpty()) {
            return finish(job, JobStatus.FAILED, null, "No accounts specified");
        }

        int total = accounts.size();
        JobPatch start = JobPatch.of().progress(new Progress(total, 0));
        if (job.accounts().isAllAccessible()) {
            start.accounts(selection);
        }
        stores.jobs().update(JobCollection.RUNNING, job.id(), start);

        CancellationToken cancellation = () -> stores.cancelMarkers().exists(job.id());
        List<AccountResult> results = new ArrayList<>();
        boolean cancelled = false;
        boolean lockLost = false;

        for (int i = 0; i < total; i++) {
            String account = accounts.get(i);
            AccountResult result = runAccount(job, account, destination, cancellation);
            results.add(result);
            counters.accounts.add(account);

            if (job.type().producesArtifacts() && result.hasArtifact()) {
                ManifestEntry entry = stores.manifest().record(destination.id(), ManifestEntry.of(
                        job.scheduleId(), account, result.filename(), result.companionFilename(),
                        result.size(), clock.instant()));
                log.debug("backbork manifest recorded destination={} schedule={} account={} file={} seq={}",
                        destination.id(), entry.scheduleId(), account, entry.filename(), entry.sequence());
            }

            stores.jobs().update(JobCollection.RUNNING, job.id(), JobPatch.of()
                    .progress(new Progress(total, i + 1))
                    .accountResults(results));
            if (!lease.heartbeat()) {
                lockLost = true;
                log.error("backbork job stopped, lock lost id={} after={}/{}", job.id(), i + 1, total);
                break;
            }

            if (stores.cancelMarkers().exists(job.id())) {
                stores.cancelMarkers().clear(job.id());
                cancelled = true;
                log.info("backbork job cancellation observed id={} after={}/{}", job.id(), i + 1, total);
                break;
            }
        }

        if (lockLost) {
            return finish(job, JobStatus.FAILED, null,
                    "Processing lock lost after " + results.size() + " of " + total + " account(s)");
        }
        if (cancelled) {
            return finish(job, JobStatus.CANCELLED,
                    "Cancelled after " + results.size() + " of " + total + " account(s)", null);
        }

        List<AccountResult> failures = results.stream().filter(r -> !r.success()).collect(Collectors.toList());
        if (failures.isEmpty()) {
            return finish(job, JobStatus.COMPLETED, "Completed " + total + " account(s)", null);
        }
        String error = failures.stream()
                .map(r -> r.account() + ": " + r.message())
                .collect(Collectors.joining("; "));
        return finish(job, JobStatus.FAILED, failures.size() + " of " + total + " account(s) failed", error);
    }

    private AccountResult runAccount(Job job, String account, Destination destination, CancellationToken cancellation) {
        AccountOperation operation = new AccountOperation(job.id(), job.type(), account, destination,
                job.owner(), job.scheduleId(), job.options());
        Instant startedAt = clock.instant();
        AccountResult result;
        try {
            result = engine.runAccountOperation(operation, cancellation);
            if (result == null) {
                result = AccountResult.failure(account, "Execution engine returned no result");
            }
        } catch (RuntimeException e) {
            log.warn("backbork account failed job={} account={} msg={}", job.id(), account, e.getMessage(), e);
            result = AccountResult.failure(account, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        long millis = Math.max(0L, clock.millis() - startedAt.toEpochMilli());
        log.debug("backbork account finished job={} account={} success={} durationMs={}",
                job.id(), account, result.success(), millis);
        return result.withDuration(millis);
    }

    private JobStatus finish(Job job, JobStatus status, String message, String error) {
        try {
            stores.jobs().move(job.id(), JobCollection.RUNNING, JobCollection.COMPLETED, JobPatch.of()
                    .status(status)
                    .finishedAt(clock.instant())
                    .message(message)
                    .error(error));
        } catch (NotFoundException e) {
            // finalized by the pass that took the lock over
            log.warn("backbork job already finalized elsewhere id={}", job.id());
            return JobStatus.FAILED;
        }
        // a marker placed after the last check must not outlive the job
        stores.cancelMarkers().clear(job.id());

        log.info("backbork job finished id={} status={} msg={}", job.id(), status,
                message != null ? message : error);
        AuditEventType type = switch (status) {
            case COMPLETED -> AuditEventType.JOB_COMPLETED;
            case CANCELLED -> AuditEventType.JOB_CANCELLED;
            default -> AuditEventType.JOB_FAILED;
        };
        auditor.emit(type, job.owner(), List.of(job.id()), status == JobStatus.COMPLETED,
                message != null ? message : error);
        return status;
    }

    /* ================= helper ================= */

    private AccountSelection resolve(AccountSelection selection, String owner) {
        if (!selection.isAllAccessible()) {
            return selection;
        }
        List<String> resolved = accessResolver.accessibleAccounts(owner);
        return AccountSelection.fromList(resolved == null ? List.of() : resolved);
    }

    private static final class Counters {
        int schedulesQueued;
        int completed;
        int failed;
        int cancelled;
        int interrupted;
        final List<String> accounts = new ArrayList<>();
    }
}
