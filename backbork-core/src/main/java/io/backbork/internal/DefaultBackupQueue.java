package io.backbork.internal;

import io.backbork.AuditSink;
import io.backbork.BackupQueue;
import io.backbork.DestinationRegistry;
import io.backbork.JobBuilder;
import io.backbork.config.BackborkProperties;
import io.backbork.core.AccountSelection;
import io.backbork.core.AlreadyTerminalException;
import io.backbork.core.AuditEventType;
import io.backbork.core.CancelMarker;
import io.backbork.core.CancelResult;
import io.backbork.core.Destination;
import io.backbork.core.Frequency;
import io.backbork.core.InvalidDestinationException;
import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobRequest;
import io.backbork.core.JobStatus;
import io.backbork.core.JobType;
import io.backbork.core.KillResult;
import io.backbork.core.NotFoundException;
import io.backbork.core.QueueSnapshot;
import io.backbork.core.QueueStats;
import io.backbork.core.Schedule;
import io.backbork.core.ScheduleUpdate;
import io.backbork.core.SubmitResult;
import io.backbork.store.BackborkStores;
import io.backbork.utils.JobIds;
import io.backbork.utils.RecurrenceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link BackupQueue} over a set of {@link BackborkStores}. Only writes requests and markers;
 * execution happens in the {@link QueueProcessor}.
 */
public class DefaultBackupQueue implements BackupQueue {
    private static final Logger log = LoggerFactory.getLogger(DefaultBackupQueue.class);

    public static final String BACKUP_FILE_OPTION = "backup_file";

    private final BackborkStores stores;
    private final DestinationRegistry destinations;
    private final QueueLock lock;
    private final Auditor auditor;
    private final Clock clock;
    private final ZoneId zone;

    public DefaultBackupQueue(BackborkProperties props,
                              BackborkStores stores,
                              DestinationRegistry destinations,
                              AuditSink auditSink,
                              QueueLock lock,
                              Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.destinations = Objects.requireNonNull(destinations, "destinations must not be null");
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.auditor = new Auditor(auditSink == null ? AuditSink.noop() : auditSink, clock);
        this.zone = props.zoneId();
    }

    @Override
    public JobBuilder backup(AccountSelection accounts, String destinationId) {
        return new SimpleJobBuilder(JobType.BACKUP, accounts, destinationId, this::submit);
    }

    @Override
    public JobBuilder restore(String account, String destinationId, String backupFile) {
        Objects.requireNonNull(backupFile, "backupFile must not be null");
        return new SimpleJobBuilder(JobType.RESTORE, AccountSelection.explicit(account), destinationId, this::submit)
                .option(BACKUP_FILE_OPTION, backupFile);
    }

    @Override
    public SubmitResult submit(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(request.type(), "type must not be null");
        Objects.requireNonNull(request.accounts(), "accounts must not be null");
        Objects.requireNonNull(request.owner(), "owner must not be null");
        if (request.accounts().isEmpty()) {
            throw new IllegalArgumentException("accounts must not be empty");
        }

        Destination destination = destinations.find(request.destinationId())
                .orElseThrow(() -> new InvalidDestinationException("Destination not found: " + request.destinationId()));

        Instant now = clock.instant();
        String id = JobIds.next(now);

        if (request.isRecurring()) {
            if (request.type() != JobType.BACKUP) {
                throw new IllegalArgumentException("only backup jobs can be scheduled");
            }
            requireEnabled(destination);
            Instant nextRun = RecurrenceCalculator.nextRun(request.frequency(), request.preferredHour(),
                    request.dayOfWeek(), now, zone);
            Schedule schedule = new Schedule(id, request.owner(), request.accounts(),
                    destination.id(), destination.displayName(), request.frequency(),
                    request.preferredHour(), request.dayOfWeek(), request.retention(), true,
                    nextRun, null, null, now, now);
            stores.schedules().create(schedule);

            log.info("backbork schedule created id={} owner={} frequency={} nextRun={}",
                    id, request.owner(), request.frequency(), nextRun);
            auditor.success(AuditEventType.SCHEDULE_CREATE, request.owner(), List.of(id),
                    request.frequency().name().toLowerCase() + " backup to " + destination.displayName());
            return new SubmitResult(id, true, null);
        }

        if (request.type() == JobType.RESTORE) {
            String backupFile = request.options().get(BACKUP_FILE_OPTION);
            if (backupFile == null || backupFile.isBlank()) {
                throw new IllegalArgumentException("restore requires option " + BACKUP_FILE_OPTION);
            }
            if (request.accounts().isAllAccessible() || request.accounts().accounts().size() != 1) {
                throw new IllegalArgumentException("restore targets exactly one account");
            }
        }

        String warning = null;
        if (!destination.enabled()) {
            warning = "Destination '" + destination.displayName() + "' is disabled";
            log.warn("backbork job queued against disabled destination id={} destination={}", id, destination.id());
        }

        Job job = Job.queued(id, request.type(), request.owner(), now, request.accounts(), destination,
                request.options(), Job.MANUAL_SCHEDULE_ID, request.retention());
        stores.jobs().create(JobCollection.QUEUED, job);

        log.info("backbork job queued id={} type={} owner={} accounts={}",
                id, request.type(), request.owner(), request.accounts().toList());
        auditor.success(AuditEventType.QUEUE_ADD, request.owner(), List.of(id),
                request.type().name().toLowerCase() + " queued for " + destination.displayName());
        return new SubmitResult(id, false, warning);
    }

    @Override
    public Schedule updateSchedule(String scheduleId, ScheduleUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        Schedule current = stores.schedules().get(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule", scheduleId));

        String destinationId = current.destinationId();
        String destinationName = current.destinationName();
        if (update.destinationId() != null) {
            Destination destination = destinations.find(update.destinationId())
                    .orElseThrow(() -> new InvalidDestinationException("Destination not found: " + update.destinationId()));
            requireEnabled(destination);
            destinationId = destination.id();
            destinationName = destination.displayName();
        }

        AccountSelection accounts = current.accounts();
        if (update.accounts() != null) {
            if (update.accounts().isEmpty()) {
                throw new IllegalArgumentException("accounts must not be empty");
            }
            accounts = update.accounts();
        }

        Frequency frequency = update.frequency() != null ? update.frequency() : current.frequency();
        int hour = update.preferredHour() != null ? update.preferredHour() : current.preferredHour();
        int dayOfWeek = update.dayOfWeek() != null ? update.dayOfWeek() : current.dayOfWeek();
        int retention = update.retention() != null ? update.retention() : current.retention();
        boolean enabled = update.enabled() != null ? update.enabled() : current.enabled();

        Instant now = clock.instant();
        Instant nextRun = current.nextRun();
        boolean timingChanged = frequency != current.frequency()
                || hour != current.preferredHour()
                || dayOfWeek != current.dayOfWeek();
        if (timingChanged) {
            nextRun = RecurrenceCalculator.nextRun(frequency, hour, dayOfWeek, now, zone);
        }

        Schedule updated = stores.schedules().save(new Schedule(current.id(), current.owner(), accounts,
                destinationId, destinationName, frequency, hour, dayOfWeek, retention, enabled,
                nextRun, current.lastRun(), current.lastStatus(), current.createdAt(), now));

        log.info("backbork schedule updated id={} frequency={} nextRun={} enabled={}", scheduleId, frequency, nextRun, enabled);
        auditor.success(AuditEventType.SCHEDULE_UPDATE, current.owner(), List.of(scheduleId), "Schedule updated");
        return updated;
    }

    @Override
    public void removeSchedule(String scheduleId) {
        Schedule schedule = stores.schedules().get(scheduleId)
                .orElseThrow(() -> new NotFoundException("Schedule", scheduleId));
        if (!stores.schedules().delete(scheduleId)) {
            throw new NotFoundException("Schedule", scheduleId);
        }
        log.info("backbork schedule removed id={}", scheduleId);
        auditor.success(AuditEventType.SCHEDULE_DELETE, schedule.owner(), List.of(scheduleId), "Schedule removed");
    }

    @Override
    public void removeQueued(String jobId) {
        Job job = stores.jobs().get(JobCollection.QUEUED, jobId)
                .orElseThrow(() -> new NotFoundException("Queued job", jobId));
        if (!stores.jobs().delete(JobCollection.QUEUED, jobId)) {
            throw new NotFoundException("Queued job", jobId);
        }
        log.info("backbork job removed id={}", jobId);
        auditor.success(AuditEventType.QUEUE_REMOVE, job.owner(), List.of(jobId), "Removed from queue");
    }

    @Override
    public CancelResult cancel(String jobId, String requestedBy) {
        Objects.requireNonNull(jobId, "jobId must not be null");

        Optional<Job> queued = stores.jobs().get(JobCollection.QUEUED, jobId);
        if (queued.isPresent() && stores.jobs().delete(JobCollection.QUEUED, jobId)) {
            log.info("backbork queued job cancelled id={} by={}", jobId, requestedBy);
            auditor.success(AuditEventType.CANCEL_REQUEST, requestedBy, List.of(jobId), "Queued job removed");
            return CancelResult.removed(jobId);
        }

        if (stores.jobs().get(JobCollection.RUNNING, jobId).isPresent()) {
            stores.cancelMarkers().create(new CancelMarker(jobId, requestedBy, clock.instant(), null));
            if (stores.jobs().get(JobCollection.RUNNING, jobId).isEmpty()) {
                // finished between the two reads
                stores.cancelMarkers().clear(jobId);
                throw terminalOrMissing(jobId);
            }
            log.info("backbork cancellation requested id={} by={}", jobId, requestedBy);
            auditor.success(AuditEventType.CANCEL_REQUEST, requestedBy, List.of(jobId), "Cancellation requested");
            return CancelResult.requested(jobId);
        }

        throw terminalOrMissing(jobId);
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return stores.jobs().find(jobId);
    }

    @Override
    public Optional<Schedule> findSchedule(String scheduleId) {
        return stores.schedules().get(scheduleId);
    }

    @Override
    public QueueSnapshot snapshot() {
        return new QueueSnapshot(
                stores.jobs().list(JobCollection.QUEUED),
                stores.jobs().list(JobCollection.RUNNING),
                stores.schedules().list());
    }

    /**
     * Finished jobs, most recently finished first.
     */
    @Override
    public List<Job> completed() {
        return stores.jobs().list(JobCollection.COMPLETED).stream()
                .sorted(Comparator.comparing(DefaultBackupQueue::finishedOrCreated).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public QueueStats stats() {
        List<Job> finished = stores.jobs().list(JobCollection.COMPLETED);
        return new QueueStats(
                stores.jobs().list(JobCollection.QUEUED).size(),
                stores.jobs().list(JobCollection.RUNNING).size(),
                countByStatus(finished, JobStatus.COMPLETED),
                countByStatus(finished, JobStatus.FAILED),
                countByStatus(finished, JobStatus.CANCELLED));
    }

    @Override
    public int clearCompleted() {
        return deleteFinished(JobStatus.COMPLETED);
    }

    @Override
    public int clearFailed() {
        return deleteFinished(JobStatus.FAILED);
    }

    @Override
    public int retryFailed() {
        int retried = 0;
        for (Job failed : stores.jobs().list(JobCollection.COMPLETED)) {
            if (failed.status() != JobStatus.FAILED) {
                continue;
            }
            Instant now = clock.instant();
            Job retry = failed.requeueAs(JobIds.next(now), now);
            stores.jobs().create(JobCollection.QUEUED, retry);
            stores.jobs().delete(JobCollection.COMPLETED, failed.id());
            retried++;
            log.info("backbork job retried id={} retryOf={}", retry.id(), failed.id());
            auditor.success(AuditEventType.QUEUE_ADD, failed.owner(), List.of(retry.id(), failed.id()), "Retry of failed job");
        }
        return retried;
    }

    @Override
    public int cleanupCompletedJobs(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        if (olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan must not be negative");
        }
        Instant cutoff = clock.instant().minus(olderThan);
        int deleted = 0;
        for (Job job : stores.jobs().list(JobCollection.COMPLETED)) {
            if (finishedOrCreated(job).isBefore(cutoff) && stores.jobs().delete(JobCollection.COMPLETED, job.id())) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("backbork finished jobs cleaned up count={} cutoff={}", deleted, cutoff);
        }
        return deleted;
    }

    @Override
    public KillResult killAll() {
        int removed = 0;
        for (Job job : stores.jobs().list(JobCollection.QUEUED)) {
            if (stores.jobs().delete(JobCollection.QUEUED, job.id())) {
                removed++;
            }
        }
        int cancelled = 0;
        for (Job job : stores.jobs().list(JobCollection.RUNNING)) {
            stores.cancelMarkers().create(new CancelMarker(job.id(), "system", clock.instant(), "kill all"));
            cancelled++;
        }
        log.warn("backbork kill all queuedRemoved={} runningCancelled={}", removed, cancelled);
        return new KillResult(removed, cancelled);
    }

    @Override
    public boolean isProcessing() {
        return lock.isLocked();
    }

    /* ================= helper ================= */

    private RuntimeException terminalOrMissing(String jobId) {
        Optional<Job> finished = stores.jobs().get(JobCollection.COMPLETED, jobId);
        if (finished.isPresent()) {
            return new AlreadyTerminalException(jobId, finished.get().status());
        }
        return new NotFoundException("Job", jobId);
    }

    private int deleteFinished(JobStatus status) {
        int deleted = 0;
        for (Job job : stores.jobs().list(JobCollection.COMPLETED)) {
            if (job.status() == status && stores.jobs().delete(JobCollection.COMPLETED, job.id())) {
                deleted++;
            }
        }
        log.info("backbork finished jobs cleared status={} count={}", status, deleted);
        return deleted;
    }

    private static void requireEnabled(Destination destination) {
        if (!destination.enabled()) {
            throw new InvalidDestinationException("Destination is disabled: " + destination.displayName());
        }
    }

    private static int countByStatus(List<Job> jobs, JobStatus status) {
        return (int) jobs.stream().filter(j -> j.status() == status).count();
    }

    private static Instant finishedOrCreated(Job job) {
        return job.finishedAt() != null ? job.finishedAt() : job.createdAt();
    }
}
