package io.backbork.internal;

import io.backbork.AuditSink;
import io.backbork.ProcessLiveness;
import io.backbork.config.BackborkProperties;
import io.backbork.core.AccountSelection;
import io.backbork.core.AlreadyTerminalException;
import io.backbork.core.AuditEvent;
import io.backbork.core.AuditEventType;
import io.backbork.core.Destination;
import io.backbork.core.Frequency;
import io.backbork.core.InvalidDestinationException;
import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;
import io.backbork.core.JobRequest;
import io.backbork.core.JobStatus;
import io.backbork.core.JobType;
import io.backbork.core.KillResult;
import io.backbork.core.NotFoundException;
import io.backbork.core.QueueStats;
import io.backbork.core.Schedule;
import io.backbork.core.ScheduleUpdate;
import io.backbork.core.SubmitResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultBackupQueueTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryStores memory = new InMemoryStores();
    private final List<AuditEvent> events = new ArrayList<>();
    private final Map<String, Destination> destinationMap = Map.of(
            "local", new Destination("local", "Local disk", "local", true),
            "offsite", new Destination("offsite", "Offsite SFTP", "sftp", false));

    private DefaultBackupQueue queue;

    @BeforeEach
    void setUp() {
        BackborkProperties props = new BackborkProperties();
        props.setZone("UTC");
        QueueLock lock = new QueueLock(memory.lock, pid -> ProcessLiveness.State.ALIVE, clock,
                Duration.ofHours(1), "test-host", 100L);
        AuditSink audit = events::add;
        queue = new DefaultBackupQueue(props, memory.stores(), id -> Optional.ofNullable(destinationMap.get(id)),
                audit, lock, clock);
    }

    @Test
    void scheduleShouldComputeFirstRunAndAudit() {
        SubmitResult result = queue.backup(AccountSelection.explicit("alice"), "local")
                .weekly(1, 3)
                .retention(4)
                .save();

        Schedule schedule = queue.findSchedule(result.id()).orElseThrow();
        assertThat(schedule.frequency()).isEqualTo(Frequency.WEEKLY);
        assertThat(schedule.nextRun()).isEqualTo(Instant.parse("2026-01-05T03:00:00Z"));
        assertThat(schedule.destinationName()).isEqualTo("Local disk");
        assertThat(schedule.enabled()).isTrue();
        assertThat(events).extracting(AuditEvent::type).containsExactly(AuditEventType.SCHEDULE_CREATE);
    }

    @Test
    void scheduleAgainstDisabledDestinationShouldBeRejected() {
        assertThatThrownBy(() -> queue.backup(AccountSelection.explicit("alice"), "offsite").daily(1).save())
                .isInstanceOf(InvalidDestinationException.class)
                .hasMessageContaining("disabled");
        assertThat(memory.schedules.list()).isEmpty();
    }

    @Test
    void oneTimeJobAgainstDisabledDestinationShouldBeAcceptedWithWarning() {
        SubmitResult result = queue.backup(AccountSelection.explicit("alice"), "offsite").save();

        assertThat(result.hasWarning()).isTrue();
        assertThat(queue.findJob(result.id())).get()
                .extracting(Job::status)
                .isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void unknownDestinationShouldBeRejected() {
        assertThatThrownBy(() -> queue.backup(AccountSelection.explicit("alice"), "nowhere").save())
                .isInstanceOf(InvalidDestinationException.class);
    }

    @Test
    void restoreShouldTargetOneAccountWithBackupFile() {
        SubmitResult result = queue.restore("alice", "local", "backup-alice.tar.gz").save();

        Job job = queue.findJob(result.id()).orElseThrow();
        assertThat(job.type()).isEqualTo(JobType.RESTORE);
        assertThat(job.options()).containsEntry(DefaultBackupQueue.BACKUP_FILE_OPTION, "backup-alice.tar.gz");

        assertThatThrownBy(() -> queue.submit(new JobRequest(JobType.RESTORE,
                AccountSelection.explicit("alice"), "local", "root", null, 0, 0, 0, Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queue.restore("alice", "local", "f.tar.gz").daily(2).save())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateScheduleShouldRecomputeNextRunOnlyWhenTimingChanges() {
        String id = queue.backup(AccountSelection.explicit("alice"), "local").daily(2).save().id();
        Instant original = queue.findSchedule(id).orElseThrow().nextRun();

        clock.advance(Duration.ofMinutes(30));
        Schedule retentionOnly = queue.updateSchedule(id, ScheduleUpdate.builder().retention(9).build());
        assertThat(retentionOnly.nextRun()).isEqualTo(original);
        assertThat(retentionOnly.retention()).isEqualTo(9);
        assertThat(retentionOnly.updatedAt()).isEqualTo(clock.instant());

        Schedule monthly = queue.updateSchedule(id, ScheduleUpdate.builder().frequency(Frequency.MONTHLY).build());
        assertThat(monthly.nextRun()).isEqualTo(Instant.parse("2026-02-01T02:00:00Z"));
    }

    @Test
    void updateScheduleShouldRejectDisabledDestination() {
        String id = queue.backup(AccountSelection.explicit("alice"), "local").daily(2).save().id();

        assertThatThrownBy(() -> queue.updateSchedule(id, ScheduleUpdate.builder().destination("offsite").build()))
                .isInstanceOf(InvalidDestinationException.class);
        assertThatThrownBy(() -> queue.updateSchedule("bb_missing", ScheduleUpdate.builder().enabled(false).build()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void removeScheduleAndQueuedShouldFailForUnknownIds() {
        String scheduleId = queue.backup(AccountSelection.explicit("alice"), "local").daily(2).save().id();
        String jobId = queue.backup(AccountSelection.explicit("alice"), "local").save().id();

        queue.removeSchedule(scheduleId);
        queue.removeQueued(jobId);

        assertThat(queue.findSchedule(scheduleId)).isEmpty();
        assertThat(queue.findJob(jobId)).isEmpty();
        assertThatThrownBy(() -> queue.removeSchedule(scheduleId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> queue.removeQueued(jobId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void cancelShouldRejectFinishedAndUnknownJobs() {
        String id = queue.backup(AccountSelection.explicit("alice"), "local").save().id();
        memory.jobs.move(id, JobCollection.QUEUED, JobCollection.COMPLETED,
                JobPatch.of().status(JobStatus.COMPLETED).finishedAt(T0));

        assertThatThrownBy(() -> queue.cancel(id, "root"))
                .isInstanceOf(AlreadyTerminalException.class)
                .hasMessageContaining("COMPLETED");
        assertThatThrownBy(() -> queue.cancel("bb_unknown", "root"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void retryFailedShouldRequeueUnderNewId() {
        String id = queue.backup(AccountSelection.explicit("alice"), "local").save().id();
        memory.jobs.move(id, JobCollection.QUEUED, JobCollection.COMPLETED,
                JobPatch.of().status(JobStatus.FAILED).finishedAt(T0).error("boom"));
        clock.advance(Duration.ofSeconds(5));

        assertThat(queue.retryFailed()).isEqualTo(1);

        List<Job> queued = queue.snapshot().queued();
        assertThat(queued).hasSize(1);
        Job retry = queued.get(0);
        assertThat(retry.id()).isNotEqualTo(id);
        assertThat(retry.retryOf()).isEqualTo(id);
        assertThat(retry.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(retry.error()).isNull();
        assertThat(queue.findJob(id)).isEmpty();
    }

    @Test
    void statsAndHistoryMaintenanceShouldWorkByStatus() {
        finish(queue.backup(AccountSelection.explicit("a"), "local").save().id(), JobStatus.COMPLETED, T0);
        finish(queue.backup(AccountSelection.explicit("b"), "local").save().id(), JobStatus.FAILED, T0);
        finish(queue.backup(AccountSelection.explicit("c"), "local").save().id(), JobStatus.CANCELLED,
                T0.plus(Duration.ofDays(20)));
        queue.backup(AccountSelection.explicit("d"), "local").save();

        QueueStats stats = queue.stats();
        assertThat(stats.queued()).isEqualTo(1);
        assertThat(stats.completed()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.cancelled()).isEqualTo(1);
        assertThat(stats.total()).isEqualTo(4);

        assertThat(queue.clearCompleted()).isEqualTo(1);
        clock.set(T0.plus(Duration.ofDays(30)));
        assertThat(queue.cleanupCompletedJobs(Duration.ofDays(15))).isEqualTo(1);
        assertThat(queue.completed()).extracting(Job::status).containsExactly(JobStatus.CANCELLED);
        assertThat(queue.clearFailed()).isZero();
    }

    @Test
    void killAllShouldDropQueueAndMarkRunningJobs() {
        queue.backup(AccountSelection.explicit("a"), "local").save();
        String running = queue.backup(AccountSelection.explicit("b"), "local").save().id();
        memory.jobs.move(running, JobCollection.QUEUED, JobCollection.RUNNING,
                JobPatch.of().status(JobStatus.PROCESSING).startedAt(T0));

        KillResult result = queue.killAll();

        assertThat(result.queuedRemoved()).isEqualTo(1);
        assertThat(result.runningCancelled()).isEqualTo(1);
        assertThat(memory.markers.exists(running)).isTrue();
        assertThat(queue.snapshot().queued()).isEmpty();
    }

    private void finish(String id, JobStatus status, Instant finishedAt) {
        memory.jobs.move(id, JobCollection.QUEUED, JobCollection.COMPLETED,
                JobPatch.of().status(status).finishedAt(finishedAt));
    }
}
