package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A unit of backup or restore work.
 *
 * <p>Jobs are immutable; state changes are expressed as a {@link JobPatch} applied by the
 * {@link io.backbork.store.JobStore} while updating or moving the record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(

        // identity
        String id,
        JobType type,
        String owner,
        Instant createdAt,

        // target
        AccountSelection accounts,
        String destinationId,
        String destinationName,
        Map<String, String> options,

        // origin
        String scheduleId,
        int retention,
        String retryOf,

        // lifecycle
        JobStatus status,
        Progress progress,
        List<AccountResult> accountResults,
        Instant startedAt,
        Instant finishedAt,
        String message,
        String error
) {

    /**
     * Schedule id carried by ad-hoc jobs and their manifest entries.
     */
    public static final String MANUAL_SCHEDULE_ID = "_manual";

    public Job {
        options = options == null ? Map.of() : Map.copyOf(options);
        accountResults = accountResults == null ? List.of() : List.copyOf(accountResults);
        progress = progress == null ? Progress.none() : progress;
        scheduleId = scheduleId == null ? MANUAL_SCHEDULE_ID : scheduleId;
    }

    /**
     * New queued job.
     */
    public static Job queued(String id,
                             JobType type,
                             String owner,
                             Instant createdAt,
                             AccountSelection accounts,
                             Destination destination,
                             Map<String, String> options,
                             String scheduleId,
                             int retention) {
        return new Job(id, type, owner, createdAt,
                accounts, destination.id(), destination.displayName(), options,
                scheduleId, retention, null,
                JobStatus.QUEUED, Progress.none(), List.of(), null, null, null, null);
    }

    @JsonIgnore
    public boolean isManual() {
        return MANUAL_SCHEDULE_ID.equals(scheduleId);
    }

    public Job with(JobPatch patch) {
        return patch.applyTo(this);
    }

    /**
     * Copy used by retry: fresh id, queued, progress reset.
     */
    public Job requeueAs(String newId, Instant now) {
        return new Job(newId, type, owner, now,
                accounts, destinationId, destinationName, options,
                scheduleId, retention, id,
                JobStatus.QUEUED, Progress.none(), List.of(), null, null, null, null);
    }
}
