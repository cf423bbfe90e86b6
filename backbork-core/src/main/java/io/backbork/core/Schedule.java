package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Recurrence definition that materializes backup jobs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Schedule(
        String id,
        String owner,
        AccountSelection accounts,
        String destinationId,
        String destinationName,
        Frequency frequency,
        int preferredHour,
        int dayOfWeek,
        int retention,
        boolean enabled,
        Instant nextRun,
        Instant lastRun,
        String lastStatus,
        Instant createdAt,
        Instant updatedAt
) {

    public Schedule {
        if (preferredHour < 0 || preferredHour > 23) {
            throw new IllegalArgumentException("preferredHour must be within 0..23: " + preferredHour);
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be within 0..6: " + dayOfWeek);
        }
        if (retention < 0) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }
    }

    public boolean isDue(Instant now) {
        return enabled && nextRun != null && !nextRun.isAfter(now);
    }

    /**
     * Copy after a job has been materialized from this schedule.
     */
    public Schedule materialized(Instant ranAt, Instant next) {
        return new Schedule(id, owner, accounts, destinationId, destinationName, frequency,
                preferredHour, dayOfWeek, retention, enabled, next, ranAt, "queued", createdAt, updatedAt);
    }

    public Schedule withNextRun(Instant next) {
        return new Schedule(id, owner, accounts, destinationId, destinationName, frequency,
                preferredHour, dayOfWeek, retention, enabled, next, lastRun, lastStatus, createdAt, updatedAt);
    }
}
