package io.backbork.core;

import java.util.Map;

/**
 * Immutable request produced by {@link io.backbork.JobBuilder#build()}.
 * A {@code null} frequency means a one-time job; otherwise a recurring schedule.
 */
public record JobRequest(
        JobType type,
        AccountSelection accounts,
        String destinationId,
        String owner,
        Frequency frequency,
        int preferredHour,
        int dayOfWeek,
        int retention,
        Map<String, String> options
) {
    public JobRequest {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public boolean isRecurring() {
        return frequency != null;
    }
}
