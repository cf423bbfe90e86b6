package io.backbork.core;

import java.util.List;

/**
 * Point-in-time view of queued and running jobs and configured schedules.
 */
public record QueueSnapshot(List<Job> queued, List<Job> running, List<Schedule> schedules) {
    public QueueSnapshot {
        queued = List.copyOf(queued);
        running = List.copyOf(running);
        schedules = List.copyOf(schedules);
    }
}
