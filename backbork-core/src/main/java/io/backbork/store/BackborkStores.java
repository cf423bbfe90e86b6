package io.backbork.store;

import java.util.Objects;

/**
 * The set of stores one backup queue runs on. All of them must come from the same backend.
 */
public record BackborkStores(
        JobStore jobs,
        ScheduleStore schedules,
        ManifestLedger manifest,
        CancelMarkerStore cancelMarkers,
        LockStore lock
) {
    public BackborkStores {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Objects.requireNonNull(schedules, "schedules must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(cancelMarkers, "cancelMarkers must not be null");
        Objects.requireNonNull(lock, "lock must not be null");
    }
}
