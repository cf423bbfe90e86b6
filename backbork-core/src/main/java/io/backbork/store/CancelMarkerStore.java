package io.backbork.store;

import io.backbork.core.CancelMarker;

import java.util.Optional;

/**
 * Ephemeral cancellation markers keyed by job id.
 */
public interface CancelMarkerStore {

    void create(CancelMarker marker);

    boolean exists(String jobId);

    Optional<CancelMarker> get(String jobId);

    /**
     * @return true if a marker was removed
     */
    boolean clear(String jobId);
}
