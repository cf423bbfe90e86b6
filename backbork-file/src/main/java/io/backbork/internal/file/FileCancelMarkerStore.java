package io.backbork.internal.file;

import io.backbork.core.CancelMarker;
import io.backbork.store.CancelMarkerStore;
import io.backbork.utils.JobIds;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Cancel markers as {@code cancel/<jobId>.json}; the file's existence is the signal.
 */
public class FileCancelMarkerStore implements CancelMarkerStore {

    private final Path dir;
    private final JsonFiles json;

    FileCancelMarkerStore(Path dir, JsonFiles json) {
        JsonFiles.createDirectories(dir);
        this.dir = dir;
        this.json = json;
    }

    @Override
    public void create(CancelMarker marker) {
        json.write(JsonFiles.recordPath(dir, JobIds.requireSafe(marker.jobId())), marker);
    }

    @Override
    public boolean exists(String jobId) {
        return JobIds.isSafe(jobId) && Files.exists(JsonFiles.recordPath(dir, jobId));
    }

    @Override
    public Optional<CancelMarker> get(String jobId) {
        if (!JobIds.isSafe(jobId)) {
            return Optional.empty();
        }
        return json.read(JsonFiles.recordPath(dir, jobId), CancelMarker.class);
    }

    @Override
    public boolean clear(String jobId) {
        return JobIds.isSafe(jobId) && JsonFiles.delete(JsonFiles.recordPath(dir, jobId));
    }
}
