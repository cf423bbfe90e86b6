package io.backbork;

import io.backbork.core.Destination;
import io.backbork.core.RemoteFile;
import io.backbork.core.TransportResult;

import java.util.List;

/**
 * Storage access for a destination. Paths are relative to the destination root,
 * e.g. {@code alice/backup-alice-2026-01-01.tar.gz}.
 */
public interface Transport {

    /**
     * Delete a file. Deleting a path that no longer exists should report success so that
     * an interrupted pruning run can be repeated.
     */
    TransportResult delete(String path, Destination destination);

    List<RemoteFile> list(String pathPrefix, Destination destination);
}
