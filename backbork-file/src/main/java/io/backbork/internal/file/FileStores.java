package io.backbork.internal.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backbork.core.JobCollection;
import io.backbork.store.BackborkStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Filesystem layout of a backup queue:
 * <pre>
 * baseDir/
 *   queue/       queued jobs          (&lt;id&gt;.json)
 *   running/     processing jobs
 *   completed/   finished jobs
 *   schedules/   schedules
 *   cancel/      cancel markers
 *   manifest/    one ledger per destination
 *   ids/         issued ids (empty marker files)
 *   queue.lock   processing lock
 * </pre>
 */
public final class FileStores {
    private static final Logger log = LoggerFactory.getLogger(FileStores.class);

    private FileStores() {
    }

    public static BackborkStores open(Path baseDir) {
        return open(baseDir, JsonFiles.defaultMapper());
    }

    public static BackborkStores open(Path baseDir, ObjectMapper mapper) {
        Objects.requireNonNull(baseDir, "baseDir must not be null");
        Path root = baseDir.toAbsolutePath().normalize();
        JsonFiles json = new JsonFiles(mapper);
        FileIdLedger ids = new FileIdLedger(root.resolve("ids"));

        BackborkStores stores = new BackborkStores(
                new FileJobStore(root, ids, json),
                new FileScheduleStore(root.resolve("schedules"), ids, json),
                new FileManifestLedger(root.resolve("manifest"), json),
                new FileCancelMarkerStore(root.resolve("cancel"), json),
                new FileLockStore(root.resolve(JobCollection.QUEUED.storageName() + ".lock"), json));
        log.info("backbork file stores opened baseDir={}", root);
        return stores;
    }
}
