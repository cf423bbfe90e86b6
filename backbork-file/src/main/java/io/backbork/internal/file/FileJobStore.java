package io.backbork.internal.file;

import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;
import io.backbork.core.NotFoundException;
import io.backbork.core.StoreException;
import io.backbork.store.JobStore;
import io.backbork.utils.JobIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Jobs as JSON files, one directory per {@link JobCollection}.
 *
 * <p>A move renames the record file into the target directory first and then rewrites it with
 * the patch applied, so at every instant the file exists in exactly one directory. A crash between
 * the two steps leaves the record in the target with its old fields; the queue processor finishes
 * such records on its next pass.
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    private static final Comparator<Job> FIFO = Comparator.comparing(Job::createdAt).thenComparing(Job::id);

    private final Map<JobCollection, Path> dirs = new EnumMap<>(JobCollection.class);
    private final FileIdLedger ids;
    private final JsonFiles json;

    FileJobStore(Path baseDir, FileIdLedger ids, JsonFiles json) {
        for (JobCollection collection : JobCollection.values()) {
            Path dir = baseDir.resolve(collection.storageName());
            JsonFiles.createDirectories(dir);
            dirs.put(collection, dir);
        }
        this.ids = ids;
        this.json = json;
    }

    @Override
    public void create(JobCollection collection, Job job) {
        ids.issue(job.id());
        json.write(path(collection, job.id()), job);
        log.debug("backbork file job created id={} collection={}", job.id(), collection);
    }

    @Override
    public Optional<Job> get(JobCollection collection, String id) {
        if (!JobIds.isSafe(id)) {
            return Optional.empty();
        }
        return json.read(path(collection, id), Job.class);
    }

    @Override
    public Optional<Job> find(String id) {
        for (JobCollection collection : JobCollection.values()) {
            Optional<Job> job = get(collection, id);
            if (job.isPresent()) {
                return job;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Job> list(JobCollection collection) {
        List<Job> jobs = new ArrayList<>();
        for (String id : JsonFiles.listIds(dirs.get(collection))) {
            // a file listed here may be moved away before it is read
            json.read(path(collection, id), Job.class).ifPresent(jobs::add);
        }
        jobs.sort(FIFO);
        return jobs;
    }

    @Override
    public synchronized Job update(JobCollection collection, String id, JobPatch patch) {
        Job current = get(collection, id).orElseThrow(() -> new NotFoundException("Job", id));
        Job updated = patch.applyTo(current);
        json.write(path(collection, id), updated);
        return updated;
    }

    @Override
    public synchronized Job move(String id, JobCollection from, JobCollection to, JobPatch patch) {
        JobIds.requireSafe(id);
        Path source = path(from, id);
        Path target = path(to, id);
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Job", id);
        } catch (FileAlreadyExistsException e) {
            throw new StoreException("Job " + id + " already present in " + to, e);
        } catch (AtomicMoveNotSupportedException e) {
            throw new StoreException("Atomic rename not supported for " + source, e);
        } catch (IOException e) {
            throw new StoreException("Failed to move job " + id + " from " + from + " to " + to, e);
        }

        Job moved = json.read(target, Job.class).orElseThrow(() -> new NotFoundException("Job", id));
        if (!patch.isEmpty()) {
            moved = patch.applyTo(moved);
            json.write(target, moved);
        }
        log.debug("backbork file job moved id={} from={} to={}", id, from, to);
        return moved;
    }

    @Override
    public boolean delete(JobCollection collection, String id) {
        if (!JobIds.isSafe(id)) {
            return false;
        }
        return JsonFiles.delete(path(collection, id));
    }

    private Path path(JobCollection collection, String id) {
        return JsonFiles.recordPath(dirs.get(collection), id);
    }
}
