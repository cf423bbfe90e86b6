package io.backbork.store;

import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;

import java.util.List;
import java.util.Optional;

/**
 * Durable job records across the {@link JobCollection}s.
 *
 * <p>{@link #move} is the only primitive used for lifecycle transitions and must never leave a
 * job readable in both or neither collection, even if the process dies half way.
 */
public interface JobStore {

    /**
     * @throws io.backbork.core.DuplicateIdException if the id was ever issued before
     */
    void create(JobCollection collection, Job job);

    Optional<Job> get(JobCollection collection, String id);

    /**
     * Look the id up in every collection.
     */
    Optional<Job> find(String id);

    /**
     * Jobs of a collection ordered by creation time, then id. Empty when the collection does not exist.
     */
    List<Job> list(JobCollection collection);

    /**
     * @throws io.backbork.core.NotFoundException if the id is not in {@code collection}
     */
    Job update(JobCollection collection, String id, JobPatch patch);

    /**
     * Atomically move a job and apply {@code patch} on the way.
     *
     * @throws io.backbork.core.NotFoundException if the id is not in {@code from}
     */
    Job move(String id, JobCollection from, JobCollection to, JobPatch patch);

    /**
     * @return true if a record was deleted
     */
    boolean delete(JobCollection collection, String id);
}
