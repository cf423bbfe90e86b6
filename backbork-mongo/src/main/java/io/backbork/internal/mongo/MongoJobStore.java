package io.backbork.internal.mongo;

import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;
import io.backbork.core.NotFoundException;
import io.backbork.core.StoreException;
import io.backbork.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Lifecycle moves rewrite the {@code collection} field and the payload in one
 * {@code findAndModify}, conditioned on the source collection and the revision that was read. A
 * job is therefore never visible in two collections, and a concurrent writer makes the move retry
 * instead of being overwritten.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final Comparator<Job> FIFO = Comparator.comparing(Job::createdAt).thenComparing(Job::id);
    private static final int MAX_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;
    private final MongoIdLedger ids;
    private final MongoPayloads payloads;

    MongoJobStore(MongoTemplate mongoTemplate, MongoIdLedger ids, MongoPayloads payloads) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.ids = ids;
        this.payloads = payloads;
    }

    @Override
    public void create(JobCollection collection, Job job) {
        Objects.requireNonNull(job, "job must not be null");
        ids.issue(job.id(), job.createdAt());

        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setCollection(collection.storageName());
        doc.setCreatedAt(job.createdAt());
        doc.setRevision(0L);
        doc.setPayload(payloads.toMap(job));
        mongoTemplate.insert(doc);
        log.debug("backbork mongo job created id={} collection={}", job.id(), collection);
    }

    @Override
    public Optional<Job> get(JobCollection collection, String id) {
        return findDocument(collection, id).map(this::toJob);
    }

    @Override
    public Optional<Job> find(String id) {
        JobDocument doc = mongoTemplate.findOne(new Query(Criteria.where("_id").is(id)), JobDocument.class);
        return Optional.ofNullable(doc).map(this::toJob);
    }

    @Override
    public List<Job> list(JobCollection collection) {
        Query q = new Query(Criteria.where("collection").is(collection.storageName()));
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));

        List<JobDocument> docs = mongoTemplate.find(q, JobDocument.class);
        List<Job> jobs = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            jobs.add(toJob(d));
        }
        // stored dates are millisecond precision; the payload keeps the exact instant
        jobs.sort(FIFO);
        return jobs;
    }

    @Override
    public Job update(JobCollection collection, String id, JobPatch patch) {
        return rewrite(id, collection, collection, patch);
    }

    @Override
    public Job move(String id, JobCollection from, JobCollection to, JobPatch patch) {
        Job moved = rewrite(id, from, to, patch);
        log.debug("backbork mongo job moved id={} from={} to={}", id, from, to);
        return moved;
    }

    @Override
    public boolean delete(JobCollection collection, String id) {
        Query q = new Query(Criteria.where("_id").is(id).and("collection").is(collection.storageName()));
        return mongoTemplate.remove(q, JobDocument.class).getDeletedCount() > 0;
    }

    private Job rewrite(String id, JobCollection from, JobCollection to, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        for (int attempt = 1; ; attempt++) {
            JobDocument current = findDocument(from, id).orElseThrow(() -> new NotFoundException("Job", id));
            Job updated = patch.applyTo(toJob(current));

            Query q = new Query(
                    Criteria.where("_id").is(id)
                            .and("collection").is(from.storageName())
                            // Prevent lost updates if another writer got in between.
                            .and("revision").is(current.getRevision())
            );
            Update u = new Update()
                    .set("collection", to.storageName())
                    .set("payload", payloads.toMap(updated))
                    .inc("revision", 1);

            JobDocument written = mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true),
                    JobDocument.class);
            if (written != null) {
                return updated;
            }
            if (attempt >= MAX_ATTEMPTS) {
                throw new StoreException("Job " + id + " kept changing while writing it to " + to, null);
            }
            log.debug("backbork mongo job write conflict id={} attempt={}", id, attempt);
        }
    }

    private Optional<JobDocument> findDocument(JobCollection collection, String id) {
        if (id == null) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("_id").is(id).and("collection").is(collection.storageName()));
        return Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class));
    }

    private Job toJob(JobDocument doc) {
        return payloads.fromMap(doc.getPayload(), Job.class);
    }
}
