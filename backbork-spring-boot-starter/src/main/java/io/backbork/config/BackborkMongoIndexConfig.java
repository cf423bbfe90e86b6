package io.backbork.config;

import io.backbork.internal.mongo.JobDocument;
import io.backbork.internal.mongo.ManifestEntryDocument;
import io.backbork.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the mongo storage backend.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code backbork.ensure-indexes-on-startup=true};
 * in production they are usually managed by migration scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_jobs_collection_fifo</b> on {@code backbork_jobs}: { collection: 1, createdAt: 1, _id: 1 }
 *       <br/>Queue draining and per-collection listings.</li>
 *   <li><b>idx_schedules_due</b> on {@code backbork_schedules}: { enabled: 1, nextRun: 1 }</li>
 *   <li><b>idx_manifest_schedule</b> on {@code backbork_manifest}:
 *       { destinationId: 1, scheduleId: 1, createdAt: 1, sequence: 1 }
 *       <br/>Retention lookups, oldest first.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.backbork_jobs.createIndex({ collection: 1, createdAt: 1, _id: 1 }, { name: "idx_jobs_collection_fifo" });
 * db.backbork_schedules.createIndex({ enabled: 1, nextRun: 1 }, { name: "idx_schedules_due" });
 * db.backbork_manifest.createIndex(
 *   { destinationId: 1, scheduleId: 1, createdAt: 1, sequence: 1 },
 *   { name: "idx_manifest_schedule" }
 * );
 * </pre>
 */
public class BackborkMongoIndexConfig {

    public static final String IDX_JOBS_COLLECTION_FIFO = "idx_jobs_collection_fifo";
    public static final String IDX_SCHEDULES_DUE = "idx_schedules_due";
    public static final String IDX_MANIFEST_SCHEDULE = "idx_manifest_schedule";

    private final MongoTemplate mongoTemplate;

    public BackborkMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobsFifoIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(schedulesDueIndex());
        mongoTemplate.indexOps(ManifestEntryDocument.class).ensureIndex(manifestScheduleIndex());
    }

    public static Index jobsFifoIndex() {
        return new Index()
                .on("collection", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_JOBS_COLLECTION_FIFO);
    }

    public static Index schedulesDueIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRun", Sort.Direction.ASC)
                .named(IDX_SCHEDULES_DUE);
    }

    public static Index manifestScheduleIndex() {
        return new Index()
                .on("destinationId", Sort.Direction.ASC)
                .on("scheduleId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .on("sequence", Sort.Direction.ASC)
                .named(IDX_MANIFEST_SCHEDULE);
    }
}
