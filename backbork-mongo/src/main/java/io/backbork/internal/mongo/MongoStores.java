package io.backbork.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backbork.store.BackborkStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.Objects;

/**
 * Stores backed by MongoDB. Collections:
 * <pre>
 * backbork_jobs             job records, discriminated by {@code collection}
 * backbork_schedules        schedules
 * backbork_manifest         manifest entries
 * backbork_sequences        manifest sequences
 * backbork_cancel_markers   cancel markers
 * backbork_lock             processing lock
 * backbork_ids              issued ids
 * </pre>
 */
public final class MongoStores {
    private static final Logger log = LoggerFactory.getLogger(MongoStores.class);

    private MongoStores() {
    }

    public static BackborkStores open(MongoTemplate mongoTemplate) {
        return open(mongoTemplate, MongoPayloads.defaultMapper());
    }

    public static BackborkStores open(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        MongoPayloads payloads = new MongoPayloads(objectMapper);
        MongoIdLedger ids = new MongoIdLedger(mongoTemplate);

        BackborkStores stores = new BackborkStores(
                new MongoJobStore(mongoTemplate, ids, payloads),
                new MongoScheduleStore(mongoTemplate, ids, payloads),
                new MongoManifestLedger(mongoTemplate),
                new MongoCancelMarkerStore(mongoTemplate),
                new MongoLockStore(mongoTemplate));
        log.info("backbork mongo stores opened");
        return stores;
    }
}
