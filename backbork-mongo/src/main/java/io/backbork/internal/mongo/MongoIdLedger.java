package io.backbork.internal.mongo;

import io.backbork.core.DuplicateIdException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Instant;

/**
 * Ids are claimed by inserting into {@code backbork_ids}; the unique {@code _id} index rejects reuse.
 */
class MongoIdLedger {

    private final MongoTemplate mongoTemplate;

    MongoIdLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    void issue(String id, Instant at) {
        try {
            mongoTemplate.insert(new IssuedIdDocument(id, at));
        } catch (DuplicateKeyException e) {
            throw new DuplicateIdException(id);
        }
    }
}
