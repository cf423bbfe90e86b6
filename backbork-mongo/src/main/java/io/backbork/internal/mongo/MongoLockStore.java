package io.backbork.internal.mongo;

import io.backbork.core.LockRecord;
import io.backbork.store.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Optional;

/**
 * Single lock document; creation relies on the unique {@code _id}, every other write is
 * conditioned on the holder's token.
 */
public class MongoLockStore implements LockStore {
    private static final Logger log = LoggerFactory.getLogger(MongoLockStore.class);

    private final MongoTemplate mongoTemplate;

    MongoLockStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<LockRecord> read() {
        LockDocument doc = mongoTemplate.findById(LockDocument.QUEUE_LOCK_ID, LockDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new LockRecord(doc.getToken(), doc.getHolderPid(), doc.getHost(),
                doc.getAcquiredAt(), doc.getHeartbeatAt()));
    }

    @Override
    public boolean tryCreate(LockRecord lock) {
        LockDocument doc = new LockDocument();
        doc.setId(LockDocument.QUEUE_LOCK_ID);
        doc.setToken(lock.token());
        doc.setHolderPid(lock.holderPid());
        doc.setHost(lock.host());
        doc.setAcquiredAt(lock.acquiredAt());
        doc.setHeartbeatAt(lock.heartbeatAt());
        try {
            mongoTemplate.insert(doc);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("backbork mongo lock already held");
            return false;
        }
    }

    @Override
    public boolean removeIf(LockRecord expected) {
        Query q = new Query(Criteria.where("_id").is(LockDocument.QUEUE_LOCK_ID)
                .and("token").is(expected.token())
                .and("heartbeatAt").is(expected.heartbeatAt()));
        return mongoTemplate.remove(q, LockDocument.class).getDeletedCount() > 0;
    }

    @Override
    public boolean heartbeat(String token, Instant at) {
        Query q = byToken(token);
        Update u = new Update().set("heartbeatAt", at);
        return mongoTemplate.updateFirst(q, u, LockDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean release(String token) {
        return mongoTemplate.remove(byToken(token), LockDocument.class).getDeletedCount() > 0;
    }

    private static Query byToken(String token) {
        return new Query(Criteria.where("_id").is(LockDocument.QUEUE_LOCK_ID).and("token").is(token));
    }
}
