package io.backbork.internal.mongo;

import io.backbork.core.ManifestEntry;
import io.backbork.store.ManifestLedger;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Manifest entries as individual documents, with a per-destination sequence from
 * {@code backbork_sequences}.
 */
public class MongoManifestLedger implements ManifestLedger {

    private static final String SEQUENCE_PREFIX = "manifest:";

    private final MongoTemplate mongoTemplate;

    MongoManifestLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public ManifestEntry record(String destinationId, ManifestEntry entry) {
        Objects.requireNonNull(destinationId, "destinationId must not be null");
        Objects.requireNonNull(entry, "entry must not be null");

        ManifestEntry recorded = entry.withSequence(nextSequence(destinationId));
        mongoTemplate.insert(toDocument(destinationId, recorded));
        return recorded;
    }

    @Override
    public List<ManifestEntry> entries(String destinationId, String scheduleId) {
        Query q = new Query(Criteria.where("destinationId").is(destinationId).and("scheduleId").is(scheduleId));
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("sequence")));

        List<ManifestEntry> entries = new ArrayList<>();
        for (ManifestEntryDocument d : mongoTemplate.find(q, ManifestEntryDocument.class)) {
            entries.add(toEntry(d));
        }
        return entries;
    }

    @Override
    public int remove(String destinationId, String scheduleId, Collection<String> filenames) {
        if (filenames == null || filenames.isEmpty()) {
            return 0;
        }
        Query q = new Query(Criteria.where("destinationId").is(destinationId)
                .and("scheduleId").is(scheduleId)
                .and("filename").in(filenames));
        return (int) mongoTemplate.remove(q, ManifestEntryDocument.class).getDeletedCount();
    }

    @Override
    public boolean removeEntry(String destinationId, ManifestEntry entry) {
        Query q = new Query(Criteria.where("destinationId").is(destinationId)
                .and("scheduleId").is(entry.scheduleId())
                .and("account").is(entry.account())
                .and("filename").is(entry.filename())
                .and("sequence").is(entry.sequence()));
        return mongoTemplate.remove(q, ManifestEntryDocument.class).getDeletedCount() > 0;
    }

    private long nextSequence(String destinationId) {
        Query q = new Query(Criteria.where("_id").is(SEQUENCE_PREFIX + destinationId));
        Update u = new Update().inc("value", 1L);
        SequenceDocument seq = mongoTemplate.findAndModify(q, u,
                FindAndModifyOptions.options().upsert(true).returnNew(true), SequenceDocument.class);
        return Objects.requireNonNull(seq, "upserted sequence must not be null").getValue();
    }

    private static ManifestEntryDocument toDocument(String destinationId, ManifestEntry entry) {
        ManifestEntryDocument doc = new ManifestEntryDocument();
        doc.setDestinationId(destinationId);
        doc.setScheduleId(entry.scheduleId());
        doc.setAccount(entry.account());
        doc.setFilename(entry.filename());
        doc.setCompanionFilename(entry.companionFilename());
        doc.setSize(entry.size());
        doc.setCreatedAt(entry.createdAt());
        doc.setSequence(entry.sequence());
        return doc;
    }

    private static ManifestEntry toEntry(ManifestEntryDocument doc) {
        return new ManifestEntry(
                doc.getScheduleId(),
                doc.getAccount(),
                doc.getFilename(),
                doc.getCompanionFilename(),
                doc.getSize(),
                doc.getCreatedAt(),
                doc.getSequence()
        );
    }
}
