package io.backbork.internal.mongo;

import io.backbork.core.CancelMarker;
import io.backbork.store.CancelMarkerStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Optional;

public class MongoCancelMarkerStore implements CancelMarkerStore {

    private final MongoTemplate mongoTemplate;

    MongoCancelMarkerStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void create(CancelMarker marker) {
        CancelMarkerDocument doc = new CancelMarkerDocument();
        doc.setJobId(marker.jobId());
        doc.setRequestedBy(marker.requestedBy());
        doc.setRequestedAt(marker.requestedAt());
        doc.setReason(marker.reason());
        // replaces an earlier marker for the same job
        mongoTemplate.save(doc);
    }

    @Override
    public boolean exists(String jobId) {
        return jobId != null && mongoTemplate.exists(byJob(jobId), CancelMarkerDocument.class);
    }

    @Override
    public Optional<CancelMarker> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        CancelMarkerDocument doc = mongoTemplate.findOne(byJob(jobId), CancelMarkerDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new CancelMarker(doc.getJobId(), doc.getRequestedBy(), doc.getRequestedAt(), doc.getReason()));
    }

    @Override
    public boolean clear(String jobId) {
        return jobId != null && mongoTemplate.remove(byJob(jobId), CancelMarkerDocument.class).getDeletedCount() > 0;
    }

    private static Query byJob(String jobId) {
        return new Query(Criteria.where("_id").is(jobId));
    }
}
