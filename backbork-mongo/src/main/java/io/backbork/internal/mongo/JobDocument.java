package io.backbork.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document for a job record.
 *
 * <p>All three job collections share one Mongo collection; {@code collection} says which one the
 * record is in, so a lifecycle move is a single-document update. {@code revision} is bumped on every
 * write and guards read-modify-write cycles.
 */
@Document(collection = "backbork_jobs")
public class JobDocument {

    @Id
    private String id;

    private String collection;
    private Instant createdAt;
    private long revision;
    private Map<String, Object> payload;

    public JobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }
}
