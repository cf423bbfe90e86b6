package io.backbork.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Every job and schedule id ever issued; never deleted.
 */
@Document(collection = "backbork_ids")
public class IssuedIdDocument {

    @Id
    private String id;

    private Instant issuedAt;

    public IssuedIdDocument() {
    }

    public IssuedIdDocument(String id, Instant issuedAt) {
        this.id = id;
        this.issuedAt = issuedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(Instant issuedAt) {
        this.issuedAt = issuedAt;
    }
}
