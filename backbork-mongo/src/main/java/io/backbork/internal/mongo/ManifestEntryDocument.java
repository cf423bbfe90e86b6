package io.backbork.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One manifest entry; the destination's ledger is the set of documents sharing {@code destinationId}.
 */
@Document(collection = "backbork_manifest")
public class ManifestEntryDocument {

    @Id
    private String id;

    private String destinationId;
    private String scheduleId;
    private String account;
    private String filename;
    private String companionFilename;
    private long size;
    private Instant createdAt;
    private long sequence;

    public ManifestEntryDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDestinationId() {
        return destinationId;
    }

    public void setDestinationId(String destinationId) {
        this.destinationId = destinationId;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(String scheduleId) {
        this.scheduleId = scheduleId;
    }

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getCompanionFilename() {
        return companionFilename;
    }

    public void setCompanionFilename(String companionFilename) {
        this.companionFilename = companionFilename;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }
}
