package io.backbork.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * The queue processing lock. There is at most one document, with the fixed id {@link #QUEUE_LOCK_ID};
 * the unique {@code _id} index makes creation atomic.
 */
@Document(collection = "backbork_lock")
public class LockDocument {

    public static final String QUEUE_LOCK_ID = "queue";

    @Id
    private String id;

    private String token;
    private Long holderPid;
    private String host;
    private Instant acquiredAt;
    private Instant heartbeatAt;

    public LockDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Long getHolderPid() {
        return holderPid;
    }

    public void setHolderPid(Long holderPid) {
        this.holderPid = holderPid;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public void setAcquiredAt(Instant acquiredAt) {
        this.acquiredAt = acquiredAt;
    }

    public Instant getHeartbeatAt() {
        return heartbeatAt;
    }

    public void setHeartbeatAt(Instant heartbeatAt) {
        this.heartbeatAt = heartbeatAt;
    }
}
