package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Holder of the queue processing lock.
 *
 * <p>{@code holderPid} and {@code host} identify the holding process for liveness checks; either
 * may be missing on a lock written by a foreign or damaged writer, in which case liveness cannot be
 * verified. {@code heartbeatAt} is refreshed by the holder while it makes progress.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LockRecord(
        String token,
        Long holderPid,
        String host,
        Instant acquiredAt,
        Instant heartbeatAt
) {

    public LockRecord withHeartbeat(Instant at) {
        return new LockRecord(token, holderPid, host, acquiredAt, at);
    }

    /**
     * Last sign of life: the heartbeat, or the acquisition time if none was written.
     */
    public Instant lastSeen() {
        if (heartbeatAt != null) {
            return heartbeatAt;
        }
        return acquiredAt;
    }
}
