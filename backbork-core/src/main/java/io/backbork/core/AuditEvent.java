package io.backbork.core;

import java.time.Instant;
import java.util.List;

public record AuditEvent(
        AuditEventType type,
        String owner,
        List<String> subjects,
        boolean success,
        String message,
        Instant occurredAt
) {
    public AuditEvent {
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }
}
