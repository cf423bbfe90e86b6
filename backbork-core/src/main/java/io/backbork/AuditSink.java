package io.backbork;

import io.backbork.core.AuditEvent;

/**
 * Receives audit events. Failures are logged by the caller and never interrupt processing.
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEvent event);

    static AuditSink noop() {
        return event -> {
        };
    }
}
