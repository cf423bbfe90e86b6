package io.backbork.internal;

import io.backbork.AuditSink;
import io.backbork.core.AuditEvent;
import io.backbork.core.AuditEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Fire-and-forget front of the {@link AuditSink}: sink failures are logged and dropped.
 */
final class Auditor {
    private static final Logger log = LoggerFactory.getLogger(Auditor.class);

    private final AuditSink sink;
    private final Clock clock;

    Auditor(AuditSink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    void success(AuditEventType type, String owner, List<String> subjects, String message) {
        emit(type, owner, subjects, true, message);
    }

    void failure(AuditEventType type, String owner, List<String> subjects, String message) {
        emit(type, owner, subjects, false, message);
    }

    void emit(AuditEventType type, String owner, List<String> subjects, boolean success, String message) {
        try {
            sink.record(new AuditEvent(type, owner, subjects, success, message, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("backbork audit sink failed type={} msg={}", type, e.getMessage());
        }
    }
}
