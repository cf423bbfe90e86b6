package io.backbork.config;

import io.backbork.AuditSink;
import io.backbork.core.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default audit sink: one log line per event on the {@code io.backbork.audit} logger.
 */
public class LoggingAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger("io.backbork.audit");

    @Override
    public void record(AuditEvent event) {
        if (event.success()) {
            log.info("backbork audit type={} owner={} subjects={} msg={}",
                    event.type(), event.owner(), event.subjects(), event.message());
        } else {
            log.warn("backbork audit type={} owner={} subjects={} success=false msg={}",
                    event.type(), event.owner(), event.subjects(), event.message());
        }
    }
}
