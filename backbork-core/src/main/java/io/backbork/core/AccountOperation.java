package io.backbork.core;

import java.util.Map;

/**
 * One account-level unit of work handed to the execution engine.
 */
public record AccountOperation(
        String jobId,
        JobType type,
        String account,
        Destination destination,
        String owner,
        String scheduleId,
        Map<String, String> options
) {
    public AccountOperation {
        options = options == null ? Map.of() : Map.copyOf(options);
    }
}
