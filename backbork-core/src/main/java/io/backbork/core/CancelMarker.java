package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Request to stop a processing job after its current account.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelMarker(String jobId, String requestedBy, Instant requestedAt, String reason) {
}
