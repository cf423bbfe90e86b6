package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Comparator;

/**
 * One artifact recorded in a destination's manifest.
 *
 * <p>{@code sequence} is assigned by the ledger on append and breaks ties between entries
 * created at the same instant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(
        String scheduleId,
        String account,
        String filename,
        String companionFilename,
        long size,
        Instant createdAt,
        long sequence
) {

    /**
     * Oldest first; insertion order among equal timestamps.
     */
    public static final Comparator<ManifestEntry> OLDEST_FIRST =
            Comparator.comparing(ManifestEntry::createdAt).thenComparingLong(ManifestEntry::sequence);

    public static ManifestEntry of(String scheduleId, String account, String filename, String companionFilename,
                                   long size, Instant createdAt) {
        return new ManifestEntry(scheduleId, account, filename, companionFilename, size, createdAt, 0L);
    }

    public ManifestEntry withSequence(long sequence) {
        return new ManifestEntry(scheduleId, account, filename, companionFilename, size, createdAt, sequence);
    }

    @JsonIgnore
    public boolean isManual() {
        return Job.MANUAL_SCHEDULE_ID.equals(scheduleId);
    }

    @JsonIgnore
    public boolean hasCompanion() {
        return companionFilename != null && !companionFilename.isBlank();
    }

    /**
     * Path of the artifact on the destination, relative to its root.
     */
    public String artifactPath() {
        return account + "/" + filename;
    }

    public String companionPath() {
        return hasCompanion() ? account + "/" + companionFilename : null;
    }
}
