package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one account-level operation reported by the execution engine.
 *
 * <p>For successful backups {@code filename} names the produced artifact (relative to the account
 * directory on the destination) and {@code companionFilename} an optional second artifact such as
 * a separate database dump.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountResult(
        String account,
        boolean success,
        String message,
        String filename,
        String companionFilename,
        long size,
        long durationMillis
) {

    public static AccountResult success(String account, String message) {
        return new AccountResult(account, true, message, null, null, 0L, 0L);
    }

    public static AccountResult artifact(String account, String filename, String companionFilename, long size) {
        return new AccountResult(account, true, "Backup created: " + filename, filename, companionFilename, size, 0L);
    }

    public static AccountResult failure(String account, String message) {
        return new AccountResult(account, false, message, null, null, 0L, 0L);
    }

    public boolean hasArtifact() {
        return success && filename != null && !filename.isBlank();
    }

    public AccountResult withDuration(long durationMillis) {
        return new AccountResult(account, success, message, filename, companionFilename, size, durationMillis);
    }
}
