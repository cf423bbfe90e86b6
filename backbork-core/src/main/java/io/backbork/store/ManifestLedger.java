package io.backbork.store;

import io.backbork.core.Job;
import io.backbork.core.ManifestEntry;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Append-only record, per destination, of which artifacts each schedule produced for each account.
 */
public interface ManifestLedger {

    /**
     * Append an entry. The ledger assigns the insertion sequence.
     */
    ManifestEntry record(String destinationId, ManifestEntry entry);

    /**
     * Entries of one schedule, oldest first.
     */
    List<ManifestEntry> entries(String destinationId, String scheduleId);

    /**
     * Remove entries of {@code scheduleId} whose filename is in {@code filenames}.
     *
     * @return number of entries removed
     */
    int remove(String destinationId, String scheduleId, Collection<String> filenames);

    /**
     * Remove exactly {@code entry} (same schedule, account, filename and sequence).
     *
     * @return true if it was present
     */
    boolean removeEntry(String destinationId, ManifestEntry entry);

    /**
     * Entries of {@code account} beyond the {@code keepCount} newest, oldest first.
     *
     * <p>Manual entries and a {@code keepCount} of zero or less never expire.
     */
    default List<ManifestEntry> expiredEntries(String destinationId, String scheduleId, String account, int keepCount) {
        Objects.requireNonNull(account, "account must not be null");
        if (keepCount <= 0 || Job.MANUAL_SCHEDULE_ID.equals(scheduleId)) {
            return List.of();
        }
        List<ManifestEntry> forAccount = entries(destinationId, scheduleId).stream()
                .filter(e -> account.equals(e.account()))
                .filter(e -> !e.isManual())
                .sorted(ManifestEntry.OLDEST_FIRST)
                .collect(Collectors.toList());
        int expired = forAccount.size() - keepCount;
        if (expired <= 0) {
            return List.of();
        }
        return List.copyOf(forAccount.subList(0, expired));
    }
}
