package io.backbork.store;

import io.backbork.core.Job;
import io.backbork.core.ManifestEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void expiredEntriesShouldBreakTimestampTiesByInsertionOrder() {
        ListLedger ledger = new ListLedger();
        for (int i = 1; i <= 4; i++) {
            ledger.record("local", ManifestEntry.of("s1", "alice", "f" + i, null, 1L, T0));
        }
        ledger.record("local", ManifestEntry.of("s1", "bob", "g1", null, 1L, T0));

        List<String> expired = ledger.expiredEntries("local", "s1", "alice", 2).stream()
                .map(ManifestEntry::filename)
                .collect(Collectors.toList());

        assertEquals(List.of("f1", "f2"), expired);
    }

    @Test
    void manualAndUnlimitedShouldNeverExpire() {
        ListLedger ledger = new ListLedger();
        for (int i = 1; i <= 3; i++) {
            ledger.record("local", ManifestEntry.of(Job.MANUAL_SCHEDULE_ID, "alice", "m" + i, null, 1L, T0.plusSeconds(i)));
            ledger.record("local", ManifestEntry.of("s1", "alice", "f" + i, null, 1L, T0.plusSeconds(i)));
        }

        assertTrue(ledger.expiredEntries("local", Job.MANUAL_SCHEDULE_ID, "alice", 1).isEmpty());
        assertTrue(ledger.expiredEntries("local", "s1", "alice", 0).isEmpty());
        assertEquals(2, ledger.expiredEntries("local", "s1", "alice", 1).size());
    }

    private static final class ListLedger implements ManifestLedger {
        private final List<ManifestEntry> entries = new ArrayList<>();

        @Override
        public ManifestEntry record(String destinationId, ManifestEntry entry) {
            ManifestEntry stored = entry.withSequence(entries.size() + 1L);
            // newest first on purpose; expiredEntries must sort on its own
            entries.add(0, stored);
            return stored;
        }

        @Override
        public List<ManifestEntry> entries(String destinationId, String scheduleId) {
            return entries.stream().filter(e -> e.scheduleId().equals(scheduleId)).collect(Collectors.toList());
        }

        @Override
        public int remove(String destinationId, String scheduleId, Collection<String> filenames) {
            int before = entries.size();
            entries.removeIf(e -> e.scheduleId().equals(scheduleId) && filenames.contains(e.filename()));
            return before - entries.size();
        }

        @Override
        public boolean removeEntry(String destinationId, ManifestEntry entry) {
            return entries.remove(entry);
        }
    }
}
