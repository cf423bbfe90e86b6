package io.backbork.internal.file;

import io.backbork.core.ManifestEntry;
import io.backbork.store.ManifestLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileManifestLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path baseDir;

    @Test
    void sequenceShouldSurviveReopenAndBreakTies() {
        ManifestLedger ledger = FileStores.open(baseDir).manifest();
        ledger.record("local", ManifestEntry.of("s1", "alice", "a1.tar.gz", null, 10L, T0));
        ledger.record("local", ManifestEntry.of("s1", "alice", "a2.tar.gz", "a2.sql", 10L, T0));

        ManifestLedger reopened = FileStores.open(baseDir).manifest();
        ManifestEntry third = reopened.record("local", ManifestEntry.of("s1", "alice", "a3.tar.gz", null, 10L, T0));

        assertEquals(3L, third.sequence());
        List<String> expired = reopened.expiredEntries("local", "s1", "alice", 1).stream()
                .map(ManifestEntry::filename)
                .collect(Collectors.toList());
        assertEquals(List.of("a1.tar.gz", "a2.tar.gz"), expired);
        assertEquals("a2.sql", reopened.entries("local", "s1").get(1).companionFilename());
    }

    @Test
    void removalShouldBeScopedToScheduleAndEntry() {
        ManifestLedger ledger = FileStores.open(baseDir).manifest();
        ManifestEntry alice = ledger.record("local", ManifestEntry.of("s1", "alice", "same.tar.gz", null, 1L, T0));
        ledger.record("local", ManifestEntry.of("s1", "bob", "same.tar.gz", null, 1L, T0));
        ledger.record("local", ManifestEntry.of("s2", "alice", "same.tar.gz", null, 1L, T0));

        assertTrue(ledger.removeEntry("local", alice));
        assertFalse(ledger.removeEntry("local", alice));
        assertEquals(1, ledger.entries("local", "s1").size());

        assertEquals(1, ledger.remove("local", "s2", List.of("same.tar.gz")));
        assertTrue(ledger.entries("local", "s2").isEmpty());
        assertTrue(ledger.entries("offsite", "s1").isEmpty());
    }
}
