package io.backbork.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobIdsTest {

    @Test
    void idsShouldBeFileSafeAndCarryUtcTimestamp() {
        String id = JobIds.next(Instant.parse("2026-03-04T05:06:07Z"));

        assertTrue(id.startsWith("bb_20260304_050607_"), id);
        assertTrue(id.matches("bb_\\d{8}_\\d{6}_[0-9a-f]{8}"), id);
        assertTrue(JobIds.isSafe(id));
    }

    @Test
    void idsIssuedInSameSecondShouldBeUnique() {
        Instant now = Instant.parse("2026-03-04T05:06:07Z");
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(JobIds.next(now));
        }
        assertEquals(ids.size(), new HashSet<>(ids).size());
    }

    @Test
    void unsafeIdsShouldBeRejected() {
        assertFalse(JobIds.isSafe("../etc/passwd"));
        assertFalse(JobIds.isSafe("a/b"));
        assertFalse(JobIds.isSafe(""));
        assertFalse(JobIds.isSafe(null));
    }
}
