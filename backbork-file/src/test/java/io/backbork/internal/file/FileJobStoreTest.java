package io.backbork.internal.file;

import io.backbork.core.AccountSelection;
import io.backbork.core.Destination;
import io.backbork.core.DuplicateIdException;
import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;
import io.backbork.core.JobStatus;
import io.backbork.core.JobType;
import io.backbork.core.NotFoundException;
import io.backbork.core.Progress;
import io.backbork.store.BackborkStores;
import io.backbork.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileJobStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Destination LOCAL = new Destination("local", "Local disk", "local", true);

    @TempDir
    Path baseDir;

    private JobStore jobs;

    @BeforeEach
    void setUp() {
        BackborkStores stores = FileStores.open(baseDir);
        jobs = stores.jobs();
    }

    @Test
    void recordShouldSurviveJsonRoundTrip() {
        Job job = Job.queued("bb_1", JobType.RESTORE, "reseller1", T0, AccountSelection.explicit("alice"), LOCAL,
                Map.of("backup_file", "alice.tar.gz"), null, 2);

        jobs.create(JobCollection.QUEUED, job);

        assertEquals(job, jobs.get(JobCollection.QUEUED, "bb_1").orElseThrow());
    }

    @Test
    void wildcardSelectionShouldBePersistedAsWildcard() throws Exception {
        jobs.create(JobCollection.QUEUED, job("bb_w", T0, AccountSelection.allAccessible()));

        String raw = Files.readString(baseDir.resolve("queue").resolve("bb_w.json"));
        assertTrue(raw.contains("\"accounts\":[\"*\"]"), raw);
        assertTrue(jobs.get(JobCollection.QUEUED, "bb_w").orElseThrow().accounts().isAllAccessible());
    }

    @Test
    void listShouldBeFifoAndIgnoreTempFiles() throws Exception {
        jobs.create(JobCollection.QUEUED, job("bb_b", T0.plusSeconds(1), AccountSelection.explicit("b")));
        jobs.create(JobCollection.QUEUED, job("bb_a", T0.plusSeconds(2), AccountSelection.explicit("a")));
        jobs.create(JobCollection.QUEUED, job("bb_c", T0, AccountSelection.explicit("c")));
        Files.writeString(baseDir.resolve("queue").resolve(".bb_x.json.tmp-1"), "{");

        List<String> ids = jobs.list(JobCollection.QUEUED).stream().map(Job::id).collect(Collectors.toList());

        assertEquals(List.of("bb_c", "bb_b", "bb_a"), ids);
        assertTrue(jobs.list(JobCollection.RUNNING).isEmpty());
    }

    @Test
    void idsShouldNeverBeReusedEvenAfterDelete() {
        jobs.create(JobCollection.QUEUED, job("bb_1", T0, AccountSelection.explicit("a")));
        assertTrue(jobs.delete(JobCollection.QUEUED, "bb_1"));

        assertThrows(DuplicateIdException.class,
                () -> jobs.create(JobCollection.COMPLETED, job("bb_1", T0, AccountSelection.explicit("a"))));
    }

    @Test
    void moveShouldApplyPatchAndLeaveSingleCopy() {
        jobs.create(JobCollection.QUEUED, job("bb_1", T0, AccountSelection.explicit("a")));

        Job moved = jobs.move("bb_1", JobCollection.QUEUED, JobCollection.RUNNING,
                JobPatch.of().status(JobStatus.PROCESSING).startedAt(T0).progress(new Progress(1, 0)));

        assertEquals(JobStatus.PROCESSING, moved.status());
        assertTrue(jobs.get(JobCollection.QUEUED, "bb_1").isEmpty());
        assertEquals(moved, jobs.get(JobCollection.RUNNING, "bb_1").orElseThrow());
        assertEquals(1, countEverywhere("bb_1"));
    }

    @Test
    void moveOfMissingJobShouldFailWithNotFound() {
        assertThrows(NotFoundException.class, () -> jobs.move("bb_none", JobCollection.QUEUED, JobCollection.RUNNING,
                JobPatch.of().status(JobStatus.PROCESSING)));
        assertThrows(NotFoundException.class, () -> jobs.update(JobCollection.RUNNING, "bb_none",
                JobPatch.of().message("x")));
    }

    @Test
    void crashBetweenRenameAndPatchShouldStillYieldSingleCopy() throws Exception {
        jobs.create(JobCollection.QUEUED, job("bb_1", T0, AccountSelection.explicit("a")));
        // first half of a move only
        Files.move(baseDir.resolve("queue").resolve("bb_1.json"), baseDir.resolve("running").resolve("bb_1.json"),
                StandardCopyOption.ATOMIC_MOVE);

        assertEquals(1, countEverywhere("bb_1"));
        assertEquals(JobStatus.QUEUED, jobs.find("bb_1").orElseThrow().status());
    }

    @Test
    void deleteShouldIgnoreUnsafeIds() {
        assertFalse(jobs.delete(JobCollection.QUEUED, "../queue.lock"));
        assertTrue(jobs.get(JobCollection.QUEUED, "../x").isEmpty());
    }

    private long countEverywhere(String id) {
        long count = 0;
        for (JobCollection c : JobCollection.values()) {
            count += jobs.list(c).stream().filter(j -> j.id().equals(id)).count();
        }
        return count;
    }

    private static Job job(String id, Instant createdAt, AccountSelection accounts) {
        return Job.queued(id, JobType.BACKUP, "root", createdAt, accounts, LOCAL, null, null, 0);
    }
}
