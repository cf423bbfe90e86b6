package io.backbork.internal.mongo;

import com.mongodb.client.MongoClients;
import io.backbork.AuditSink;
import io.backbork.DestinationRegistry;
import io.backbork.ProcessLiveness;
import io.backbork.Transport;
import io.backbork.config.BackborkProperties;
import io.backbork.core.AccountResult;
import io.backbork.core.AccountSelection;
import io.backbork.core.Destination;
import io.backbork.core.DuplicateIdException;
import io.backbork.core.Job;
import io.backbork.core.JobCollection;
import io.backbork.core.JobPatch;
import io.backbork.core.JobStatus;
import io.backbork.core.JobType;
import io.backbork.core.LockRecord;
import io.backbork.core.ManifestEntry;
import io.backbork.core.NotFoundException;
import io.backbork.core.PassResult;
import io.backbork.core.Progress;
import io.backbork.core.RemoteFile;
import io.backbork.core.TransportResult;
import io.backbork.internal.DefaultBackupQueue;
import io.backbork.internal.QueueLock;
import io.backbork.internal.QueueProcessor;
import io.backbork.store.BackborkStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Destination LOCAL = new Destination("local", "Local disk", "local", true);

    private MongoTemplate mongoTemplate;
    private BackborkStores stores;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "backbork_test");
        mongoTemplate.getDb().drop();
        stores = MongoStores.open(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.getDb().drop();
    }

    @Test
    void jobShouldSurviveRoundTripAndListInCreationOrder() {
        Job restore = Job.queued("bb_2", JobType.RESTORE, "reseller1", T0.plusSeconds(5),
                AccountSelection.explicit("alice"), LOCAL, Map.of("backup_file", "alice.tar.gz"), null, 0);
        Job wildcard = job("bb_1", T0, AccountSelection.allAccessible());

        stores.jobs().create(JobCollection.QUEUED, restore);
        stores.jobs().create(JobCollection.QUEUED, wildcard);

        assertEquals(restore, stores.jobs().get(JobCollection.QUEUED, "bb_2").orElseThrow());
        assertEquals(List.of("bb_1", "bb_2"), stores.jobs().list(JobCollection.QUEUED).stream()
                .map(Job::id)
                .collect(Collectors.toList()));
        assertTrue(stores.jobs().get(JobCollection.QUEUED, "bb_1").orElseThrow().accounts().isAllAccessible());
    }

    @Test
    void idShouldNeverBeReusedEvenAfterDelete() {
        stores.jobs().create(JobCollection.QUEUED, job("bb_1", T0, AccountSelection.explicit("a")));
        assertTrue(stores.jobs().delete(JobCollection.QUEUED, "bb_1"));

        assertThrows(DuplicateIdException.class,
                () -> stores.jobs().create(JobCollection.QUEUED, job("bb_1", T0, AccountSelection.explicit("a"))));
    }

    @Test
    void moveShouldLeaveJobInExactlyOneCollection() {
        stores.jobs().create(JobCollection.QUEUED, job("bb_1", T0, AccountSelection.explicit("a")));

        Job moved = stores.jobs().move("bb_1", JobCollection.QUEUED, JobCollection.RUNNING,
                JobPatch.of().status(JobStatus.PROCESSING).startedAt(T0).progress(new Progress(1, 0)));

        assertEquals(JobStatus.PROCESSING, moved.status());
        assertTrue(stores.jobs().get(JobCollection.QUEUED, "bb_1").isEmpty());
        assertEquals(moved, stores.jobs().get(JobCollection.RUNNING, "bb_1").orElseThrow());
        assertThrows(NotFoundException.class,
                () -> stores.jobs().move("bb_1", JobCollection.QUEUED, JobCollection.RUNNING, JobPatch.of()));
    }

    @Test
    void lockShouldBeExclusiveAndTokenGuarded() {
        LockRecord first = new LockRecord("t1", 100L, "host-a", T0, T0);
        LockRecord second = new LockRecord("t2", 200L, "host-b", T0, T0);

        assertTrue(stores.lock().tryCreate(first));
        assertFalse(stores.lock().tryCreate(second));
        assertFalse(stores.lock().heartbeat("t2", T0.plusSeconds(1)));
        assertTrue(stores.lock().heartbeat("t1", T0.plusSeconds(1)));

        // stale view: heartbeat moved on since it was read
        assertFalse(stores.lock().removeIf(first));
        LockRecord current = stores.lock().read().orElseThrow();
        assertEquals(T0.plusSeconds(1), current.heartbeatAt());
        assertTrue(stores.lock().removeIf(current));
        assertTrue(stores.lock().read().isEmpty());
    }

    @Test
    void manifestShouldAssignSequencesAndRemoveExactEntry() {
        ManifestEntry a = stores.manifest().record("local", ManifestEntry.of("s1", "alice", "x.tar.gz", null, 1, T0));
        ManifestEntry b = stores.manifest().record("local", ManifestEntry.of("s1", "bob", "x.tar.gz", null, 1, T0));

        assertTrue(b.sequence() > a.sequence());
        assertTrue(stores.manifest().removeEntry("local", a));
        assertEquals(List.of(b), stores.manifest().entries("local", "s1"));
        assertTrue(stores.manifest().entries("offsite", "s1").isEmpty());
    }

    @Test
    void processingPassShouldRunQueuedBackupAgainstMongo() {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        BackborkProperties props = new BackborkProperties();
        props.setZone("UTC");
        DestinationRegistry destinations = id -> "local".equals(id) ? Optional.of(LOCAL) : Optional.empty();
        QueueLock lock = new QueueLock(stores.lock(), ProcessLiveness.processHandles(), clock,
                Duration.ofHours(1), "test-host", ProcessHandle.current().pid());
        DefaultBackupQueue queue = new DefaultBackupQueue(props, stores, destinations, AuditSink.noop(), lock, clock);
        QueueProcessor processor = new QueueProcessor(props, stores,
                (op, cancellation) -> AccountResult.artifact(op.account(), op.account() + ".tar.gz", null, 7L),
                new NoopTransport(), owner -> List.of("a", "b"), destinations, AuditSink.noop(), lock, clock);

        String id = queue.backup(AccountSelection.allAccessible(), "local").owner("reseller1").save().id();
        PassResult pass = processor.runPass();

        assertEquals(1, pass.jobsCompleted());
        Job done = stores.jobs().get(JobCollection.COMPLETED, id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(List.of("a", "b"), done.accounts().toList());
        assertEquals(2, stores.manifest().entries("local", Job.MANUAL_SCHEDULE_ID).size());
        assertTrue(stores.lock().read().isEmpty());
    }

    private static Job job(String id, Instant createdAt, AccountSelection accounts) {
        return Job.queued(id, JobType.BACKUP, "root", createdAt, accounts, LOCAL, Map.of(), null, 0);
    }

    static final class NoopTransport implements Transport {
        @Override
        public TransportResult delete(String path, Destination destination) {
            return TransportResult.ok();
        }

        @Override
        public List<RemoteFile> list(String pathPrefix, Destination destination) {
            return List.of();
        }
    }
}
