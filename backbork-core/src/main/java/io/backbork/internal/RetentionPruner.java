package io.backbork.internal;

import io.backbork.DestinationRegistry;
import io.backbork.Transport;
import io.backbork.core.AuditEventType;
import io.backbork.core.Destination;
import io.backbork.core.ManifestEntry;
import io.backbork.core.PruneResult;
import io.backbork.core.Schedule;
import io.backbork.core.TransportResult;
import io.backbork.store.ManifestLedger;
import io.backbork.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Deletes artifacts beyond each schedule's retention count.
 *
 * <p>A manifest entry is removed only after its companion and its primary artifact were both
 * deleted; a failed delete leaves the entry in place so the next run retries it.
 */
public class RetentionPruner {
    private static final Logger log = LoggerFactory.getLogger(RetentionPruner.class);

    private final ScheduleStore schedules;
    private final ManifestLedger manifest;
    private final Transport transport;
    private final DestinationRegistry destinations;
    private final Auditor auditor;

    RetentionPruner(ScheduleStore schedules,
                    ManifestLedger manifest,
                    Transport transport,
                    DestinationRegistry destinations,
                    Auditor auditor) {
        this.schedules = Objects.requireNonNull(schedules, "schedules must not be null");
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.destinations = Objects.requireNonNull(destinations, "destinations must not be null");
        this.auditor = Objects.requireNonNull(auditor, "auditor must not be null");
    }

    public PruneResult prune() {
        int pruned = 0;
        int failed = 0;
        int skipped = 0;
        List<String> deletedPaths = new ArrayList<>();

        for (Schedule schedule : schedules.list()) {
            if (schedule.retention() <= 0) {
                continue;
            }

            Optional<Destination> destination = destinations.find(schedule.destinationId());
            if (destination.isEmpty() || !destination.get().enabled()) {
                skipped++;
                String reason = destination.isEmpty()
                        ? "Destination not found: " + schedule.destinationId()
                        : "Destination is disabled: " + destination.get().displayName();
                log.warn("backbork prune skipped schedule={} reason={}", schedule.id(), reason);
                auditor.failure(AuditEventType.PRUNE_SKIPPED, schedule.owner(), List.of(schedule.id()), reason);
                continue;
            }

            Destination dest = destination.get();
            int prunedForSchedule = 0;
            for (String account : accountsOf(dest.id(), schedule.id())) {
                List<ManifestEntry> expired = manifest.expiredEntries(dest.id(), schedule.id(), account, schedule.retention());
                for (ManifestEntry entry : expired) {
                    if (deleteArtifacts(entry, dest)) {
                        manifest.removeEntry(dest.id(), entry);
                        deletedPaths.add(entry.artifactPath());
                        prunedForSchedule++;
                        log.info("backbork pruned schedule={} account={} file={}", schedule.id(), account, entry.filename());
                    } else {
                        failed++;
                    }
                }
            }

            if (prunedForSchedule > 0) {
                pruned += prunedForSchedule;
                auditor.success(AuditEventType.PRUNE, schedule.owner(), List.of(schedule.id()),
                        "Pruned " + prunedForSchedule + " backup(s) beyond retention " + schedule.retention());
            }
        }

        if (pruned > 0 || failed > 0) {
            log.info("backbork prune finished pruned={} failed={} skippedSchedules={}", pruned, failed, skipped);
        }
        return new PruneResult(pruned, failed, skipped, deletedPaths);
    }

    private Set<String> accountsOf(String destinationId, String scheduleId) {
        Set<String> accounts = new LinkedHashSet<>();
        for (ManifestEntry entry : manifest.entries(destinationId, scheduleId)) {
            accounts.add(entry.account());
        }
        return accounts;
    }

    // Companion first, primary last.
    private boolean deleteArtifacts(ManifestEntry entry, Destination destination) {
        if (entry.hasCompanion() && !delete(entry.companionPath(), destination)) {
            return false;
        }
        return delete(entry.artifactPath(), destination);
    }

    private boolean delete(String path, Destination destination) {
        try {
            TransportResult result = transport.delete(path, destination);
            if (result == null || !result.success()) {
                log.warn("backbork prune delete failed path={} destination={} msg={}",
                        path, destination.id(), result == null ? "no result" : result.message());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("backbork prune delete failed path={} destination={} msg={}", path, destination.id(), e.getMessage(), e);
            return false;
        }
    }
}
