package io.backbork.internal.file;

import io.backbork.core.ManifestEntry;
import io.backbork.store.ManifestLedger;
import io.backbork.utils.JobIds;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One manifest file per destination, {@code manifest/<destinationId>.json}, rewritten atomically
 * on every change.
 */
public class FileManifestLedger implements ManifestLedger {

    /**
     * On-disk form of a destination manifest.
     */
    record ManifestFile(long lastSequence, List<ManifestEntry> entries) {
        ManifestFile {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }

        static ManifestFile empty() {
            return new ManifestFile(0L, List.of());
        }
    }

    private final Path dir;
    private final JsonFiles json;

    FileManifestLedger(Path dir, JsonFiles json) {
        JsonFiles.createDirectories(dir);
        this.dir = dir;
        this.json = json;
    }

    @Override
    public synchronized ManifestEntry record(String destinationId, ManifestEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        ManifestFile current = load(destinationId);
        long sequence = current.lastSequence() + 1;
        ManifestEntry stored = entry.withSequence(sequence);
        List<ManifestEntry> entries = new ArrayList<>(current.entries());
        entries.add(stored);
        save(destinationId, new ManifestFile(sequence, entries));
        return stored;
    }

    @Override
    public synchronized List<ManifestEntry> entries(String destinationId, String scheduleId) {
        return load(destinationId).entries().stream()
                .filter(e -> Objects.equals(scheduleId, e.scheduleId()))
                .sorted(ManifestEntry.OLDEST_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int remove(String destinationId, String scheduleId, Collection<String> filenames) {
        ManifestFile current = load(destinationId);
        List<ManifestEntry> kept = current.entries().stream()
                .filter(e -> !(Objects.equals(scheduleId, e.scheduleId()) && filenames.contains(e.filename())))
                .collect(Collectors.toList());
        int removed = current.entries().size() - kept.size();
        if (removed > 0) {
            save(destinationId, new ManifestFile(current.lastSequence(), kept));
        }
        return removed;
    }

    @Override
    public synchronized boolean removeEntry(String destinationId, ManifestEntry entry) {
        ManifestFile current = load(destinationId);
        List<ManifestEntry> kept = new ArrayList<>(current.entries());
        if (!kept.remove(entry)) {
            return false;
        }
        save(destinationId, new ManifestFile(current.lastSequence(), kept));
        return true;
    }

    private ManifestFile load(String destinationId) {
        return json.read(file(destinationId), ManifestFile.class).orElseGet(ManifestFile::empty);
    }

    private void save(String destinationId, ManifestFile manifest) {
        json.write(file(destinationId), manifest);
    }

    private Path file(String destinationId) {
        return JsonFiles.recordPath(dir, JobIds.requireSafe(destinationId));
    }
}
