package io.backbork.internal.file;

import io.backbork.core.LockRecord;
import io.backbork.core.StoreException;
import io.backbork.store.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * The queue lock as a single JSON file.
 *
 * <p>Every mutation runs while holding an OS lock on a sibling guard file, so a compare-and-remove
 * of a stale lock can never interleave with another process creating a fresh one. Creation writes
 * the full record to a temp file and hard-links it to the lock path, which fails atomically if a
 * lock already exists.
 */
public class FileLockStore implements LockStore {
    private static final Logger log = LoggerFactory.getLogger(FileLockStore.class);

    // OS file locks are held per JVM, so stores sharing a guard file also share a monitor
    private static final ConcurrentMap<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final Path guardFile;
    private final Object monitor;
    private final JsonFiles json;

    FileLockStore(Path lockFile, JsonFiles json) {
        JsonFiles.createDirectories(lockFile.getParent());
        this.lockFile = lockFile;
        this.guardFile = lockFile.resolveSibling("." + lockFile.getFileName() + ".guard");
        this.monitor = MONITORS.computeIfAbsent(guardFile.toAbsolutePath().normalize(), k -> new Object());
        this.json = json;
    }

    @Override
    public Optional<LockRecord> read() {
        return json.read(lockFile, LockRecord.class);
    }

    @Override
    public boolean tryCreate(LockRecord lock) {
        Objects.requireNonNull(lock, "lock must not be null");
        return guarded(() -> create(lock));
    }

    @Override
    public boolean removeIf(LockRecord expected) {
        Objects.requireNonNull(expected, "expected must not be null");
        return guarded(() -> {
            Optional<LockRecord> current = read();
            if (current.isEmpty() || !current.get().equals(expected)) {
                return false;
            }
            return JsonFiles.delete(lockFile);
        });
    }

    @Override
    public boolean heartbeat(String token, Instant at) {
        return guarded(() -> {
            Optional<LockRecord> current = read();
            if (current.isEmpty() || !current.get().token().equals(token)) {
                return false;
            }
            json.write(lockFile, current.get().withHeartbeat(at));
            return true;
        });
    }

    @Override
    public boolean release(String token) {
        return guarded(() -> {
            Optional<LockRecord> current = read();
            if (current.isEmpty() || !current.get().token().equals(token)) {
                return false;
            }
            return JsonFiles.delete(lockFile);
        });
    }

    private boolean guarded(Supplier<Boolean> action) {
        synchronized (monitor) {
            try (FileChannel channel = FileChannel.open(guardFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            } catch (IOException e) {
                throw new StoreException("Failed to lock guard file " + guardFile, e);
            }
        }
    }

    private boolean create(LockRecord lock) {
        Path tmp = json.writeTemp(lockFile, lock);
        try {
            Files.createLink(lockFile, tmp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (UnsupportedOperationException e) {
            log.debug("backbork hard links unsupported, using exclusive create for {}", lockFile);
            return createExclusive(lock);
        } catch (IOException e) {
            throw new StoreException("Failed to create lock " + lockFile, e);
        } finally {
            JsonFiles.deleteQuietly(tmp);
        }
    }

    private boolean createExclusive(LockRecord lock) {
        try {
            Files.write(lockFile, json.mapper().writeValueAsBytes(lock), StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new StoreException("Failed to create lock " + lockFile, e);
        }
    }
}
