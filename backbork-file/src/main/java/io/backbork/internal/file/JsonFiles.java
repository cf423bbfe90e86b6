package io.backbork.internal.file;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.backbork.core.StoreException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON record files: one document per file, replaced through a temp file and an atomic rename so
 * readers never see a half-written record.
 *
 * <p>Temp files start with a dot and are ignored by {@link #listIds(Path)}.
 */
public final class JsonFiles {

    static final String SUFFIX = ".json";

    private final ObjectMapper mapper;

    public JsonFiles(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Mapper used for every record file: ISO-8601 instants, unknown properties tolerated.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    ObjectMapper mapper() {
        return mapper;
    }

    static Path recordPath(Path dir, String id) {
        return dir.resolve(id + SUFFIX);
    }

    <T> Optional<T> read(Path file, Class<T> type) {
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (NoSuchFileException | FileNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            throw new StoreException("Failed to read " + file, e);
        }
    }

    void write(Path file, Object value) {
        Path tmp = tempSibling(file);
        try {
            Files.createDirectories(file.getParent());
            mapper.writeValue(tmp.toFile(), value);
            moveReplacing(tmp, file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreException("Failed to write " + file, e);
        }
    }

    /**
     * Write {@code value} to a new temp file next to {@code file} and return the temp path.
     */
    Path writeTemp(Path file, Object value) {
        Path tmp = tempSibling(file);
        try {
            Files.createDirectories(file.getParent());
            mapper.writeValue(tmp.toFile(), value);
            return tmp;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreException("Failed to write " + tmp, e);
        }
    }

    /**
     * Ids of the record files in {@code dir}; empty for a missing directory.
     */
    static List<String> listIds(Path dir) {
        List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (name.startsWith(".")) {
                    continue;
                }
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (NoSuchFileException e) {
            return ids;
        } catch (IOException e) {
            throw new StoreException("Failed to list " + dir, e);
        }
        return ids;
    }

    static boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StoreException("Failed to delete " + file, e);
        }
    }

    static void moveReplacing(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("Failed to create " + dir, e);
        }
    }

    static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ignored) {
            // temp file only
        }
    }

    private static Path tempSibling(Path file) {
        return file.resolveSibling("." + file.getFileName() + ".tmp-" + UUID.randomUUID());
    }
}
