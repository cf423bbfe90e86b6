package io.backbork.internal.file;

import io.backbork.core.DuplicateIdException;
import io.backbork.core.StoreException;
import io.backbork.utils.JobIds;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Append-only record of issued ids: one empty marker file per id, created exclusively.
 */
final class FileIdLedger {

    private final Path dir;

    FileIdLedger(Path dir) {
        this.dir = dir;
        JsonFiles.createDirectories(dir);
    }

    /**
     * @throws DuplicateIdException if {@code id} was issued before
     */
    void issue(String id) {
        JobIds.requireSafe(id);
        try {
            Files.createFile(dir.resolve(id));
        } catch (FileAlreadyExistsException e) {
            throw new DuplicateIdException(id);
        } catch (IOException e) {
            throw new StoreException("Failed to record id " + id, e);
        }
    }
}
