package io.ringdb.common.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A data or index file could not be read or written. The in-memory state of the block is unaffected.
 */
public final class IOStorageException extends StorageException {

    private final Path file;

    public IOStorageException(String action, Path file, IOException cause) {
        super("Failed to " + action + " " + file, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
