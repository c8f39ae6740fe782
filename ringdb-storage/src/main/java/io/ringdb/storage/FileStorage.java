package io.ringdb.storage;

import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.exception.CorruptionException;
import io.ringdb.common.exception.IOStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Storage kept entirely in memory and backed by a single file: the whole file is read on {@link #open()}
 * and rewritten on every {@link #flush()}. Meant for development-scale data.
 */
public abstract class FileStorage extends MemoryStorage {

    private static final Logger logger = LoggerFactory.getLogger(FileStorage.class);

    private final Path path;
    private final ReentrantLock flushLock;

    protected FileStorage(Path path) {
        this.path = path;
        this.flushLock = new ReentrantLock();
    }

    public Path path() {
        return path;
    }

    @Override
    public void open() {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            if (!Files.exists(path)) {
                Files.createFile(path);
            }
            entries.clear();
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                read(reader);
            }
            logger.info("Loaded {} records from {}", entries.size(), path);
        } catch (IOException e) {
            throw new IOStorageException("load", path, e);
        }
    }

    @Override
    public void flush() {
        flushLock.lock();
        try {
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CloseableIterator<KeyValue> it = scan(null, null)) {
                write(it, writer);
            }
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.info("Flushed {} records to {}", entries.size(), path);
        } catch (IOException e) {
            throw new IOStorageException("flush", path, e);
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Adds a record read from the file; a key that occurs twice means the file is corrupt.
     */
    protected void load(ByteArray key, String value) {
        if (entries.putIfAbsent(key, value) != null) {
            throw new CorruptionException("Duplicate key " + key + " in " + path);
        }
    }

    protected abstract void read(BufferedReader reader) throws IOException;

    protected abstract void write(CloseableIterator<KeyValue> records, BufferedWriter writer) throws IOException;
}
