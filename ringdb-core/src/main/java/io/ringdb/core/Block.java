package io.ringdb.core;

import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Physical container of one sequence of a ring. Owns its {@link Storage} exclusively, tracks whether it
 * holds unflushed writes and persists them either right away or after the debounce window of the context.
 * Subclasses mutate {@link #storage()} directly, then call {@link #markDirty()} and {@link #flush()}.
 */
public class Block implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Block.class);

    private final String name;
    private final RecordSchema schema;
    private final Storage storage;
    private final DatabaseContext context;
    private final FlushScheduler flushScheduler;
    private final AtomicBoolean dirty;
    private final AtomicBoolean closed;

    protected Block(String name, RecordSchema schema, Storage storage, DatabaseContext context) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.flushScheduler = new FlushScheduler(context.scheduler(), name);
        this.dirty = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
    }

    public String name() {
        return name;
    }

    public RecordSchema schema() {
        return schema;
    }

    public void open() {
        storage.open();
        dirty.set(false);
    }

    public Optional<String> get(ByteArray key) {
        return storage.get(key);
    }

    public CloseableIterator<KeyValue> scan(ByteArray start, ByteArray stop) {
        return storage.scan(start, stop);
    }

    public long size() {
        return storage.size();
    }

    /**
     * Removes every record and persists the empty block immediately.
     */
    public void erase() {
        storage.erase();
        markDirty();
        flush(Duration.ZERO);
    }

    public boolean isDirty() {
        return dirty.get();
    }

    /**
     * Flushes after the database's configured delay.
     */
    public void flush() {
        flush(context.flushDelay());
    }

    /**
     * Persists pending writes, if any. A zero delay writes synchronously; otherwise a single write is
     * scheduled after {@code delay}, replacing any flush already pending for this block.
     */
    public void flush(Duration delay) {
        if (!dirty.get()) {
            return;
        }
        if (delay.isZero()) {
            flushScheduler.cancel();
            flushNow();
            return;
        }
        flushScheduler.reset(delay, this::flushNow);
    }

    private void flushNow() {
        if (!dirty.compareAndSet(true, false)) {
            return;
        }
        try {
            storage.flush();
        } catch (RuntimeException e) {
            dirty.set(true);
            throw e;
        }
    }

    protected final Storage storage() {
        return storage;
    }

    protected final void markDirty() {
        dirty.set(true);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            flush(Duration.ZERO);
        } finally {
            storage.close();
        }
        logger.debug("Block {} closed", name);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
