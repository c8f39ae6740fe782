package io.ringdb.core;

import com.google.gson.JsonElement;
import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.core.index.DerivedIndex;
import io.ringdb.storage.Storage;
import io.ringdb.storage.StorageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One layer of the database: the primary data block plus one block per derived index, all governed by the
 * ring's id range and read-only flag.
 *
 * <p>Changes of the data block are propagated to the index blocks on a single thread per ring, in the order
 * the mutations happened. Writers do not wait for it; {@link #awaitPropagation()} does.
 */
public final class Ring implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Ring.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final RingConfig config;
    private final DataBlock data;
    private final Map<String, IndexBlock> indexes;
    private final ExecutorService propagationExecutor;
    private final AtomicBoolean closed;

    private Ring(RingConfig config, DatabaseContext context, Storage dataStorage, Map<String, Storage> indexStorage) {
        this.config = config;
        this.propagationExecutor = Executors.newSingleThreadExecutor(
            DatabaseContext.daemonThreads("ringdb-propagate-" + config.name())
        );
        this.data = new DataBlock(config, dataStorage, context, this::propagate);

        Map<String, IndexBlock> blocks = new LinkedHashMap<>();
        for (DerivedIndex index : config.indexes()) {
            blocks.put(index.name(), new IndexBlock(config.name(), index, indexStorage.get(index.name()), context));
        }
        this.indexes = Collections.unmodifiableMap(blocks);
        this.closed = new AtomicBoolean(false);
    }

    /**
     * Creates the ring's storage from its configuration and loads it.
     */
    public static Ring open(RingConfig config, DatabaseContext context) {
        Storage dataStorage = config.dataFormat().create(config.dataFile(), RecordSchema.DATA);
        Map<String, Storage> indexStorage = new LinkedHashMap<>();
        for (DerivedIndex index : config.indexes()) {
            Path file = config.indexFile(index.name());
            indexStorage.put(index.name(), StorageFormat.forPath(file).create(file, index.schema()));
        }
        return open(config, context, dataStorage, indexStorage);
    }

    static Ring open(RingConfig config, DatabaseContext context, Storage dataStorage, Map<String, Storage> indexStorage) {
        Ring ring = new Ring(config, context, dataStorage, indexStorage);
        try {
            ring.data.open();
            for (IndexBlock index : ring.indexes.values()) {
                index.open();
            }
        } catch (RuntimeException e) {
            try {
                ring.close();
            } catch (RuntimeException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        logger.info(
            "Ring {} opened: {} items, ids {}, {}",
            config.name(), ring.data.size(), config.idRange(), config.readonly() ? "readonly" : "writable"
        );
        return ring;
    }

    public RingConfig config() {
        return config;
    }

    public String name() {
        return config.name();
    }

    public boolean isReadonly() {
        return config.readonly();
    }

    /**
     * Whether a new item with this id may be inserted here.
     */
    public boolean writable(long id) {
        return !config.readonly() && config.validId(id);
    }

    public Optional<IndexBlock> indexBlock(String name) {
        return Optional.ofNullable(indexes.get(name));
    }

    public long size() {
        return data.size();
    }

    public boolean contains(long id) {
        return data.contains(id);
    }

    public Optional<JsonElement> select(long id) {
        return data.select(id);
    }

    /**
     * Next id an insert without an explicit id would get here; it may lie outside the ring's range
     * once the range is used up.
     */
    long nextId() {
        return Math.max(data.autoincrement() + 1, config.startId());
    }

    long insert(Long id, JsonElement item) {
        ensureWritable("insert into");
        return data.insert(id, item);
    }

    void save(long id, JsonElement item) {
        ensureWritable("save to");
        data.save(id, item);
    }

    boolean delete(long id) {
        ensureWritable("delete from");
        return data.delete(id);
    }

    public CloseableIterator<KeyValue> scan(ByteArray start, ByteArray stop) {
        return data.scan(start, stop);
    }

    /**
     * Removes all items and index records of this ring.
     */
    public void erase() {
        ensureWritable("erase");
        onPropagationThread(() -> {
            data.erase();
            for (IndexBlock index : indexes.values()) {
                index.erase();
            }
        });
        logger.info("Ring {} erased", name());
    }

    /**
     * Recomputes every index block from a full scan of the data block.
     */
    public void rebuildIndexes() {
        ensureWritable("rebuild indexes of");
        onPropagationThread(() -> {
            List<Item> items = new ArrayList<>();
            try (CloseableIterator<KeyValue> it = data.scan(null, null)) {
                while (it.hasNext()) {
                    items.add(Item.fromKeyValue(it.next()));
                }
            }
            for (IndexBlock index : indexes.values()) {
                index.rebuild(items);
                logger.info("Index {} rebuilt from {} items, {} records", index.name(), items.size(), index.size());
            }
        });
    }

    private void propagate(Change change) {
        if (indexes.isEmpty()) {
            return;
        }
        propagationExecutor.execute(() -> {
            for (IndexBlock index : indexes.values()) {
                try {
                    index.apply(change);
                } catch (RuntimeException e) {
                    logger.error("Propagation of change {} to index {} failed", change.key(), index.name(), e);
                }
            }
        });
    }

    /**
     * Blocks until every change propagated so far has been applied to the index blocks.
     */
    public void awaitPropagation() {
        onPropagationThread(() -> {});
    }

    private void onPropagationThread(Runnable task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        propagationExecutor.execute(() -> {
            try {
                task.run();
                done.complete(null);
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
        try {
            done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for ring " + name(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Task on ring " + name() + " failed", e.getCause());
        }
    }

    /**
     * Writes all dirty blocks of this ring now.
     */
    public void flush() {
        data.flush(Duration.ZERO);
        for (IndexBlock index : indexes.values()) {
            index.flush(Duration.ZERO);
        }
    }

    private void ensureWritable(String operation) {
        if (config.readonly()) {
            throw new DatabaseException.ReadOnly(name(), "Cannot " + operation + " read-only ring '" + name() + "'");
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        propagationExecutor.shutdown();
        try {
            if (!propagationExecutor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Ring {} closed with index propagation still pending", name());
                propagationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            propagationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            data.close();
        } finally {
            for (IndexBlock index : indexes.values()) {
                index.close();
            }
        }
        logger.info("Ring {} closed", name());
    }

    @Override
    public String toString() {
        return "Ring[" + name() + " " + config.idRange() + (config.readonly() ? " readonly" : "") + "]";
    }
}
