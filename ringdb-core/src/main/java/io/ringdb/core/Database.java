package io.ringdb.core;

import com.google.gson.JsonElement;
import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.record.Record;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.storage.MergingIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A stack of rings presenting one namespace of items keyed by id.
 *
 * <ul>
 *   <li>Reads probe the rings top-down and return the first copy found.</li>
 *   <li>Inserts go to the topmost ring that is writable for the new id.</li>
 *   <li>Updates and deletes act on the topmost ring holding the id. An update computed from a read-only
 *       ring is saved in the nearest writable ring above it, shadowing the old copy.</li>
 *   <li>Scans merge all rings; on equal keys the higher ring wins.</li>
 * </ul>
 *
 * Updates, deletes and inserts with an explicit id are serialized per id.
 */
public final class Database implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private static final int ID_LOCK_STRIPES = 64;

    private final DatabaseContext context;
    private final IdLocks idLocks;
    private final ReentrantLock appendLock;
    private final AtomicBoolean closed;

    private volatile RingChain chain;

    private Database(DatabaseContext context) {
        this.context = context;
        this.idLocks = new IdLocks(ID_LOCK_STRIPES);
        this.appendLock = new ReentrantLock();
        this.closed = new AtomicBoolean(false);
        this.chain = RingChain.EMPTY;
    }

    /**
     * Opens the rings in order, the first one becoming the bottom of the stack.
     */
    public static Database open(DatabaseConfig config, List<RingConfig> rings) {
        Database database = new Database(DatabaseContext.create(config));
        try {
            for (RingConfig ring : rings) {
                database.append(ring);
            }
        } catch (RuntimeException e) {
            try {
                database.close();
            } catch (RuntimeException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        return database;
    }

    public static Database open(DatabaseConfig config, RingConfig... rings) {
        return open(config, List.of(rings));
    }

    /**
     * Opens a new ring and links it on top of the stack. Concurrent readers see either the old stack or
     * the new one with the ring fully loaded.
     */
    public Ring append(RingConfig config) {
        ensureOpen();
        appendLock.lock();
        try {
            if (chain.indexOf(config.name()).isPresent()) {
                throw new IllegalArgumentException("Duplicate ring name: " + config.name());
            }
            Ring ring = Ring.open(config, context);
            chain = chain.append(ring);
            logger.info("Ring {} linked at position {}", ring.name(), chain.size() - 1);
            return ring;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Rings ordered bottom to top.
     */
    public List<Ring> rings() {
        return chain.rings();
    }

    public Ring top() {
        return chain.top().orElseThrow(() -> new IllegalStateException("Database has no rings"));
    }

    public Ring bottom() {
        return chain.bottom().orElseThrow(() -> new IllegalStateException("Database has no rings"));
    }

    public Optional<Ring> findRing(String name) {
        RingChain rings = chain;
        OptionalInt position = rings.indexOf(name);
        return position.isPresent() ? Optional.of(rings.get(position.getAsInt())) : Optional.empty();
    }

    /**
     * The topmost ring currently holding the item.
     */
    public Optional<Ring> findRing(long id) {
        RingChain rings = chain;
        OptionalInt position = locate(rings, id);
        return position.isPresent() ? Optional.of(rings.get(position.getAsInt())) : Optional.empty();
    }

    /**
     * @throws DatabaseException.NotFound if no ring holds the item
     */
    public JsonElement select(long id) {
        return get(id).orElseThrow(() -> new DatabaseException.NotFound(id));
    }

    public Optional<JsonElement> get(long id) {
        ensureOpen();
        for (Ring ring : chain.topDown()) {
            Optional<JsonElement> data = ring.select(id);
            if (data.isPresent()) {
                return data;
            }
        }
        return Optional.empty();
    }

    /**
     * Inserts a new item under the next free id of the topmost writable ring whose range is not used up.
     *
     * @return the assigned id
     */
    public long insert(JsonElement data) {
        ensureOpen();
        RingChain rings = chain;
        Ring exhausted = null;
        for (OptionalInt i = rings.topPosition(); i.isPresent(); i = rings.prev(i.getAsInt())) {
            Ring ring = rings.get(i.getAsInt());
            if (ring.isReadonly()) {
                logger.debug("Insert skips read-only ring {}", ring.name());
                continue;
            }
            if (!ring.writable(ring.nextId())) {
                logger.debug("Insert skips ring {} with exhausted id range {}", ring.name(), ring.config().idRange());
                exhausted = exhausted == null ? ring : exhausted;
                continue;
            }
            return ring.insert(null, data);
        }
        if (exhausted != null) {
            throw new DatabaseException.IdOutOfRange(exhausted.nextId(), exhausted.name(), exhausted.config().idRange());
        }
        throw new DatabaseException.NoWritableRing("No writable ring to insert a new item into");
    }

    /**
     * Inserts an item under a caller-chosen id, into the topmost writable ring whose range contains it.
     *
     * @throws DatabaseException.DuplicateId if the id exists in that ring or any ring below it
     */
    public long insert(long id, JsonElement data) {
        ensureOpen();
        return idLocks.withLock(id, () -> {
            RingChain rings = chain;
            Ring outOfRange = null;
            for (OptionalInt i = rings.topPosition(); i.isPresent(); i = rings.prev(i.getAsInt())) {
                Ring ring = rings.get(i.getAsInt());
                if (ring.isReadonly()) {
                    continue;
                }
                if (!ring.writable(id)) {
                    outOfRange = outOfRange == null ? ring : outOfRange;
                    continue;
                }
                ensureUnique(rings, i.getAsInt(), id);
                return ring.insert(id, data);
            }
            if (outOfRange != null) {
                throw new DatabaseException.IdOutOfRange(id, outOfRange.name(), outOfRange.config().idRange());
            }
            throw new DatabaseException.NoWritableRing("No writable ring to insert item " + id + " into");
        });
    }

    /**
     * Inserts a new item into the named ring, with the next id of that ring.
     */
    public long insert(JsonElement data, String ringName) {
        ensureOpen();
        Ring ring = findRing(ringName).orElseThrow(() -> new DatabaseException.UnknownRing(ringName));
        return ring.insert(null, data);
    }

    private void ensureUnique(RingChain rings, int from, long id) {
        for (OptionalInt i = OptionalInt.of(from); i.isPresent(); i = rings.prev(i.getAsInt())) {
            Ring ring = rings.get(i.getAsInt());
            if (ring.contains(id)) {
                throw new DatabaseException.DuplicateId(id, ring.name());
            }
        }
    }

    public JsonElement update(long id, Edit... edits) {
        return update(id, List.of(edits));
    }

    /**
     * Applies the edits in order to the topmost copy of the item. The result is stored in the ring holding
     * that copy, or, if that ring is read-only, in the nearest writable ring above it. The edits run once;
     * only their result travels upward.
     *
     * @return the new data
     * @throws DatabaseException.NotFound if no ring holds the item
     * @throws DatabaseException.ReadOnly if the ring holding it and all rings above are read-only
     */
    public JsonElement update(long id, List<Edit> edits) {
        Objects.requireNonNull(edits, "edits must not be null");
        ensureOpen();
        return idLocks.withLock(id, () -> {
            RingChain rings = chain;
            OptionalInt found = locate(rings, id);
            if (found.isEmpty()) {
                throw new DatabaseException.NotFound(id);
            }
            Ring source = rings.get(found.getAsInt());
            JsonElement data = source.select(id).orElseThrow(() -> new DatabaseException.NotFound(id));
            for (Edit edit : edits) {
                data = edit.apply(data);
            }

            for (OptionalInt i = found; i.isPresent(); i = rings.next(i.getAsInt())) {
                Ring target = rings.get(i.getAsInt());
                if (target.isReadonly()) {
                    continue;
                }
                if (target != source) {
                    logger.debug("Update of item {} from read-only ring {} saved to ring {}", id, source.name(), target.name());
                }
                target.save(id, data);
                return data;
            }
            throw new DatabaseException.ReadOnly(
                source.name(),
                "Cannot save item " + id + ": ring '" + source.name() + "' and all rings above it are read-only"
            );
        });
    }

    /**
     * Deletes the topmost copy of the item. A copy in a lower ring, if any, becomes visible again.
     *
     * @return false if no ring holds the item
     * @throws DatabaseException.ReadOnly if the topmost copy lives in a read-only ring
     */
    public boolean delete(long id) {
        ensureOpen();
        return idLocks.withLock(id, () -> {
            RingChain rings = chain;
            OptionalInt found = locate(rings, id);
            if (found.isEmpty()) {
                return false;
            }
            return rings.get(found.getAsInt()).delete(id);
        });
    }

    private static OptionalInt locate(RingChain rings, long id) {
        for (OptionalInt i = rings.topPosition(); i.isPresent(); i = rings.prev(i.getAsInt())) {
            if (rings.get(i.getAsInt()).contains(id)) {
                return i;
            }
        }
        return OptionalInt.empty();
    }

    public CloseableIterator<Item> scan() {
        return scan(null, null);
    }

    /**
     * Items with {@code start <= id < stop} in id order, merged across all rings; a null bound is open.
     * The scan is weakly consistent with concurrent writes.
     */
    public CloseableIterator<Item> scan(Long start, Long stop) {
        ensureOpen();
        ByteArray from = start == null ? null : DataBlock.key(start);
        ByteArray to = stop == null ? null : DataBlock.key(stop);

        List<CloseableIterator<KeyValue>> sources = new ArrayList<>();
        for (Ring ring : chain.topDown()) {
            sources.add(ring.scan(from, to));
        }
        return new MergingIterator(sources).map(Item::fromKeyValue);
    }

    /**
     * Records of the named index with binary keys in {@code [start, stop)}, merged across every ring that
     * maintains the index. A null bound is open, a {@code limit} of zero means no limit.
     */
    public CloseableIterator<Record> scanIndex(String index, ByteArray start, ByteArray stop, long limit) {
        ensureOpen();
        RecordSchema schema = null;
        List<CloseableIterator<KeyValue>> sources = new ArrayList<>();
        for (Ring ring : chain.topDown()) {
            Optional<IndexBlock> block = ring.indexBlock(index);
            if (block.isPresent()) {
                schema = block.get().schema();
                sources.add(block.get().scan(start, stop));
            }
        }
        if (schema == null) {
            throw new IllegalArgumentException("No ring maintains an index named " + index);
        }

        RecordSchema recordSchema = schema;
        CloseableIterator<Record> records = new MergingIterator(sources).map(kv -> Record.fromBinary(recordSchema, kv));
        return limit > 0 ? records.limit(limit) : records;
    }

    /**
     * Index records whose leading key fields equal {@code prefix}.
     */
    public CloseableIterator<Record> scanIndex(String index, List<?> prefix) {
        ByteArray start = indexSchema(index).encodeKey(prefix);
        return scanIndex(index, start, RecordSchema.prefixStop(start).orElse(null), 0);
    }

    /**
     * Like {@link #scanIndex(String, List)}, except that the last prefix field only has to be a prefix of
     * the stored value, e.g. all names starting with "Al".
     */
    public CloseableIterator<Record> scanIndexStartingWith(String index, List<?> prefix) {
        ByteArray start = indexSchema(index).encodeOpenKey(prefix);
        return scanIndex(index, start, RecordSchema.prefixStop(start).orElse(null), 0);
    }

    private RecordSchema indexSchema(String index) {
        for (Ring ring : chain.topDown()) {
            Optional<IndexBlock> block = ring.indexBlock(index);
            if (block.isPresent()) {
                return block.get().schema();
            }
        }
        throw new IllegalArgumentException("No ring maintains an index named " + index);
    }

    /**
     * Blocks until all index changes queued so far are applied in every ring.
     */
    public void awaitPropagation() {
        for (Ring ring : chain.rings()) {
            ring.awaitPropagation();
        }
    }

    /**
     * Writes every dirty block now instead of waiting for the flush delay.
     */
    public void flush() {
        ensureOpen();
        awaitPropagation();
        for (Ring ring : chain.rings()) {
            ring.flush();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Database is closed");
        }
    }

    /**
     * Drains index propagation, flushes all dirty blocks and releases the rings and the scheduler.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        RuntimeException failure = null;
        for (Ring ring : chain.topDown()) {
            try {
                ring.close();
            } catch (RuntimeException e) {
                logger.error("Failed to close ring {}", ring.name(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        context.close();
        logger.info("Database closed");

        if (failure != null) {
            throw failure;
        }
    }
}
