package io.ringdb.core;

import com.google.gson.JsonElement;
import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.exception.CorruptionException;
import io.ringdb.common.record.Record;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.storage.Storage;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Block of the primary item sequence of a ring: records keyed by item id with an opaque JSON payload.
 * Keeps the autoincrement counter and reports every successful mutation to the ring for propagation.
 *
 * <p>All lookups are local; forwarding to other rings is done by {@link Database}.
 */
public final class DataBlock extends Block {

    private final RingConfig ring;
    private final Consumer<Change> propagation;

    private long autoincrement;

    DataBlock(RingConfig ring, Storage storage, DatabaseContext context, Consumer<Change> propagation) {
        super(ring.name() + ".data", RecordSchema.DATA, storage, context);
        this.ring = ring;
        this.propagation = propagation;
    }

    static ByteArray key(long id) {
        return RecordSchema.DATA.encodeKey(id);
    }

    static long id(ByteArray key) {
        return (Long) RecordSchema.DATA.decodeKey(key).get(0);
    }

    /**
     * Loads the storage and checks that no stored id lies at or above the ring's stop id. Ids below the
     * start id are accepted: they belong to items of lower rings whose updates were saved here.
     */
    @Override
    public void open() {
        super.open();
        long max = 0;
        try (CloseableIterator<KeyValue> it = scan(null, null)) {
            while (it.hasNext()) {
                long id = id(it.next().key());
                if (id >= ring.stopId()) {
                    throw new CorruptionException(
                        "Item id %d loaded into ring '%s' is above its id range %s".formatted(id, ring.name(), ring.idRange())
                    );
                }
                max = Math.max(max, id);
            }
        }
        synchronized (this) {
            autoincrement = max;
        }
    }

    public synchronized long autoincrement() {
        return autoincrement;
    }

    public boolean contains(long id) {
        return id >= 0 && get(key(id)).isPresent();
    }

    public Optional<JsonElement> select(long id) {
        if (id < 0) {
            return Optional.empty();
        }
        return get(key(id)).map(RecordSchema.DATA::decodeValue);
    }

    /**
     * Inserts a new item. Without an explicit id the next one is {@code max(autoincrement + 1, startId)}.
     *
     * @throws DatabaseException.IdOutOfRange if the id falls outside the ring's range
     * @throws DatabaseException.DuplicateId if the explicit id is already present here
     */
    synchronized long insert(Long id, JsonElement data) {
        long candidate = id != null ? id : Math.max(autoincrement + 1, ring.startId());
        if (!ring.validId(candidate)) {
            throw new DatabaseException.IdOutOfRange(candidate, ring.name(), ring.idRange());
        }
        if (id != null && contains(candidate)) {
            throw new DatabaseException.DuplicateId(candidate, ring.name());
        }
        autoincrement = Math.max(autoincrement, candidate);
        save(candidate, data);
        return candidate;
    }

    /**
     * Writes the item here, replacing a local copy if there is one. No range check: ranges restrict
     * new ids only, while updates of items from lower rings may land here with any id.
     *
     * <p>The change is handed to propagation before the flush, so a failed flush leaves the indexes in
     * line with the item that is visible in memory.
     */
    void save(long id, JsonElement data) {
        Record record = Record.of(RecordSchema.DATA, List.of(id), data);
        String previous = get(record.key()).orElse(null);
        storage().put(record.key(), record.value());
        markDirty();
        propagation.accept(new Change(record.key(), previous, record.value()));
        flush();
    }

    boolean delete(long id) {
        if (id < 0) {
            return false;
        }
        ByteArray key = key(id);
        Optional<String> previous = get(key);
        if (previous.isEmpty() || !storage().delete(key)) {
            return false;
        }
        markDirty();
        propagation.accept(new Change(key, previous.get(), null));
        flush();
        return true;
    }

    @Override
    public synchronized void erase() {
        super.erase();
        autoincrement = 0;
    }
}
