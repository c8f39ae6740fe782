package io.ringdb.core;

import io.ringdb.common.ByteArray;
import io.ringdb.common.KeyValue;
import io.ringdb.core.index.DerivedIndex;
import io.ringdb.core.index.IndexPlan;
import io.ringdb.storage.Storage;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Block of one derived index, written only by propagation of changes from the ring's data block.
 */
public final class IndexBlock extends Block {

    private final DerivedIndex index;

    IndexBlock(String ringName, DerivedIndex index, Storage storage, DatabaseContext context) {
        super(ringName + "." + index.name(), index.schema(), storage, context);
        this.index = index;
    }

    void apply(Change change) {
        IndexPlan plan = index.plan(change);
        if (plan.isEmpty()) {
            return;
        }
        for (ByteArray key : plan.deletes()) {
            storage().delete(key);
        }
        for (KeyValue record : plan.puts()) {
            storage().put(record.key(), record.value());
        }
        markDirty();
        flush();
    }

    void rebuild(List<Item> items) {
        storage().erase();
        for (Item item : items) {
            Map<ByteArray, String> records = index.records(item.id(), item.data());
            records.forEach(storage()::put);
        }
        markDirty();
        flush(Duration.ZERO);
    }
}
