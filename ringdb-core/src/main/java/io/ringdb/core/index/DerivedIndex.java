package io.ringdb.core.index;

import com.google.gson.JsonElement;
import io.ringdb.common.ByteArray;
import io.ringdb.common.KeyValue;
import io.ringdb.common.record.Record;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.core.Change;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A sequence derived from the primary items of a ring. Each item maps to zero or more index records;
 * a change of the item is turned into an {@link IndexPlan} that removes the records of the old version
 * and writes those of the new one.
 */
public abstract class DerivedIndex {

    private final String name;
    private final RecordSchema schema;

    protected DerivedIndex(String name, RecordSchema schema) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public String name() {
        return name;
    }

    public RecordSchema schema() {
        return schema;
    }

    /**
     * Maps one item to its index records. An empty list means the item is not indexed.
     */
    protected abstract List<Record> derive(long id, JsonElement data);

    /**
     * Index records of an item, keyed by binary key. When several records share a key the first one is kept.
     */
    public Map<ByteArray, String> records(long id, JsonElement data) {
        Map<ByteArray, String> records = new LinkedHashMap<>();
        for (Record record : derive(id, data)) {
            records.putIfAbsent(record.key(), record.value());
        }
        return records;
    }

    public IndexPlan plan(Change change) {
        long id = (Long) RecordSchema.DATA.decodeKey(change.key()).get(0);
        Map<ByteArray, String> deletes = change.isInsert()
            ? new LinkedHashMap<>()
            : records(id, RecordSchema.DATA.decodeValue(change.oldValue()));
        Map<ByteArray, String> puts = change.isDelete()
            ? new LinkedHashMap<>()
            : records(id, RecordSchema.DATA.decodeValue(change.newValue()));

        prune(deletes, puts);

        List<KeyValue> writes = new ArrayList<>(puts.size());
        puts.forEach((key, value) -> writes.add(new KeyValue(key, value)));
        return new IndexPlan(new ArrayList<>(deletes.keySet()), writes);
    }

    /**
     * Drops records present in both versions: identical ones need no write at all, and a key that is
     * about to be overwritten needs no delete.
     */
    static void prune(Map<ByteArray, String> deletes, Map<ByteArray, String> puts) {
        Iterator<Map.Entry<ByteArray, String>> it = deletes.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<ByteArray, String> old = it.next();
            String replacement = puts.get(old.getKey());
            if (replacement == null) {
                continue;
            }
            if (replacement.equals(old.getValue())) {
                puts.remove(old.getKey());
            }
            it.remove();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + schema + "]";
    }
}
