package io.ringdb.storage;

import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class MemoryStorage implements Storage {

    protected final ConcurrentSkipListMap<ByteArray, String> entries;

    public MemoryStorage() {
        this.entries = new ConcurrentSkipListMap<>();
    }

    @Override
    public void open() {}

    @Override
    public Optional<String> get(ByteArray key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(ByteArray key, String value) {
        entries.put(key, value);
    }

    @Override
    public boolean delete(ByteArray key) {
        return entries.remove(key) != null;
    }

    @Override
    public CloseableIterator<KeyValue> scan(ByteArray start, ByteArray stop) {
        ConcurrentNavigableMap<ByteArray, String> range;

        if (start == null && stop == null) {
            range = entries;
        } else if (start == null) {
            range = entries.headMap(stop, false);
        } else if (stop == null) {
            range = entries.tailMap(start, true);
        } else if (start.compareTo(stop) >= 0) {
            return CloseableIterator.empty();
        } else {
            range = entries.subMap(start, true, stop, false);
        }

        return CloseableIterator.wrap(range.entrySet().iterator())
            .map(MemoryStorage::toKeyValue);
    }

    @Override
    public void erase() {
        entries.clear();
    }

    @Override
    public void flush() {}

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public void close() {}

    private static KeyValue toKeyValue(Map.Entry<ByteArray, String> entry) {
        return new KeyValue(entry.getKey(), entry.getValue());
    }
}
