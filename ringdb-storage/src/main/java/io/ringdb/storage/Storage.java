package io.ringdb.storage;

import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;

import java.util.Optional;

/**
 * Sorted map of binary keys to string values owned by exactly one block.
 *
 * <p>{@link #scan} always yields entries in ascending unsigned key order over the half-open range
 * {@code [start, stop)}; a null bound leaves that side unbounded.
 */
public interface Storage extends AutoCloseable {

    /**
     * Loads persisted contents. Called once, before any other operation.
     */
    void open();

    Optional<String> get(ByteArray key);

    void put(ByteArray key, String value);

    boolean delete(ByteArray key);

    CloseableIterator<KeyValue> scan(ByteArray start, ByteArray stop);

    void erase();

    /**
     * Persists the current contents to the durable medium, if there is one.
     */
    void flush();

    long size();

    @Override
    void close();
}
