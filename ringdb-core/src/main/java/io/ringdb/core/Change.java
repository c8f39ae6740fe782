package io.ringdb.core;

import io.ringdb.common.ByteArray;

import java.util.Objects;

/**
 * One successful mutation of a primary data block, as seen by derived indexes. A null {@code oldValue}
 * means the record was created, a null {@code newValue} that it was deleted.
 */
public record Change(ByteArray key, String oldValue, String newValue) {

    public Change {
        Objects.requireNonNull(key, "key must not be null");
        if (oldValue == null && newValue == null) {
            throw new IllegalArgumentException("A change needs an old or a new value");
        }
    }

    public boolean isInsert() {
        return oldValue == null;
    }

    public boolean isDelete() {
        return newValue == null;
    }
}
