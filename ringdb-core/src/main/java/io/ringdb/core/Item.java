package io.ringdb.core;

import com.google.gson.JsonElement;
import io.ringdb.common.KeyValue;
import io.ringdb.common.record.RecordSchema;

import java.util.Objects;

/**
 * A primary record: item id and its JSON data.
 */
public record Item(long id, JsonElement data) {

    public Item {
        Objects.requireNonNull(data, "data must not be null");
    }

    static Item fromKeyValue(KeyValue entry) {
        return new Item(DataBlock.id(entry.key()), RecordSchema.DATA.decodeValue(entry.value()));
    }
}
