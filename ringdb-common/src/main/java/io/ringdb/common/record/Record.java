package io.ringdb.common.record;

import com.google.gson.JsonElement;
import io.ringdb.common.ByteArray;
import io.ringdb.common.KeyValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable key/value record of a sequence. It can be created from decoded fields and a payload, or from
 * the binary key and serialized value; the other representation is computed on first access and cached.
 */
public final class Record implements Comparable<Record> {

    private final RecordSchema schema;

    private List<Object> fields;
    private ByteArray key;
    private JsonElement payload;
    private String value;

    private Record(RecordSchema schema, List<Object> fields, ByteArray key, JsonElement payload, String value) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.fields = fields;
        this.key = key;
        this.payload = payload;
        this.value = value;
    }

    public static Record of(RecordSchema schema, List<?> fields, JsonElement payload) {
        if (fields.size() != schema.keyFields().size()) {
            throw new RecordException.SchemaMismatch(
                "Record key needs %d fields %s, got %d".formatted(schema.keyFields().size(), schema.keyNames(), fields.size())
            );
        }
        ByteArray key = schema.encodeKey(fields);
        return new Record(schema, Collections.unmodifiableList(new ArrayList<>(fields)), key, payload, null);
    }

    public static Record fromBinary(RecordSchema schema, ByteArray key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        return new Record(schema, null, key, null, value == null ? "" : value);
    }

    public static Record fromBinary(RecordSchema schema, KeyValue entry) {
        return fromBinary(schema, entry.key(), entry.value());
    }

    public RecordSchema schema() {
        return schema;
    }

    public List<Object> fields() {
        if (fields == null) {
            fields = Collections.unmodifiableList(schema.decodeKey(key));
        }
        return fields;
    }

    public ByteArray key() {
        return key;
    }

    public JsonElement payload() {
        if (payload == null) {
            payload = schema.decodeValue(value);
        }
        return payload;
    }

    /**
     * Serialized value; an empty string when the record carries no payload.
     */
    public String value() {
        if (value == null) {
            value = schema.encodeValue(payload);
        }
        return value;
    }

    public KeyValue toKeyValue() {
        return new KeyValue(key, value());
    }

    @Override
    public int compareTo(Record other) {
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Record other && key.equals(other.key) && value().equals(other.value());
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value());
    }

    @Override
    public String toString() {
        return "Record[" + fields() + " -> " + value() + "]";
    }
}
