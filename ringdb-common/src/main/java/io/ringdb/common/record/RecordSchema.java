package io.ringdb.common.record;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import io.ringdb.common.ByteArray;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Layout of the records of one sequence: the typed key fields, and either a list of named payload fields
 * or an opaque JSON payload.
 *
 * <p>Key encoding is order-preserving: comparing two encoded keys byte-wise gives the same result as
 * comparing the decoded field tuples lexicographically.
 */
public final class RecordSchema {

    /** Schema of a primary data sequence: a single id field and an opaque JSON object as the value. */
    public static final RecordSchema DATA = builder().key("id", FieldType.INTEGER).opaqueValue().build();

    private final List<Field> keyFields;
    private final List<String> valueFields;

    private RecordSchema(List<Field> keyFields, List<String> valueFields) {
        if (keyFields.isEmpty()) {
            throw new IllegalArgumentException("Key schema must have at least one field");
        }
        this.keyFields = List.copyOf(keyFields);
        this.valueFields = valueFields == null ? null : List.copyOf(valueFields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Field> keyFields() {
        return keyFields;
    }

    public List<String> keyNames() {
        return keyFields.stream().map(Field::name).toList();
    }

    /**
     * Names of the payload fields, or empty when the payload is an opaque JSON document.
     */
    public Optional<List<String>> valueFields() {
        return Optional.ofNullable(valueFields);
    }

    public boolean hasOpaqueValue() {
        return valueFields == null;
    }

    public ByteArray encodeKey(List<?> fields) {
        return encode(fields, false);
    }

    public ByteArray encodeKey(Object... fields) {
        return encode(Arrays.asList(fields), false);
    }

    /**
     * Encodes a possibly partial key whose last supplied field is written without a terminator.
     * The result is a scan bound only and must never be stored.
     */
    public ByteArray encodeOpenKey(List<?> fields) {
        return encode(fields, true);
    }

    private ByteArray encode(List<?> fields, boolean openLast) {
        if (fields.size() > keyFields.size()) {
            throw new RecordException.SchemaMismatch(
                "Key has %d fields but the schema defines only %d %s".formatted(fields.size(), keyFields.size(), keyNames())
            );
        }
        KeyOutput out = new KeyOutput();
        for (int i = 0; i < fields.size(); i++) {
            boolean open = openLast && i == fields.size() - 1;
            keyFields.get(i).type().write(out, fields.get(i), open);
        }
        return out.result();
    }

    /**
     * Decodes a full key. Partial keys are not supported.
     */
    public List<Object> decodeKey(ByteArray key) {
        KeyInput in = new KeyInput(key);
        List<Object> fields = new ArrayList<>(keyFields.size());
        for (Field field : keyFields) {
            fields.add(field.type().read(in));
        }
        if (in.remaining() > 0) {
            throw new RecordException.CorruptKey(
                "%d trailing bytes after decoding all %d key fields of %s".formatted(in.remaining(), keyFields.size(), key)
            );
        }
        return fields;
    }

    /**
     * Encodes a payload. For an opaque schema the payload is serialized as is; otherwise the named fields
     * are taken from the payload object in schema order, with missing fields written as null.
     * Returns an empty string when there is nothing to store.
     */
    public String encodeValue(JsonElement payload) {
        if (valueFields == null) {
            return payload == null || payload.isJsonNull() ? "" : Json.stringify(payload);
        }
        if (valueFields.isEmpty()) {
            return "";
        }
        JsonObject object = payload != null && payload.isJsonObject() ? payload.getAsJsonObject() : new JsonObject();
        JsonArray vector = new JsonArray(valueFields.size());
        for (String field : valueFields) {
            JsonElement element = object.get(field);
            vector.add(element == null ? JsonNull.INSTANCE : element);
        }
        return Json.stringify(vector);
    }

    public JsonElement decodeValue(String value) {
        if (valueFields == null) {
            return value == null || value.isEmpty() ? JsonNull.INSTANCE : Json.parse(value);
        }
        JsonObject object = new JsonObject();
        if (value == null || value.isEmpty()) {
            return object;
        }
        JsonElement parsed = Json.parse(value);
        if (!parsed.isJsonArray() || parsed.getAsJsonArray().size() != valueFields.size()) {
            throw new RecordException.SchemaMismatch(
                "Value %s does not match payload fields %s".formatted(value, valueFields)
            );
        }
        JsonArray vector = parsed.getAsJsonArray();
        for (int i = 0; i < valueFields.size(); i++) {
            object.add(valueFields.get(i), vector.get(i));
        }
        return object;
    }

    /**
     * Returns the smallest key greater than every key starting with {@code prefix}, or empty when no such
     * key exists (the prefix is all 0xFF bytes), meaning the scan is unbounded above.
     */
    public static Optional<ByteArray> prefixStop(ByteArray prefix) {
        byte[] bytes = prefix.toByteArray();
        int last = bytes.length - 1;
        while (last >= 0 && bytes[last] == (byte) 0xFF) {
            last--;
        }
        if (last < 0) {
            return Optional.empty();
        }
        bytes[last]++;
        return Optional.of(ByteArray.copyOf(bytes, 0, last + 1));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RecordSchema other
            && keyFields.equals(other.keyFields)
            && Objects.equals(valueFields, other.valueFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyFields, valueFields);
    }

    @Override
    public String toString() {
        return "RecordSchema[key=" + keyFields + ", value=" + (valueFields == null ? "<opaque>" : valueFields) + "]";
    }

    public record Field(String name, FieldType type) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    public static final class Builder {

        private final Map<String, Field> keyFields = new LinkedHashMap<>();
        private List<String> valueFields = new ArrayList<>();

        private Builder() {}

        public Builder key(String name, FieldType type) {
            if (keyFields.putIfAbsent(name, new Field(name, type)) != null) {
                throw new IllegalArgumentException("Duplicate key field: " + name);
            }
            return this;
        }

        public Builder value(String... names) {
            if (valueFields == null) {
                throw new IllegalStateException("Payload is already declared opaque");
            }
            valueFields.addAll(List.of(names));
            return this;
        }

        public Builder opaqueValue() {
            valueFields = null;
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(new ArrayList<>(keyFields.values()), valueFields);
        }
    }
}
