package io.ringdb.storage;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.exception.CorruptionException;
import io.ringdb.common.record.Json;
import io.ringdb.common.record.RecordException;
import io.ringdb.common.record.RecordSchema;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Data records kept in a JSON array of objects. Each object carries the key fields as {@code __<field>}
 * properties (e.g. {@code __id}) and the payload either flattened into the same object, or nested
 * under {@code __data} when it is not an object or would collide with the reserved names.
 */
public final class JsonDataStorage extends FileStorage {

    static final String KEY_PREFIX = "__";
    static final String DATA_FIELD = "__data";

    private final RecordSchema schema;

    public JsonDataStorage(Path path, RecordSchema schema) {
        super(path);
        this.schema = schema;
    }

    @Override
    protected void read(BufferedReader reader) throws IOException {
        JsonElement document;
        try {
            document = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new CorruptionException("Malformed data file " + path(), e);
        }
        if (document.isJsonNull()) {
            return;
        }
        if (!document.isJsonArray()) {
            throw new CorruptionException("Data file " + path() + " must contain a JSON array of records");
        }
        for (JsonElement element : document.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new CorruptionException("Record in " + path() + " is not an object: " + element);
            }
            readRecord(element.getAsJsonObject().deepCopy());
        }
    }

    private void readRecord(JsonObject record) {
        List<Object> fields = new ArrayList<>();
        for (RecordSchema.Field field : schema.keyFields()) {
            JsonElement value = record.remove(KEY_PREFIX + field.name());
            if (value == null) {
                throw new CorruptionException("Record in " + path() + " has no " + KEY_PREFIX + field.name() + " field: " + record);
            }
            try {
                fields.add(field.type().fromJson(value));
            } catch (RecordException e) {
                throw new CorruptionException("Invalid key field in " + path() + ": " + e.getMessage(), e);
            }
        }
        JsonElement data = record.has(DATA_FIELD) ? record.get(DATA_FIELD) : record;
        load(schema.encodeKey(fields), schema.encodeValue(data));
    }

    @Override
    protected void write(CloseableIterator<KeyValue> records, BufferedWriter writer) throws IOException {
        JsonArray document = new JsonArray();
        while (records.hasNext()) {
            KeyValue entry = records.next();
            document.add(toRecord(entry));
        }
        writer.write(Json.pretty(document));
        writer.newLine();
    }

    private JsonObject toRecord(KeyValue entry) {
        JsonObject record = new JsonObject();
        List<Object> fields = schema.decodeKey(entry.key());
        for (int i = 0; i < fields.size(); i++) {
            RecordSchema.Field field = schema.keyFields().get(i);
            record.add(KEY_PREFIX + field.name(), field.type().toJson(fields.get(i)));
        }

        JsonElement data = schema.decodeValue(entry.value());
        if (data.isJsonObject() && !hasReservedNames(data.getAsJsonObject())) {
            for (Map.Entry<String, JsonElement> member : data.getAsJsonObject().entrySet()) {
                record.add(member.getKey(), member.getValue());
            }
        } else {
            record.add(DATA_FIELD, data == null ? JsonNull.INSTANCE : data);
        }
        return record;
    }

    private boolean hasReservedNames(JsonObject data) {
        if (data.has(DATA_FIELD)) {
            return true;
        }
        for (RecordSchema.Field field : schema.keyFields()) {
            if (data.has(KEY_PREFIX + field.name())) {
                return true;
            }
        }
        return false;
    }
}
