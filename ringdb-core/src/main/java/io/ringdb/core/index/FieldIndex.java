package io.ringdb.core.index;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.ringdb.common.record.FieldType;
import io.ringdb.common.record.Record;
import io.ringdb.common.record.RecordException;
import io.ringdb.common.record.RecordSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Index over selected fields of the item data. The key is built from the schema's key fields, read from the
 * item object by name; a key field named {@value #ID_FIELD} takes the item id. The payload carries the
 * schema's value fields.
 *
 * <p>Items lacking one of the key fields are not indexed. If the first key field holds a JSON array, the
 * item is indexed once per element; arrays in other key fields are rejected.
 */
public final class FieldIndex extends DerivedIndex {

    public static final String ID_FIELD = "id";

    public FieldIndex(String name, RecordSchema schema) {
        super(name, schema);
        if (schema.hasOpaqueValue()) {
            throw new IllegalArgumentException("Field index " + name + " needs named payload fields, not an opaque value");
        }
    }

    @Override
    protected List<Record> derive(long id, JsonElement data) {
        if (data == null || !data.isJsonObject()) {
            return List.of();
        }
        JsonObject object = data.getAsJsonObject();
        List<RecordSchema.Field> keyFields = schema().keyFields();

        List<JsonElement> heads = new ArrayList<>();
        List<Object> tail = new ArrayList<>(keyFields.size() - 1);

        for (int i = 0; i < keyFields.size(); i++) {
            RecordSchema.Field field = keyFields.get(i);
            JsonElement value = field.name().equals(ID_FIELD) ? new JsonPrimitive(id) : object.get(field.name());
            if (value == null || (value.isJsonNull() && !field.type().nullable())) {
                return List.of();
            }
            if (value.isJsonArray()) {
                if (i > 0) {
                    throw new RecordException.SchemaMismatch(
                        "Key field " + field.name() + " of index " + name() + " has multiple values, allowed only in the first key field"
                    );
                }
                JsonArray values = value.getAsJsonArray();
                if (values.isEmpty()) {
                    return List.of();
                }
                values.forEach(heads::add);
            } else if (i == 0) {
                heads.add(value);
            } else {
                tail.add(field.type().fromJson(value));
            }
        }

        FieldType headType = keyFields.get(0).type();
        List<Record> records = new ArrayList<>(heads.size());
        for (JsonElement head : heads) {
            List<Object> key = new ArrayList<>(keyFields.size());
            key.add(headType.fromJson(head));
            key.addAll(tail);
            records.add(Record.of(schema(), key, object));
        }
        return records;
    }
}
