package io.ringdb.storage;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;
import io.ringdb.common.exception.CorruptionException;
import io.ringdb.common.record.Json;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Index records in newline-delimited JSON: {@code [[k0,k1,...]]} or {@code [[k0,k1,...], "value"]},
 * where the inner array holds the unsigned bytes of the binary key.
 */
public final class JsonLinesStorage extends FileStorage {

    public JsonLinesStorage(Path path) {
        super(path);
    }

    @Override
    protected void read(BufferedReader reader) throws IOException {
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            readLine(line, lineNumber);
        }
    }

    private void readLine(String line, int lineNumber) {
        JsonArray record;
        try {
            JsonElement element = JsonParser.parseString(line);
            if (!element.isJsonArray()) {
                throw new CorruptionException("Line %d of %s is not a JSON array".formatted(lineNumber, path()));
            }
            record = element.getAsJsonArray();
        } catch (JsonParseException e) {
            throw new CorruptionException("Malformed line %d of %s".formatted(lineNumber, path()), e);
        }

        if (record.isEmpty() || record.size() > 2 || !record.get(0).isJsonArray()) {
            throw new CorruptionException("Line %d of %s must be [key] or [key, value]".formatted(lineNumber, path()));
        }

        JsonArray keyBytes = record.get(0).getAsJsonArray();
        int[] unsigned = new int[keyBytes.size()];
        try {
            for (int i = 0; i < unsigned.length; i++) {
                unsigned[i] = keyByte(keyBytes.get(i));
            }
        } catch (IllegalArgumentException e) {
            throw new CorruptionException("Invalid key bytes on line %d of %s".formatted(lineNumber, path()), e);
        }

        String value = "";
        if (record.size() == 2) {
            JsonElement v = record.get(1);
            value = v.isJsonPrimitive() && v.getAsJsonPrimitive().isString() ? v.getAsString() : Json.stringify(v);
        }

        try {
            load(ByteArray.fromUnsigned(unsigned), value);
        } catch (IllegalArgumentException e) {
            throw new CorruptionException("Invalid key bytes on line %d of %s".formatted(lineNumber, path()), e);
        }
    }

    private static int keyByte(JsonElement element) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("Key byte is not a number: " + element);
        }
        try {
            return element.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Key byte is not an integer: " + element, e);
        }
    }

    @Override
    protected void write(CloseableIterator<KeyValue> records, BufferedWriter writer) throws IOException {
        while (records.hasNext()) {
            KeyValue entry = records.next();
            JsonArray key = new JsonArray();
            for (int b : entry.key().toUnsigned()) {
                key.add(b);
            }
            JsonArray record = new JsonArray();
            record.add(key);
            if (!entry.value().isEmpty()) {
                record.add(new JsonPrimitive(entry.value()));
            }
            writer.write(Json.stringify(record));
            writer.newLine();
        }
    }
}
