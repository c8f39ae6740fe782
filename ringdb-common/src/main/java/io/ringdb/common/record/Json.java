package io.ringdb.common.record;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Shared JSON settings for record values and file backends.
 */
public final class Json {

    private static final Gson COMPACT = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    private static final Gson PRETTY = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .setPrettyPrinting()
        .create();

    private Json() {}

    public static String stringify(JsonElement element) {
        return COMPACT.toJson(element == null ? JsonNull.INSTANCE : element);
    }

    public static String pretty(JsonElement element) {
        return PRETTY.toJson(element == null ? JsonNull.INSTANCE : element);
    }

    public static JsonElement parse(String json) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new RecordException.SchemaMismatch("Malformed JSON value: " + abbreviate(json), e);
        }
    }

    public static JsonObject parseObject(String json) {
        JsonElement element = parse(json);
        if (!element.isJsonObject()) {
            throw new RecordException.SchemaMismatch("Expected a JSON object, got: " + abbreviate(json));
        }
        return element.getAsJsonObject();
    }

    private static String abbreviate(String json) {
        return json.length() > 64 ? json.substring(0, 64) + "..." : json;
    }
}
