package io.ringdb.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.Map;
import java.util.Objects;

/**
 * A pure transformation of item data, applied by {@link Database#update}. Implementations must not mutate
 * their input and must not depend on which ring the input was read from.
 */
@FunctionalInterface
public interface Edit {

    JsonElement apply(JsonElement data);

    static Edit overwrite(JsonElement data) {
        return new Overwrite(data);
    }

    static Edit mergePatch(JsonElement patch) {
        return new MergePatch(patch);
    }

    static Edit set(String field, JsonElement value) {
        return new SetField(field, value);
    }

    static Edit remove(String field) {
        return new RemoveField(field);
    }

    record Overwrite(JsonElement data) implements Edit {
        public Overwrite {
            data = data == null ? JsonNull.INSTANCE : data.deepCopy();
        }

        @Override
        public JsonElement apply(JsonElement current) {
            return data.deepCopy();
        }
    }

    /**
     * JSON merge patch (RFC 7386): object members are merged recursively, null members are removed,
     * anything else replaces the target.
     */
    record MergePatch(JsonElement patch) implements Edit {
        public MergePatch {
            Objects.requireNonNull(patch, "patch must not be null");
            patch = patch.deepCopy();
        }

        @Override
        public JsonElement apply(JsonElement current) {
            return merge(current, patch);
        }

        private static JsonElement merge(JsonElement target, JsonElement patch) {
            if (!patch.isJsonObject()) {
                return patch.deepCopy();
            }
            JsonObject result = target != null && target.isJsonObject() ? target.getAsJsonObject().deepCopy() : new JsonObject();
            for (Map.Entry<String, JsonElement> member : patch.getAsJsonObject().entrySet()) {
                if (member.getValue().isJsonNull()) {
                    result.remove(member.getKey());
                } else {
                    result.add(member.getKey(), merge(result.get(member.getKey()), member.getValue()));
                }
            }
            return result;
        }
    }

    record SetField(String field, JsonElement value) implements Edit {
        public SetField {
            Objects.requireNonNull(field, "field must not be null");
            value = value == null ? JsonNull.INSTANCE : value.deepCopy();
        }

        @Override
        public JsonElement apply(JsonElement current) {
            JsonObject result = asObject(current, this);
            result.add(field, value.deepCopy());
            return result;
        }
    }

    record RemoveField(String field) implements Edit {
        public RemoveField {
            Objects.requireNonNull(field, "field must not be null");
        }

        @Override
        public JsonElement apply(JsonElement current) {
            JsonObject result = asObject(current, this);
            result.remove(field);
            return result;
        }
    }

    private static JsonObject asObject(JsonElement data, Edit edit) {
        if (data == null || data.isJsonNull()) {
            return new JsonObject();
        }
        if (!data.isJsonObject()) {
            throw new IllegalArgumentException(edit + " needs object data, got " + data);
        }
        return data.getAsJsonObject().deepCopy();
    }
}
