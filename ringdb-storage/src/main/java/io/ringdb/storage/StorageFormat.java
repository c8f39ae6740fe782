package io.ringdb.storage;

import io.ringdb.common.record.RecordSchema;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Registry of storage backends by format tag, resolved once when a ring is configured.
 */
public enum StorageFormat {

    MEMORY("memory") {
        @Override
        public Storage create(Path path, RecordSchema schema) {
            return new MemoryStorage();
        }
    },

    JSON("json") {
        @Override
        public Storage create(Path path, RecordSchema schema) {
            Objects.requireNonNull(path, "json storage requires a file");
            return new JsonDataStorage(path, schema);
        }
    },

    JSON_LINES("jsonl") {
        @Override
        public Storage create(Path path, RecordSchema schema) {
            Objects.requireNonNull(path, "jsonl storage requires a file");
            return new JsonLinesStorage(path);
        }
    };

    private final String tag;

    StorageFormat(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public abstract Storage create(Path path, RecordSchema schema);

    public static StorageFormat forTag(String tag) {
        for (StorageFormat format : values()) {
            if (format.tag.equalsIgnoreCase(tag)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown storage format: " + tag);
    }

    /**
     * Picks the backend from the file extension; no file means in-memory storage.
     */
    public static StorageFormat forPath(Path path) {
        if (path == null) {
            return MEMORY;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON;
        }
        if (name.endsWith(".jl") || name.endsWith(".jsonl")) {
            return JSON_LINES;
        }
        throw new IllegalArgumentException("No storage format registered for file: " + path);
    }
}
