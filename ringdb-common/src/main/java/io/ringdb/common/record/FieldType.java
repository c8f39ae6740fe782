package io.ringdb.common.record;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Order-preserving binary encodings of key fields. Every type writes a self-delimiting form, so that
 * byte-wise comparison of concatenated fields equals the tuple comparison of the decoded values.
 * Variable-length types also have an open form without a terminator, used only for scan bounds.
 */
public enum FieldType {

    /** Non-negative 64-bit integer, 8 bytes big-endian. */
    INTEGER {
        @Override
        void write(KeyOutput out, Object value, boolean open) {
            long v = asLong(value);
            if (v < 0) {
                throw new RecordException.SchemaMismatch("INTEGER field requires a non-negative value, got " + v);
            }
            out.writeLong(v);
        }

        @Override
        Object read(KeyInput in) {
            long v = in.readLong();
            if (v < 0) {
                throw new RecordException.CorruptKey("INTEGER field decoded to a negative value: " + v);
            }
            return v;
        }
    },

    /** Like {@link #INTEGER} but accepts null: values are shifted by one and zero encodes null. */
    NULLABLE_INTEGER {
        @Override
        void write(KeyOutput out, Object value, boolean open) {
            if (value == null) {
                out.writeLong(0);
                return;
            }
            long v = asLong(value);
            if (v < 0 || v == Long.MAX_VALUE) {
                throw new RecordException.SchemaMismatch("NULLABLE_INTEGER value out of range: " + v);
            }
            out.writeLong(v + 1);
        }

        @Override
        Object read(KeyInput in) {
            long v = in.readLong();
            if (v < 0) {
                throw new RecordException.CorruptKey("NULLABLE_INTEGER field decoded to a negative value: " + v);
            }
            return v == 0 ? null : v - 1;
        }

        @Override
        public boolean nullable() {
            return true;
        }
    },

    /** Signed 64-bit integer; the sign bit is flipped so negative values sort first. */
    LONG {
        @Override
        void write(KeyOutput out, Object value, boolean open) {
            out.writeLong(asLong(value) ^ Long.MIN_VALUE);
        }

        @Override
        Object read(KeyInput in) {
            return in.readLong() ^ Long.MIN_VALUE;
        }
    },

    /** UTF-8 text; 0x00 is escaped as 0x00 0x01 and the field ends with 0x00 0x00, except in the open form. */
    STRING {
        @Override
        void write(KeyOutput out, Object value, boolean open) {
            if (!(value instanceof String s)) {
                throw new RecordException.SchemaMismatch("STRING field requires a String, got " + describe(value));
            }
            for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
                out.write(b);
                if (b == 0) {
                    out.write(0x01);
                }
            }
            // the open form is a prefix of every stored key starting with the same text
            if (open) {
                return;
            }
            out.write(0x00);
            out.write(0x00);
        }

        @Override
        Object read(KeyInput in) {
            ByteArrayOutputStream text = new ByteArrayOutputStream();
            while (true) {
                int b = in.read();
                if (b != 0) {
                    text.write(b);
                    continue;
                }
                int marker = in.read();
                if (marker == 0x00) {
                    return text.toString(StandardCharsets.UTF_8);
                }
                if (marker != 0x01) {
                    throw new RecordException.CorruptKey(
                        "Invalid escape byte 0x%02x in STRING field at position %d".formatted(marker, in.position() - 1)
                    );
                }
                text.write(0);
            }
        }
    },

    BOOLEAN {
        @Override
        void write(KeyOutput out, Object value, boolean open) {
            if (!(value instanceof Boolean b)) {
                throw new RecordException.SchemaMismatch("BOOLEAN field requires a Boolean, got " + describe(value));
            }
            out.write(b ? 1 : 0);
        }

        @Override
        Object read(KeyInput in) {
            int b = in.read();
            if (b > 1) {
                throw new RecordException.CorruptKey("Invalid BOOLEAN byte: " + b);
            }
            return b == 1;
        }
    };

    abstract void write(KeyOutput out, Object value, boolean open);

    abstract Object read(KeyInput in);

    /**
     * Converts a JSON value taken from an object's data into the Java value this type encodes.
     */
    public Object fromJson(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            if (nullable()) {
                return null;
            }
            throw new RecordException.SchemaMismatch(name() + " field cannot be null");
        }
        if (!element.isJsonPrimitive()) {
            throw new RecordException.SchemaMismatch(name() + " field requires a primitive value, got " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        return switch (this) {
            case STRING -> {
                if (!primitive.isString()) {
                    throw new RecordException.SchemaMismatch("STRING field requires a string, got " + primitive);
                }
                yield primitive.getAsString();
            }
            case BOOLEAN -> {
                if (!primitive.isBoolean()) {
                    throw new RecordException.SchemaMismatch("BOOLEAN field requires a boolean, got " + primitive);
                }
                yield primitive.getAsBoolean();
            }
            case INTEGER, NULLABLE_INTEGER, LONG -> {
                if (!primitive.isNumber()) {
                    throw new RecordException.SchemaMismatch(name() + " field requires a number, got " + primitive);
                }
                try {
                    yield primitive.getAsBigDecimal().longValueExact();
                } catch (ArithmeticException e) {
                    throw new RecordException.SchemaMismatch(name() + " field requires an integral number, got " + primitive, e);
                }
            }
        };
    }

    public JsonElement toJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        if (value instanceof Number n) {
            return new JsonPrimitive(n);
        }
        return new JsonPrimitive(value.toString());
    }

    public boolean nullable() {
        return false;
    }

    private static long asLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new RecordException.SchemaMismatch("Integer field requires an integral number, got " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
