package io.ringdb.common;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable byte string ordered by unsigned lexicographic comparison, the order in which
 * binary record keys are stored and scanned.
 */
public final class ByteArray implements Comparable<ByteArray> {

    private static final ByteArray EMPTY = new ByteArray(new byte[0]);

    private final byte[] data;

    private ByteArray(byte[] data) {
        this.data = data;
    }

    public static ByteArray of(byte... bytes) {
        if (bytes.length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes.clone());
    }

    public static ByteArray copyOf(byte[] bytes) {
        if (bytes.length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes.clone());
    }

    public static ByteArray copyOf(byte[] bytes, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IndexOutOfBoundsException(
                "Invalid offset=%d, length=%d for array of size %d".formatted(offset, length, bytes.length)
            );
        }
        if (length == 0) {
            return EMPTY;
        }
        return new ByteArray(Arrays.copyOfRange(bytes, offset, offset + length));
    }

    /**
     * Builds a key from unsigned byte values, the representation used by the JSON-lines index files.
     */
    public static ByteArray fromUnsigned(int[] values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            int v = values[i];
            if (v < 0 || v > 0xFF) {
                throw new IllegalArgumentException("Byte value out of range at position " + i + ": " + v);
            }
            bytes[i] = (byte) v;
        }
        return bytes.length == 0 ? EMPTY : new ByteArray(bytes);
    }

    public static ByteArray empty() {
        return EMPTY;
    }

    public int length() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public byte get(int index) {
        return data[index];
    }

    public int unsignedAt(int index) {
        return data[index] & 0xFF;
    }

    public ByteArray slice(int offset, int length) {
        return copyOf(data, offset, length);
    }

    public boolean startsWith(ByteArray prefix) {
        if (prefix.data.length > data.length) {
            return false;
        }
        return Arrays.equals(data, 0, prefix.data.length, prefix.data, 0, prefix.data.length);
    }

    public ByteArray concat(ByteArray other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        byte[] joined = Arrays.copyOf(data, data.length + other.data.length);
        System.arraycopy(other.data, 0, joined, data.length, other.data.length);
        return new ByteArray(joined);
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public int[] toUnsigned() {
        int[] values = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            values[i] = data[i] & 0xFF;
        }
        return values;
    }

    @Override
    public int compareTo(ByteArray other) {
        return Arrays.compareUnsigned(data, other.data);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ByteArray other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        if (data.length == 0) {
            return "ByteArray[]";
        }
        String hex = HexFormat.of().formatHex(data);
        if (hex.length() > 32) {
            return "ByteArray[" + hex.substring(0, 32) + "... (" + data.length + " bytes)]";
        }
        return "ByteArray[" + hex + "]";
    }
}
