package io.ringdb.common.record;

import io.ringdb.common.ByteArray;

import java.util.Arrays;

final class KeyOutput {

    private byte[] buffer;
    private int size;

    KeyOutput() {
        this.buffer = new byte[16];
        this.size = 0;
    }

    void write(int b) {
        ensureCapacity(1);
        buffer[size++] = (byte) b;
    }

    void writeLong(long value) {
        ensureCapacity(Long.BYTES);
        for (int i = Long.BYTES - 1; i >= 0; i--) {
            buffer[size + i] = (byte) value;
            value >>>= 8;
        }
        size += Long.BYTES;
    }

    ByteArray result() {
        return ByteArray.copyOf(buffer, 0, size);
    }

    private void ensureCapacity(int extra) {
        if (size + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, size + extra));
        }
    }
}
