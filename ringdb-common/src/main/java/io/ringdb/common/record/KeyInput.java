package io.ringdb.common.record;

import io.ringdb.common.ByteArray;

final class KeyInput {

    private final ByteArray key;
    private int position;

    KeyInput(ByteArray key) {
        this.key = key;
        this.position = 0;
    }

    int read() {
        require(1);
        return key.unsignedAt(position++);
    }

    long readLong() {
        require(Long.BYTES);
        long value = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            value = (value << 8) | key.unsignedAt(position++);
        }
        return value;
    }

    int position() {
        return position;
    }

    int remaining() {
        return key.length() - position;
    }

    private void require(int count) {
        if (remaining() < count) {
            throw new RecordException.CorruptKey(
                "Unexpected end of key at position %d (need %d more bytes) in %s".formatted(position, count, key)
            );
        }
    }
}
