package io.ringdb.common;

import java.util.Objects;

public record KeyValue(ByteArray key, String value) {

    public KeyValue {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
