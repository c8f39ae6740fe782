package io.ringdb.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Database-wide settings.
 *
 * @param flushDelay debounce window for writing dirty blocks to disk; {@link Duration#ZERO} flushes
 *                   synchronously after every mutation
 */
public record DatabaseConfig(Duration flushDelay) {

    public static final Duration DEFAULT_FLUSH_DELAY = Duration.ofSeconds(1);

    public DatabaseConfig {
        Objects.requireNonNull(flushDelay, "flushDelay must not be null");
        if (flushDelay.isNegative()) {
            throw new IllegalArgumentException("flushDelay must not be negative");
        }
    }

    public static DatabaseConfig create() {
        return new DatabaseConfig(DEFAULT_FLUSH_DELAY);
    }

    public DatabaseConfig withFlushDelay(Duration flushDelay) {
        return new DatabaseConfig(flushDelay);
    }
}
