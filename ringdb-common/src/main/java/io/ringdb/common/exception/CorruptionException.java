package io.ringdb.common.exception;

/**
 * Persisted content violates the format or the ring's invariants: malformed lines, duplicate keys,
 * ids outside the ring's range. Raised while opening, so a ring never starts from a broken file.
 */
public final class CorruptionException extends StorageException {

    public CorruptionException(String message) {
        super(message);
    }

    public CorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
