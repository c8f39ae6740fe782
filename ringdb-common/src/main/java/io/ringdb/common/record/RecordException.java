package io.ringdb.common.record;

public sealed class RecordException extends RuntimeException
    permits RecordException.CorruptKey,
            RecordException.SchemaMismatch {

    public RecordException(String message) {
        super(message);
    }

    public RecordException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class CorruptKey extends RecordException {
        public CorruptKey(String message) {
            super(message);
        }
    }

    public static final class SchemaMismatch extends RecordException {
        public SchemaMismatch(String message) {
            super(message);
        }

        public SchemaMismatch(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
