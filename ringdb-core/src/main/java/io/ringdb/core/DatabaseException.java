package io.ringdb.core;

public sealed class DatabaseException extends RuntimeException
    permits DatabaseException.NotFound,
            DatabaseException.DuplicateId,
            DatabaseException.IdOutOfRange,
            DatabaseException.ReadOnly,
            DatabaseException.NoWritableRing,
            DatabaseException.UnknownRing {

    public DatabaseException(String message) {
        super(message);
    }

    public static final class NotFound extends DatabaseException {
        private final long id;

        public NotFound(long id) {
            super("Item " + id + " not found in any ring");
            this.id = id;
        }

        public long id() {
            return id;
        }
    }

    public static final class DuplicateId extends DatabaseException {
        private final long id;
        private final String ring;

        public DuplicateId(long id, String ring) {
            super("Item " + id + " already exists in ring '" + ring + "'");
            this.id = id;
            this.ring = ring;
        }

        public long id() {
            return id;
        }

        public String ring() {
            return ring;
        }
    }

    public static final class IdOutOfRange extends DatabaseException {
        private final long id;
        private final String ring;

        public IdOutOfRange(long id, String ring, String range) {
            super("Item id " + id + " is outside the id range " + range + " of ring '" + ring + "'");
            this.id = id;
            this.ring = ring;
        }

        public long id() {
            return id;
        }

        public String ring() {
            return ring;
        }
    }

    public static final class ReadOnly extends DatabaseException {
        private final String ring;

        public ReadOnly(String ring, String message) {
            super(message);
            this.ring = ring;
        }

        public String ring() {
            return ring;
        }
    }

    public static final class NoWritableRing extends DatabaseException {
        public NoWritableRing(String message) {
            super(message);
        }
    }

    public static final class UnknownRing extends DatabaseException {
        private final String name;

        public UnknownRing(String name) {
            super("No ring named '" + name + "'");
            this.name = name;
        }

        public String name() {
            return name;
        }
    }
}
