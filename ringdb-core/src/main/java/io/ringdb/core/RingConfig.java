package io.ringdb.core;

import io.ringdb.core.index.DerivedIndex;
import io.ringdb.storage.StorageFormat;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of one ring.
 *
 * @param name     unique name of the ring within the database
 * @param dataFile file holding the primary data, or null for a purely in-memory ring
 * @param startId  lowest id this ring may assign to new items
 * @param stopId   exclusive upper bound of new ids, {@link #UNBOUNDED} for none
 * @param readonly whether the ring refuses all modifications
 * @param indexes  derived indexes maintained next to the data
 */
public record RingConfig(
    String name,
    Path dataFile,
    long startId,
    long stopId,
    boolean readonly,
    List<DerivedIndex> indexes
) {
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private static final String INDEX_EXTENSION = ".jl";

    public RingConfig {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (startId < 0) {
            throw new IllegalArgumentException("startId must not be negative");
        }
        if (stopId <= startId) {
            throw new IllegalArgumentException("stopId must be greater than startId");
        }
        indexes = List.copyOf(indexes);
        Set<String> names = new HashSet<>();
        for (DerivedIndex index : indexes) {
            if (!names.add(index.name())) {
                throw new IllegalArgumentException("Duplicate index name in ring " + name + ": " + index.name());
            }
        }
        if (dataFile != null) {
            StorageFormat.forPath(dataFile);
        }
    }

    public static RingConfig memory(String name) {
        return new RingConfig(name, null, 0, UNBOUNDED, false, List.of());
    }

    /**
     * A file-backed ring named after the base name of its data file.
     */
    public static RingConfig file(Path dataFile) {
        Objects.requireNonNull(dataFile, "dataFile must not be null");
        return new RingConfig(baseName(dataFile), dataFile, 0, UNBOUNDED, false, List.of());
    }

    public RingConfig withName(String name) {
        return new RingConfig(name, dataFile, startId, stopId, readonly, indexes);
    }

    public RingConfig withIdRange(long startId, long stopId) {
        return new RingConfig(name, dataFile, startId, stopId, readonly, indexes);
    }

    public RingConfig withReadonly(boolean readonly) {
        return new RingConfig(name, dataFile, startId, stopId, readonly, indexes);
    }

    public RingConfig withIndexes(DerivedIndex... indexes) {
        return new RingConfig(name, dataFile, startId, stopId, readonly, List.of(indexes));
    }

    public boolean validId(long id) {
        return startId <= id && id < stopId;
    }

    public StorageFormat dataFormat() {
        return StorageFormat.forPath(dataFile);
    }

    /**
     * File of the given index, {@code <base>.<index>.jl} next to the data file; null for an in-memory ring.
     */
    public Path indexFile(String indexName) {
        if (dataFile == null) {
            return null;
        }
        return dataFile.resolveSibling(baseName(dataFile) + "." + indexName + INDEX_EXTENSION);
    }

    public String idRange() {
        return "[" + startId + ", " + (stopId == UNBOUNDED ? "inf" : String.valueOf(stopId)) + ")";
    }

    private static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
