package io.ringdb.core;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks that serialize read-modify-write operations on the same item id across all rings.
 * Different ids may share a stripe, which only costs some parallelism.
 */
final class IdLocks {

    private final ReentrantLock[] stripes;

    IdLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    <T> T withLock(long id, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(Long.hashCode(id), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
