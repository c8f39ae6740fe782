package io.ringdb.storage;

import io.ringdb.common.ByteArray;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.KeyValue;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Merges ascending scans into one ascending scan. Sources are given in priority order: when several
 * sources hold the same key, the entry from the source with the lowest index wins and the others are dropped.
 */
public final class MergingIterator implements CloseableIterator<KeyValue> {

    private static final Comparator<IteratorEntry> ENTRY_ORDER = Comparator
        .comparing((IteratorEntry e) -> e.entry.key())
        .thenComparingInt(e -> e.index);

    private final PriorityQueue<IteratorEntry> heap;
    private final List<? extends CloseableIterator<KeyValue>> sources;
    private ByteArray lastEmittedKey;
    private KeyValue nextEntry;

    public MergingIterator(List<? extends CloseableIterator<KeyValue>> sources) {
        this.sources = sources;
        this.heap = new PriorityQueue<>(ENTRY_ORDER);

        for (int i = 0; i < sources.size(); i++) {
            CloseableIterator<KeyValue> source = sources.get(i);
            if (source.hasNext()) {
                heap.offer(new IteratorEntry(source.next(), i));
            }
        }

        this.lastEmittedKey = null;
        advance();
    }

    private void advance() {
        while (!heap.isEmpty()) {
            IteratorEntry current = heap.poll();
            CloseableIterator<KeyValue> source = sources.get(current.index);

            if (source.hasNext()) {
                heap.offer(new IteratorEntry(source.next(), current.index));
            }

            if (lastEmittedKey != null && current.entry.key().equals(lastEmittedKey)) {
                continue;
            }

            lastEmittedKey = current.entry.key();
            nextEntry = current.entry;
            return;
        }

        nextEntry = null;
    }

    @Override
    public boolean hasNext() {
        return nextEntry != null;
    }

    @Override
    public KeyValue next() {
        if (nextEntry == null) {
            throw new NoSuchElementException();
        }
        KeyValue result = nextEntry;
        advance();
        return result;
    }

    @Override
    public void close() {
        for (CloseableIterator<KeyValue> source : sources) {
            source.close();
        }
    }

    private record IteratorEntry(KeyValue entry, int index) {}
}
