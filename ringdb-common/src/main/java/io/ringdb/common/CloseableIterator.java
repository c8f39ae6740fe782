package io.ringdb.common;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();

    static <T> CloseableIterator<T> wrap(Iterator<T> iterator) {
        return new CloseableIterator<>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public T next() {
                return iterator.next();
            }

            @Override
            public void close() {}
        };
    }

    static <T> CloseableIterator<T> empty() {
        return wrap(Collections.emptyIterator());
    }

    default <R> CloseableIterator<R> map(Function<? super T, ? extends R> mapper) {
        CloseableIterator<T> source = this;
        return new CloseableIterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public R next() {
                if (!source.hasNext()) {
                    throw new NoSuchElementException();
                }
                return mapper.apply(source.next());
            }

            @Override
            public void close() {
                source.close();
            }
        };
    }

    /**
     * Yields at most {@code max} elements; closing the result closes this iterator.
     */
    default CloseableIterator<T> limit(long max) {
        if (max < 0) {
            throw new IllegalArgumentException("max must not be negative");
        }
        CloseableIterator<T> source = this;
        return new CloseableIterator<>() {
            private long returned;

            @Override
            public boolean hasNext() {
                return returned < max && source.hasNext();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                returned++;
                return source.next();
            }

            @Override
            public void close() {
                source.close();
            }
        };
    }
}
