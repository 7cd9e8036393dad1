package io.spiketrains.core;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finite, pull-based sequence of spikes.
 *
 * <p>{@link #hasNext()} returning {@code false} is the end-of-sequence signal. Implementations that hold
 * files release them as soon as the sequence is exhausted; callers that stop early must call
 * {@link #close()}, which never needs the remaining spikes to be drained. Closing is idempotent.
 *
 * <pre>{@code
 * try (SpikeCursor cursor = buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_TIME))) {
 *     while (cursor.hasNext()) {
 *         SpikeRecord spike = cursor.next();
 *         ...
 *     }
 * }
 * }</pre>
 */
public interface SpikeCursor extends Iterator<SpikeRecord>, AutoCloseable {

    @Override
    void close();

    /**
     * Sequential stream over the remaining spikes. Closing the stream closes this cursor.
     */
    default Stream<SpikeRecord> stream() {
        Spliterator<SpikeRecord> spliterator = Spliterators.spliteratorUnknownSize(
                this, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    /**
     * Drains the remaining spikes into a list and closes this cursor.
     */
    default List<SpikeRecord> toList() {
        try (Stream<SpikeRecord> s = stream()) {
            return s.toList();
        }
    }

    static SpikeCursor empty() {
        return of(List.<SpikeRecord>of().iterator());
    }

    /**
     * Cursor over an in-memory iterator; {@link #close()} only stops iteration.
     */
    static SpikeCursor of(Iterator<SpikeRecord> spikes) {
        return new SpikeCursor() {
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && spikes.hasNext();
            }

            @Override
            public SpikeRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return spikes.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
