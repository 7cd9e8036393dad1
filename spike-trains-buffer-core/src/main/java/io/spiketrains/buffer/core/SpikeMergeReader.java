package io.spiketrains.buffer.core;

import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeFilter;
import io.spiketrains.core.SpikeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * K-way merge of individually sorted spike sources into one globally sorted cursor.
 *
 * <p>A min-heap holds the current head of every live source. Each {@link #next()} pops the smallest head
 * and refills the heap from the source it came from, so at most one spike per source is in flight.
 * Heads that compare equal are emitted in source order.
 *
 * <p>Every source is owned by the merge: a source is closed as soon as it is exhausted, and all
 * remaining sources are closed on {@link #close()} or when any source fails.
 */
final class SpikeMergeReader implements SpikeCursor {

    private static final Logger logger = LoggerFactory.getLogger(SpikeMergeReader.class);

    private final Comparator<SpikeRecord> order;
    private final List<SpikeCursor> sources;
    private final PriorityQueue<Head> heap;
    private boolean closed;

    /**
     * @param sources cursors each sorted by {@code order}; ownership passes to the merge
     * @param order the order every source is sorted by
     */
    SpikeMergeReader(List<? extends SpikeCursor> sources, Comparator<SpikeRecord> order) {
        this.order = Objects.requireNonNull(order, "order");
        this.sources = new ArrayList<>(Objects.requireNonNull(sources, "sources"));
        Comparator<Head> byHead = (a, b) -> order.compare(a.spike, b.spike);
        this.heap = new PriorityQueue<>(Math.max(1, this.sources.size()), byHead.thenComparingInt(h -> h.source));
        try {
            for (int i = 0; i < this.sources.size(); i++) {
                advance(i, null);
            }
        } catch (RuntimeException e) {
            closeAfter(e);
            throw e;
        }
        logger.debug("Merging {} sorted spike sources, {} non-empty", this.sources.size(), heap.size());
    }

    /**
     * Opens every file as a source, passing only spikes accepted by {@code filter}.
     * Files opened before a failing one are closed again.
     */
    static SpikeMergeReader open(List<Path> sortedFiles, SortOrder sortOrder, SpikeFilter filter) {
        Comparator<SpikeRecord> order = sortOrder.comparator()
                .orElseThrow(() -> new IllegalArgumentException("merge requires a sort order, got " + sortOrder));
        List<SpikeCursor> opened = new ArrayList<>(sortedFiles.size());
        try {
            for (Path file : sortedFiles) {
                opened.add(SpikeFileCursor.open(file, filter));
            }
        } catch (RuntimeException e) {
            for (SpikeCursor cursor : opened) {
                try {
                    cursor.close();
                } catch (RuntimeException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw e;
        }
        return new SpikeMergeReader(opened, order);
    }

    @Override
    public boolean hasNext() {
        if (heap.isEmpty()) {
            close();
            return false;
        }
        return true;
    }

    @Override
    public SpikeRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Head head = heap.poll();
        try {
            advance(head.source, head.spike);
        } catch (RuntimeException e) {
            closeAfter(e);
            throw e;
        }
        return head.spike;
    }

    private void advance(int source, SpikeRecord previous) {
        SpikeCursor cursor = sources.get(source);
        if (cursor == null) {
            return;
        }
        if (cursor.hasNext()) {
            SpikeRecord spike = cursor.next();
            if (previous != null && order.compare(previous, spike) > 0) {
                throw new IllegalStateException("merge source " + source + " is not sorted: "
                        + spike + " follows " + previous);
            }
            heap.add(new Head(spike, source));
        } else {
            sources.set(source, null);
            cursor.close();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        heap.clear();
        RuntimeException failure = null;
        for (int i = 0; i < sources.size(); i++) {
            SpikeCursor cursor = sources.get(i);
            if (cursor == null) {
                continue;
            }
            sources.set(i, null);
            try {
                cursor.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void closeAfter(RuntimeException failure) {
        try {
            close();
        } catch (RuntimeException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }

    /**
     * Sources not yet exhausted or closed.
     */
    int openSources() {
        int open = 0;
        for (SpikeCursor cursor : sources) {
            if (cursor != null) {
                open++;
            }
        }
        return open;
    }

    private static final class Head {
        private final SpikeRecord spike;
        private final int source;

        private Head(SpikeRecord spike, int source) {
            this.spike = spike;
            this.source = source;
        }
    }
}
