package io.spiketrains.core;

import java.util.Comparator;
import java.util.Optional;

/**
 * Retrieval ordering for spike reads. Never affects the order spikes are written in.
 */
public enum SortOrder {
    /** Storage order, no sorting pass. */
    NONE(null),

    /** Ascending timestamp. */
    BY_TIME(SpikeRecord.BY_TIME),

    /** Ascending node id. */
    BY_ID(SpikeRecord.BY_ID);

    private final Comparator<SpikeRecord> comparator;

    SortOrder(Comparator<SpikeRecord> comparator) {
        this.comparator = comparator;
    }

    /**
     * Comparator for this order, empty for {@link #NONE}.
     */
    public Optional<Comparator<SpikeRecord>> comparator() {
        return Optional.ofNullable(comparator);
    }

    public boolean isSorted() {
        return comparator != null;
    }
}
