package io.spiketrains.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * One spike observation: the time it fired, the population it belongs to and its node id.
 */
public record SpikeRecord(double timestamp, String population, long nodeId) {

    /** Timestamp first, then node id, then population. */
    public static final Comparator<SpikeRecord> BY_TIME = Comparator
            .comparingDouble(SpikeRecord::timestamp)
            .thenComparingLong(SpikeRecord::nodeId)
            .thenComparing(SpikeRecord::population);

    /** Node id first, then timestamp, then population. */
    public static final Comparator<SpikeRecord> BY_ID = Comparator
            .comparingLong(SpikeRecord::nodeId)
            .thenComparingDouble(SpikeRecord::timestamp)
            .thenComparing(SpikeRecord::population);

    public SpikeRecord {
        Objects.requireNonNull(population, "population");
    }
}
