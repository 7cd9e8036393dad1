package io.spiketrains.buffer.spi;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.TimeRange;
import io.spiketrains.core.TimeWindow;

import java.util.Arrays;
import java.util.Set;

/**
 * Read half of a spike buffer.
 *
 * <p>Disk-backed readers flush pending writes before every read. Aggregates over zero spikes that have
 * no meaningful value, such as {@link #timeRange(Set)}, fail with
 * {@link io.spiketrains.core.SpikeTrainsException.EmptyBuffer}.
 */
public interface SpikeReader {

    /**
     * Lazy sequence of the spikes matching {@code query}, in the query's sort order.
     * The caller must close the cursor if it stops before the end.
     */
    SpikeCursor spikes(SpikeQuery query);

    /**
     * Every spike, in storage order.
     */
    default SpikeCursor spikes() {
        return spikes(SpikeQuery.all());
    }

    /**
     * Materialized snapshot of the spikes matching {@code query}.
     */
    default SpikeTable toTable(SpikeQuery query) {
        return SpikeTable.collect(spikes(query), units());
    }

    default SpikeTable toTable() {
        return toTable(SpikeQuery.all());
    }

    /**
     * Ascending spike times of one node.
     *
     * @param population population of the node, {@code null} for the configured default
     * @param window inclusive window, {@code null} for all times
     */
    default double[] getTimes(long nodeId, String population, TimeWindow window) {
        SpikeQuery query = SpikeQuery.builder()
                .nodeIds(nodeId)
                .populations(population == null ? defaultPopulation() : population)
                .timeWindow(window)
                .build();
        double[] times;
        try (SpikeCursor cursor = spikes(query)) {
            times = cursor.stream().mapToDouble(SpikeRecord::timestamp).toArray();
        }
        Arrays.sort(times);
        return times;
    }

    default double[] getTimes(long nodeId) {
        return getTimes(nodeId, null, null);
    }

    /**
     * Total number of spikes across all populations.
     */
    long nSpikes();

    /**
     * Number of spikes recorded under {@code population}; {@code null} means the configured default.
     */
    long nSpikes(String population);

    /**
     * Population labels that have at least one spike, in ascending order.
     */
    Set<String> populations();

    /**
     * Node ids that spiked in any of {@code populations}; {@code null} for every population.
     */
    Set<Long> nodes(Set<String> populations);

    default Set<Long> nodes() {
        return nodes(null);
    }

    /**
     * Earliest and latest spike time in {@code populations}; {@code null} for every population.
     *
     * @throws io.spiketrains.core.SpikeTrainsException.EmptyBuffer if no spike matches
     */
    TimeRange timeRange(Set<String> populations);

    default TimeRange timeRange() {
        return timeRange(null);
    }

    /**
     * Label of the time unit of stored timestamps.
     */
    String units();

    /**
     * Population used when a writer omits one.
     */
    String defaultPopulation();

    default long size() {
        return nSpikes();
    }
}
