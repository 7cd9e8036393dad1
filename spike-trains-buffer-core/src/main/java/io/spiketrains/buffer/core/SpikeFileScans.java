package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeFilters;
import io.spiketrains.core.SpikePredicate;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;
import io.spiketrains.core.TimeRange;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full scans computing aggregates over one or more cache files. Nothing is cached.
 */
final class SpikeFileScans {

    private SpikeFileScans() {}

    static Map<String, Long> populationCounts(List<Path> files) {
        Map<String, Long> counts = new HashMap<>();
        for (Path file : files) {
            try (SpikeCursor cursor = SpikeFileCursor.open(file)) {
                while (cursor.hasNext()) {
                    counts.merge(cursor.next().population(), 1L, Long::sum);
                }
            }
        }
        return counts;
    }

    static Set<Long> nodes(List<Path> files, Set<String> populations) {
        SpikePredicate predicate = SpikeFilters.create(populations, null);
        Set<Long> nodes = new HashSet<>();
        for (Path file : files) {
            try (SpikeCursor cursor = SpikeFileCursor.open(file)) {
                while (cursor.hasNext()) {
                    SpikeRecord spike = cursor.next();
                    if (predicate.test(spike.population(), spike.timestamp())) {
                        nodes.add(spike.nodeId());
                    }
                }
            }
        }
        return nodes;
    }

    /**
     * @throws SpikeTrainsException.EmptyBuffer if no spike in {@code files} matches {@code populations}
     */
    static TimeRange timeRange(List<Path> files, Set<String> populations) {
        SpikePredicate predicate = SpikeFilters.create(populations, null);
        TimeRange range = null;
        for (Path file : files) {
            try (SpikeCursor cursor = SpikeFileCursor.open(file)) {
                while (cursor.hasNext()) {
                    SpikeRecord spike = cursor.next();
                    if (predicate.test(spike.population(), spike.timestamp())) {
                        double t = spike.timestamp();
                        range = range == null ? new TimeRange(t, t) : range.including(t);
                    }
                }
            }
        }
        if (range == null) {
            throw new SpikeTrainsException.EmptyBuffer(
                    populations == null ? "no spikes recorded" : "no spikes recorded for populations " + populations);
        }
        return range;
    }
}
