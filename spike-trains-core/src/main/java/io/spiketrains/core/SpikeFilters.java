package io.spiketrains.core;

import java.util.Set;

/**
 * Builds the per-spike predicates applied on every read path.
 *
 * <p>The constraint combination is resolved once, here, so the predicate evaluated for each stored
 * spike carries no branching on which constraints are present. A {@code null} population set or
 * window means "match everything" for that constraint.
 */
public final class SpikeFilters {

    private static final SpikePredicate ALL = (population, timestamp) -> true;

    private SpikeFilters() {}

    /**
     * Predicate over (population, timestamp).
     *
     * @param populations accepted population labels, or {@code null} for all
     * @param window inclusive time window, or {@code null} for all
     */
    public static SpikePredicate create(Set<String> populations, TimeWindow window) {
        if (populations == null && window == null) {
            return ALL;
        }
        if (populations == null) {
            double lo = window.lo();
            double hi = window.hi();
            return (population, timestamp) -> lo <= timestamp && timestamp <= hi;
        }
        Set<String> accepted = Set.copyOf(populations);
        if (window == null) {
            return (population, timestamp) -> accepted.contains(population);
        }
        double lo = window.lo();
        double hi = window.hi();
        return (population, timestamp) -> accepted.contains(population) && lo <= timestamp && timestamp <= hi;
    }

    /**
     * Single-label form of {@link #create(Set, TimeWindow)}.
     */
    public static SpikePredicate create(String population, TimeWindow window) {
        return create(population == null ? null : Set.of(population), window);
    }

    /**
     * Predicate over (population, timestamp, node id); {@code nodeIds == null} accepts every node.
     */
    public static SpikeFilter create(Set<Long> nodeIds, Set<String> populations, TimeWindow window) {
        SpikePredicate predicate = create(populations, window);
        if (nodeIds == null) {
            return (population, timestamp, nodeId) -> predicate.test(population, timestamp);
        }
        Set<Long> accepted = Set.copyOf(nodeIds);
        return (population, timestamp, nodeId) -> accepted.contains(nodeId) && predicate.test(population, timestamp);
    }
}
