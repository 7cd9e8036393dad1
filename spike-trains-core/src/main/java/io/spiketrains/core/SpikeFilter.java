package io.spiketrains.core;

/**
 * Test over a full stored spike, node id included.
 */
@FunctionalInterface
public interface SpikeFilter {

    boolean test(String population, double timestamp, long nodeId);

    default boolean test(SpikeRecord spike) {
        return test(spike.population(), spike.timestamp(), spike.nodeId());
    }
}
