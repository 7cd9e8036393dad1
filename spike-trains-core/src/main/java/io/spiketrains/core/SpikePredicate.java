package io.spiketrains.core;

/**
 * Test over the population and timestamp of a stored spike.
 */
@FunctionalInterface
public interface SpikePredicate {

    boolean test(String population, double timestamp);
}
