package io.spiketrains.buffer.spi;

/**
 * Write half of a spike buffer, driven by the simulation every timestep.
 */
public interface SpikeWriter {

    /**
     * Records one spike under the configured default population.
     */
    default void addSpike(long nodeId, double timestamp) {
        addSpike(nodeId, timestamp, null);
    }

    /**
     * Records one spike.
     *
     * @param population population label, {@code null} for the configured default
     */
    void addSpike(long nodeId, double timestamp, String population);

    /**
     * Records {@code nodeIds[i]} firing at {@code timestamps[i]} for every i.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    default void addSpikes(long[] nodeIds, double[] timestamps, String population) {
        if (nodeIds.length != timestamps.length) {
            throw new IllegalArgumentException(
                    "nodeIds and timestamps differ in length: " + nodeIds.length + " != " + timestamps.length);
        }
        for (int i = 0; i < nodeIds.length; i++) {
            addSpike(nodeIds[i], timestamps[i], population);
        }
    }

    /**
     * Records one node firing at every one of {@code timestamps}.
     */
    default void addSpikes(long nodeId, double[] timestamps, String population) {
        for (double timestamp : timestamps) {
            addSpike(nodeId, timestamp, population);
        }
    }

    /**
     * Forces buffered writes to durable storage. No-op for in-memory backends.
     */
    void flush();
}
