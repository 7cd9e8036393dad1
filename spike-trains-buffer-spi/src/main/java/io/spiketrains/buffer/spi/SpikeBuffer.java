package io.spiketrains.buffer.spi;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;

/**
 * A spike buffer: written during a simulation run, read back afterwards, closed at run end.
 *
 * <p>Backends are independent implementations of this capability; none extends another.
 * {@link #close()} is idempotent and releases every resource and temporary file the buffer owns;
 * every other operation on a closed buffer fails with
 * {@link io.spiketrains.core.SpikeTrainsException.BufferClosed}.
 */
public interface SpikeBuffer extends SpikeWriter, SpikeReader, AutoCloseable {

    void setUnits(String units);

    /**
     * Copies every spike of {@code source}, keeping its populations.
     */
    default void importSpikes(SpikeReader source) {
        try (SpikeCursor cursor = source.spikes()) {
            while (cursor.hasNext()) {
                SpikeRecord spike = cursor.next();
                addSpike(spike.nodeId(), spike.timestamp(), spike.population());
            }
        }
    }

    @Override
    void close();
}
