package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.DistributedRuntime;
import io.spiketrains.buffer.spi.SpikeBuffer;

import java.util.Objects;
import java.util.Properties;

/**
 * Creates the {@link SpikeBuffer} backend a {@link BufferConfig} selects.
 */
public final class SpikeBuffers {

    private SpikeBuffers() {}

    public static SpikeBuffer open(BufferConfig config) {
        Objects.requireNonNull(config, "config");
        return switch (config.backend()) {
            case MEMORY -> new InMemorySpikeBuffer(config);
            case FILE -> new FileSpikeBuffer(config);
            case DISTRIBUTED_FILE -> new DistributedFileSpikeBuffer(config);
        };
    }

    /**
     * Reads the configuration from {@code spike-trains.*} properties, see
     * {@link BufferConfig#fromProperties(Properties, DistributedRuntime)}.
     */
    public static SpikeBuffer open(Properties props, DistributedRuntime runtime) {
        return open(BufferConfig.fromProperties(props, runtime));
    }
}
