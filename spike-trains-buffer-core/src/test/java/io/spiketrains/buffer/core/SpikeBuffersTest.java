package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.DistributedRuntime;
import io.spiketrains.buffer.spi.SpikeBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class SpikeBuffersTest {

    @TempDir
    Path tempDir;

    @Test
    void opensBackendSelectedByConfig() {
        BufferConfig.Builder config = BufferConfig.builder().cacheDir(tempDir).defaultPopulation("v1");

        try (SpikeBuffer memory = SpikeBuffers.open(config.backend(BufferConfig.Backend.MEMORY).build());
             SpikeBuffer file = SpikeBuffers.open(config.backend(BufferConfig.Backend.FILE).build());
             SpikeBuffer distributed = SpikeBuffers.open(config.backend(BufferConfig.Backend.DISTRIBUTED_FILE).build())) {
            assertThat(memory).isInstanceOf(InMemorySpikeBuffer.class);
            assertThat(file).isInstanceOf(FileSpikeBuffer.class);
            assertThat(distributed).isInstanceOf(DistributedFileSpikeBuffer.class);
        }
    }

    @Test
    void opensFromProperties() {
        Properties props = new Properties();
        props.setProperty("spike-trains.backend", "file");
        props.setProperty("spike-trains.cache-dir", tempDir.toString());
        props.setProperty("spike-trains.cache-name", "props");
        props.setProperty("spike-trains.default-population", "cortex");
        props.setProperty("spike-trains.units", "s");

        try (SpikeBuffer buffer = SpikeBuffers.open(props, DistributedRuntime.local())) {
            assertThat(((FileSpikeBuffer) buffer).cacheFile()).isEqualTo(tempDir.resolve(".props.cache.csv"));
            assertThat(buffer.defaultPopulation()).isEqualTo("cortex");
            assertThat(buffer.units()).isEqualTo("s");
        }
    }
}
