package io.spiketrains.buffer.spi;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferConfigTest {

    @Test
    void builderDefaults() {
        BufferConfig config = BufferConfig.builder().defaultPopulation("v1").build();

        assertThat(config.backend()).isEqualTo(BufferConfig.Backend.MEMORY);
        assertThat(config.cacheDir()).isNull();
        assertThat(config.cacheName()).isEqualTo("spikes");
        assertThat(config.units()).isEqualTo("ms");
        assertThat(config.sortRunSize()).isEqualTo(BufferConfig.DEFAULT_SORT_RUN_SIZE);
        assertThat(config.runtime().rank()).isZero();
        assertThat(config.runtime().size()).isEqualTo(1);
    }

    @Test
    void defaultPopulationIsRequired() {
        assertThatThrownBy(() -> BufferConfig.builder().build()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> BufferConfig.builder().defaultPopulation("has space").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void diskBackendsRequireCacheDir() {
        assertThatThrownBy(() -> BufferConfig.builder()
                .backend(BufferConfig.Backend.FILE)
                .defaultPopulation("v1")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cacheDir");
    }

    @Test
    void rejectsRankOutsideRuntimeSize() {
        DistributedRuntime broken = new DistributedRuntime() {
            @Override
            public int rank() {
                return 2;
            }

            @Override
            public int size() {
                return 2;
            }

            @Override
            public void barrier() {}
        };
        assertThatThrownBy(() -> BufferConfig.builder().defaultPopulation("v1").runtime(broken).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty("spike-trains.backend", "distributed-file");
        props.setProperty("spike-trains.cache-dir", "/tmp/spikes");
        props.setProperty("spike-trains.cache-name", "run42");
        props.setProperty("spike-trains.default-population", "cortex");
        props.setProperty("spike-trains.units", "s");
        props.setProperty("spike-trains.sort-run-size", "500");

        BufferConfig config = BufferConfig.fromProperties(props, DistributedRuntime.local());

        assertThat(config.backend()).isEqualTo(BufferConfig.Backend.DISTRIBUTED_FILE);
        assertThat(config.cacheDir()).isEqualTo(Path.of("/tmp/spikes"));
        assertThat(config.cacheName()).isEqualTo("run42");
        assertThat(config.defaultPopulation()).isEqualTo("cortex");
        assertThat(config.units()).isEqualTo("s");
        assertThat(config.sortRunSize()).isEqualTo(500);
        assertThat(config.toBuilder().build().toString()).isEqualTo(config.toString());
    }

    @Test
    void rejectsUnknownBackendProperty() {
        Properties props = new Properties();
        props.setProperty("spike-trains.backend", "tape");
        props.setProperty("spike-trains.default-population", "cortex");

        assertThatThrownBy(() -> BufferConfig.fromProperties(props, DistributedRuntime.local()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tape");
    }
}
