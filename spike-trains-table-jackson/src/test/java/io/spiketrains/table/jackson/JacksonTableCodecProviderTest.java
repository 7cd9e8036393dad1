package io.spiketrains.table.jackson;

import io.spiketrains.buffer.core.InMemorySpikeBuffer;
import io.spiketrains.buffer.core.ServiceLoaderTableCodecRegistry;
import io.spiketrains.buffer.spi.SpikeQuery;
import io.spiketrains.buffer.spi.SpikeTable;
import io.spiketrains.buffer.spi.SpikeTableCodec;
import io.spiketrains.buffer.spi.SpikeTableCodecRegistry;
import io.spiketrains.core.SortOrder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonTableCodecProviderTest {

    @Test
    void serviceLoaderFindsBothCodecs() {
        SpikeTableCodecRegistry registry = ServiceLoaderTableCodecRegistry.defaultRegistry();

        assertThat(registry.find("text/csv; charset=utf-8")).get().isInstanceOf(JacksonCsvTableCodec.class);
        assertThat(registry.find("Application/JSON")).get().isInstanceOf(JacksonJsonTableCodec.class);
        assertThat(registry.find("application/x-parquet")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.forFile(Path.of("output", "spikes.CSV"))).get().isInstanceOf(JacksonCsvTableCodec.class);
        assertThat(registry.forFile(Path.of("spikes.json"))).get().isInstanceOf(JacksonJsonTableCodec.class);
        assertThat(registry.forFile(Path.of("spikes"))).isEmpty();
    }

    @Test
    void exportsAndLoadsByFileExtension(@TempDir Path tempDir) throws IOException {
        SpikeTableCodecRegistry registry = ServiceLoaderTableCodecRegistry.defaultRegistry();
        SpikeTable table = SpikeTable.builder("ms").add(0.5, "v1", 7).add(1.5, "lgn", 3).build();
        Path csv = tempDir.resolve("spikes.csv");

        registry.export(table, csv);

        assertThat(Files.readAllLines(csv)).startsWith("timestamps population node_ids", "0.5 v1 7");
        assertThat(registry.load(csv, "ms")).isEqualTo(table);
        assertThatThrownBy(() -> registry.export(table, tempDir.resolve("spikes.h5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spikes.h5");
    }

    @Test
    void exportsBufferSnapshot() throws IOException {
        SpikeTableCodec codec = SpikeTableCodecRegistry.builder()
                .registerAll(new JacksonTableCodecProvider().codecs())
                .build()
                .find(JacksonCsvTableCodec.CONTENT_TYPE)
                .orElseThrow();
        SpikeTable table;
        try (InMemorySpikeBuffer buffer = new InMemorySpikeBuffer("v1")) {
            buffer.addSpike(2, 0.2);
            buffer.addSpike(1, 0.1, "lgn");
            table = buffer.toTable(SpikeQuery.sortedBy(SortOrder.BY_TIME));
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        codec.write(table, out);

        assertThat(codec.read(new ByteArrayInputStream(out.toByteArray()), "ms")).isEqualTo(table);
    }
}
