package io.spiketrains.buffer.spi;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpikeTableTest {

    @Test
    void collectsCursorIntoAlignedColumns() {
        List<SpikeRecord> spikes = List.of(
                new SpikeRecord(0.5, "B", 7),
                new SpikeRecord(1.5, "A", 3));

        SpikeTable table = SpikeTable.collect(SpikeCursor.of(spikes.iterator()), "ms");

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.units()).isEqualTo("ms");
        assertThat(table.timestamps()).containsExactly(0.5, 1.5);
        assertThat(table.populations()).containsExactly("B", "A");
        assertThat(table.nodeIds()).containsExactly(7L, 3L);
        assertThat(table.records()).isEqualTo(spikes);
    }

    @Test
    void builderGrowsPastInitialCapacity() {
        SpikeTable.Builder builder = SpikeTable.builder("s");
        for (int i = 0; i < 100; i++) {
            builder.add(i, "P", i);
        }
        SpikeTable table = builder.build();

        assertThat(table.size()).isEqualTo(100);
        assertThat(table.record(99)).isEqualTo(new SpikeRecord(99.0, "P", 99));
        assertThat(table).isEqualTo(builder.build());
    }

    @Test
    void columnsAreCopies() {
        SpikeTable table = SpikeTable.builder("ms").add(1.0, "A", 1).build();
        table.timestamps()[0] = 42.0;
        assertThat(table.timestamp(0)).isEqualTo(1.0);
        assertThat(SpikeTable.builder("ms").build().isEmpty()).isTrue();
    }
}
