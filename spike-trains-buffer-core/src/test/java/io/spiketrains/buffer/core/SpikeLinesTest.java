package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpikeLinesTest {

    private static final Path FILE = Path.of("spikes.csv");

    @Test
    void formatsSpaceDelimitedFields() {
        assertThat(SpikeLines.format(0.25, "v1", 17)).isEqualTo("0.25 v1 17");
        assertThat(SpikeLines.parse(FILE, 1, "0.25 v1 17")).isEqualTo(new SpikeRecord(0.25, "v1", 17));
    }

    @Test
    void keepsTimestampPrecision() {
        SpikeRecord spike = new SpikeRecord(0.1 + 0.2, "lgn", Long.MAX_VALUE);
        assertThat(SpikeLines.parse(FILE, 1, SpikeLines.format(spike))).isEqualTo(spike);
    }

    @Test
    void rejectsMalformedLines() {
        for (String line : new String[] {"1.0 A", "1.0 A 2 3", "x A 2", "1.0 A two", " A 2", "1.0  2", "1.0 A "}) {
            assertThatThrownBy(() -> SpikeLines.parse(FILE, 3, line))
                    .as(line)
                    .isInstanceOf(SpikeTrainsException.MalformedRecord.class)
                    .hasMessageContaining("spikes.csv:3");
        }
    }

    @Test
    void rejectsPopulationsThatBreakTheFormat() {
        assertThat(SpikeLines.requirePopulation("v1")).isEqualTo("v1");
        assertThatThrownBy(() -> SpikeLines.requirePopulation("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpikeLines.requirePopulation("a\tb")).isInstanceOf(IllegalArgumentException.class);
    }
}
