package io.spiketrains.table.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.spiketrains.buffer.spi.SpikeTable;

@JsonPropertyOrder({SpikeTable.TIMESTAMPS_COLUMN, SpikeTable.POPULATION_COLUMN, SpikeTable.NODE_IDS_COLUMN})
final class CsvSpikeRow {

    @JsonProperty(SpikeTable.TIMESTAMPS_COLUMN)
    final double timestamp;

    @JsonProperty(SpikeTable.POPULATION_COLUMN)
    final String population;

    @JsonProperty(SpikeTable.NODE_IDS_COLUMN)
    final long nodeId;

    @JsonCreator
    CsvSpikeRow(
            @JsonProperty(SpikeTable.TIMESTAMPS_COLUMN) double timestamp,
            @JsonProperty(SpikeTable.POPULATION_COLUMN) String population,
            @JsonProperty(SpikeTable.NODE_IDS_COLUMN) long nodeId) {
        this.timestamp = timestamp;
        this.population = population;
        this.nodeId = nodeId;
    }
}
