package io.spiketrains.buffer.spi;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable columnar snapshot of spikes: one timestamp, population and node id column, row aligned.
 */
public final class SpikeTable {

    public static final String TIMESTAMPS_COLUMN = "timestamps";
    public static final String POPULATION_COLUMN = "population";
    public static final String NODE_IDS_COLUMN = "node_ids";

    private final double[] timestamps;
    private final String[] populations;
    private final long[] nodeIds;
    private final String units;

    private SpikeTable(double[] timestamps, String[] populations, long[] nodeIds, String units) {
        this.timestamps = timestamps;
        this.populations = populations;
        this.nodeIds = nodeIds;
        this.units = units;
    }

    /**
     * Drains {@code cursor} into a table and closes it.
     */
    public static SpikeTable collect(SpikeCursor cursor, String units) {
        Builder b = builder(units);
        try (cursor) {
            while (cursor.hasNext()) {
                b.add(cursor.next());
            }
        }
        return b.build();
    }

    public static Builder builder(String units) {
        return new Builder(units);
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public String units() {
        return units;
    }

    public double timestamp(int row) {
        return timestamps[row];
    }

    public String population(int row) {
        return populations[row];
    }

    public long nodeId(int row) {
        return nodeIds[row];
    }

    public SpikeRecord record(int row) {
        return new SpikeRecord(timestamps[row], populations[row], nodeIds[row]);
    }

    public double[] timestamps() {
        return timestamps.clone();
    }

    public List<String> populations() {
        return List.of(populations);
    }

    public long[] nodeIds() {
        return nodeIds.clone();
    }

    /**
     * Row view of this table.
     */
    public List<SpikeRecord> records() {
        return new AbstractList<>() {
            @Override
            public SpikeRecord get(int index) {
                return record(index);
            }

            @Override
            public int size() {
                return SpikeTable.this.size();
            }
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof SpikeTable)) return false;
        SpikeTable t = (SpikeTable) other;
        return units.equals(t.units)
                && Arrays.equals(timestamps, t.timestamps)
                && Arrays.equals(populations, t.populations)
                && Arrays.equals(nodeIds, t.nodeIds);
    }

    @Override
    public int hashCode() {
        int h = units.hashCode();
        h = 31 * h + Arrays.hashCode(timestamps);
        h = 31 * h + Arrays.hashCode(populations);
        return 31 * h + Arrays.hashCode(nodeIds);
    }

    @Override
    public String toString() {
        return "SpikeTable{rows=" + size() + ", units=" + units + '}';
    }

    public static final class Builder {
        private final String units;
        private double[] timestamps = new double[16];
        private String[] populations = new String[16];
        private long[] nodeIds = new long[16];
        private int size;

        private Builder(String units) {
            this.units = Objects.requireNonNull(units, "units");
        }

        public Builder add(double timestamp, String population, long nodeId) {
            Objects.requireNonNull(population, "population");
            if (size == timestamps.length) {
                int capacity = size * 2;
                timestamps = Arrays.copyOf(timestamps, capacity);
                populations = Arrays.copyOf(populations, capacity);
                nodeIds = Arrays.copyOf(nodeIds, capacity);
            }
            timestamps[size] = timestamp;
            populations[size] = population;
            nodeIds[size] = nodeId;
            size++;
            return this;
        }

        public Builder add(SpikeRecord spike) {
            return add(spike.timestamp(), spike.population(), spike.nodeId());
        }

        public SpikeTable build() {
            return new SpikeTable(
                    Arrays.copyOf(timestamps, size),
                    Arrays.copyOf(populations, size),
                    Arrays.copyOf(nodeIds, size),
                    units);
        }
    }
}
