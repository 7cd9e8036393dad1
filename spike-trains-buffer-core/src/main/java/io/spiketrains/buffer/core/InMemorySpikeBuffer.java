package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.SpikeBuffer;
import io.spiketrains.buffer.spi.SpikeQuery;
import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeFilter;
import io.spiketrains.core.SpikeFilters;
import io.spiketrains.core.SpikePredicate;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;
import io.spiketrains.core.TimeRange;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link SpikeBuffer} keeping every spike in process memory.
 *
 * <p>Spikes live in three parallel arrays. Appends are amortized O(1). Sorted reads walk a permutation of
 * row indices and never reorder the stored rows, so reads are repeatable in any order. The permutation for
 * each sort order is kept until the next write. Nothing is durable.
 */
public final class InMemorySpikeBuffer implements SpikeBuffer {

    private static final int INITIAL_CAPACITY = 1024;

    private final String defaultPopulation;
    private final Map<String, Long> populationCounts = new HashMap<>();
    private final Map<SortOrder, int[]> permutations = new EnumMap<>(SortOrder.class);
    private String units;

    private long[] nodeIds = new long[INITIAL_CAPACITY];
    private double[] timestamps = new double[INITIAL_CAPACITY];
    private String[] populations = new String[INITIAL_CAPACITY];
    private int size;
    private boolean closed;

    public InMemorySpikeBuffer(String defaultPopulation) {
        this(defaultPopulation, BufferConfig.DEFAULT_UNITS);
    }

    public InMemorySpikeBuffer(String defaultPopulation, String units) {
        this.defaultPopulation = SpikeLines.requirePopulation(Objects.requireNonNull(defaultPopulation, "defaultPopulation"));
        this.units = Objects.requireNonNull(units, "units");
    }

    public InMemorySpikeBuffer(BufferConfig config) {
        this(config.defaultPopulation(), config.units());
    }

    @Override
    public void addSpike(long nodeId, double timestamp, String population) {
        ensureOpen();
        String pop = population == null ? defaultPopulation : SpikeLines.requirePopulation(population);
        if (size == timestamps.length) {
            int capacity = size * 2;
            nodeIds = Arrays.copyOf(nodeIds, capacity);
            timestamps = Arrays.copyOf(timestamps, capacity);
            populations = Arrays.copyOf(populations, capacity);
        }
        nodeIds[size] = nodeId;
        timestamps[size] = timestamp;
        populations[size] = pop;
        size++;
        populationCounts.merge(pop, 1L, Long::sum);
        permutations.clear();
    }

    @Override
    public void flush() {
        ensureOpen();
    }

    @Override
    public SpikeCursor spikes(SpikeQuery query) {
        ensureOpen();
        Objects.requireNonNull(query, "query");
        int[] order = permutation(query.sortOrder());
        return new RowCursor(order, query.filter());
    }

    @Override
    public long nSpikes() {
        ensureOpen();
        return size;
    }

    @Override
    public long nSpikes(String population) {
        ensureOpen();
        return populationCounts.getOrDefault(population == null ? defaultPopulation : population, 0L);
    }

    @Override
    public Set<String> populations() {
        ensureOpen();
        return Collections.unmodifiableSet(new TreeSet<>(populationCounts.keySet()));
    }

    @Override
    public Set<Long> nodes(Set<String> populations) {
        ensureOpen();
        SpikePredicate predicate = SpikeFilters.create(populations, null);
        Set<Long> nodes = new HashSet<>();
        for (int i = 0; i < size; i++) {
            if (predicate.test(this.populations[i], timestamps[i])) {
                nodes.add(nodeIds[i]);
            }
        }
        return Collections.unmodifiableSet(nodes);
    }

    @Override
    public TimeRange timeRange(Set<String> populations) {
        ensureOpen();
        SpikePredicate predicate = SpikeFilters.create(populations, null);
        TimeRange range = null;
        for (int i = 0; i < size; i++) {
            if (predicate.test(this.populations[i], timestamps[i])) {
                range = range == null ? new TimeRange(timestamps[i], timestamps[i]) : range.including(timestamps[i]);
            }
        }
        if (range == null) {
            throw new SpikeTrainsException.EmptyBuffer(
                    populations == null ? "no spikes recorded" : "no spikes recorded for populations " + populations);
        }
        return range;
    }

    @Override
    public String units() {
        ensureOpen();
        return units;
    }

    @Override
    public void setUnits(String units) {
        ensureOpen();
        this.units = Objects.requireNonNull(units, "units");
    }

    @Override
    public String defaultPopulation() {
        return defaultPopulation;
    }

    /**
     * Drops every stored spike. Further use fails; closing again does nothing.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        nodeIds = new long[0];
        timestamps = new double[0];
        populations = new String[0];
        size = 0;
        populationCounts.clear();
        permutations.clear();
    }

    private int[] permutation(SortOrder sortOrder) {
        if (sortOrder == SortOrder.NONE) {
            return null;
        }
        int[] cached = permutations.get(sortOrder);
        if (cached != null) {
            return cached;
        }
        Integer[] rows = new Integer[size];
        for (int i = 0; i < size; i++) {
            rows[i] = i;
        }
        Comparator<Integer> byRow = switch (sortOrder) {
            case BY_TIME -> (a, b) -> {
                int c = Double.compare(timestamps[a], timestamps[b]);
                if (c != 0) return c;
                c = Long.compare(nodeIds[a], nodeIds[b]);
                return c != 0 ? c : populations[a].compareTo(populations[b]);
            };
            case BY_ID -> (a, b) -> {
                int c = Long.compare(nodeIds[a], nodeIds[b]);
                if (c != 0) return c;
                c = Double.compare(timestamps[a], timestamps[b]);
                return c != 0 ? c : populations[a].compareTo(populations[b]);
            };
            case NONE -> throw new IllegalArgumentException("unsupported sort order " + sortOrder);
        };
        Arrays.sort(rows, byRow);
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = rows[i];
        }
        permutations.put(sortOrder, order);
        return order;
    }

    private void ensureOpen() {
        if (closed) {
            throw new SpikeTrainsException.BufferClosed("in-memory spike buffer is closed");
        }
    }

    /**
     * Walks rows in permutation order ({@code null} for storage order), up to the row count at creation.
     */
    private final class RowCursor implements SpikeCursor {
        private final int[] order;
        private final SpikeFilter filter;
        private final int limit;
        private int position;
        private SpikeRecord next;
        private boolean done;

        private RowCursor(int[] order, SpikeFilter filter) {
            this.order = order;
            this.filter = filter;
            this.limit = size;
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                throw new SpikeTrainsException.BufferClosed("in-memory spike buffer is closed");
            }
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            while (position < limit) {
                int row = order == null ? position : order[position];
                position++;
                if (filter.test(populations[row], timestamps[row], nodeIds[row])) {
                    next = new SpikeRecord(timestamps[row], populations[row], nodeIds[row]);
                    return true;
                }
            }
            done = true;
            return false;
        }

        @Override
        public SpikeRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SpikeRecord spike = next;
            next = null;
            return spike;
        }

        @Override
        public void close() {
            done = true;
            next = null;
        }
    }
}
