package io.spiketrains.buffer.spi;

import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeFilter;
import io.spiketrains.core.SpikeFilters;
import io.spiketrains.core.TimeWindow;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Constraints and ordering for a spike read. Absent constraints match everything.
 */
public final class SpikeQuery {

    private static final SpikeQuery ALL = builder().build();

    private final Set<Long> nodeIds;
    private final Set<String> populations;
    private final TimeWindow timeWindow;
    private final SortOrder sortOrder;

    private SpikeQuery(Builder b) {
        this.nodeIds = b.nodeIds == null ? null : Set.copyOf(b.nodeIds);
        this.populations = b.populations == null ? null : Set.copyOf(b.populations);
        this.timeWindow = b.timeWindow;
        this.sortOrder = b.sortOrder;
    }

    public static SpikeQuery all() {
        return ALL;
    }

    public static SpikeQuery sortedBy(SortOrder sortOrder) {
        return builder().sortOrder(sortOrder).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Set<Long>> nodeIds() {
        return Optional.ofNullable(nodeIds);
    }

    public Optional<Set<String>> populations() {
        return Optional.ofNullable(populations);
    }

    public Optional<TimeWindow> timeWindow() {
        return Optional.ofNullable(timeWindow);
    }

    public SortOrder sortOrder() {
        return sortOrder;
    }

    /**
     * The per-spike filter for this query's constraints.
     */
    public SpikeFilter filter() {
        return SpikeFilters.create(nodeIds, populations, timeWindow);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.nodeIds = nodeIds;
        b.populations = populations;
        b.timeWindow = timeWindow;
        b.sortOrder = sortOrder;
        return b;
    }

    @Override
    public String toString() {
        return "SpikeQuery{nodeIds=" + nodeIds + ", populations=" + populations
                + ", timeWindow=" + timeWindow + ", sortOrder=" + sortOrder + '}';
    }

    public static final class Builder {
        private Set<Long> nodeIds;
        private Set<String> populations;
        private TimeWindow timeWindow;
        private SortOrder sortOrder = SortOrder.NONE;

        private Builder() {}

        public Builder nodeIds(long... nodeIds) {
            Set<Long> ids = new LinkedHashSet<>();
            for (long id : nodeIds) {
                ids.add(id);
            }
            this.nodeIds = ids;
            return this;
        }

        /**
         * @param nodeIds accepted node ids, {@code null} for all
         */
        public Builder nodeIds(Set<Long> nodeIds) {
            this.nodeIds = nodeIds;
            return this;
        }

        public Builder populations(String... populations) {
            this.populations = new LinkedHashSet<>(Arrays.asList(populations));
            return this;
        }

        /**
         * @param populations accepted population labels, {@code null} for all
         */
        public Builder populations(Set<String> populations) {
            this.populations = populations;
            return this;
        }

        /**
         * @param timeWindow inclusive window, {@code null} for all times
         */
        public Builder timeWindow(TimeWindow timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder timeWindow(double lo, double hi) {
            return timeWindow(new TimeWindow(lo, hi));
        }

        public Builder sortOrder(SortOrder sortOrder) {
            this.sortOrder = Objects.requireNonNull(sortOrder, "sortOrder");
            return this;
        }

        public SpikeQuery build() {
            return new SpikeQuery(this);
        }
    }
}
