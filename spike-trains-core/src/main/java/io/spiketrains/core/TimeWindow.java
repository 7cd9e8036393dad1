package io.spiketrains.core;

/**
 * Closed time interval {@code [lo, hi]} used to restrict reads.
 */
public record TimeWindow(double lo, double hi) {

    public TimeWindow {
        if (Double.isNaN(lo) || Double.isNaN(hi)) {
            throw new IllegalArgumentException("time window bounds must not be NaN");
        }
        if (lo > hi) {
            throw new IllegalArgumentException("time window lower bound " + lo + " is after upper bound " + hi);
        }
    }

    public static TimeWindow of(double lo, double hi) {
        return new TimeWindow(lo, hi);
    }

    public boolean contains(double timestamp) {
        return lo <= timestamp && timestamp <= hi;
    }
}
