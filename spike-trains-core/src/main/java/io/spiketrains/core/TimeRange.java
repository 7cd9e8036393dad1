package io.spiketrains.core;

/**
 * Smallest and largest timestamp recorded in a buffer.
 */
public record TimeRange(double min, double max) {

    /**
     * Widens this range so it also covers {@code timestamp}.
     */
    public TimeRange including(double timestamp) {
        return new TimeRange(Math.min(min, timestamp), Math.max(max, timestamp));
    }
}
