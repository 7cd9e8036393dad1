package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;

import java.nio.file.Path;

/**
 * Cache file line format: {@code "<timestamp> <population> <node_id>"}, space delimited, no header,
 * no escaping.
 */
final class SpikeLines {

    static final char DELIMITER = ' ';

    private SpikeLines() {}

    static String format(double timestamp, String population, long nodeId) {
        return Double.toString(timestamp) + DELIMITER + population + DELIMITER + nodeId;
    }

    static String format(SpikeRecord spike) {
        return format(spike.timestamp(), spike.population(), spike.nodeId());
    }

    static SpikeRecord parse(Path file, long lineNumber, String line) {
        int first = line.indexOf(DELIMITER);
        int second = first < 0 ? -1 : line.indexOf(DELIMITER, first + 1);
        if (first <= 0 || second <= first + 1 || second == line.length() - 1
                || line.indexOf(DELIMITER, second + 1) >= 0) {
            throw new SpikeTrainsException.MalformedRecord(file, lineNumber, line);
        }
        try {
            double timestamp = Double.parseDouble(line.substring(0, first));
            long nodeId = Long.parseLong(line.substring(second + 1));
            return new SpikeRecord(timestamp, line.substring(first + 1, second), nodeId);
        } catch (NumberFormatException e) {
            throw new SpikeTrainsException.MalformedRecord(file, lineNumber, line);
        }
    }

    /**
     * Rejects population labels that would break the line format.
     */
    static String requirePopulation(String population) {
        if (population.isEmpty()) {
            throw new IllegalArgumentException("population must not be empty");
        }
        for (int i = 0; i < population.length(); i++) {
            if (Character.isWhitespace(population.charAt(i))) {
                throw new IllegalArgumentException("population must not contain whitespace: '" + population + "'");
            }
        }
        return population;
    }
}
