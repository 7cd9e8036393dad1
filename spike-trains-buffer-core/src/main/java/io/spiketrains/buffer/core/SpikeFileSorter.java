package io.spiketrains.buffer.core;

import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts a spike cache file into a separate target file; the source is never modified.
 *
 * <p>Runs of at most {@code runSize} spikes are sorted in memory. A source that fits in one run is written
 * straight to the target, larger sources are spilled run by run next to the target and combined with a
 * {@link SpikeMergeReader}. The target is replaced atomically where the file system allows it.
 */
final class SpikeFileSorter {

    private static final Logger logger = LoggerFactory.getLogger(SpikeFileSorter.class);

    private final int runSize;

    SpikeFileSorter(int runSize) {
        if (runSize <= 0) {
            throw new IllegalArgumentException("runSize must be positive");
        }
        this.runSize = runSize;
    }

    /**
     * @return number of spikes written to {@code target}
     */
    long sort(Path source, Path target, SortOrder sortOrder) {
        Comparator<SpikeRecord> order = sortOrder.comparator()
                .orElseThrow(() -> new IllegalArgumentException("cannot sort by " + sortOrder));
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        List<Path> runs = new ArrayList<>();
        long count = 0;
        try {
            List<SpikeRecord> run = new ArrayList<>();
            try (SpikeCursor cursor = SpikeFileCursor.open(source)) {
                while (cursor.hasNext()) {
                    run.add(cursor.next());
                    count++;
                    if (run.size() == runSize) {
                        Path runFile = target.resolveSibling(target.getFileName() + ".run" + runs.size());
                        writeSorted(run, order, runFile);
                        runs.add(runFile);
                        run.clear();
                    }
                }
            }
            if (runs.isEmpty()) {
                writeSorted(run, order, tmp);
            } else {
                if (!run.isEmpty()) {
                    Path runFile = target.resolveSibling(target.getFileName() + ".run" + runs.size());
                    writeSorted(run, order, runFile);
                    runs.add(runFile);
                }
                mergeRuns(runs, sortOrder, tmp);
            }
            moveInto(tmp, target);
            logger.debug("Sorted {} spikes of {} by {} into {} using {} runs", count, source, sortOrder, target, Math.max(1, runs.size()));
            return count;
        } finally {
            for (Path runFile : runs) {
                deleteQuietly(runFile);
            }
            deleteQuietly(tmp);
        }
    }

    private static void writeSorted(List<SpikeRecord> run, Comparator<SpikeRecord> order, Path file) {
        run.sort(order);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (SpikeRecord spike : run) {
                writer.write(SpikeLines.format(spike));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(file, "failed to write sorted spikes", e);
        }
    }

    private static void mergeRuns(List<Path> runs, SortOrder sortOrder, Path file) {
        try (SpikeMergeReader merge = SpikeMergeReader.open(runs, sortOrder, (population, timestamp, nodeId) -> true);
             BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            while (merge.hasNext()) {
                writer.write(SpikeLines.format(merge.next()));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(file, "failed to write merged spikes", e);
        }
    }

    private static void moveInto(Path tmp, Path target) {
        try {
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(target, "failed to replace sorted spike file", e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary spike file {}", file, e);
        }
    }
}
