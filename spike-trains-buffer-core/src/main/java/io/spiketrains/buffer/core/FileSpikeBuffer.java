package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.SpikeBuffer;
import io.spiketrains.buffer.spi.SpikeQuery;
import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeTrainsException;
import io.spiketrains.core.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link SpikeBuffer} appending every spike to one text file in a cache directory.
 *
 * <p>Storage layout:
 * <pre>
 * cacheDir/
 *   .{cacheName}.cache.csv           - append log, one "timestamp population node_id" line per spike
 *   .{cacheName}.cache.csv.lock      - ownership lock, kept after close
 *   .{cacheName}.cache.csv.by_time   - sorted copy, built on demand
 *   .{cacheName}.cache.csv.by_id     - sorted copy, built on demand
 * </pre>
 *
 * <p>The log keeps insertion order forever. A sorted read builds (or reuses) a separate sorted copy, so
 * alternating sort orders cost at most one sort per order between writes, at the price of up to two extra
 * files the size of the log. The log file is owned exclusively; a second buffer on the same directory and
 * cache name fails with {@link SpikeTrainsException.DuplicateCacheTarget}. {@link #close()} deletes every
 * file listed above except the empty lock file, which the next buffer on the same target reuses.
 */
public final class FileSpikeBuffer implements SpikeBuffer {

    private static final Logger logger = LoggerFactory.getLogger(FileSpikeBuffer.class);

    private final String defaultPopulation;
    private final SpikeCacheFile log;
    private final SortedFileCache sortedCopies;
    private final BufferCursors cursors;
    private final Map<String, Long> populationCounts = new HashMap<>();
    private String units;
    private boolean closed;

    public FileSpikeBuffer(Path cacheDir, String defaultPopulation) {
        this(BufferConfig.builder()
                .backend(BufferConfig.Backend.FILE)
                .cacheDir(cacheDir)
                .defaultPopulation(defaultPopulation)
                .build());
    }

    public FileSpikeBuffer(BufferConfig config) {
        Objects.requireNonNull(config, "config");
        Path cacheDir = Objects.requireNonNull(config.cacheDir(), "cacheDir");
        this.defaultPopulation = config.defaultPopulation();
        this.units = config.units();
        ensureDirectory(cacheDir);
        this.log = SpikeCacheFile.create(cacheDir.resolve(cacheFileName(config.cacheName())));
        this.sortedCopies = new SortedFileCache(config.sortRunSize(), "");
        this.cursors = new BufferCursors("file spike buffer " + log.path());
        logger.info("Opened file spike buffer at {}", log.path());
    }

    /**
     * Name of the append log for {@code cacheName} inside the cache directory.
     */
    public static String cacheFileName(String cacheName) {
        return "." + cacheName + ".cache.csv";
    }

    public Path cacheFile() {
        return log.path();
    }

    @Override
    public void addSpike(long nodeId, double timestamp, String population) {
        ensureOpen();
        String pop = population == null ? defaultPopulation : SpikeLines.requirePopulation(population);
        log.append(timestamp, pop, nodeId);
        populationCounts.merge(pop, 1L, Long::sum);
    }

    @Override
    public void flush() {
        ensureOpen();
        log.flush();
    }

    @Override
    public SpikeCursor spikes(SpikeQuery query) {
        Objects.requireNonNull(query, "query");
        flush();
        if (!query.sortOrder().isSorted()) {
            return cursors.track(SpikeFileCursor.open(log.path(), query.filter()));
        }
        Path sorted = sortedCopies.sorted(log.path(), query.sortOrder());
        return cursors.track(SpikeFileCursor.open(sorted, query.filter()));
    }

    @Override
    public long nSpikes() {
        ensureOpen();
        return log.appended();
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
        flush();
        return Collections.unmodifiableSet(SpikeFileScans.nodes(List.of(log.path()), populations));
    }

    @Override
    public TimeRange timeRange(Set<String> populations) {
        flush();
        return SpikeFileScans.timeRange(List.of(log.path()), populations);
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
     * Closes open cursors and the log handle, deletes the log and every sorted copy, and releases the
     * lock. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            cursors.closeAll();
        } finally {
            try {
                log.close();
            } finally {
                sortedCopies.close();
            }
        }
        logger.info("Closed file spike buffer at {}", log.path());
    }

    private void ensureOpen() {
        if (closed) {
            throw new SpikeTrainsException.BufferClosed("file spike buffer is closed: " + log.path());
        }
    }

    static void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(dir, "failed to create spike cache directory", e);
        }
    }
}
