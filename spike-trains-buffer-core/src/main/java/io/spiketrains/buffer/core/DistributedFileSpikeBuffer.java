package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.DistributedRuntime;
import io.spiketrains.buffer.spi.SpikeBuffer;
import io.spiketrains.buffer.spi.SpikeQuery;
import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeTrainsException;
import io.spiketrains.core.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link SpikeBuffer} for a simulation split across cooperating workers, one cache file per worker rank.
 *
 * <p>Storage layout, shared by all workers:
 * <pre>
 * cacheDir/
 *   .{cacheName}.cache.node0.csv                  - spikes written by rank 0
 *   .{cacheName}.cache.node1.csv                  - spikes written by rank 1
 *   ...
 *   .{cacheName}.cache.node{r}.csv.by_time.reader{q} - sorted copy of rank r's file, owned by reader rank q
 * </pre>
 *
 * <p>Writes only touch this worker's own file, so workers never contend. Reads span every worker's file:
 * the caller must make sure all workers have flushed their last write, typically with a barrier, before
 * reading. A worker file that does not exist is read as empty.
 *
 * <p>Aggregates ({@link #populations()}, {@link #nSpikes()}, {@link #nodes}, {@link #timeRange}) rescan
 * every file on each call; cache the result when it is needed repeatedly. Sorted reads sort each worker
 * file into a copy owned by this reader and merge the copies with a {@link SpikeMergeReader}; equal keys are
 * emitted in rank order. Unsorted reads concatenate the files in rank order.
 */
public final class DistributedFileSpikeBuffer implements SpikeBuffer {

    private static final Logger logger = LoggerFactory.getLogger(DistributedFileSpikeBuffer.class);

    private final Path cacheDir;
    private final String cacheName;
    private final String defaultPopulation;
    private final int rank;
    private final int workers;
    private final SpikeCacheFile log;
    private final SortedFileCache sortedCopies;
    private final BufferCursors cursors;
    private String units;
    private boolean closed;

    /**
     * Rank 0 creates the cache directory, then every worker waits on the runtime barrier before opening its
     * own file. Must therefore be called collectively by all workers.
     */
    public DistributedFileSpikeBuffer(BufferConfig config) {
        Objects.requireNonNull(config, "config");
        DistributedRuntime runtime = config.runtime();
        this.cacheDir = Objects.requireNonNull(config.cacheDir(), "cacheDir");
        this.cacheName = config.cacheName();
        this.defaultPopulation = config.defaultPopulation();
        this.units = config.units();
        this.rank = runtime.rank();
        this.workers = runtime.size();

        SpikeTrainsException directoryFailure = null;
        if (rank == 0) {
            try {
                FileSpikeBuffer.ensureDirectory(cacheDir);
            } catch (SpikeTrainsException e) {
                directoryFailure = e;
            }
        }
        // Rank 0 reaches the barrier even when directory creation failed.
        runtime.barrier();
        if (directoryFailure != null) {
            throw directoryFailure;
        }

        this.log = SpikeCacheFile.create(rankFile(rank));
        this.sortedCopies = new SortedFileCache(config.sortRunSize(), ".reader" + rank);
        this.cursors = new BufferCursors("distributed spike buffer rank " + rank);
        logger.info("Opened distributed spike buffer rank {}/{} at {}", rank, workers, log.path());
    }

    /**
     * Name of rank {@code rank}'s cache file for {@code cacheName} inside the cache directory.
     */
    public static String rankFileName(String cacheName, int rank) {
        return "." + cacheName + ".cache.node" + rank + ".csv";
    }

    public Path rankFile(int rank) {
        if (rank < 0 || rank >= workers) {
            throw new IllegalArgumentException("rank " + rank + " outside [0, " + workers + ")");
        }
        return cacheDir.resolve(rankFileName(cacheName, rank));
    }

    public int rank() {
        return rank;
    }

    /**
     * Number of cooperating workers, each owning one cache file.
     */
    public int workers() {
        return workers;
    }

    @Override
    public void addSpike(long nodeId, double timestamp, String population) {
        ensureOpen();
        log.append(timestamp, population == null ? defaultPopulation : SpikeLines.requirePopulation(population), nodeId);
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
        List<Path> files = existingRankFiles();
        if (!query.sortOrder().isSorted()) {
            return cursors.track(new ConcatSpikeCursor(files, query.filter()));
        }
        List<Path> sorted = new ArrayList<>(files.size());
        for (Path file : files) {
            sorted.add(sortedCopies.sorted(file, query.sortOrder()));
        }
        logger.debug("Rank {} merging {} worker files by {}", rank, sorted.size(), query.sortOrder());
        return cursors.track(SpikeMergeReader.open(sorted, query.sortOrder(), query.filter()));
    }

    @Override
    public long nSpikes() {
        long total = 0;
        for (long count : gather().values()) {
            total += count;
        }
        return total;
    }

    @Override
    public long nSpikes(String population) {
        return gather().getOrDefault(population == null ? defaultPopulation : population, 0L);
    }

    @Override
    public Set<String> populations() {
        return Collections.unmodifiableSet(new TreeSet<>(gather().keySet()));
    }

    @Override
    public Set<Long> nodes(Set<String> populations) {
        flush();
        return Collections.unmodifiableSet(SpikeFileScans.nodes(existingRankFiles(), populations));
    }

    @Override
    public TimeRange timeRange(Set<String> populations) {
        flush();
        return SpikeFileScans.timeRange(existingRankFiles(), populations);
    }

    /**
     * Spikes this worker has written, without reading the other workers' files.
     */
    public long localSpikes() {
        ensureOpen();
        return log.appended();
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
     * Closes cursors handed out by this worker, then closes and deletes this worker's file and every sorted
     * copy this worker built. The file's empty lock file stays for reuse. Other workers' files are left
     * alone. Idempotent.
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
        logger.info("Closed distributed spike buffer rank {}/{}", rank, workers);
    }

    private Map<String, Long> gather() {
        flush();
        return SpikeFileScans.populationCounts(existingRankFiles());
    }

    private List<Path> existingRankFiles() {
        List<Path> files = new ArrayList<>(workers);
        for (int r = 0; r < workers; r++) {
            Path file = rankFile(r);
            if (Files.exists(file)) {
                files.add(file);
            } else {
                logger.warn("Spike cache file of rank {} not found, reading it as empty: {}", r, file);
            }
        }
        return files;
    }

    private void ensureOpen() {
        if (closed) {
            throw new SpikeTrainsException.BufferClosed("distributed spike buffer rank " + rank + " is closed");
        }
    }
}
