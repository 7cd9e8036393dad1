package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeTrainsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only spike log owned by exactly one buffer.
 *
 * <p>The file is claimed through {@link CacheTargets}, truncated, and then held open for every append
 * until {@link #close()}, which deletes it.
 */
final class SpikeCacheFile implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SpikeCacheFile.class);

    private final Path path;
    private final CacheTargets.Claim claim;
    private final FileChannel channel;
    private final BufferedWriter writer;
    private long appended;
    private boolean closed;

    private SpikeCacheFile(Path path, CacheTargets.Claim claim, FileChannel channel) {
        this.path = path;
        this.claim = claim;
        this.channel = channel;
        this.writer = new BufferedWriter(Channels.newWriter(channel, StandardCharsets.UTF_8));
    }

    /**
     * Claims and opens {@code path} for appending, discarding content left by an earlier run.
     * The parent directory must already exist.
     */
    static SpikeCacheFile create(Path path) {
        CacheTargets.Claim claim = CacheTargets.claim(path);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            channel.truncate(0);
            logger.debug("Opened spike cache file {}", path);
            return new SpikeCacheFile(path, claim, channel);
        } catch (IOException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            claim.close();
            throw new SpikeTrainsException.StorageUnavailable(path, "failed to open spike cache file", e);
        }
    }

    void append(double timestamp, String population, long nodeId) {
        try {
            writer.write(SpikeLines.format(timestamp, population, nodeId));
            writer.newLine();
            appended++;
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(path, "failed to append spike", e);
        }
    }

    /**
     * Pushes buffered lines to the file and forces them to the storage device.
     */
    void flush() {
        try {
            writer.flush();
            channel.force(false);
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(path, "failed to flush spike cache file", e);
        }
    }

    /**
     * Spikes appended so far; grows with every append, so it also identifies the file's content version.
     */
    long appended() {
        return appended;
    }

    Path path() {
        return path;
    }

    /**
     * Closes the handle, deletes the file and releases the claim. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            logger.warn("Failed to close spike cache file {}", path, e);
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete spike cache file {}", path, e);
        } finally {
            claim.close();
        }
        logger.debug("Closed and deleted spike cache file {}", path);
    }
}
