package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeFilter;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Streams the spikes of one cache file, skipping those rejected by a filter.
 *
 * <p>The file handle is opened on construction and released on exhaustion, on {@link #close()}, and
 * before any read or parse failure propagates.
 */
final class SpikeFileCursor implements SpikeCursor {

    private final Path file;
    private final SpikeFilter filter;
    private BufferedReader reader;
    private long lineNumber;
    private SpikeRecord next;

    private SpikeFileCursor(Path file, SpikeFilter filter, BufferedReader reader) {
        this.file = file;
        this.filter = filter;
        this.reader = reader;
    }

    /**
     * Opens {@code file} and yields every spike accepted by {@code filter}.
     *
     * @throws SpikeTrainsException.StorageUnavailable if the file cannot be opened
     */
    static SpikeFileCursor open(Path file, SpikeFilter filter) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(filter, "filter");
        try {
            return new SpikeFileCursor(file, filter, Files.newBufferedReader(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(file, "failed to open spike cache file", e);
        }
    }

    static SpikeFileCursor open(Path file) {
        return open(file, (population, timestamp, nodeId) -> true);
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (reader == null) {
            return false;
        }
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                SpikeRecord spike = SpikeLines.parse(file, lineNumber, line);
                if (filter.test(spike)) {
                    next = spike;
                    return true;
                }
            }
        } catch (IOException e) {
            SpikeTrainsException failure =
                    new SpikeTrainsException.StorageUnavailable(file, "failed to read spike cache file", e);
            closeAfter(failure);
            throw failure;
        } catch (RuntimeException e) {
            closeAfter(e);
            throw e;
        }
        close();
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
        next = null;
        if (reader == null) {
            return;
        }
        BufferedReader r = reader;
        reader = null;
        try {
            r.close();
        } catch (IOException e) {
            throw new SpikeTrainsException.StorageUnavailable(file, "failed to close spike cache file", e);
        }
    }

    private void closeAfter(Throwable failure) {
        try {
            close();
        } catch (RuntimeException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }

    Path file() {
        return file;
    }
}
