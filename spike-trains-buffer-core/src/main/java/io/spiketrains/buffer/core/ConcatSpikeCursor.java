package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeFilter;
import io.spiketrains.core.SpikeRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Spikes of several cache files, file after file. At most one file is open at a time.
 */
final class ConcatSpikeCursor implements SpikeCursor {

    private final List<Path> files;
    private final SpikeFilter filter;
    private int nextFile;
    private SpikeFileCursor current;
    private boolean closed;

    ConcatSpikeCursor(List<Path> files, SpikeFilter filter) {
        this.files = List.copyOf(files);
        this.filter = filter;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        while (current == null || !current.hasNext()) {
            if (current != null) {
                current.close();
                current = null;
            }
            if (nextFile == files.size()) {
                closed = true;
                return false;
            }
            current = SpikeFileCursor.open(files.get(nextFile++), filter);
        }
        return true;
    }

    @Override
    public SpikeRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    @Override
    public void close() {
        closed = true;
        if (current != null) {
            SpikeFileCursor c = current;
            current = null;
            c.close();
        }
    }
}
