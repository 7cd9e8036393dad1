package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Cursors a disk-backed buffer has handed out and not yet seen exhausted or closed.
 *
 * <p>{@link #closeAll()} releases every open file handle before the buffer deletes its files. A cursor
 * used after that throws {@link SpikeTrainsException.BufferClosed} instead of reading a deleted file.
 */
final class BufferCursors {

    private final String owner;
    private final Set<TrackedCursor> open = new LinkedHashSet<>();
    private boolean closed;

    /**
     * @param owner description of the owning buffer, used in {@code BufferClosed} messages
     */
    BufferCursors(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    SpikeCursor track(SpikeCursor cursor) {
        Objects.requireNonNull(cursor, "cursor");
        if (closed) {
            cursor.close();
            throw new SpikeTrainsException.BufferClosed(owner + " is closed");
        }
        TrackedCursor tracked = new TrackedCursor(cursor);
        open.add(tracked);
        return tracked;
    }

    int openCount() {
        return open.size();
    }

    /**
     * Closes every tracked cursor. Idempotent.
     */
    void closeAll() {
        if (closed) {
            return;
        }
        closed = true;
        List<TrackedCursor> cursors = new ArrayList<>(open);
        open.clear();
        RuntimeException failure = null;
        for (TrackedCursor cursor : cursors) {
            try {
                cursor.delegate.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private final class TrackedCursor implements SpikeCursor {
        private final SpikeCursor delegate;

        private TrackedCursor(SpikeCursor delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            ensureOwnerOpen();
            if (delegate.hasNext()) {
                return true;
            }
            open.remove(this);
            return false;
        }

        @Override
        public SpikeRecord next() {
            ensureOwnerOpen();
            return delegate.next();
        }

        @Override
        public void close() {
            open.remove(this);
            delegate.close();
        }

        private void ensureOwnerOpen() {
            if (closed) {
                throw new SpikeTrainsException.BufferClosed(owner + " is closed");
            }
        }
    }
}
