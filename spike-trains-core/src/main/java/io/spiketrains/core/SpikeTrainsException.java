package io.spiketrains.core;

import java.nio.file.Path;

/**
 * Base class for spike buffer failures.
 *
 * <p>All subclasses are unchecked. I/O causes are preserved.
 */
public abstract class SpikeTrainsException extends RuntimeException {

    protected SpikeTrainsException(String message) {
        super(message);
    }

    protected SpikeTrainsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a cache directory or file cannot be created, opened, read or written.
     * Fatal for the buffer; never retried.
     */
    public static class StorageUnavailable extends SpikeTrainsException {
        private final Path path;

        public StorageUnavailable(Path path, String message, Throwable cause) {
            super(message + ": " + path, cause);
            this.path = path;
        }

        public Path path() {
            return path;
        }
    }

    /**
     * Raised when an aggregate such as a time range is requested over zero spikes.
     */
    public static class EmptyBuffer extends SpikeTrainsException {
        public EmptyBuffer(String message) {
            super(message);
        }
    }

    /**
     * Raised when a second buffer is configured onto a backing file another buffer already owns.
     */
    public static class DuplicateCacheTarget extends SpikeTrainsException {
        private final Path path;

        public DuplicateCacheTarget(Path path) {
            super("cache file is already owned by another buffer: " + path);
            this.path = path;
        }

        public Path path() {
            return path;
        }
    }

    /**
     * Raised when a buffer is used after {@code close()}.
     */
    public static class BufferClosed extends SpikeTrainsException {
        public BufferClosed(String message) {
            super(message);
        }
    }

    /**
     * Raised when a cache file line is not {@code "<timestamp> <population> <node_id>"}.
     */
    public static class MalformedRecord extends SpikeTrainsException {
        public MalformedRecord(Path file, long lineNumber, String line) {
            super("malformed spike record at " + file + ":" + lineNumber + ": '" + line + "'");
        }
    }
}
