package io.spiketrains.buffer.spi;

/**
 * The cooperating-worker runtime a distributed buffer runs inside, such as an MPI job.
 *
 * <p>Supplied by the caller; buffers never own it.
 */
public interface DistributedRuntime {

    /**
     * Index of this worker, {@code 0 <= rank < size}.
     */
    int rank();

    /**
     * Number of cooperating workers, at least 1.
     */
    int size();

    /**
     * Blocks until every worker has called this method.
     */
    void barrier();

    /**
     * Single-process runtime: rank 0 of 1, barrier returns immediately.
     */
    static DistributedRuntime local() {
        return LocalRuntime.INSTANCE;
    }

    final class LocalRuntime implements DistributedRuntime {
        private static final LocalRuntime INSTANCE = new LocalRuntime();

        private LocalRuntime() {}

        @Override
        public int rank() {
            return 0;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public void barrier() {}

        @Override
        public String toString() {
            return "LocalRuntime";
        }
    }
}
