package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.DistributedRuntime;
import io.spiketrains.buffer.spi.SpikeBuffer;
import io.spiketrains.buffer.spi.SpikeQuery;
import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeCursor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Write and read throughput of the spike buffer backends.
 *
 * <p>Run with: {@code java SpikeBufferBenchmark [spikes] [workers]}
 *
 * <p>Benchmarks:
 * <ul>
 *   <li>Writes - {@code addSpike} followed by one flush</li>
 *   <li>Unsorted read - full scan in storage order</li>
 *   <li>Sorted read by time - first read builds the ordering, second reuses it</li>
 *   <li>Distributed merge - every worker writes its share, rank 0 reads the merged stream</li>
 * </ul>
 */
public class SpikeBufferBenchmark {

    private static final int DEFAULT_SPIKES = 1_000_000;
    private static final int DEFAULT_WORKERS = 4;
    private static final int NODES = 10_000;
    private static final double SIM_TIME_MS = 3_000.0;

    public static void main(String[] args) throws Exception {
        int spikes = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_SPIKES;
        int workers = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_WORKERS;

        System.out.println("=".repeat(80));
        System.out.println("Spike Buffer Benchmark");
        System.out.println("=".repeat(80));
        System.out.printf("  Spikes:   %d%n", spikes);
        System.out.printf("  Workers:  %d (distributed backend)%n", workers);
        System.out.println();

        Path tempDir = Files.createTempDirectory("spike-buffer-benchmark");
        try {
            runSingle("memory", new InMemorySpikeBuffer("benchmark"), spikes);
            runSingle("file", new FileSpikeBuffer(tempDir.resolve("file"), "benchmark"), spikes);
            runDistributed(tempDir.resolve("distributed"), spikes, workers);
        } finally {
            deleteRecursively(tempDir);
        }
    }

    private static void runSingle(String name, SpikeBuffer buffer, int spikes) {
        try (buffer) {
            Random random = new Random(42);
            long start = System.nanoTime();
            for (int i = 0; i < spikes; i++) {
                buffer.addSpike(random.nextInt(NODES), random.nextDouble() * SIM_TIME_MS);
            }
            buffer.flush();
            report(name, "write", spikes, System.nanoTime() - start);

            report(name, "read unsorted", spikes, timeRead(buffer, SortOrder.NONE));
            report(name, "read by_time (cold)", spikes, timeRead(buffer, SortOrder.BY_TIME));
            report(name, "read by_time (warm)", spikes, timeRead(buffer, SortOrder.BY_TIME));
            report(name, "read by_id", spikes, timeRead(buffer, SortOrder.BY_ID));
        }
        System.out.println();
    }

    private static void runDistributed(Path cacheDir, int spikes, int workers) throws Exception {
        CyclicBarrier barrier = new CyclicBarrier(workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int rank = 0; rank < workers; rank++) {
                int r = rank;
                results.add(pool.submit(() -> runWorker(cacheDir, r, workers, barrier, spikes / workers)));
            }
            for (Future<Long> result : results) {
                result.get();
            }
            report("distributed", "merge by_time (rank 0)", spikes, results.get(0).get());
        } finally {
            pool.shutdown();
        }
        System.out.println();
    }

    private static long runWorker(Path cacheDir, int rank, int size, CyclicBarrier barrier, int spikes) {
        DistributedRuntime runtime = new ThreadRuntime(rank, size, barrier);
        BufferConfig config = BufferConfig.builder()
                .backend(BufferConfig.Backend.DISTRIBUTED_FILE)
                .cacheDir(cacheDir)
                .defaultPopulation("benchmark")
                .runtime(runtime)
                .build();
        try (SpikeBuffer buffer = SpikeBuffers.open(config)) {
            Random random = new Random(rank);
            for (int i = 0; i < spikes; i++) {
                buffer.addSpike(random.nextInt(NODES), random.nextDouble() * SIM_TIME_MS);
            }
            buffer.flush();
            runtime.barrier();
            long elapsed = rank == 0 ? timeRead(buffer, SortOrder.BY_TIME) : 0L;
            runtime.barrier();
            return elapsed;
        }
    }

    private static long timeRead(SpikeBuffer buffer, SortOrder order) {
        long start = System.nanoTime();
        long count = 0;
        try (SpikeCursor cursor = buffer.spikes(SpikeQuery.sortedBy(order))) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        if (count != buffer.nSpikes()) {
            throw new IllegalStateException("read " + count + " spikes, expected " + buffer.nSpikes());
        }
        return System.nanoTime() - start;
    }

    private static void report(String backend, String operation, int spikes, long nanos) {
        double seconds = nanos / 1e9;
        System.out.printf("  %-12s %-26s %10.1f ms %14.0f spikes/s%n",
                backend, operation, nanos / 1e6, seconds > 0 ? spikes / seconds : 0.0);
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
        }
    }

    private static final class ThreadRuntime implements DistributedRuntime {
        private final int rank;
        private final int size;
        private final CyclicBarrier barrier;

        private ThreadRuntime(int rank, int size, CyclicBarrier barrier) {
            this.rank = rank;
            this.size = size;
            this.barrier = barrier;
        }

        @Override
        public int rank() {
            return rank;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public void barrier() {
            try {
                barrier.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted at barrier", e);
            } catch (BrokenBarrierException e) {
                throw new IllegalStateException("barrier broken", e);
            }
        }
    }
}
