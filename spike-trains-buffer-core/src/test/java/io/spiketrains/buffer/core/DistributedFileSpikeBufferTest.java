package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.BufferConfig;
import io.spiketrains.buffer.spi.DistributedRuntime;
import io.spiketrains.buffer.spi.SpikeQuery;
import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;
import io.spiketrains.core.TimeRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DistributedFileSpikeBufferTest {

    @TempDir
    Path tempDir;

    @Test
    void mergesWorkerFilesInTimeOrder() throws Exception {
        List<List<SpikeRecord>> results = runWorkers(2,
                buffer -> {
                    if (buffer.rank() == 0) {
                        buffer.addSpike(0, 1.0, "A");
                        buffer.addSpike(0, 3.0, "A");
                    } else {
                        buffer.addSpike(1, 2.0, "A");
                    }
                },
                buffer -> buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_TIME)).toList());

        List<SpikeRecord> expected = List.of(
                new SpikeRecord(1.0, "A", 0),
                new SpikeRecord(2.0, "A", 1),
                new SpikeRecord(3.0, "A", 0));
        assertThat(results).containsExactly(expected, expected);
    }

    @Test
    void mergeMatchesSortedConcatenation() throws Exception {
        List<List<List<SpikeRecord>>> results = runWorkers(3,
                buffer -> {
                    for (int i = 0; i < 50; i++) {
                        buffer.addSpike((i * 7 + buffer.rank()) % 11, (i * 13 % 17) / 2.0, i % 2 == 0 ? "A" : "B");
                    }
                },
                buffer -> List.of(
                        buffer.spikes().toList(),
                        buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_ID)).toList()));

        List<SpikeRecord> concatenated = new ArrayList<>(results.get(0).get(0));
        concatenated.sort(SpikeRecord.BY_ID);
        assertThat(concatenated).hasSize(150);
        for (List<List<SpikeRecord>> perRank : results) {
            assertThat(perRank.get(1)).isEqualTo(concatenated);
        }
    }

    @Test
    void aggregatesSpanEveryWorker() throws Exception {
        List<String> results = runWorkers(2,
                buffer -> {
                    if (buffer.rank() == 0) {
                        buffer.addSpike(1, 0.5);
                        buffer.addSpike(2, 4.0, "B");
                    } else {
                        buffer.addSpike(3, 1.5);
                    }
                },
                buffer -> buffer.nSpikes() + " " + buffer.nSpikes(null) + " " + buffer.populations() + " "
                        + buffer.nodes().size() + " " + buffer.timeRange().equals(new TimeRange(0.5, 4.0))
                                + " " + buffer.localSpikes() + " " + buffer.size() + " " + buffer.workers());

        assertThat(results).containsExactly("3 2 [B, v1] 3 true 2 3 2", "3 2 [B, v1] 3 true 1 3 2");
    }

    @Test
    void unsortedReadConcatenatesInRankOrder() throws Exception {
        List<List<SpikeRecord>> results = runWorkers(2,
                buffer -> buffer.addSpike(buffer.rank(), 10.0 - buffer.rank(), "A"),
                buffer -> buffer.spikes().toList());

        assertThat(results.get(1)).containsExactly(
                new SpikeRecord(10.0, "A", 0),
                new SpikeRecord(9.0, "A", 1));
    }

    @Test
    void closeRemovesEveryWorkerFileAndSortedCopyButKeepsLocks() throws Exception {
        runWorkers(2,
                buffer -> buffer.addSpike(1, 1.0),
                buffer -> {
                    buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_TIME)).toList();
                    buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_ID)).toList();
                    return null;
                });

        try (Stream<Path> listing = Files.list(tempDir.resolve("cache"))) {
            assertThat(listing).extracting(p -> p.getFileName().toString())
                    .containsExactlyInAnyOrder(".spikes.cache.node0.csv.lock", ".spikes.cache.node1.csv.lock");
        }
    }

    @Test
    void missingWorkerFileReadsAsEmpty() {
        try (DistributedFileSpikeBuffer buffer = new DistributedFileSpikeBuffer(config(halfStarted()))) {
            buffer.addSpike(1, 2.0);
            buffer.addSpike(2, 1.0);

            assertThat(buffer.nSpikes()).isEqualTo(2);
            assertThat(buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_TIME)).toList())
                    .extracting(SpikeRecord::nodeId)
                    .containsExactly(2L, 1L);
        }
    }

    @Test
    void closeLeavesOtherWorkersFilesAlone() throws Exception {
        Path sibling;
        try (DistributedFileSpikeBuffer buffer = new DistributedFileSpikeBuffer(config(halfStarted()))) {
            sibling = Files.writeString(buffer.rankFile(1), "0.5 B 9\n");
            buffer.addSpike(1, 1.0);

            assertThat(buffer.spikes(SpikeQuery.sortedBy(SortOrder.BY_TIME)).toList()).containsExactly(
                    new SpikeRecord(0.5, "B", 9),
                    new SpikeRecord(1.0, "v1", 1));
            assertThat(buffer.populations()).containsExactly("B", "v1");
        }
        assertThat(sibling).exists();
        assertThat(Files.readString(sibling)).isEqualTo("0.5 B 9\n");
    }

    @Test
    void directoryFailureStillReleasesBarrier() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        CyclicBarrier barrier = new CyclicBarrier(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Throwable>> futures = new ArrayList<>();
            for (int rank = 0; rank < 2; rank++) {
                BufferConfig config = BufferConfig.builder()
                        .backend(BufferConfig.Backend.DISTRIBUTED_FILE)
                        .cacheDir(blocker.resolve("cache"))
                        .defaultPopulation("v1")
                        .runtime(new ThreadBarrierRuntime(rank, barrier))
                        .build();
                futures.add(pool.submit(() -> {
                    try (DistributedFileSpikeBuffer ignored = new DistributedFileSpikeBuffer(config)) {
                        return null;
                    } catch (RuntimeException e) {
                        return e;
                    }
                }));
            }
            for (Future<Throwable> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS))
                        .isInstanceOf(SpikeTrainsException.StorageUnavailable.class);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsRankOutsideRuntime() {
        try (DistributedFileSpikeBuffer buffer = new DistributedFileSpikeBuffer(config(DistributedRuntime.local()))) {
            assertThatThrownBy(() -> buffer.rankFile(1)).isInstanceOf(IllegalArgumentException.class);
            assertThat(buffer.rankFile(0).getFileName().toString()).isEqualTo(".spikes.cache.node0.csv");
        }
    }

    private BufferConfig config(DistributedRuntime runtime) {
        return BufferConfig.builder()
                .backend(BufferConfig.Backend.DISTRIBUTED_FILE)
                .cacheDir(tempDir.resolve("cache"))
                .defaultPopulation("v1")
                .runtime(runtime)
                .build();
    }

    /**
     * Rank 0 of two whose peer never started.
     */
    private static DistributedRuntime halfStarted() {
        return new DistributedRuntime() {
            @Override
            public int rank() {
                return 0;
            }

            @Override
            public int size() {
                return 2;
            }

            @Override
            public void barrier() {}
        };
    }

    /**
     * Runs one thread per rank, each with its own buffer: {@code write}, flush, barrier, {@code read}, barrier,
     * close. Returns the read results in rank order.
     */
    private <T> List<T> runWorkers(int size, Consumer<DistributedFileSpikeBuffer> write,
                                   Function<DistributedFileSpikeBuffer, T> read) throws Exception {
        CyclicBarrier barrier = new CyclicBarrier(size);
        ExecutorService pool = Executors.newFixedThreadPool(size);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int rank = 0; rank < size; rank++) {
                ThreadBarrierRuntime runtime = new ThreadBarrierRuntime(rank, barrier);
                futures.add(pool.submit(() -> {
                    try (DistributedFileSpikeBuffer buffer = new DistributedFileSpikeBuffer(config(runtime))) {
                        write.accept(buffer);
                        buffer.flush();
                        runtime.barrier();
                        T result = read.apply(buffer);
                        runtime.barrier();
                        return result;
                    }
                }));
            }
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
