/**
 * Capability interfaces shared by every spike buffer backend.
 *
 * <p>A backend implements {@link io.spiketrains.buffer.spi.SpikeBuffer}: the write half
 * ({@link io.spiketrains.buffer.spi.SpikeWriter}) called by the simulation while it runs, and the read half
 * ({@link io.spiketrains.buffer.spi.SpikeReader}) used by analysis tools afterwards. Backends are picked
 * from a {@link io.spiketrains.buffer.spi.BufferConfig}; distributed backends get worker rank, worker count
 * and the barrier from an injected {@link io.spiketrains.buffer.spi.DistributedRuntime}.
 *
 * <p>Instances perform no internal locking and must be confined to one thread.
 */
package io.spiketrains.buffer.spi;
