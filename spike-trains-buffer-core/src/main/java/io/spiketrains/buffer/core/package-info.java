/**
 * Spike buffer backends.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.spiketrains.buffer.core.InMemorySpikeBuffer} (process memory)</li>
 *   <li>{@link io.spiketrains.buffer.core.FileSpikeBuffer} (one append-only cache file)</li>
 *   <li>{@link io.spiketrains.buffer.core.DistributedFileSpikeBuffer} (one cache file per worker rank,
 *       merged on sorted reads)</li>
 *   <li>{@link io.spiketrains.buffer.core.SpikeBuffers} (backend selection from configuration)</li>
 * </ul>
 *
 * <p>Cache files are plain text, one {@code "timestamp population node_id"} line per spike.
 */
package io.spiketrains.buffer.core;
