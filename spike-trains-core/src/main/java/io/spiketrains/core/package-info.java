/**
 * Storage-neutral core for spike trains.
 *
 * <p>This module has no dependencies. It contains only:
 * <ul>
 *   <li>The spike event model ({@link io.spiketrains.core.SpikeRecord}) and its orderings</li>
 *   <li>The filter builder used by every backend on the read path</li>
 *   <li>The pull-based {@link io.spiketrains.core.SpikeCursor} and the exception hierarchy</li>
 * </ul>
 *
 * <p>Buffer contracts live in {@code spike-trains-buffer-spi}, backends in {@code spike-trains-buffer-core}.
 */
package io.spiketrains.core;
