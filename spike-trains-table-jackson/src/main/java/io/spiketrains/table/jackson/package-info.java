/**
 * Jackson-backed {@link io.spiketrains.buffer.spi.SpikeTableCodec} implementations: space separated CSV with a
 * {@code timestamps population node_ids} header, and a JSON array of spike objects.
 *
 * <p>Registered for {@link java.util.ServiceLoader} discovery through {@link
 * io.spiketrains.table.jackson.JacksonTableCodecProvider}.
 */
package io.spiketrains.table.jackson;
