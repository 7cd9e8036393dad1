package io.spiketrains.buffer.spi;

import java.util.List;

/**
 * ServiceLoader provider for {@link SpikeTableCodec}.
 *
 * <p>Modules such as {@code spike-trains-table-jackson} register implementations
 * via {@code META-INF/services}.
 */
public interface SpikeTableCodecProvider {
    List<SpikeTableCodec> codecs();
}
