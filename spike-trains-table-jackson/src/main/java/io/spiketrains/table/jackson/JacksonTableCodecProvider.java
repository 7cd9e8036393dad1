package io.spiketrains.table.jackson;

import io.spiketrains.buffer.spi.SpikeTableCodec;
import io.spiketrains.buffer.spi.SpikeTableCodecProvider;

import java.util.List;

/**
 * ServiceLoader provider for {@link JacksonCsvTableCodec} and {@link JacksonJsonTableCodec}.
 */
public final class JacksonTableCodecProvider implements SpikeTableCodecProvider {
    @Override
    public List<SpikeTableCodec> codecs() {
        return List.of(new JacksonCsvTableCodec(), new JacksonJsonTableCodec());
    }
}
