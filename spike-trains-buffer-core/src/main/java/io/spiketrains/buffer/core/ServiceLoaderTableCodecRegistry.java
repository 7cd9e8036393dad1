package io.spiketrains.buffer.core;

import io.spiketrains.buffer.spi.SpikeTableCodec;
import io.spiketrains.buffer.spi.SpikeTableCodecProvider;
import io.spiketrains.buffer.spi.SpikeTableCodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link SpikeTableCodecRegistry} over every installed {@link SpikeTableCodecProvider}, such as the
 * {@code csv} and {@code json} codecs of {@code spike-trains-table-jackson}.
 */
public final class ServiceLoaderTableCodecRegistry implements SpikeTableCodecRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ServiceLoaderTableCodecRegistry.class);

    private final SpikeTableCodecRegistry codecs;

    public ServiceLoaderTableCodecRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        SpikeTableCodecRegistry.Builder builder = SpikeTableCodecRegistry.builder();
        for (SpikeTableCodecProvider provider : ServiceLoader.load(SpikeTableCodecProvider.class, cl)) {
            List<SpikeTableCodec> provided = provider.codecs();
            builder.registerAll(provided);
            logger.debug("Registered {} spike table codecs from {}", provided.size(), provider.getClass().getName());
        }
        this.codecs = builder.build();
    }

    public static ServiceLoaderTableCodecRegistry defaultRegistry() {
        return new ServiceLoaderTableCodecRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public Optional<SpikeTableCodec> find(String contentType) {
        return codecs.find(contentType);
    }

    @Override
    public Optional<SpikeTableCodec> forFile(Path file) {
        return codecs.forFile(file);
    }
}
