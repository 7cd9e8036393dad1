package io.spiketrains.buffer.spi;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the {@link SpikeTableCodec} for an export, by content type or by the export file's extension.
 *
 * <pre>{@code
 * SpikeTableCodecRegistry registry = SpikeTableCodecRegistry.builder()
 *     .register(new JacksonCsvTableCodec())
 *     .build();
 * registry.export(buffer.toTable(SpikeQuery.sortedBy(SortOrder.BY_TIME)), Path.of("output/spikes.csv"));
 * }</pre>
 */
public interface SpikeTableCodecRegistry {

    /**
     * @param contentType content type, parameters such as {@code ; charset=} are ignored
     */
    Optional<SpikeTableCodec> find(String contentType);

    /**
     * Codec whose {@link SpikeTableCodec#fileExtension()} matches {@code file}'s extension, ignoring case.
     */
    Optional<SpikeTableCodec> forFile(Path file);

    /**
     * Writes {@code table} to {@code file}, replacing it, in the format its extension names.
     *
     * @throws IllegalArgumentException if no codec handles the extension
     */
    default void export(SpikeTable table, Path file) throws IOException {
        SpikeTableCodec codec = requireCodec(file);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            codec.write(table, out);
        }
    }

    /**
     * Reads a table written by {@link #export}.
     *
     * @throws IllegalArgumentException if no codec handles the extension
     */
    default SpikeTable load(Path file, String units) throws IOException {
        SpikeTableCodec codec = requireCodec(file);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return codec.read(in, units);
        }
    }

    private SpikeTableCodec requireCodec(Path file) {
        Objects.requireNonNull(file, "file");
        return forFile(file).orElseThrow(
                () -> new IllegalArgumentException("no spike table codec for file " + file));
    }

    static Builder builder() {
        return new Builder();
    }

    private static String baseType(String contentType) {
        int semi = contentType.indexOf(';');
        return (semi >= 0 ? contentType.substring(0, semi) : contentType).trim().toLowerCase(Locale.ROOT);
    }

    private static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot < 0 ? "" : s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Later registrations for the same content type or extension replace earlier ones.
     */
    final class Builder {
        private final Map<String, SpikeTableCodec> byContentType = new HashMap<>();
        private final Map<String, SpikeTableCodec> byExtension = new HashMap<>();

        private Builder() {}

        public Builder register(SpikeTableCodec codec) {
            Objects.requireNonNull(codec, "codec");
            String contentType = baseType(Objects.requireNonNull(codec.contentType(), "contentType"));
            String extension = Objects.requireNonNull(codec.fileExtension(), "fileExtension")
                    .toLowerCase(Locale.ROOT);
            if (contentType.isEmpty() || extension.isEmpty() || extension.indexOf('.') >= 0) {
                throw new IllegalArgumentException("codec needs a content type and a dot-free file extension, got '"
                        + codec.contentType() + "' and '" + codec.fileExtension() + "'");
            }
            byContentType.put(contentType, codec);
            byExtension.put(extension, codec);
            return this;
        }

        public Builder registerAll(Iterable<? extends SpikeTableCodec> codecs) {
            for (SpikeTableCodec codec : codecs) {
                register(codec);
            }
            return this;
        }

        public SpikeTableCodecRegistry build() {
            return new Index(Map.copyOf(byContentType), Map.copyOf(byExtension));
        }

        private static final class Index implements SpikeTableCodecRegistry {
            private final Map<String, SpikeTableCodec> byContentType;
            private final Map<String, SpikeTableCodec> byExtension;

            private Index(Map<String, SpikeTableCodec> byContentType, Map<String, SpikeTableCodec> byExtension) {
                this.byContentType = byContentType;
                this.byExtension = byExtension;
            }

            @Override
            public Optional<SpikeTableCodec> find(String contentType) {
                return contentType == null
                        ? Optional.empty()
                        : Optional.ofNullable(byContentType.get(baseType(contentType)));
            }

            @Override
            public Optional<SpikeTableCodec> forFile(Path file) {
                return Optional.ofNullable(byExtension.get(extensionOf(Objects.requireNonNull(file, "file"))));
            }
        }
    }
}
