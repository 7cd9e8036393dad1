package io.spiketrains.buffer.spi;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Construction-time configuration of a spike buffer.
 *
 * <p>The default population has no implicit value and must always be set.
 *
 * <pre>{@code
 * BufferConfig config = BufferConfig.builder()
 *     .backend(BufferConfig.Backend.DISTRIBUTED_FILE)
 *     .cacheDir(Path.of("output/spikes"))
 *     .defaultPopulation("v1")
 *     .runtime(mpiRuntime)
 *     .build();
 * }</pre>
 */
public final class BufferConfig {

    public static final String PROPERTY_PREFIX = "spike-trains.";
    public static final String DEFAULT_CACHE_NAME = "spikes";
    public static final String DEFAULT_UNITS = "ms";
    public static final int DEFAULT_SORT_RUN_SIZE = 1_000_000;

    public enum Backend {
        /** Process memory, no durability. */
        MEMORY,
        /** One append-only cache file. */
        FILE,
        /** One cache file per worker rank in a shared directory. */
        DISTRIBUTED_FILE
    }

    private final Backend backend;
    private final Path cacheDir;
    private final String cacheName;
    private final String defaultPopulation;
    private final String units;
    private final int sortRunSize;
    private final DistributedRuntime runtime;

    private BufferConfig(Builder b) {
        this.backend = Objects.requireNonNull(b.backend, "backend");
        this.defaultPopulation = requireLabel(b.defaultPopulation, "defaultPopulation");
        this.cacheName = requireLabel(b.cacheName, "cacheName");
        this.units = Objects.requireNonNull(b.units, "units");
        this.runtime = Objects.requireNonNull(b.runtime, "runtime");
        if (backend != Backend.MEMORY && b.cacheDir == null) {
            throw new IllegalArgumentException(backend + " backend requires a cacheDir");
        }
        this.cacheDir = b.cacheDir;
        if (b.sortRunSize <= 0) {
            throw new IllegalArgumentException("sortRunSize must be positive");
        }
        this.sortRunSize = b.sortRunSize;
        if (runtime.size() < 1 || runtime.rank() < 0 || runtime.rank() >= runtime.size()) {
            throw new IllegalArgumentException(
                    "invalid runtime rank/size: " + runtime.rank() + "/" + runtime.size());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code spike-trains.*} keys. Missing keys keep builder defaults, except
     * {@code spike-trains.default-population} which is required.
     */
    public static BufferConfig fromProperties(Properties props, DistributedRuntime runtime) {
        Objects.requireNonNull(props, "props");
        Builder b = builder().runtime(runtime);
        String backend = props.getProperty(PROPERTY_PREFIX + "backend");
        if (backend != null) {
            b.backend(parseBackend(backend));
        }
        String cacheDir = props.getProperty(PROPERTY_PREFIX + "cache-dir");
        if (cacheDir != null) {
            b.cacheDir(Path.of(cacheDir.trim()));
        }
        String cacheName = props.getProperty(PROPERTY_PREFIX + "cache-name");
        if (cacheName != null) {
            b.cacheName(cacheName.trim());
        }
        b.defaultPopulation(props.getProperty(PROPERTY_PREFIX + "default-population"));
        String units = props.getProperty(PROPERTY_PREFIX + "units");
        if (units != null) {
            b.units(units.trim());
        }
        String runSize = props.getProperty(PROPERTY_PREFIX + "sort-run-size");
        if (runSize != null) {
            try {
                b.sortRunSize(Integer.parseInt(runSize.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid " + PROPERTY_PREFIX + "sort-run-size: " + runSize, e);
            }
        }
        return b.build();
    }

    private static Backend parseBackend(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Backend.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + PROPERTY_PREFIX + "backend: " + value, e);
        }
    }

    // Labels end up as space-delimited fields in cache files.
    private static String requireLabel(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank() || value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(name + " must be non-empty and contain no whitespace: '" + value + "'");
        }
        return value;
    }

    public Backend backend() {
        return backend;
    }

    /**
     * Directory owning the cache files; {@code null} for {@link Backend#MEMORY}.
     */
    public Path cacheDir() {
        return cacheDir;
    }

    public String cacheName() {
        return cacheName;
    }

    public String defaultPopulation() {
        return defaultPopulation;
    }

    public String units() {
        return units;
    }

    /**
     * Records sorted in memory per run when ordering a cache file.
     */
    public int sortRunSize() {
        return sortRunSize;
    }

    public DistributedRuntime runtime() {
        return runtime;
    }

    public Builder toBuilder() {
        return builder()
                .backend(backend)
                .cacheDir(cacheDir)
                .cacheName(cacheName)
                .defaultPopulation(defaultPopulation)
                .units(units)
                .sortRunSize(sortRunSize)
                .runtime(runtime);
    }

    @Override
    public String toString() {
        return "BufferConfig{backend=" + backend + ", cacheDir=" + cacheDir + ", cacheName=" + cacheName
                + ", defaultPopulation=" + defaultPopulation + ", units=" + units
                + ", rank=" + runtime.rank() + "/" + runtime.size() + '}';
    }

    public static final class Builder {
        private Backend backend = Backend.MEMORY;
        private Path cacheDir;
        private String cacheName = DEFAULT_CACHE_NAME;
        private String defaultPopulation;
        private String units = DEFAULT_UNITS;
        private int sortRunSize = DEFAULT_SORT_RUN_SIZE;
        private DistributedRuntime runtime = DistributedRuntime.local();

        private Builder() {}

        public Builder backend(Backend backend) {
            this.backend = backend;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder cacheName(String cacheName) {
            this.cacheName = cacheName;
            return this;
        }

        public Builder defaultPopulation(String defaultPopulation) {
            this.defaultPopulation = defaultPopulation;
            return this;
        }

        public Builder units(String units) {
            this.units = units;
            return this;
        }

        public Builder sortRunSize(int sortRunSize) {
            this.sortRunSize = sortRunSize;
            return this;
        }

        public Builder runtime(DistributedRuntime runtime) {
            this.runtime = runtime;
            return this;
        }

        public BufferConfig build() {
            return new BufferConfig(this);
        }
    }
}
