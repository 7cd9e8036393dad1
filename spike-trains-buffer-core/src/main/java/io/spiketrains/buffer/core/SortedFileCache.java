package io.spiketrains.buffer.core;

import io.spiketrains.core.SortOrder;
import io.spiketrains.core.SpikeTrainsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Sorted copies of cache files, one per (source, sort order), rebuilt only when the source changed.
 *
 * <p>Sources are append-only, so a copy is current while the source keeps the size and modification time
 * it had when the copy was built. Copies are named {@code <source>.<order><suffix>} and belong to the
 * cache that built them; {@link #close()} deletes them.
 */
final class SortedFileCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SortedFileCache.class);

    private final SpikeFileSorter sorter;
    private final String suffix;
    private final Map<Key, Entry> entries = new HashMap<>();

    /**
     * @param suffix appended to every copy's file name, distinguishes copies of different owners
     */
    SortedFileCache(int sortRunSize, String suffix) {
        this.sorter = new SpikeFileSorter(sortRunSize);
        this.suffix = Objects.requireNonNull(suffix, "suffix");
    }

    /**
     * Path of a copy of {@code source} sorted by {@code order}, building it if missing or stale.
     */
    Path sorted(Path source, SortOrder order) {
        if (!order.isSorted()) {
            throw new IllegalArgumentException("no sorted copy for " + order);
        }
        Fingerprint current = Fingerprint.of(source);
        Key key = new Key(source, order);
        Entry entry = entries.get(key);
        if (entry != null && entry.fingerprint.equals(current) && Files.exists(entry.path)) {
            logger.debug("Reusing {} copy of {}", order, source);
            return entry.path;
        }
        Path target = source.resolveSibling(
                source.getFileName() + "." + order.name().toLowerCase(Locale.ROOT) + suffix);
        sorter.sort(source, target, order);
        entries.put(key, new Entry(target, current));
        return target;
    }

    /**
     * Number of sorted copies currently held.
     */
    int size() {
        return entries.size();
    }

    /**
     * Deletes every sorted copy. The cache remains usable.
     */
    @Override
    public void close() {
        for (Entry entry : entries.values()) {
            try {
                Files.deleteIfExists(entry.path);
            } catch (IOException e) {
                logger.warn("Failed to delete sorted spike file {}", entry.path, e);
            }
        }
        entries.clear();
    }

    private record Key(Path source, SortOrder order) {}

    private record Entry(Path path, Fingerprint fingerprint) {}

    private record Fingerprint(long size, FileTime lastModified) {
        static Fingerprint of(Path file) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                return new Fingerprint(attrs.size(), attrs.lastModifiedTime());
            } catch (IOException e) {
                throw new SpikeTrainsException.StorageUnavailable(file, "failed to stat spike cache file", e);
            }
        }
    }
}
