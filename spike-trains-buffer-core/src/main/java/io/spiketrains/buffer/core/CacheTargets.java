package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeTrainsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exclusive ownership of cache files.
 *
 * <p>A claim is registered in a JVM-wide set and backed by an exclusive lock on a {@code .lock} file next
 * to the cache file, so two buffers on one backing file are refused whether they live in this JVM or in
 * another process. The lock file is never opened elsewhere, which keeps the OS lock from being dropped
 * by unrelated channel closes. Lock files are never deleted: deleting one would let two processes lock
 * different inodes under the same name. A lock file left by a closed or crashed owner holds no lock and
 * is reclaimed by the next claim.
 */
final class CacheTargets {

    private static final Logger logger = LoggerFactory.getLogger(CacheTargets.class);
    private static final Set<Path> CLAIMED = ConcurrentHashMap.newKeySet();

    private CacheTargets() {}

    /**
     * @throws SpikeTrainsException.DuplicateCacheTarget if {@code cacheFile} is already claimed
     * @throws SpikeTrainsException.StorageUnavailable if the lock file cannot be created
     */
    static Claim claim(Path cacheFile) {
        Path key = cacheFile.toAbsolutePath().normalize();
        if (!CLAIMED.add(key)) {
            throw new SpikeTrainsException.DuplicateCacheTarget(key);
        }
        Path lockFile = key.resolveSibling(key.getFileName() + ".lock");
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                throw new SpikeTrainsException.DuplicateCacheTarget(key);
            }
            return new Claim(key, lockFile, channel, lock);
        } catch (IOException | OverlappingFileLockException | SpikeTrainsException e) {
            CLAIMED.remove(key);
            closeQuietly(channel);
            if (e instanceof SpikeTrainsException ste) {
                throw ste;
            }
            if (e instanceof OverlappingFileLockException) {
                throw new SpikeTrainsException.DuplicateCacheTarget(key);
            }
            throw new SpikeTrainsException.StorageUnavailable(lockFile, "failed to lock spike cache file", e);
        }
    }

    static boolean isClaimed(Path cacheFile) {
        return CLAIMED.contains(cacheFile.toAbsolutePath().normalize());
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Failed to close lock channel", e);
        }
    }

    static final class Claim implements AutoCloseable {
        private final Path cacheFile;
        private final Path lockFile;
        private final FileChannel channel;
        private final FileLock lock;
        private boolean released;

        private Claim(Path cacheFile, Path lockFile, FileChannel channel, FileLock lock) {
            this.cacheFile = cacheFile;
            this.lockFile = lockFile;
            this.channel = channel;
            this.lock = lock;
        }

        /**
         * Releases the lock and frees the path for new claims, leaving the lock file in place. Idempotent.
         */
        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                lock.release();
            } catch (IOException e) {
                logger.warn("Failed to release lock on {}", lockFile, e);
            } finally {
                closeQuietly(channel);
                CLAIMED.remove(cacheFile);
            }
        }
    }
}
