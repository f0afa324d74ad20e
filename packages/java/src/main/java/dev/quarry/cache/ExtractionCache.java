package dev.quarry.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.quarry.ErrorCode;
import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-tier extraction cache: Caffeine in memory, optionally backed by {@link DiskCacheStore}.
 *
 * <p>At most one computation per key is in flight. The first caller installs its own future and
 * computes on its own thread; concurrent callers of the same key join that future. A failed
 * computation is evicted and never cached.</p>
 *
 * <p>Disk failures are logged, counted and degrade to an uncached extraction.</p>
 */
public final class ExtractionCache {
    private static final Logger LOG = LoggerFactory.getLogger(ExtractionCache.class);

    private final AsyncCache<CacheKey, ExtractionResult> memory;
    private final DiskCacheStore disk;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public ExtractionCache(CacheSettings settings) {
        this.memory = Caffeine.newBuilder()
            .maximumSize(settings.maxMemoryEntries())
            .expireAfterWrite(settings.maxAge())
            .recordStats()
            .buildAsync();
        this.disk = settings.hasDiskTier()
            ? new DiskCacheStore(settings.directory(), settings.maxDiskEntries(), settings.maxAge())
            : null;
    }

    /**
     * Computes a cache entry.
     */
    @FunctionalInterface
    public interface Loader {
        ExtractionResult load() throws QuarryException;
    }

    /**
     * Returns the cached result for {@code key}, computing it with {@code loader} at most once.
     *
     * @param key fingerprint
     * @param loader extraction to run on a miss
     * @return the result
     * @throws QuarryException the loader's failure, shared by every caller that joined it
     */
    public ExtractionResult getOrCompute(CacheKey key, Loader loader) throws QuarryException {
        CompletableFuture<ExtractionResult> mine = new CompletableFuture<>();
        CompletableFuture<ExtractionResult> shared = memory.get(key, (k, executor) -> mine);
        if (shared != mine) {
            hits.increment();
            LOG.debug("Cache hit (memory) for {}", key);
            return await(key, shared);
        }
        ExtractionResult result;
        try {
            result = loadThroughDisk(key, loader);
        } catch (Throwable t) {
            mine.completeExceptionally(t);
            throw t;
        }
        mine.complete(result);
        return result;
    }

    /**
     * Looks up {@code key} without computing.
     *
     * @param key fingerprint
     * @return the completed entry, if any
     */
    public Optional<ExtractionResult> getIfPresent(CacheKey key) {
        CompletableFuture<ExtractionResult> future = memory.getIfPresent(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    /**
     * Empties both tiers. Counters are kept.
     *
     * @throws QuarryException.Cache if the disk tier cannot be emptied
     */
    public void clear() throws QuarryException.Cache {
        memory.synchronous().invalidateAll();
        if (disk != null) {
            disk.clear();
        }
        LOG.debug("Cache cleared");
    }

    public CacheStats stats() {
        long diskEntries = 0;
        long diskBytes = 0;
        if (disk != null) {
            try {
                diskEntries = disk.entryCount();
                diskBytes = disk.totalBytes();
            } catch (QuarryException.Cache e) {
                errors.increment();
                LOG.warn("Failed to read disk cache statistics: {}", e.getMessage());
            }
        }
        return new CacheStats(
            memory.synchronous().estimatedSize(),
            diskEntries,
            hits.sum(),
            misses.sum(),
            errors.sum(),
            diskBytes);
    }

    private ExtractionResult loadThroughDisk(CacheKey key, Loader loader) throws QuarryException {
        if (disk != null) {
            try {
                Optional<ExtractionResult> stored = disk.read(key);
                if (stored.isPresent()) {
                    hits.increment();
                    LOG.debug("Cache hit (disk) for {}", key);
                    return stored.get();
                }
            } catch (QuarryException.Cache e) {
                errors.increment();
                LOG.warn("Cache read failed, extracting without cache: {}", e.getMessage());
            }
        }
        misses.increment();
        LOG.debug("Cache miss for {}", key);
        ExtractionResult result = loader.load();
        if (disk != null) {
            try {
                disk.write(key, result);
            } catch (QuarryException.Cache e) {
                errors.increment();
                LOG.warn("Cache write failed, result not persisted: {}", e.getMessage());
            }
        }
        return result;
    }

    private static ExtractionResult await(CacheKey key, CompletableFuture<ExtractionResult> future)
        throws QuarryException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw QuarryException.of(ErrorCode.INTERNAL, "Interrupted while waiting for cache entry " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QuarryException) {
                throw (QuarryException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw QuarryException.of(ErrorCode.INTERNAL, "Cached computation failed: " + cause, cause);
        }
    }
}
