package dev.quarry.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the two cache tiers.
 *
 * @param maxMemoryEntries bound of the in-memory tier
 * @param maxAge entry lifetime, for both tiers
 * @param directory root of the on-disk tier, or null for memory only
 * @param maxDiskEntries bound of the on-disk tier
 */
public record CacheSettings(int maxMemoryEntries, Duration maxAge, Path directory, int maxDiskEntries) {
    public static final int DEFAULT_MEMORY_ENTRIES = 256;
    public static final int DEFAULT_DISK_ENTRIES = 10_000;
    public static final Duration DEFAULT_MAX_AGE = Duration.ofDays(30);

    public CacheSettings {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxMemoryEntries < 1) {
            throw new IllegalArgumentException("maxMemoryEntries must be positive, got " + maxMemoryEntries);
        }
        if (maxDiskEntries < 1) {
            throw new IllegalArgumentException("maxDiskEntries must be positive, got " + maxDiskEntries);
        }
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive, got " + maxAge);
        }
    }

    public static CacheSettings memoryOnly() {
        return new CacheSettings(DEFAULT_MEMORY_ENTRIES, DEFAULT_MAX_AGE, null, DEFAULT_DISK_ENTRIES);
    }

    public static CacheSettings onDisk(Path directory) {
        return new CacheSettings(DEFAULT_MEMORY_ENTRIES, DEFAULT_MAX_AGE,
            Objects.requireNonNull(directory, "directory must not be null"), DEFAULT_DISK_ENTRIES);
    }

    public boolean hasDiskTier() {
        return directory != null;
    }
}
