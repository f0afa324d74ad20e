package dev.quarry.cache;

import java.util.Objects;

/**
 * Fingerprint of one extraction: content identity, effective configuration and library version.
 *
 * @param hex lowercase SHA-256 hex digest
 */
public record CacheKey(String hex) {
    public CacheKey {
        Objects.requireNonNull(hex, "hex must not be null");
        if (hex.length() < 2) {
            throw new IllegalArgumentException("cache key too short: " + hex);
        }
    }

    /**
     * Two-character shard used by the on-disk tier.
     *
     * @return shard directory name
     */
    public String shard() {
        return hex.substring(0, 2);
    }

    @Override
    public String toString() {
        return hex;
    }
}
