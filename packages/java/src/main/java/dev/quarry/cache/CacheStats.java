package dev.quarry.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of the extraction cache. Never carries content.
 *
 * @param entries entries held in memory
 * @param diskEntries entries held on disk
 * @param hits lookups served from either tier, including callers that joined an in-flight computation
 * @param misses lookups that ran the extraction
 * @param errors degraded disk reads and writes
 * @param diskBytes bytes used on disk
 */
public record CacheStats(
    @JsonProperty("entries") long entries,
    @JsonProperty("disk_entries") long diskEntries,
    @JsonProperty("hits") long hits,
    @JsonProperty("misses") long misses,
    @JsonProperty("errors") long errors,
    @JsonProperty("disk_bytes") long diskBytes
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
