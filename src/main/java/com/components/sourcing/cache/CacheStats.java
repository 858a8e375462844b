package com.components.sourcing.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cache performance counters since startup.
 */
public record CacheStats(
        @JsonProperty("hits") long hits,
        @JsonProperty("misses") long misses,
        @JsonProperty("errors") long errors,
        @JsonProperty("invalidations") long invalidations,
        @JsonProperty("live_entries") int liveEntries
) {
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, Live entries: %d",
                hitRatio() * 100, liveEntries);
    }
}
