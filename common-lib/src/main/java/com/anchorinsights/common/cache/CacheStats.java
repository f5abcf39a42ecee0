package com.anchorinsights.common.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time counters of a {@link CacheAsideExecutor}.
 */
public record CacheStats(
    long hits,
    long misses,
    long writes,
    long decodeFailures
) {
    @JsonProperty("hit_ratio")
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }
}
