package com.anchorinsights.common.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * TTL lookup keyed by resource tag ({@code "anchor"}, {@code "corridor"}, ...).
 *
 * <p>Built once from configuration and handed to the {@link CacheAsideExecutor}.
 * Unknown or {@code null} tags resolve to {@code defaultTtl}.
 */
public record CacheTtlConfig(Map<String, Duration> ttlByResource, Duration defaultTtl) {

    public static final String ANCHOR   = "anchor";
    public static final String CORRIDOR = "corridor";

    public CacheTtlConfig {
        Objects.requireNonNull(defaultTtl, "defaultTtl");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        ttlByResource = ttlByResource == null ? Map.of() : Map.copyOf(ttlByResource);
    }

    public Duration ttlFor(String resourceTag) {
        if (resourceTag == null) {
            return defaultTtl;
        }
        return ttlByResource.getOrDefault(resourceTag, defaultTtl);
    }
}
