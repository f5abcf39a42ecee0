package com.anchorinsights.metrics.filter;

import com.anchorinsights.common.cache.CacheKeys;
import com.anchorinsights.metrics.dto.CorridorMetrics;

import java.util.List;
import java.util.Locale;

/**
 * Optional corridor list predicates. Every field may be {@code null}; numeric bounds are
 * inclusive.
 *
 * <p>{@code assetCode} is a case-insensitive substring match against the source or the
 * destination asset code. Issuers never take part in the match.
 * {@code timePeriod} is accepted and part of the cache identity but does not narrow the
 * result: the payment sample carries no time window to filter on.
 */
public record CorridorFilter(
    Double successRateMin,
    Double successRateMax,
    Double volumeMin,
    Double volumeMax,
    String assetCode,
    String timePeriod
) {
    public static CorridorFilter none() {
        return new CorridorFilter(null, null, null, null, null, null);
    }

    public boolean matches(CorridorMetrics corridor) {
        if (successRateMin != null && corridor.successRate() < successRateMin) return false;
        if (successRateMax != null && corridor.successRate() > successRateMax) return false;
        if (volumeMin != null && corridor.liquidityDepthUsd() < volumeMin) return false;
        if (volumeMax != null && corridor.liquidityDepthUsd() > volumeMax) return false;
        if (assetCode != null) {
            String needle = assetCode.toLowerCase(Locale.ROOT);
            return corridor.sourceAsset().toLowerCase(Locale.ROOT).contains(needle)
                || corridor.destinationAsset().toLowerCase(Locale.ROOT).contains(needle);
        }
        return true;
    }

    public List<CorridorMetrics> apply(List<CorridorMetrics> corridors) {
        return corridors.stream().filter(this::matches).toList();
    }

    /**
     * Deterministic rendering of all six fields for cache keys. Absent fields render as
     * {@code None}, so an absent filter never collides with an empty one.
     */
    public String fingerprint() {
        return "sr_min:"  + CacheKeys.debug(successRateMin)
            + "_sr_max:"  + CacheKeys.debug(successRateMax)
            + "_vol_min:" + CacheKeys.debug(volumeMin)
            + "_vol_max:" + CacheKeys.debug(volumeMax)
            + "_asset:"   + CacheKeys.debug(assetCode)
            + "_period:"  + CacheKeys.debug(timePeriod);
    }
}
