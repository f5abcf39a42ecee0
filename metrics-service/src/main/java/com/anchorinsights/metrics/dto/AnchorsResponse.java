package com.anchorinsights.metrics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code total} is the number of entries in {@code anchors}, not the store-wide count.
 */
public record AnchorsResponse(
    @JsonProperty("anchors") List<AnchorMetrics> anchors,
    @JsonProperty("total")   int total
) {
    public static AnchorsResponse of(List<AnchorMetrics> anchors) {
        return new AnchorsResponse(List.copyOf(anchors), anchors.size());
    }
}
