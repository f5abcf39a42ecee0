package com.anchorinsights.metrics.dto;

import com.anchorinsights.common.exception.ApiException;

import java.util.Comparator;

/**
 * Corridor list ordering. All orders are descending.
 */
public enum SortBy {
    SUCCESS_RATE("success_rate", Comparator.comparingDouble(CorridorMetrics::successRate)),
    HEALTH_SCORE("health_score", Comparator.comparingDouble(CorridorMetrics::healthScore)),
    VOLUME("volume",             Comparator.comparingDouble(CorridorMetrics::liquidityDepthUsd));

    private final String param;
    private final Comparator<CorridorMetrics> ascending;

    SortBy(String param, Comparator<CorridorMetrics> ascending) {
        this.param     = param;
        this.ascending = ascending;
    }

    public String param() {
        return param;
    }

    public Comparator<CorridorMetrics> comparator() {
        return ascending.reversed();
    }

    /**
     * @param value query value; {@code null} or blank selects {@link #SUCCESS_RATE}
     * @throws ApiException {@code BAD_REQUEST} for unknown values
     */
    public static SortBy fromParam(String value) {
        if (value == null || value.isBlank()) {
            return SUCCESS_RATE;
        }
        for (SortBy sortBy : values()) {
            if (sortBy.param.equalsIgnoreCase(value.trim())) {
                return sortBy;
            }
        }
        throw ApiException.badRequest("Unsupported sort_by value: " + value);
    }
}
