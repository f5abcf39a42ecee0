package com.anchorinsights.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse liquidity direction of a corridor, derived from its observed volume.
 */
public enum LiquidityTrend {
    INCREASING("increasing"),
    STABLE("stable"),
    DECREASING("decreasing");

    private final String label;

    LiquidityTrend(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
