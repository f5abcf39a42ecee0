package com.anchorinsights.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Traffic-light classification of an anchor's reliability score.
 * See {@link com.anchorinsights.common.metrics.ReliabilityCalculator#classifyStatus(double)}.
 */
public enum AnchorStatus {
    GREEN("green"),
    YELLOW("yellow"),
    RED("red");

    private final String label;

    AnchorStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
