package com.anchorinsights.metrics.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * HAL collection envelope of the ledger API: {@code {"_embedded": {"records": [...]}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HorizonPage<T>(
    @JsonProperty("_embedded") Embedded<T> embedded
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Embedded<T>(
        @JsonProperty("records") List<T> records
    ) {}

    public List<T> records() {
        if (embedded == null || embedded.records() == null) {
            return List.of();
        }
        return embedded.records();
    }
}
