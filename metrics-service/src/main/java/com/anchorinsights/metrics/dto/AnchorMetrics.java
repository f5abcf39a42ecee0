package com.anchorinsights.metrics.dto;

import com.anchorinsights.common.model.AnchorStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

public record AnchorMetrics(
    @JsonProperty("id")                      String id,
    @JsonProperty("name")                    String name,
    @JsonProperty("stellar_account")         String stellarAccount,
    @JsonProperty("reliability_score")       double reliabilityScore,
    @JsonProperty("asset_coverage")          long assetCoverage,
    @JsonProperty("failure_rate")            double failureRate,
    @JsonProperty("total_transactions")      long totalTransactions,
    @JsonProperty("successful_transactions") long successfulTransactions,
    @JsonProperty("failed_transactions")     long failedTransactions,
    @JsonProperty("status")                  AnchorStatus status
) {}
