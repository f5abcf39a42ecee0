package com.anchorinsights.metrics.dto;

import com.anchorinsights.common.model.LiquidityTrend;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated statistics for one source → destination asset route.
 *
 * <p>{@code id} is the synthetic bucket key {@code CODE:ISSUER->CODE:ISSUER};
 * {@code sourceAsset} and {@code destinationAsset} carry the asset codes only. Latency fields
 * are derived placeholders, see {@link com.anchorinsights.common.metrics.LatencyProfile}.
 */
public record CorridorMetrics(
    @JsonProperty("id")                       String id,
    @JsonProperty("source_asset")             String sourceAsset,
    @JsonProperty("destination_asset")        String destinationAsset,
    @JsonProperty("success_rate")             double successRate,
    @JsonProperty("total_attempts")           long totalAttempts,
    @JsonProperty("successful_payments")      long successfulPayments,
    @JsonProperty("failed_payments")          long failedPayments,
    @JsonProperty("average_latency_ms")       double averageLatencyMs,
    @JsonProperty("median_latency_ms")        double medianLatencyMs,
    @JsonProperty("p95_latency_ms")           double p95LatencyMs,
    @JsonProperty("p99_latency_ms")           double p99LatencyMs,
    @JsonProperty("liquidity_depth_usd")      double liquidityDepthUsd,
    @JsonProperty("liquidity_volume_24h_usd") double liquidityVolume24hUsd,
    @JsonProperty("liquidity_trend")          LiquidityTrend liquidityTrend,
    @JsonProperty("health_score")             double healthScore,
    @JsonProperty("last_updated")             String lastUpdated
) {}
