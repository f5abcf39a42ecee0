package com.anchorinsights.metrics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    @JsonProperty("id")                   String id,
    @JsonProperty("base_asset_code")      String baseAssetCode,
    @JsonProperty("base_asset_issuer")    String baseAssetIssuer,
    @JsonProperty("base_amount")          String baseAmount,
    @JsonProperty("counter_asset_code")   String counterAssetCode,
    @JsonProperty("counter_asset_issuer") String counterAssetIssuer,
    @JsonProperty("counter_amount")       String counterAmount,
    @JsonProperty("ledger_close_time")    String ledgerCloseTime
) {}
