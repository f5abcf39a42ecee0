package com.anchorinsights.metrics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A settled ledger payment as returned by the ledger API.
 *
 * <p>{@code assetCode}/{@code assetIssuer} are {@code null} for the native asset.
 * {@code amount} is a decimal string and is absent for operations such as account
 * creation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Payment(
    @JsonProperty("id")                     String id,
    @JsonProperty("paging_token")           String pagingToken,
    @JsonProperty("type")                   String type,
    @JsonProperty("from")                   String from,
    @JsonProperty("to")                     String to,
    @JsonProperty("asset_type")             String assetType,
    @JsonProperty("asset_code")             String assetCode,
    @JsonProperty("asset_issuer")           String assetIssuer,
    @JsonProperty("amount")                 String amount,
    @JsonProperty("created_at")             String createdAt,
    @JsonProperty("transaction_successful") Boolean transactionSuccessful
) {}
