package com.anchorinsights.metrics.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Anchor metadata owned by the metadata store. Read-only to this service.
 *
 * Column mapping (R2DBC snake_case convention):
 *   stellarAccount          → stellar_account
 *   homeDomain              → home_domain
 *   totalTransactions       → total_transactions
 *   successfulTransactions  → successful_transactions
 *   failedTransactions      → failed_transactions
 *   reliabilityScore        → reliability_score
 *
 * The transaction counters and reliability score are only used when live ledger data
 * is unavailable for the anchor's account.
 */
@Data
@NoArgsConstructor
@Table("anchors")
public class Anchor {

    @Id
    private String id;

    private String name;

    private String stellarAccount;

    private String homeDomain;

    private long totalTransactions;

    private long successfulTransactions;

    private long failedTransactions;

    private double reliabilityScore;

    private String status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
