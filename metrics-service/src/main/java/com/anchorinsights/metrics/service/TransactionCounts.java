package com.anchorinsights.metrics.service;

import com.anchorinsights.metrics.model.Anchor;

/**
 * Transaction counters for one anchor, tagged with where they came from.
 *
 * <p>Exactly one source is used per anchor: either the live ledger feed ({@link Source#LIVE})
 * or the stored counters ({@link Source#FALLBACK}). The two are never blended.
 * {@code fallbackReason} is {@code null} for live counts.
 */
public record TransactionCounts(
    long total,
    long successful,
    long failed,
    Source source,
    String fallbackReason
) {
    public enum Source { LIVE, FALLBACK }

    /**
     * The live feed only carries settled payments, so every observed payment is a success.
     */
    public static TransactionCounts live(int paymentCount) {
        return new TransactionCounts(paymentCount, paymentCount, 0, Source.LIVE, null);
    }

    public static TransactionCounts fallback(Anchor anchor, String reason) {
        return new TransactionCounts(
            anchor.getTotalTransactions(),
            anchor.getSuccessfulTransactions(),
            anchor.getFailedTransactions(),
            Source.FALLBACK,
            reason);
    }

    public boolean isLive() {
        return source == Source.LIVE;
    }
}
