package com.anchorinsights.common.metrics;

import com.anchorinsights.common.model.LiquidityTrend;

/**
 * Pure stateless calculator for corridor health and liquidity classification.
 *
 * <p><b>Health score</b>:
 * <pre>
 *   healthScore      = successRate × 0.6 + volumeScore × 0.2 + transactionScore × 0.2
 *   volumeScore      = min(100, 100 × ln(volumeUsd) / 15)      (0 when volumeUsd &lt; 1)
 *   transactionScore = min(100, 100 × ln(totalAttempts) / 10)  (0 when totalAttempts &lt; 1)
 * </pre>
 * The logarithms are only taken for inputs ≥ 1, so neither component is ever negative or NaN.
 *
 * <p><b>Liquidity trend</b>:
 * <pre>
 *   volumeUsd &gt; 10,000,000  → INCREASING
 *   volumeUsd &gt;  1,000,000  → STABLE
 *   otherwise               → DECREASING
 * </pre>
 */
public final class CorridorHealthCalculator {

    static final double SUCCESS_WEIGHT     = 0.6;
    static final double VOLUME_WEIGHT      = 0.2;
    static final double TRANSACTION_WEIGHT = 0.2;

    static final double VOLUME_LOG_DIVISOR      = 15.0;
    static final double TRANSACTION_LOG_DIVISOR = 10.0;

    static final double INCREASING_VOLUME = 10_000_000.0;
    static final double STABLE_VOLUME     = 1_000_000.0;

    private CorridorHealthCalculator() {}

    public static double healthScore(double successRate, long totalAttempts, double volumeUsd) {
        return successRate * SUCCESS_WEIGHT
            + volumeScore(volumeUsd) * VOLUME_WEIGHT
            + transactionScore(totalAttempts) * TRANSACTION_WEIGHT;
    }

    public static double volumeScore(double volumeUsd) {
        if (Double.isNaN(volumeUsd) || volumeUsd < 1.0) {
            return 0.0;
        }
        return Math.min(100.0, Math.log(volumeUsd) / VOLUME_LOG_DIVISOR * 100.0);
    }

    public static double transactionScore(long totalAttempts) {
        if (totalAttempts < 1) {
            return 0.0;
        }
        return Math.min(100.0, Math.log((double) totalAttempts) / TRANSACTION_LOG_DIVISOR * 100.0);
    }

    public static double successRate(long totalAttempts, long successful) {
        if (totalAttempts <= 0) {
            return 0.0;
        }
        return (double) successful / totalAttempts * 100.0;
    }

    public static LiquidityTrend liquidityTrend(double volumeUsd) {
        if (volumeUsd > INCREASING_VOLUME) {
            return LiquidityTrend.INCREASING;
        }
        if (volumeUsd > STABLE_VOLUME) {
            return LiquidityTrend.STABLE;
        }
        return LiquidityTrend.DECREASING;
    }
}
