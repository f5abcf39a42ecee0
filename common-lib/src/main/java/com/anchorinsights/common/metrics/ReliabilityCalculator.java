package com.anchorinsights.common.metrics;

import com.anchorinsights.common.model.AnchorStatus;

/**
 * Pure stateless calculator for anchor transaction metrics.
 *
 * <pre>
 *   failureRate      = 100 × failed / total            (0 when total = 0)
 *   reliabilityScore = 100 × successful / total        (stored score when total = 0)
 *
 *   reliabilityScore ≥ 99        → GREEN
 *   95 ≤ reliabilityScore &lt; 99  → YELLOW
 *   otherwise                    → RED
 * </pre>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class ReliabilityCalculator {

    static final double GREEN_THRESHOLD  = 99.0;
    static final double YELLOW_THRESHOLD = 95.0;

    private ReliabilityCalculator() {}

    public static double failureRate(long total, long failed) {
        if (total <= 0) {
            return 0.0;
        }
        return clampPercent((double) failed / total * 100.0);
    }

    /**
     * @param storedScore returned unchanged when {@code total} is zero; never defaulted to 0
     */
    public static double reliabilityScore(long total, long successful, double storedScore) {
        if (total <= 0) {
            return storedScore;
        }
        return clampPercent((double) successful / total * 100.0);
    }

    public static AnchorStatus classifyStatus(double reliabilityScore) {
        if (reliabilityScore >= GREEN_THRESHOLD) {
            return AnchorStatus.GREEN;
        }
        if (reliabilityScore >= YELLOW_THRESHOLD) {
            return AnchorStatus.YELLOW;
        }
        return AnchorStatus.RED;
    }

    // Stored counters can be inconsistent (failed > total); keep the ratio in range.
    private static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
