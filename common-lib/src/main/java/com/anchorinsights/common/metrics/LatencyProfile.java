package com.anchorinsights.common.metrics;

/**
 * Synthetic corridor latency figures.
 *
 * <p>These are placeholders standing in for latency telemetry the ledger does not expose;
 * they are derived from the success rate, not measured. The multipliers are part of the
 * response contract and must not change.
 *
 * <pre>
 *   average = 400 + 2 × successRate
 *   median  = 0.75 × average
 *   p95     = 2.5  × average
 *   p99     = 4.0  × average
 * </pre>
 */
public record LatencyProfile(
    double averageMs,
    double medianMs,
    double p95Ms,
    double p99Ms
) {
    static final double BASE_MS             = 400.0;
    static final double SUCCESS_RATE_FACTOR = 2.0;
    static final double MEDIAN_FACTOR       = 0.75;
    static final double P95_FACTOR          = 2.5;
    static final double P99_FACTOR          = 4.0;

    public static LatencyProfile fromSuccessRate(double successRate) {
        double avg = BASE_MS + successRate * SUCCESS_RATE_FACTOR;
        return new LatencyProfile(avg, avg * MEDIAN_FACTOR, avg * P95_FACTOR, avg * P99_FACTOR);
    }
}
