package com.anchorinsights.metrics.corridor;

import com.anchorinsights.common.metrics.CorridorHealthCalculator;
import com.anchorinsights.common.metrics.LatencyProfile;
import com.anchorinsights.metrics.dto.CorridorMetrics;
import com.anchorinsights.metrics.model.Payment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a payment sample into per-corridor metrics.
 *
 * <p>One pass groups payments by {@link CorridorKey#bucketKey(Payment)}; buckets keep
 * first-seen order. Buckets whose key cannot be parsed back are dropped.
 *
 * <p>The sample only contains settled payments, so {@code successful == attempts} and
 * success rate is 100 for every non-empty corridor.
 */
@Component
public class CorridorAggregator {

    private static final Logger log = LoggerFactory.getLogger(CorridorAggregator.class);

    static final double VOLUME_24H_FACTOR = 0.1;

    private final Clock clock;

    public CorridorAggregator() {
        this(Clock.systemUTC());
    }

    public CorridorAggregator(Clock clock) {
        this.clock = clock;
    }

    public List<CorridorMetrics> aggregate(List<Payment> payments) {
        Map<String, CorridorBucket> buckets = group(payments);
        String lastUpdated = Instant.now(clock).toString();

        List<CorridorMetrics> corridors = new ArrayList<>(buckets.size());
        buckets.forEach((key, bucket) -> CorridorKey.parse(key).ifPresentOrElse(
            corridorKey -> corridors.add(toMetrics(key, corridorKey, bucket, lastUpdated)),
            () -> log.debug("Dropping corridor with malformed key. key={} attempts={}", key, bucket.count())));

        log.debug("Corridors aggregated. payments={} corridors={}", payments.size(), corridors.size());
        return corridors;
    }

    Map<String, CorridorBucket> group(List<Payment> payments) {
        Map<String, CorridorBucket> buckets = new LinkedHashMap<>();
        for (Payment payment : payments) {
            if (payment == null) continue;
            buckets.computeIfAbsent(CorridorKey.bucketKey(payment), k -> new CorridorBucket()).add(payment);
        }
        return buckets;
    }

    private CorridorMetrics toMetrics(String id, CorridorKey key, CorridorBucket bucket, String lastUpdated) {
        long attempts   = bucket.count();
        long successful = attempts;
        double volume   = bucket.volume();

        double successRate    = CorridorHealthCalculator.successRate(attempts, successful);
        LatencyProfile latency = LatencyProfile.fromSuccessRate(successRate);

        return new CorridorMetrics(
            id,
            key.sourceCode(),
            key.destinationCode(),
            successRate,
            attempts,
            successful,
            attempts - successful,
            latency.averageMs(),
            latency.medianMs(),
            latency.p95Ms(),
            latency.p99Ms(),
            volume,
            volume * VOLUME_24H_FACTOR,
            CorridorHealthCalculator.liquidityTrend(volume),
            CorridorHealthCalculator.healthScore(successRate, attempts, volume),
            lastUpdated);
    }
}
