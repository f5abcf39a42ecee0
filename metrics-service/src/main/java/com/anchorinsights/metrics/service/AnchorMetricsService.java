package com.anchorinsights.metrics.service;

import com.anchorinsights.common.cache.CacheAsideExecutor;
import com.anchorinsights.common.cache.CacheKeys;
import com.anchorinsights.common.cache.CacheTtlConfig;
import com.anchorinsights.common.exception.ApiException;
import com.anchorinsights.common.metrics.ReliabilityCalculator;
import com.anchorinsights.metrics.dto.AnchorMetrics;
import com.anchorinsights.metrics.dto.AnchorsResponse;
import com.anchorinsights.metrics.model.Anchor;
import com.anchorinsights.metrics.store.AnchorMetadataStore;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Anchor list with live reliability metrics, served cache-aside.
 *
 * <p><strong>Flow on a cache miss:</strong>
 * <ol>
 *   <li>Load one page of anchors from the metadata store.</li>
 *   <li>Per anchor, concurrently: count its assets (store) and resolve its transaction
 *       counters (live ledger, falling back to stored counters).</li>
 *   <li>Derive failure rate, reliability score and status.</li>
 * </ol>
 * Output keeps store order. Metadata store failures fail the whole request with
 * {@code INTERNAL_ERROR}; ledger failures never do.
 */
@Service
public class AnchorMetricsService {

    private static final Logger log = LoggerFactory.getLogger(AnchorMetricsService.class);

    static final UUID NIL_ANCHOR_ID = new UUID(0L, 0L);

    private static final TypeReference<AnchorsResponse> RESPONSE_TYPE = new TypeReference<>() {};

    private final AnchorMetadataStore metadataStore;
    private final TransactionCountResolver countResolver;
    private final CacheAsideExecutor cache;
    private final int fetchConcurrency;

    public AnchorMetricsService(AnchorMetadataStore metadataStore,
                                TransactionCountResolver countResolver,
                                CacheAsideExecutor cache,
                                @Value("${metrics.anchor-fetch-concurrency:8}") int fetchConcurrency) {
        this.metadataStore    = metadataStore;
        this.countResolver    = countResolver;
        this.cache            = cache;
        this.fetchConcurrency = Math.max(1, fetchConcurrency);
    }

    public Mono<AnchorsResponse> getAnchors(long limit, long offset) {
        String key = CacheKeys.anchorList(limit, offset);
        return cache.getOrFetch(key, CacheTtlConfig.ANCHOR, RESPONSE_TYPE, () -> computeAnchors(limit, offset));
    }

    Mono<AnchorsResponse> computeAnchors(long limit, long offset) {
        return metadataStore.listAnchors(limit, offset)
            .onErrorMap(e -> storeFailure("Failed to load anchor metadata", e))
            .flatMapSequential(this::buildMetrics, fetchConcurrency)
            .collectList()
            .map(AnchorsResponse::of)
            .doOnSuccess(r -> log.info("Anchor metrics computed. limit={} offset={} anchors={}",
                                       limit, offset, r.total()));
    }

    private Mono<AnchorMetrics> buildMetrics(Anchor anchor) {
        UUID anchorId = parseAnchorId(anchor.getId());

        Mono<Long> assetCoverage = metadataStore.getAssetsByAnchor(anchorId)
            .count()
            .onErrorMap(e -> storeFailure("Failed to load anchor assets", e));

        return Mono.zip(assetCoverage, countResolver.resolve(anchor))
            .map(tuple -> toMetrics(anchor, tuple.getT1(), tuple.getT2()));
    }

    static AnchorMetrics toMetrics(Anchor anchor, long assetCoverage, TransactionCounts counts) {
        double failureRate = ReliabilityCalculator.failureRate(counts.total(), counts.failed());
        double reliability = ReliabilityCalculator.reliabilityScore(
            counts.total(), counts.successful(), anchor.getReliabilityScore());

        return new AnchorMetrics(
            anchor.getId(),
            anchor.getName(),
            anchor.getStellarAccount(),
            reliability,
            assetCoverage,
            failureRate,
            counts.total(),
            counts.successful(),
            counts.failed(),
            ReliabilityCalculator.classifyStatus(reliability));
    }

    /**
     * Anchor ids are expected to be UUIDs. Anything else maps to the nil UUID so one bad
     * row never aborts the batch.
     */
    static UUID parseAnchorId(String id) {
        if (id == null) {
            return NIL_ANCHOR_ID;
        }
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            log.debug("Unparsable anchor id, using nil id. id={}", id);
            return NIL_ANCHOR_ID;
        }
    }

    private static Throwable storeFailure(String message, Throwable e) {
        if (e instanceof ApiException) {
            return e;
        }
        return ApiException.internal(message, e);
    }
}
