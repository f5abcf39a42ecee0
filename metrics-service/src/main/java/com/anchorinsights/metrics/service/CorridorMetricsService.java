package com.anchorinsights.metrics.service;

import com.anchorinsights.common.cache.CacheAsideExecutor;
import com.anchorinsights.common.cache.CacheKeys;
import com.anchorinsights.common.cache.CacheTtlConfig;
import com.anchorinsights.common.exception.ApiException;
import com.anchorinsights.metrics.client.LedgerDataSource;
import com.anchorinsights.metrics.corridor.CorridorAggregator;
import com.anchorinsights.metrics.dto.CorridorListQuery;
import com.anchorinsights.metrics.dto.CorridorMetrics;
import com.anchorinsights.metrics.dto.SortBy;
import com.anchorinsights.metrics.filter.CorridorFilter;
import com.anchorinsights.metrics.model.Payment;
import com.anchorinsights.metrics.model.Trade;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Corridor list derived from a network-wide payment sample, served cache-aside.
 *
 * <p><strong>Failure policy:</strong> the list is fail-open. A payment fetch failure is
 * logged and yields an empty list, which is cached like any other result. A trade fetch
 * failure is logged and ignored.
 *
 * <p>The cached value is the filtered, unsorted corridor list for one cache key. Sorting is
 * applied to every response, hit or miss. {@code limit} and {@code offset} only select the
 * cache entry; every filtered corridor is returned.
 */
@Service
public class CorridorMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CorridorMetricsService.class);

    static final int PAYMENT_SAMPLE_SIZE = 200;
    static final int TRADE_SAMPLE_SIZE   = 200;

    static final String DETAIL_NOT_AVAILABLE = "Corridor detail endpoint not yet implemented with RPC";

    private static final TypeReference<List<CorridorMetrics>> LIST_TYPE = new TypeReference<>() {};

    private final LedgerDataSource ledgerDataSource;
    private final CorridorAggregator aggregator;
    private final CacheAsideExecutor cache;

    public CorridorMetricsService(LedgerDataSource ledgerDataSource,
                                  CorridorAggregator aggregator,
                                  CacheAsideExecutor cache) {
        this.ledgerDataSource = ledgerDataSource;
        this.aggregator       = aggregator;
        this.cache            = cache;
    }

    public Mono<List<CorridorMetrics>> listCorridors(CorridorListQuery query) {
        CorridorFilter filter = query.filter();
        String key = CacheKeys.corridorList(query.limit(), query.offset(), filter.fingerprint());

        return cache.getOrFetch(key, CacheTtlConfig.CORRIDOR, LIST_TYPE, () -> computeCorridors(filter))
            .map(corridors -> sort(corridors, query.sortBy()));
    }

    /**
     * Per-corridor detail needs ledger path-finding data this service does not consume, so
     * every key resolves to {@code NOT_FOUND}. The key is not parsed or validated.
     */
    public Mono<CorridorMetrics> getCorridorDetail(String corridorKey) {
        log.debug("Corridor detail requested. key={}", corridorKey);
        return Mono.error(ApiException.notFound(DETAIL_NOT_AVAILABLE));
    }

    Mono<List<CorridorMetrics>> computeCorridors(CorridorFilter filter) {
        return Mono.defer(() -> ledgerDataSource.fetchPayments(PAYMENT_SAMPLE_SIZE, null))
            .onErrorResume(e -> {
                log.error("Failed to fetch payments from ledger. Serving empty corridor list. reason={}",
                          e.getMessage());
                return Mono.empty();
            })
            .flatMap(payments -> fetchTrades().map(trades -> buildCorridors(payments, trades, filter)))
            .defaultIfEmpty(List.of());
    }

    // Trades are fetched for parity with the ledger sample window; corridor figures do
    // not use them yet.
    private Mono<List<Trade>> fetchTrades() {
        return Mono.defer(() -> ledgerDataSource.fetchTrades(TRADE_SAMPLE_SIZE, null))
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Failed to fetch trades from ledger. Continuing without. reason={}", e.getMessage());
                return Mono.just(List.of());
            });
    }

    private List<CorridorMetrics> buildCorridors(List<Payment> payments, List<Trade> trades,
                                                 CorridorFilter filter) {
        List<CorridorMetrics> all = aggregator.aggregate(payments);
        List<CorridorMetrics> matching = filter.apply(all);
        log.info("Corridor metrics computed. payments={} trades={} corridors={} afterFilter={}",
                 payments.size(), trades.size(), all.size(), matching.size());
        return matching;
    }

    static List<CorridorMetrics> sort(List<CorridorMetrics> corridors, SortBy sortBy) {
        return corridors.stream().sorted(sortBy.comparator()).toList();
    }
}
