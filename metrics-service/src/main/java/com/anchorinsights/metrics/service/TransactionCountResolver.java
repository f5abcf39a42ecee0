package com.anchorinsights.metrics.service;

import com.anchorinsights.metrics.client.LedgerDataSource;
import com.anchorinsights.metrics.model.Anchor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Chooses live or stored transaction counters for an anchor.
 *
 * <ul>
 *   <li>Live fetch succeeds with payments → {@link TransactionCounts#live(int)}</li>
 *   <li>Live fetch succeeds with no payments → stored counters</li>
 *   <li>Live fetch fails → stored counters, WARN logged</li>
 * </ul>
 *
 * <p>Never emits an error: a ledger failure for one anchor cannot affect any other.
 */
@Component
public class TransactionCountResolver {

    private static final Logger log = LoggerFactory.getLogger(TransactionCountResolver.class);

    static final int LIVE_PAYMENT_LIMIT = 200;

    static final String REASON_NO_PAYMENTS = "no live payments";
    static final String REASON_FETCH_FAILED = "live fetch failed";

    private final LedgerDataSource ledgerDataSource;

    public TransactionCountResolver(LedgerDataSource ledgerDataSource) {
        this.ledgerDataSource = ledgerDataSource;
    }

    public Mono<TransactionCounts> resolve(Anchor anchor) {
        return Mono.defer(() -> ledgerDataSource.fetchAccountPayments(anchor.getStellarAccount(), LIVE_PAYMENT_LIMIT))
            .map(payments -> payments.isEmpty()
                ? TransactionCounts.fallback(anchor, REASON_NO_PAYMENTS)
                : TransactionCounts.live(payments.size()))
            .switchIfEmpty(Mono.fromSupplier(() -> TransactionCounts.fallback(anchor, REASON_NO_PAYMENTS)))
            .onErrorResume(e -> {
                log.warn("Failed to fetch payments for anchor. account={} reason={}. Using stored counters.",
                         anchor.getStellarAccount(), e.getMessage());
                return Mono.just(TransactionCounts.fallback(anchor, REASON_FETCH_FAILED));
            });
    }
}
