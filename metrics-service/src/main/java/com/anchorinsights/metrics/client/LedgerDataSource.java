package com.anchorinsights.metrics.client;

import com.anchorinsights.metrics.model.Payment;
import com.anchorinsights.metrics.model.Trade;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Live transaction data from the ledger. Implementations do a single request per call;
 * retry and pagination beyond one page are not their concern here.
 */
public interface LedgerDataSource {

    /** Most recent payments touching {@code account}, newest first. */
    Mono<List<Payment>> fetchAccountPayments(String account, int max);

    /** Most recent payments network-wide, newest first, optionally after {@code cursor}. */
    Mono<List<Payment>> fetchPayments(int max, String cursor);

    /** Most recent trades network-wide, newest first, optionally after {@code cursor}. */
    Mono<List<Trade>> fetchTrades(int max, String cursor);
}
