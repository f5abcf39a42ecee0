package com.anchorinsights.metrics.client;

import com.anchorinsights.metrics.model.Payment;
import com.anchorinsights.metrics.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link LedgerDataSource} over the ledger's Horizon REST API.
 *
 * <p>Each call requests a single page in descending order. The ledger caps page size at
 * {@value #MAX_PAGE_SIZE}; larger requests are clamped.
 */
public class HorizonLedgerClient implements LedgerDataSource {

    private static final Logger log = LoggerFactory.getLogger(HorizonLedgerClient.class);

    static final int MAX_PAGE_SIZE = 200;

    private static final ParameterizedTypeReference<HorizonPage<Payment>> PAYMENT_PAGE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<HorizonPage<Trade>> TRADE_PAGE =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    public HorizonLedgerClient(WebClient ledgerWebClient) {
        this.webClient = ledgerWebClient;
    }

    @Override
    public Mono<List<Payment>> fetchAccountPayments(String account, int max) {
        return webClient.get()
            .uri(b -> page(b.path("/accounts/{account}/payments"), max, null).build(account))
            .retrieve()
            .bodyToMono(PAYMENT_PAGE)
            .map(HorizonPage::records)
            .doOnSuccess(p -> log.debug("Ledger account payments fetched. account={} count={}", account, size(p)))
            .doOnError(e -> log.debug("Ledger account payments failed. account={}", account, e));
    }

    @Override
    public Mono<List<Payment>> fetchPayments(int max, String cursor) {
        return webClient.get()
            .uri(b -> page(b.path("/payments"), max, cursor).build())
            .retrieve()
            .bodyToMono(PAYMENT_PAGE)
            .map(HorizonPage::records)
            .doOnSuccess(p -> log.debug("Ledger payments fetched. count={} cursor={}", size(p), cursor));
    }

    @Override
    public Mono<List<Trade>> fetchTrades(int max, String cursor) {
        return webClient.get()
            .uri(b -> page(b.path("/trades"), max, cursor).build())
            .retrieve()
            .bodyToMono(TRADE_PAGE)
            .map(HorizonPage::records)
            .doOnSuccess(t -> log.debug("Ledger trades fetched. count={} cursor={}", size(t), cursor));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static UriBuilder page(UriBuilder builder, int max, String cursor) {
        builder.queryParam("limit", Math.max(1, Math.min(max, MAX_PAGE_SIZE)))
               .queryParam("order", "desc");
        if (cursor != null && !cursor.isBlank()) {
            builder.queryParam("cursor", cursor);
        }
        return builder;
    }

    private static int size(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
