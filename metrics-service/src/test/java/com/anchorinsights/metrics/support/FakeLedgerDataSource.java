package com.anchorinsights.metrics.support;

import com.anchorinsights.metrics.client.LedgerDataSource;
import com.anchorinsights.metrics.model.Payment;
import com.anchorinsights.metrics.model.Trade;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link LedgerDataSource}. Accounts listed in {@link #failingAccounts} fail;
 * unknown accounts return no payments.
 */
public class FakeLedgerDataSource implements LedgerDataSource {

    public final Map<String, List<Payment>> accountPayments = new ConcurrentHashMap<>();
    public final Set<String> failingAccounts = new HashSet<>();
    public final List<Payment> networkPayments = new ArrayList<>();
    public final List<Trade> trades = new ArrayList<>();

    public final AtomicInteger accountCalls = new AtomicInteger();
    public final AtomicInteger paymentCalls = new AtomicInteger();
    public final AtomicInteger tradeCalls   = new AtomicInteger();

    public volatile boolean failPayments;
    public volatile boolean failTrades;

    @Override
    public Mono<List<Payment>> fetchAccountPayments(String account, int max) {
        accountCalls.incrementAndGet();
        if (failingAccounts.contains(account)) {
            return Mono.error(new IllegalStateException("ledger timeout for " + account));
        }
        return Mono.just(accountPayments.getOrDefault(account, List.of()));
    }

    @Override
    public Mono<List<Payment>> fetchPayments(int max, String cursor) {
        paymentCalls.incrementAndGet();
        if (failPayments) {
            return Mono.error(new IllegalStateException("ledger unavailable"));
        }
        return Mono.just(List.copyOf(networkPayments));
    }

    @Override
    public Mono<List<Trade>> fetchTrades(int max, String cursor) {
        tradeCalls.incrementAndGet();
        if (failTrades) {
            return Mono.error(new IllegalStateException("ledger unavailable"));
        }
        return Mono.just(List.copyOf(trades));
    }

    public static Payment payment(String assetCode, String assetIssuer, String amount) {
        String type = assetCode == null ? "native" : "credit_alphanum4";
        return new Payment("p-" + System.nanoTime(), null, "payment", "GFROM", "GTO",
                           type, assetCode, assetIssuer, amount, "2024-01-01T00:00:00Z", Boolean.TRUE);
    }

    public static List<Payment> payments(int count) {
        List<Payment> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            list.add(payment(null, null, "1.0"));
        }
        return list;
    }
}
