package com.anchorinsights.metrics.corridor;

import com.anchorinsights.metrics.model.Payment;

import java.math.BigDecimal;

/**
 * Running totals for one corridor while a payment sample is folded.
 *
 * <p>Every payment counts as an attempt. Only amounts that parse as finite decimals add
 * to volume; the rest are counted in {@link #unparsableAmounts()}.
 */
public final class CorridorBucket {

    private long count;
    private BigDecimal volume = BigDecimal.ZERO;
    private long unparsableAmounts;

    public void add(Payment payment) {
        count++;
        BigDecimal amount = parseAmount(payment.amount());
        if (amount != null) {
            volume = volume.add(amount);
        } else {
            unparsableAmounts++;
        }
    }

    public long count() {
        return count;
    }

    public double volume() {
        return volume.doubleValue();
    }

    public long unparsableAmounts() {
        return unparsableAmounts;
    }

    static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
