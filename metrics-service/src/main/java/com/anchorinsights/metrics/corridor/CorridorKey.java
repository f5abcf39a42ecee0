package com.anchorinsights.metrics.corridor;

import com.anchorinsights.metrics.model.Payment;

import java.util.Optional;

/**
 * Synthetic corridor identity {@code SRC_CODE:SRC_ISSUER->DST_CODE:DST_ISSUER}.
 *
 * <p>The ledger payment feed carries a single asset per payment, so the destination is
 * always the native asset. Native source payments carry no code or issuer and get
 * {@code XLM} and {@code native}.
 */
public record CorridorKey(
    String sourceCode,
    String sourceIssuer,
    String destinationCode,
    String destinationIssuer
) {
    public static final String NATIVE_CODE   = "XLM";
    public static final String NATIVE_ISSUER = "native";

    static final String ROUTE_SEPARATOR = "->";
    static final String ASSET_SEPARATOR = ":";

    public static String bucketKey(Payment payment) {
        String code   = payment.assetCode()   != null ? payment.assetCode()   : NATIVE_CODE;
        String issuer = payment.assetIssuer() != null ? payment.assetIssuer() : NATIVE_ISSUER;
        return code + ASSET_SEPARATOR + issuer + ROUTE_SEPARATOR + NATIVE_CODE + ASSET_SEPARATOR + NATIVE_ISSUER;
    }

    /**
     * Splits a bucket key back into its parts. Empty when the route or either asset does
     * not split into exactly two parts, e.g. when an asset code or issuer itself contains
     * a separator.
     */
    public static Optional<CorridorKey> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String[] route = key.split(ROUTE_SEPARATOR, -1);
        if (route.length != 2) {
            return Optional.empty();
        }
        String[] source      = route[0].split(ASSET_SEPARATOR, -1);
        String[] destination = route[1].split(ASSET_SEPARATOR, -1);
        if (source.length != 2 || destination.length != 2) {
            return Optional.empty();
        }
        return Optional.of(new CorridorKey(source[0], source[1], destination[0], destination[1]));
    }
}
