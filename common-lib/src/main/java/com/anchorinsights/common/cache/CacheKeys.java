package com.anchorinsights.common.cache;

import java.math.BigDecimal;

/**
 * Deterministic cache key construction.
 *
 * <p>Key formats:
 * <pre>
 *   anchor:list:{limit}:{offset}
 *   corridor:list:{limit}:{offset}:{filterFingerprint}
 * </pre>
 *
 * <p>Optional filter values are rendered through {@link #debug(Object)}, which marks
 * absence explicitly ({@code None}) so that an absent filter never collides with a
 * present one. Free text is embedded verbatim, without case folding.
 */
public final class CacheKeys {

    public static final String ANCHOR_LIST     = "anchor:list";
    public static final String CORRIDOR_LIST   = "corridor:list";

    private CacheKeys() {}

    public static String anchorList(long limit, long offset) {
        return ANCHOR_LIST + ":" + limit + ":" + offset;
    }

    public static String corridorList(long limit, long offset, String filterFingerprint) {
        return CORRIDOR_LIST + ":" + limit + ":" + offset + ":" + filterFingerprint;
    }

    /**
     * Renders an optional value with an explicit presence marker.
     *
     * <ul>
     *   <li>{@code null} → {@code None}</li>
     *   <li>{@code String} → {@code Some("...")} with {@code "} and {@code \} escaped</li>
     *   <li>{@code Double}/{@code Float} → {@code Some(95.0)}, plain notation, at least one fraction digit</li>
     *   <li>anything else → {@code Some(value.toString())}</li>
     * </ul>
     */
    public static String debug(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof String s) {
            return "Some(\"" + escape(s) + "\")";
        }
        if (value instanceof Double || value instanceof Float) {
            return "Some(" + plainDecimal(((Number) value).doubleValue()) + ")";
        }
        return "Some(" + value + ")";
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String plainDecimal(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        String plain = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }
}
