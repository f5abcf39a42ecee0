package com.anchorinsights.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Request-id handling for reactive pipelines.
 *
 * <p>The id lives in the Reactor Context under {@link #REQUEST_ID_KEY}. It is copied into
 * MDC only while a single log statement runs, since a reactive pipeline may hop threads
 * between operators.
 *
 * <pre>
 *     // edge
 *     String id = TraceContextUtil.normalizeRequestId(header);
 *     return TraceContextUtil.withRequestId(chain.filter(exchange), id);
 *
 *     // inside
 *     Mono.deferContextual(ctx -> { TraceContextUtil.logWith(ctx, () -> log.info(...)); ... })
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";

    static final String UNKNOWN = "unknown";
    static final int MAX_REQUEST_ID_LENGTH = 128;

    private TraceContextUtil() {}

    /**
     * Caller-supplied ids are kept when non-blank and at most {@value #MAX_REQUEST_ID_LENGTH}
     * characters after trimming. Anything else is replaced by a random UUID.
     */
    public static String normalizeRequestId(String incoming) {
        if (incoming == null) {
            return UUID.randomUUID().toString();
        }
        String trimmed = incoming.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_REQUEST_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }

    /** Call at the end of pipeline assembly; {@code contextWrite} applies upstream. */
    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with the context's request id in MDC.
     */
    public static void logWith(ContextView ctx, Runnable logAction) {
        withMdc(getRequestId(ctx), logAction);
    }

    public static void withMdc(String requestId, Runnable logAction) {
        String previous = MDC.get(REQUEST_ID_KEY);
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            if (previous != null) {
                MDC.put(REQUEST_ID_KEY, previous);
            } else {
                MDC.remove(REQUEST_ID_KEY);
            }
        }
    }
}
