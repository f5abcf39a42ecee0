package com.anchorinsights.metrics.web;

import com.anchorinsights.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Assigns every request an id, echoes it in {@code X-Request-Id} and puts it in the
 * Reactor Context for downstream log lines.
 *
 * <p>Incoming ids are normalized by {@link TraceContextUtil#normalizeRequestId(String)}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdWebFilter.class);

    public static final String HEADER = "X-Request-Id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = TraceContextUtil.normalizeRequestId(exchange.getRequest().getHeaders().getFirst(HEADER));
        exchange.getResponse().getHeaders().set(HEADER, requestId);

        long startNanos = System.nanoTime();
        Mono<Void> handled = chain.filter(exchange)
            .doFinally(signal -> TraceContextUtil.withMdc(requestId, () ->
                log.info("Request completed. method={} path={} status={} elapsedMs={}",
                         exchange.getRequest().getMethod(),
                         exchange.getRequest().getPath().value(),
                         exchange.getResponse().getStatusCode(),
                         (System.nanoTime() - startNanos) / 1_000_000)));

        return TraceContextUtil.withRequestId(handled, requestId);
    }
}
