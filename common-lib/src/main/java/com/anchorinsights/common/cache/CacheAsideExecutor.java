package com.anchorinsights.common.cache;

import com.anchorinsights.common.exception.ApiException;
import com.anchorinsights.common.trace.TraceContextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Generic get-or-compute over a {@link CacheStore}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Read the key. A hit that deserializes is returned and {@code compute} is not run.</li>
 *   <li>A hit that fails to deserialize is counted and treated as a miss.</li>
 *   <li>On a miss, run {@code compute}. Only a successful result is serialized and written
 *       with the given TTL; a failed compute propagates and writes nothing.</li>
 * </ol>
 *
 * <p>Cache read/write failures surface as {@link ApiException} of kind
 * {@code INTERNAL_ERROR}.
 *
 * <p>Check, compute and write are not atomic. Two concurrent misses on the same key both
 * compute and both write; the last write wins. Callers that need single-flight semantics
 * must de-duplicate in-flight requests in front of this executor.
 */
public class CacheAsideExecutor {

    private static final Logger log = LoggerFactory.getLogger(CacheAsideExecutor.class);

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final CacheTtlConfig ttlConfig;

    private final AtomicLong hits           = new AtomicLong();
    private final AtomicLong misses         = new AtomicLong();
    private final AtomicLong writes         = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();

    public CacheAsideExecutor(CacheStore store, ObjectMapper objectMapper, CacheTtlConfig ttlConfig) {
        this.store        = store;
        this.objectMapper = objectMapper;
        this.ttlConfig    = ttlConfig;
    }

    /**
     * Resolves the TTL for {@code resourceTag} from the configured {@link CacheTtlConfig}
     * and delegates to {@link #getOrFetch(String, Duration, TypeReference, Supplier)}.
     */
    public <T> Mono<T> getOrFetch(String key, String resourceTag,
                                  TypeReference<T> type, Supplier<Mono<T>> compute) {
        return getOrFetch(key, ttlConfig.ttlFor(resourceTag), type, compute);
    }

    public <T> Mono<T> getOrFetch(String key, Duration ttl,
                                  TypeReference<T> type, Supplier<Mono<T>> compute) {
        JavaType javaType = objectMapper.getTypeFactory().constructType(type);

        return Mono.deferContextual(ctx -> {
            String requestId = TraceContextUtil.getRequestId(ctx);

            return store.get(key)
                .onErrorMap(e -> ApiException.internal("Cache read failed", e))
                .flatMap(bytes -> this.<T>decode(key, bytes, javaType))
                .doOnNext(value -> {
                    hits.incrementAndGet();
                    TraceContextUtil.logWith(ctx, () -> log.info("CACHE_HIT key={} requestId={}", key, requestId));
                })
                .switchIfEmpty(Mono.defer(() -> {
                    misses.incrementAndGet();
                    TraceContextUtil.logWith(ctx, () -> log.info("CACHE_MISS key={} requestId={}", key, requestId));
                    return Mono.defer(compute)
                        .flatMap(value -> write(key, value, ttl).thenReturn(value));
                }));
        });
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), writes.get(), decodeFailures.get());
    }

    public CacheTtlConfig ttlConfig() {
        return ttlConfig;
    }

    // ── serialization ──────────────────────────────────────────────────────

    private <T> Mono<T> decode(String key, byte[] bytes, JavaType javaType) {
        return Mono.<T>fromCallable(() -> objectMapper.readValue(bytes, javaType))
            .onErrorResume(IOException.class, e -> {
                decodeFailures.incrementAndGet();
                log.warn("CACHE_DECODE_FAILED key={} bytes={} reason={}", key, bytes.length, e.getMessage());
                return Mono.empty();
            });
    }

    private <T> Mono<Void> write(String key, T value, Duration ttl) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            return Mono.error(ApiException.internal("Failed to serialize response for caching", e));
        }
        return store.set(key, bytes, ttl)
            .onErrorMap(e -> ApiException.internal("Cache write failed", e))
            .doOnSuccess(ignored -> {
                writes.incrementAndGet();
                log.debug("CACHE_WRITE key={} ttlSeconds={} bytes={}", key, ttl.toSeconds(), bytes.length);
            });
    }
}
