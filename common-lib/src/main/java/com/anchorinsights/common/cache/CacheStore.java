package com.anchorinsights.common.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Byte-level key/value store behind the {@link CacheAsideExecutor}.
 *
 * <p>Implementations own storage, expiry and eviction. Callers only choose the key
 * and the TTL at write time.
 */
public interface CacheStore {

    /**
     * @return the stored bytes, or an empty {@code Mono} on a miss (absent or expired)
     */
    Mono<byte[]> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous entry.
     */
    Mono<Void> set(String key, byte[] value, Duration ttl);
}
