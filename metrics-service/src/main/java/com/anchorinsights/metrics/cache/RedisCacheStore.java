package com.anchorinsights.metrics.cache;

import com.anchorinsights.common.cache.CacheStore;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared {@link CacheStore} on Redis. Expiry is delegated to Redis via {@code SET ... PX}.
 */
public class RedisCacheStore implements CacheStore {

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;

    public RedisCacheStore(ReactiveRedisTemplate<String, byte[]> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl).then();
    }
}
