package com.anchorinsights.metrics.config;

import com.anchorinsights.common.cache.CacheAsideExecutor;
import com.anchorinsights.common.cache.CacheStore;
import com.anchorinsights.common.cache.CacheTtlConfig;
import com.anchorinsights.metrics.cache.InMemoryCacheStore;
import com.anchorinsights.metrics.cache.RedisCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.time.Duration;
import java.util.Map;

/**
 * Cache wiring. {@code cache.store} selects the backing store ({@code redis} by default,
 * {@code memory} for single-instance runs).
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Value("${cache.ttl.anchor:5m}")
    private Duration anchorTtl;

    @Value("${cache.ttl.corridor:2m}")
    private Duration corridorTtl;

    @Value("${cache.ttl.default:5m}")
    private Duration defaultTtl;

    @Bean
    public CacheTtlConfig cacheTtlConfig() {
        CacheTtlConfig config = new CacheTtlConfig(
            Map.of(CacheTtlConfig.ANCHOR, anchorTtl, CacheTtlConfig.CORRIDOR, corridorTtl),
            defaultTtl);
        log.info("Cache TTLs configured. anchor={}s corridor={}s default={}s",
                 anchorTtl.toSeconds(), corridorTtl.toSeconds(), defaultTtl.toSeconds());
        return config;
    }

    @Bean
    @ConditionalOnProperty(name = "cache.store", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
            .<String, byte[]>newSerializationContext(RedisSerializer.string())
            .value(RedisSerializer.byteArray())
            .build();
        log.info("Cache store: redis");
        return new RedisCacheStore(new ReactiveRedisTemplate<>(connectionFactory, context));
    }

    @Bean
    @ConditionalOnProperty(name = "cache.store", havingValue = "memory")
    public CacheStore inMemoryCacheStore() {
        log.info("Cache store: in-memory");
        return new InMemoryCacheStore();
    }

    @Bean
    public CacheAsideExecutor cacheAsideExecutor(CacheStore cacheStore,
                                                 ObjectMapper objectMapper,
                                                 CacheTtlConfig cacheTtlConfig) {
        return new CacheAsideExecutor(cacheStore, objectMapper, cacheTtlConfig);
    }
}
