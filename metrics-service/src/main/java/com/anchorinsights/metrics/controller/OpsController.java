package com.anchorinsights.metrics.controller;

import com.anchorinsights.common.cache.CacheAsideExecutor;
import com.anchorinsights.common.cache.CacheStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Liveness and cache counters. Counters are process-local and reset on restart.
 */
@RestController
@RequestMapping("/api")
public class OpsController {

    private final CacheAsideExecutor cache;

    public OpsController(CacheAsideExecutor cache) {
        this.cache = cache;
    }

    @GetMapping("/health")
    public Mono<String> health() {
        return Mono.just("OK");
    }

    @GetMapping("/cache/stats")
    public Mono<ResponseEntity<CacheStats>> cacheStats() {
        return Mono.fromSupplier(cache::stats).map(ResponseEntity::ok);
    }
}
