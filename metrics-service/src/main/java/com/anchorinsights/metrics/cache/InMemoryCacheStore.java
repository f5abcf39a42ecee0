package com.anchorinsights.metrics.cache;

import com.anchorinsights.common.cache.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link CacheStore} for single-instance deployments and local runs.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Expired entries are evicted when read, and
 * every {@value #SWEEP_INTERVAL}th write sweeps all expired entries so that keys which
 * are never read again do not accumulate.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    static final int SWEEP_INTERVAL = 64;

    private record Entry(byte[] value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();
    private final Clock clock;

    public InMemoryCacheStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromSupplier(() -> {
            Entry entry = store.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                store.remove(key, entry);
                log.debug("CACHE_EXPIRED key={}", key);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            store.put(key, new Entry(value, clock.instant().plus(ttl)));
            if (writes.incrementAndGet() % SWEEP_INTERVAL == 0) {
                sweepExpired();
            }
        });
    }

    void sweepExpired() {
        Instant now = clock.instant();
        int before = store.size();
        store.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - store.size();
        if (removed > 0) {
            log.debug("CACHE_SWEEP removed={} remaining={}", removed, store.size());
        }
    }

    public int size() {
        return store.size();
    }
}
