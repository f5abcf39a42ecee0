package com.anchorinsights.common.cache;

import com.anchorinsights.common.exception.ApiException;
import com.anchorinsights.common.exception.ErrorKind;
import com.anchorinsights.common.trace.TraceContextUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheAsideExecutorTest {

    record Sample(String name, int count) {}

    private static final TypeReference<Sample> SAMPLE = new TypeReference<>() {};

    private RecordingCacheStore store;
    private CacheAsideExecutor executor;
    private AtomicInteger computeCalls;

    @BeforeEach
    void setup() {
        store = new RecordingCacheStore();
        CacheTtlConfig ttl = new CacheTtlConfig(
            Map.of(CacheTtlConfig.ANCHOR, Duration.ofMinutes(5)), Duration.ofSeconds(30));
        executor = new CacheAsideExecutor(store, new ObjectMapper(), ttl);
        computeCalls = new AtomicInteger();
    }

    private Mono<Sample> compute(Sample value) {
        return Mono.fromCallable(() -> {
            computeCalls.incrementAndGet();
            return value;
        });
    }

    @Nested
    @DisplayName("miss → compute → write")
    class MissTests {

        @Test
        @DisplayName("miss runs compute once and stores the result with the given TTL")
        void missPopulates() {
            Sample result = executor.getOrFetch("k1", Duration.ofSeconds(42), SAMPLE,
                () -> compute(new Sample("a", 1))).block();

            assertEquals(new Sample("a", 1), result);
            assertEquals(1, computeCalls.get());
            assertTrue(store.values.containsKey("k1"));
            assertEquals(Duration.ofSeconds(42), store.ttls.get("k1"));
        }

        @Test
        @DisplayName("resource tag resolves TTL through the config; unknown tag uses default")
        void ttlByTag() {
            executor.getOrFetch("a", "anchor", SAMPLE, () -> compute(new Sample("a", 1))).block();
            executor.getOrFetch("b", "unknown", SAMPLE, () -> compute(new Sample("b", 2))).block();

            assertEquals(Duration.ofMinutes(5), store.ttls.get("a"));
            assertEquals(Duration.ofSeconds(30), store.ttls.get("b"));
        }

        @Test
        @DisplayName("failed compute propagates and writes nothing")
        void failedComputeNotCached() {
            Mono<Sample> failing = executor.getOrFetch("k2", Duration.ofSeconds(5), SAMPLE,
                () -> Mono.error(ApiException.internal("store down", new RuntimeException())));

            ApiException ex = assertThrows(ApiException.class, failing::block);
            assertEquals(ErrorKind.INTERNAL_ERROR, ex.getKind());
            assertEquals(0, store.setCalls.get());
            assertFalse(store.values.containsKey("k2"));
        }

        @Test
        @DisplayName("supplier that throws is surfaced as an error, not thrown at assembly")
        void throwingSupplier() {
            Mono<Sample> mono = executor.getOrFetch("k3", Duration.ofSeconds(5), SAMPLE, () -> {
                throw new IllegalStateException("boom");
            });
            assertThrows(IllegalStateException.class, mono::block);
            assertEquals(0, store.setCalls.get());
        }
    }

    @Nested
    @DisplayName("hit")
    class HitTests {

        @Test
        @DisplayName("repeated call with the same key does not recompute")
        void roundTrip() {
            executor.getOrFetch("k", Duration.ofSeconds(5), SAMPLE, () -> compute(new Sample("x", 7))).block();
            Sample second = executor.getOrFetch("k", Duration.ofSeconds(5), SAMPLE,
                () -> compute(new Sample("other", 0))).block();

            assertEquals(new Sample("x", 7), second);
            assertEquals(1, computeCalls.get());
            assertEquals(1, store.setCalls.get());

            CacheStats stats = executor.stats();
            assertEquals(1, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(1, stats.writes());
            assertEquals(0.5, stats.hitRatio(), 1e-9);
        }

        @Test
        @DisplayName("generic collection types round-trip")
        void genericList() {
            TypeReference<List<Sample>> listType = new TypeReference<>() {};
            executor.getOrFetch("list", Duration.ofSeconds(5), listType,
                () -> Mono.just(List.of(new Sample("a", 1), new Sample("b", 2)))).block();

            List<Sample> cached = executor.getOrFetch("list", Duration.ofSeconds(5), listType,
                () -> Mono.error(new AssertionError("must not recompute"))).block();

            assertEquals(List.of(new Sample("a", 1), new Sample("b", 2)), cached);
        }

        @Test
        @DisplayName("undecodable entry is treated as a miss and overwritten")
        void corruptEntry() {
            store.putRaw("bad", "{not json");

            Sample result = executor.getOrFetch("bad", Duration.ofSeconds(5), SAMPLE,
                () -> compute(new Sample("fresh", 3))).block();

            assertEquals(new Sample("fresh", 3), result);
            assertEquals(1, computeCalls.get());
            assertEquals(1, executor.stats().decodeFailures());
        }

        @Test
        @DisplayName("request id from the Reactor context does not change the result")
        void withRequestId() {
            Sample result = TraceContextUtil.withRequestId(
                executor.getOrFetch("rid", Duration.ofSeconds(5), SAMPLE, () -> compute(new Sample("r", 1))),
                "req-123").block();
            assertEquals(new Sample("r", 1), result);
        }
    }

    @Nested
    @DisplayName("cache store failures")
    class StoreFailureTests {

        @Test
        @DisplayName("read failure → INTERNAL_ERROR, compute not run")
        void readFailure() {
            store.failReads = true;
            ApiException ex = assertThrows(ApiException.class,
                () -> executor.getOrFetch("k", Duration.ofSeconds(5), SAMPLE,
                    () -> compute(new Sample("a", 1))).block());

            assertEquals(ErrorKind.INTERNAL_ERROR, ex.getKind());
            assertEquals(0, computeCalls.get());
        }

        @Test
        @DisplayName("write failure → INTERNAL_ERROR")
        void writeFailure() {
            store.failWrites = true;
            ApiException ex = assertThrows(ApiException.class,
                () -> executor.getOrFetch("k", Duration.ofSeconds(5), SAMPLE,
                    () -> compute(new Sample("a", 1))).block());

            assertEquals(ErrorKind.INTERNAL_ERROR, ex.getKind());
            assertEquals("Cache write failed", ex.getMessage());
        }
    }
}
