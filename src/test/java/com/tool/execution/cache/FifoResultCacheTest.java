package com.tool.execution.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tool.execution.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FifoResultCache Tests")
class FifoResultCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private FifoResultCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        cache = new FifoResultCache(3, clock);
    }

    @Nested
    @DisplayName("Eviction")
    class Eviction {

        @Test
        @DisplayName("Oldest insertion is evicted first")
        void fifoOrder() {
            cache.put("a", IntNode.valueOf(1), TTL);
            cache.put("b", IntNode.valueOf(2), TTL);
            cache.put("c", IntNode.valueOf(3), TTL);
            cache.get("a");
            cache.put("d", IntNode.valueOf(4), TTL);

            assertTrue(cache.get("a").isEmpty(), "reads do not refresh insertion order");
            assertTrue(cache.get("b").isPresent());
            assertTrue(cache.get("d").isPresent());
            assertEquals(3, cache.size());
            assertEquals(1, cache.getStats().evictionCount());
        }

        @Test
        @DisplayName("Overwriting a key moves it to the back of the queue")
        void overwriteMovesToBack() {
            cache.put("a", IntNode.valueOf(1), TTL);
            cache.put("b", IntNode.valueOf(2), TTL);
            cache.put("c", IntNode.valueOf(3), TTL);
            cache.put("a", IntNode.valueOf(10), TTL);
            cache.put("d", IntNode.valueOf(4), TTL);

            assertTrue(cache.get("b").isEmpty());
            assertEquals(10, cache.get("a").orElseThrow().asInt());
            assertEquals(3, cache.size());
        }

        @Test
        @DisplayName("Size bound holds under concurrent writers")
        void concurrentBound() throws Exception {
            FifoResultCache bounded = new FifoResultCache(50, clock);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    int thread = t;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 500; i++) {
                            bounded.put("k-" + thread + "-" + i, IntNode.valueOf(i), TTL);
                            assertTrue(bounded.size() <= 50);
                        }
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(50, bounded.size());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Entry is served until just before expiresAt and missed at expiresAt")
        void expiresAtBoundary() {
            cache.put("a", TextNode.valueOf("v"), Duration.ofSeconds(10));

            clock.advance(Duration.ofMillis(9_999));
            assertTrue(cache.get("a").isPresent());

            clock.advance(Duration.ofMillis(1));
            assertTrue(cache.get("a").isEmpty());
            assertEquals(0, cache.size());
            assertEquals(1, cache.getStats().expirationCount());
        }

        @Test
        @DisplayName("Zero TTL stores an entry that is never served")
        void zeroTtl() {
            cache.put("a", TextNode.valueOf("v"), Duration.ZERO);

            assertTrue(cache.get("a").isEmpty());
        }

        @Test
        @DisplayName("A TTL past the end of time never expires")
        void unboundedTtl() {
            cache.put("a", TextNode.valueOf("v"), Duration.ofSeconds(Long.MAX_VALUE));

            clock.advance(Duration.ofDays(365L * 10_000));
            assertEquals("v", cache.get("a").orElseThrow().asText());
        }

        @Test
        @DisplayName("Negative TTL is rejected")
        void negativeTtl() {
            assertThrows(IllegalArgumentException.class,
                    () -> cache.put("a", TextNode.valueOf("v"), Duration.ofSeconds(-1)));
        }
    }

    @Nested
    @DisplayName("Stats and isolation")
    class StatsAndIsolation {

        @Test
        @DisplayName("Hits and misses are counted")
        void stats() {
            cache.put("a", IntNode.valueOf(1), TTL);
            cache.get("a");
            cache.get("a");
            cache.get("missing");

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
            assertEquals(1, stats.size());
        }

        @Test
        @DisplayName("Stored and returned values are copies")
        void copies() {
            ObjectNode value = JsonNodeFactory.instance.objectNode().put("n", 1);
            cache.put("a", value, TTL);
            value.put("n", 2);

            JsonNode first = cache.get("a").orElseThrow();
            ((ObjectNode) first).put("n", 3);

            assertEquals(1, cache.get("a").orElseThrow().get("n").asInt());
        }

        @Test
        @DisplayName("invalidate and invalidateAll remove entries")
        void invalidation() {
            cache.put("a", IntNode.valueOf(1), TTL);
            cache.put("b", IntNode.valueOf(2), TTL);

            cache.invalidate("a");
            assertTrue(cache.get("a").isEmpty());
            assertEquals(1, cache.size());

            cache.invalidateAll();
            assertEquals(0, cache.size());
        }
    }

    @Test
    @DisplayName("Non-positive maxSize is rejected")
    void invalidMaxSize() {
        assertThrows(IllegalArgumentException.class, () -> new FifoResultCache(0, clock));
    }
}
