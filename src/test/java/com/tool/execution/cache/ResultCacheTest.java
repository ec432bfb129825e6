package com.tool.execution.cache;

import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultCache factory and config Tests")
class ResultCacheTest {

    private final Clock clock = Clock.systemUTC();

    @Test
    @DisplayName("Factory selects the implementation from the config")
    void factory() {
        assertInstanceOf(FifoResultCache.class, ResultCache.create(CacheConfig.defaults(), clock));
        assertInstanceOf(CaffeineResultCache.class, ResultCache.create(
                new CacheConfig(10, Duration.ofMinutes(1), true, CacheConfig.Provider.CAFFEINE), clock));
        assertInstanceOf(NoOpResultCache.class, ResultCache.create(CacheConfig.disabled(), clock));
    }

    @Test
    @DisplayName("Disabled cache never stores anything")
    void noOp() {
        ResultCache cache = new NoOpResultCache();
        cache.put("a", IntNode.valueOf(1), Duration.ofMinutes(1));

        assertTrue(cache.get("a").isEmpty());
        assertEquals(0, cache.size());
        assertEquals(CacheStats.empty(), cache.getStats());
    }

    @Test
    @DisplayName("Config rejects invalid bounds and parses providers case-insensitively")
    void config() {
        assertThrows(IllegalArgumentException.class,
                () -> new CacheConfig(0, Duration.ofMinutes(1), true, CacheConfig.Provider.FIFO));
        assertThrows(IllegalArgumentException.class,
                () -> new CacheConfig(10, Duration.ZERO, true, CacheConfig.Provider.FIFO));
        assertEquals(CacheConfig.Provider.CAFFEINE, CacheConfig.Provider.fromString(" caffeine "));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.Provider.fromString("redis"));
    }

    @Test
    @DisplayName("Hit rate is zero with no traffic")
    void hitRateNoTraffic() {
        assertEquals(0.0, CacheStats.empty().hitRate());
    }
}
