package com.tool.execution.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Bounded, TTL-based store of successful tool results, keyed by {@link CacheKeys#derive}.
 * Implementations must be safe for concurrent use.
 */
public interface ResultCache {

    /**
     * Gets a cached result. A miss, including an expired entry, is silent.
     *
     * @param key the cache key
     * @return the cached value, or empty on a miss
     */
    Optional<JsonNode> get(String key);

    /**
     * Inserts or overwrites a result. A zero TTL stores an entry that is already expired.
     *
     * @param key   the cache key
     * @param value the result to cache
     * @param ttl   time-to-live of the entry
     */
    void put(String key, JsonNode value, Duration ttl);

    /**
     * Removes a single entry, if present.
     */
    void invalidate(String key);

    /**
     * Removes every entry.
     */
    void invalidateAll();

    /**
     * Current number of stored entries, expired ones not yet collected included.
     */
    long size();

    CacheStats getStats();

    /**
     * Creates the cache implementation selected by the configuration.
     */
    static ResultCache create(CacheConfig config, Clock clock) {
        if (!config.enabled()) {
            return new NoOpResultCache();
        }
        return switch (config.provider()) {
            case FIFO -> new FifoResultCache(config.maxSize(), clock);
            case CAFFEINE -> new CaffeineResultCache(config.maxSize(), clock);
        };
    }
}
