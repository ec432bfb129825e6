package com.tool.execution.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * No-op cache implementation. Every lookup misses and nothing is stored.
 * Used when caching is disabled.
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public Optional<JsonNode> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, JsonNode value, Duration ttl) {
        // no-op
    }

    @Override
    public void invalidate(String key) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
