package com.tool.execution.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached tool result.
 *
 * @param key        cache key (see {@link CacheKeys})
 * @param value      the successful result
 * @param insertedAt when the entry was stored
 * @param expiresAt  first instant at which the entry is no longer served
 */
public record CacheEntry(String key, JsonNode value, Instant insertedAt, Instant expiresAt) {

    /**
     * {@code now + ttl}, saturating at {@link Instant#MAX}.
     */
    public static Instant expiryOf(Instant now, Duration ttl) {
        if (ttl.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
            return Instant.MAX;
        }
        return now.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
