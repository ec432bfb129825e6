package com.tool.execution.cache;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration for the result cache.
 *
 * @param maxSize    maximum number of entries
 * @param defaultTtl time-to-live for tools that declare none
 * @param enabled    whether caching is enabled
 * @param provider   which implementation backs the cache
 */
public record CacheConfig(int maxSize, Duration defaultTtl, boolean enabled, Provider provider) {

    public enum Provider {
        /** Exact bound, FIFO-by-insertion eviction. */
        FIFO,
        /** Caffeine-backed; bound enforced by Caffeine's own eviction policy. */
        CAFFEINE;

        public static Provider fromString(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("cache provider must not be blank");
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown cache provider: " + value, e);
            }
        }
    }

    public CacheConfig {
        Objects.requireNonNull(defaultTtl, "defaultTtl is required");
        Objects.requireNonNull(provider, "provider is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,000 entries, one hour TTL, FIFO, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, Duration.ofHours(1), true, Provider.FIFO);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false, Provider.FIFO);
    }
}
