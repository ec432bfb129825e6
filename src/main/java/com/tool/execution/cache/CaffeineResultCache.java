package com.tool.execution.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed result cache with a per-entry TTL.
 *
 * <p>The size bound is enforced by Caffeine's admission policy, which is not strictly
 * FIFO. Time is read from the injected {@link Clock} so expiry can be driven in tests.</p>
 */
public class CaffeineResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResultCache.class);
    private static final Duration MAX_EXPIRY = Duration.ofNanos(Long.MAX_VALUE);

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public CaffeineResultCache(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.clock = Objects.requireNonNull(clock, "clock is required");
        long originMillis = clock.millis();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new EntryExpiry())
                .ticker(() -> (clock.millis() - originMillis) * 1_000_000L)
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("CaffeineResultCache initialized: maxSize={}", maxSize);
    }

    @Override
    public Optional<JsonNode> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value().deepCopy());
    }

    @Override
    public void put(String key, JsonNode value, Duration ttl) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
        var now = clock.instant();
        cache.put(key, new CacheEntry(key, value.deepCopy(), now, CacheEntry.expiryOf(now, ttl)));
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.cleared");
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                0,
                size()
        );
    }

    private final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry entry) {
            Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
            if (remaining.isZero() || remaining.isNegative()) {
                return 0;
            }
            return remaining.compareTo(MAX_EXPIRY) >= 0 ? Long.MAX_VALUE : remaining.toNanos();
        }
    }
}
