package com.tool.execution.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Result cache with an exact size bound and FIFO-by-insertion eviction.
 *
 * <p>Reads go through a {@link ConcurrentHashMap} without locking. Writes take a lock that
 * also guards the insertion-order index, so the entry count never exceeds {@code maxSize}
 * once a write returns. Overwriting a key moves it to the back of the eviction order.
 * Expired entries are dropped lazily when read.</p>
 */
public class FifoResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(FifoResultCache.class);

    private final int maxSize;
    private final Clock clock;
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    // Insertion order; guarded by writeLock
    private final LinkedHashMap<String, Instant> insertionOrder = new LinkedHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    public FifoResultCache(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        log.info("FifoResultCache initialized: maxSize={}", maxSize);
    }

    @Override
    public Optional<JsonNode> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            removeExpired(entry);
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.value().deepCopy());
    }

    @Override
    public void put(String key, JsonNode value, Duration ttl) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, value.deepCopy(), now, CacheEntry.expiryOf(now, ttl));

        writeLock.lock();
        try {
            insertionOrder.remove(key);
            while (insertionOrder.size() >= maxSize) {
                evictEldest();
            }
            insertionOrder.put(key, now);
            entries.put(key, entry);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void invalidate(String key) {
        writeLock.lock();
        try {
            insertionOrder.remove(key);
            entries.remove(key);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void invalidateAll() {
        writeLock.lock();
        try {
            insertionOrder.clear();
            entries.clear();
        } finally {
            writeLock.unlock();
        }
        log.debug("cache.cleared");
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.sum(), misses.sum(), evictions.sum(), expirations.sum(), size());
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, Instant>> it = insertionOrder.entrySet().iterator();
        if (!it.hasNext()) {
            return;
        }
        String eldest = it.next().getKey();
        it.remove();
        entries.remove(eldest);
        evictions.increment();
        log.debug("cache.evicted key={}", eldest);
    }

    private void removeExpired(CacheEntry entry) {
        writeLock.lock();
        try {
            // A concurrent put may already have replaced the entry
            if (entries.remove(entry.key(), entry)) {
                insertionOrder.remove(entry.key());
                expirations.increment();
            }
        } finally {
            writeLock.unlock();
        }
    }
}
