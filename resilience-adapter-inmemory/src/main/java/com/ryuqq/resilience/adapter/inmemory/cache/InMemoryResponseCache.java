package com.ryuqq.resilience.adapter.inmemory.cache;

import com.ryuqq.resilience.core.protection.CacheEntry;
import com.ryuqq.resilience.core.protection.CacheStats;
import com.ryuqq.resilience.core.protection.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link ResponseCache} SPI.
 *
 * <p>Entries are evicted lazily: a read at or after the expiry treats the entry as absent and removes it.
 * There is no background sweeper and no size bound.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get/set/invalidate:</strong> O(1)</li>
 *   <li><strong>invalidateByPrefix/size:</strong> O(N)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResponseCache.class);

    private final ConcurrentHashMap<String, CacheEntry> entries;
    private final Clock clock;
    private final AtomicLong hits;
    private final AtomicLong misses;

    /**
     * Creates a cache on the system UTC clock.
     */
    public InMemoryResponseCache() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a cache.
     *
     * @param clock time source for expiry checks
     */
    public InMemoryResponseCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.entries = new ConcurrentHashMap<>();
        this.hits = new AtomicLong();
        this.misses = new AtomicLong();
    }

    @Override
    public Optional<Object> get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!entry.isLive(clock.instant())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            log.debug("Cache entry expired: key={}, expiry={}", key, entry.expiry());
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.data());
    }

    @Override
    public void set(String key, Object data, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        Instant expiry = clock.instant().plus(ttl);
        entries.put(key, new CacheEntry(key, data, expiry));
    }

    @Override
    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public int invalidateByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        int removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && entries.remove(key) != null) {
                removed++;
            }
        }
        log.debug("Cache invalidated by prefix: prefix={}, removed={}", prefix, removed);
        return removed;
    }

    @Override
    public int size() {
        Instant now = clock.instant();
        return (int) entries.values().stream().filter(entry -> entry.isLive(now)).count();
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), size());
    }

    /**
     * Removes all entries and resets statistics.
     */
    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }
}
