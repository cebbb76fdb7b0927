package com.ruteberegner.distance.infrastructure.cache;

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
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity, thread-safe least-recently-used cache with hit/miss statistics.
 *
 * <p>Entries are kept in a {@link LinkedHashMap} in insertion order; a hit or an
 * overwrite removes and re-inserts the key so the head is always the
 * least-recently-used entry. Every operation runs under one coarse lock per
 * instance. The lock only covers the map operation, so callers must never hold
 * it across I/O.</p>
 *
 * @param <K> key type
 * @param <V> value type, never null
 */
public class LruCache<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(LruCache.class);

    private final String name;
    private final int capacity;
    private final Clock clock;
    private final Instant createdAt;
    private final LinkedHashMap<K, V> entries;
    private final ReentrantLock lock = new ReentrantLock();

    private long hitCount;
    private long missCount;
    private long totalRequests;

    public LruCache(String name, int capacity) {
        this(name, capacity, Clock.systemUTC());
    }

    public LruCache(String name, int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, got " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1 << 16));
    }

    /**
     * Returns the cached value and marks the key as most recently used.
     * Counts as a hit or a miss.
     */
    public Optional<V> get(K key) {
        lock.lock();
        try {
            totalRequests++;
            V value = entries.remove(key);
            if (value == null) {
                missCount++;
                logger.debug("Cache {} MISS for key: {}", name, abbreviate(key));
                return Optional.empty();
            }
            entries.put(key, value);
            hitCount++;
            logger.debug("Cache {} HIT for key: {}", name, abbreviate(key));
            return Optional.of(value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value. An existing key is overwritten and becomes most recently used;
     * a new key at capacity evicts the least-recently-used entry first.
     */
    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (entries.remove(key) == null && entries.size() >= capacity) {
                Iterator<Map.Entry<K, V>> eldest = entries.entrySet().iterator();
                K evicted = eldest.next().getKey();
                eldest.remove();
                logger.debug("Cache {} evicted LRU key: {}", name, abbreviate(evicted));
            }
            entries.put(key, value);
            logger.debug("Cache {} SET for key: {}", name, abbreviate(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Membership test. Does not count as a hit or miss and does not change recency.
     */
    public boolean contains(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    /**
     * Removes all entries and resets the counters. Uptime keeps counting from construction.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hitCount = 0;
            missCount = 0;
            totalRequests = 0;
            logger.info("Cache {} cleared", name);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            double hitRate = totalRequests == 0 ? 0.0 : (hitCount * 100.0) / totalRequests;
            Duration uptime = Duration.between(createdAt, clock.instant());
            return new CacheStats(
                entries.size(),
                capacity,
                hitCount,
                missCount,
                totalRequests,
                Math.round(hitRate * 100.0) / 100.0,
                uptime.toMillis() / 1000.0);
        } finally {
            lock.unlock();
        }
    }

    private static String abbreviate(Object key) {
        String text = String.valueOf(key);
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
