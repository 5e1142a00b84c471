package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.metrics.MetricsSink;
import com.containerwatch.tracker.metrics.TrackerMetrics;
import com.containerwatch.tracker.model.CacheEntry;
import com.containerwatch.tracker.model.Coordinates;
import com.containerwatch.tracker.persistence.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Time-boxed cache of geocoding results keyed by the normalized query text.
 * Reads share the lock; writes, sweeps and the persisted snapshot they produce are exclusive.
 */
public class GeoCache {
    private static final Logger log = LoggerFactory.getLogger(GeoCache.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RecordStore<CacheEntry> store;
    private final Clock clock;
    private final Duration ttl;
    private final MetricsSink metrics;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final String storeName;

    public GeoCache(RecordStore<CacheEntry> store, Clock clock, Duration ttl, MetricsSink metrics, String storeName) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.store = store;
        this.clock = clock;
        this.ttl = ttl;
        this.metrics = metrics;
        this.storeName = storeName;
        loadEntries();
        metrics.gauge(TrackerMetrics.GEOCACHE_SIZE, this::size);
    }

    public static String normalize(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        return WHITESPACE.matcher(rawQuery.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    public Optional<Coordinates> get(String rawQuery) {
        String key = normalize(rawQuery);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry != null && key.equals(entry.key()) && entry.isFresh(clock.instant(), ttl)) {
            hits.incrementAndGet();
            metrics.increment(TrackerMetrics.GEOCACHE_HITS);
            return Optional.of(entry.coordinates());
        }
        misses.incrementAndGet();
        metrics.increment(TrackerMetrics.GEOCACHE_MISSES);
        return Optional.empty();
    }

    public void put(String rawQuery, Coordinates value) {
        String key = normalize(rawQuery);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        CacheEntry entry = new CacheEntry(key, value, clock.instant(), rawQuery.trim());
        lock.writeLock().lock();
        try {
            CacheEntry previous = entries.put(key, entry);
            try {
                store.save(entries.values());
            } catch (RuntimeException e) {
                if (previous == null) {
                    entries.remove(key);
                } else {
                    entries.put(key, previous);
                }
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Physically removes entries past the TTL.
     *
     * @return number of entries removed
     */
    public int clearExpired() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            List<CacheEntry> expired = new ArrayList<>();
            for (CacheEntry entry : entries.values()) {
                if (!entry.isFresh(now, ttl)) {
                    expired.add(entry);
                }
            }
            if (expired.isEmpty()) {
                return 0;
            }
            expired.forEach(entry -> entries.remove(entry.key()));
            try {
                store.save(entries.values());
            } catch (RuntimeException e) {
                expired.forEach(entry -> entries.put(entry.key(), entry));
                throw e;
            }
            return expired.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public GeoCacheStats stats() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            int valid = (int) entries.values().stream().filter(entry -> entry.isFresh(now, ttl)).count();
            int total = entries.size();
            return new GeoCacheStats(total, valid, total - valid, hits.get(), misses.get(), storeName);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void loadEntries() {
        List<CacheEntry> loaded = store.load();
        lock.writeLock().lock();
        try {
            for (CacheEntry entry : loaded) {
                String key = normalize(entry.key());
                if (key.isEmpty()) {
                    continue;
                }
                CacheEntry normalized = key.equals(entry.key())
                    ? entry
                    : new CacheEntry(key, entry.coordinates(), entry.createdAt(), entry.query());
                entries.merge(key, normalized, (left, right) ->
                    left.createdAt().isAfter(right.createdAt()) ? left : right);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} geocache entries from {}", entries.size(), storeName);
    }
}
