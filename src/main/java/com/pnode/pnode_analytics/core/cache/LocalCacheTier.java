package com.pnode.pnode_analytics.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process cache tier. Always available, bounded by an LRU limit.
 * Expiry is checked on every read, so no background sweep runs.
 */
public class LocalCacheTier implements CacheTier {
    private static final Logger log = LoggerFactory.getLogger(LocalCacheTier.class);
    private static final int DEFAULT_MAX_ENTRIES = 10000;

    private final Map<String, CacheEntry> store;
    private final int maxEntries;
    private final Clock clock;

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong putCount = new AtomicLong(0);
    private final AtomicLong deleteCount = new AtomicLong(0);

    public LocalCacheTier(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            log.warn("Local cache max-entries configured as {}. Setting to default {}.", maxEntries, DEFAULT_MAX_ENTRIES);
            this.maxEntries = DEFAULT_MAX_ENTRIES;
        } else {
            this.maxEntries = maxEntries;
        }
        this.clock = clock;

        this.store = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                boolean shouldEvict = size() > LocalCacheTier.this.maxEntries;
                if (shouldEvict) {
                    log.debug("Evicting LRU entry '{}' ({} > {}).", eldest.getKey(), size(), LocalCacheTier.this.maxEntries);
                }
                return shouldEvict;
            }
        });
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> read(key));
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> write(key, value, ttl));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> remove(key));
    }

    String read(String key) {
        long now = clock.millis();
        CacheEntry entry;
        synchronized (store) {
            entry = store.get(key);
            if (entry != null && entry.isExpired(now)) {
                store.remove(key);
                entry = null;
            }
        }
        if (entry == null) {
            missCount.incrementAndGet();
            log.debug("LocalCacheTier: miss for key '{}'", key);
            return null;
        }
        hitCount.incrementAndGet();
        return entry.getValue();
    }

    void write(String key, String value, Duration ttl) {
        store.put(key, CacheEntry.of(key, value, clock.millis(), ttl.toMillis()));
        putCount.incrementAndGet();
        log.debug("LocalCacheTier: stored key '{}' for {} ms. Size: {}", key, ttl.toMillis(), store.size());
    }

    void remove(String key) {
        store.remove(key);
        deleteCount.incrementAndGet();
    }

    public int size() {
        long now = clock.millis();
        synchronized (store) {
            return (int) store.values().stream().filter(e -> !e.isExpired(now)).count();
        }
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public long getPutCount() {
        return putCount.get();
    }

    public long getDeleteCount() {
        return deleteCount.get();
    }

    public double getHitRatio() {
        long hits = hitCount.get();
        long total = hits + missCount.get();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
