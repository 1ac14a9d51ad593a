package com.loopguard.runtime.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insertion-ordered cache with a running byte size, hit and miss counters. Every method
 * synchronizes on the cache.
 */
public class InMemoryCache<K, V> implements MonitoredCache {

    private final Map<K, V> entries = new LinkedHashMap<>();
    private final Map<K, Long> entrySizes = new LinkedHashMap<>();
    private final SizeEstimator estimator;
    private long sizeBytes;
    private long hits;
    private long misses;

    public InMemoryCache() {
        this(SizeEstimator.json());
    }

    public InMemoryCache(SizeEstimator estimator) {
        this.estimator = Objects.requireNonNull(estimator, "estimator");
    }

    public synchronized V get(K key) {
        V value = entries.get(key);
        if (value != null) {
            hits++;
        } else {
            misses++;
        }
        return value;
    }

    /** Store {@code value}; replacing an entry moves it to the newest position. */
    public synchronized void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        remove(key);
        long size = estimator.estimate(key, value);
        entries.put(key, value);
        entrySizes.put(key, size);
        sizeBytes += size;
    }

    public synchronized V remove(K key) {
        V previous = entries.remove(key);
        Long size = entrySizes.remove(key);
        if (size != null) sizeBytes -= size;
        return previous;
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized long sizeBytes() {
        return sizeBytes;
    }

    @Override
    public synchronized void clean(long targetSizeBytes) {
        Iterator<Map.Entry<K, Long>> it = entrySizes.entrySet().iterator();
        while (sizeBytes > targetSizeBytes && it.hasNext()) {
            Map.Entry<K, Long> oldest = it.next();
            entries.remove(oldest.getKey());
            sizeBytes -= oldest.getValue();
            it.remove();
        }
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        entrySizes.clear();
        sizeBytes = 0;
    }

    @Override
    public synchronized CacheStats stats() {
        return CacheStats.of(sizeBytes, entries.size(), hits, misses);
    }
}
