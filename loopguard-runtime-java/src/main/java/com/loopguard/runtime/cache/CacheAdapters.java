package com.loopguard.runtime.cache;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Adapts containers owned elsewhere to {@link MonitoredCache}. The adapter keeps a reference
 * to the container, so evictions are visible to its owner. Eviction follows the container's
 * iteration order; sizes are recomputed on every call.
 */
public final class CacheAdapters {

    private CacheAdapters() {}

    public static MonitoredCache forMap(Map<?, ?> map) {
        return forMap(map, SizeEstimator.json());
    }

    public static MonitoredCache forMap(Map<?, ?> map, SizeEstimator estimator) {
        return new MapCache(Objects.requireNonNull(map, "map"), estimator);
    }

    public static MonitoredCache forCollection(Collection<?> collection) {
        return forCollection(collection, SizeEstimator.json());
    }

    public static MonitoredCache forCollection(Collection<?> collection, SizeEstimator estimator) {
        return new CollectionCache(Objects.requireNonNull(collection, "collection"), estimator);
    }

    private record MapCache(Map<?, ?> map, SizeEstimator estimator) implements MonitoredCache {

        @Override
        public long sizeBytes() {
            long total = 0;
            for (Map.Entry<?, ?> e : map.entrySet()) {
                total += estimator.estimate(e.getKey(), e.getValue());
            }
            return total;
        }

        @Override
        public void clean(long targetSizeBytes) {
            long size = sizeBytes();
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (size > targetSizeBytes && it.hasNext()) {
                Map.Entry<?, ?> oldest = it.next();
                size -= estimator.estimate(oldest.getKey(), oldest.getValue());
                it.remove();
            }
        }

        @Override
        public void clear() {
            map.clear();
        }

        @Override
        public CacheStats stats() {
            return CacheStats.of(sizeBytes(), map.size(), 0, 0);
        }
    }

    private record CollectionCache(Collection<?> collection, SizeEstimator estimator) implements MonitoredCache {

        @Override
        public long sizeBytes() {
            long total = 0;
            for (Object item : collection) {
                total += estimator.estimate(null, item);
            }
            return total;
        }

        @Override
        public void clean(long targetSizeBytes) {
            long size = sizeBytes();
            Iterator<?> it = collection.iterator();
            while (size > targetSizeBytes && it.hasNext()) {
                size -= estimator.estimate(null, it.next());
                it.remove();
            }
        }

        @Override
        public void clear() {
            collection.clear();
        }

        @Override
        public CacheStats stats() {
            return CacheStats.of(sizeBytes(), collection.size(), 0, 0);
        }
    }
}
