package com.loopguard.runtime.cache;

/**
 * A cache the memory guard can observe and shrink by reference. Implementations must be
 * safe to call from the event-loop thread while their owner uses them.
 */
public interface MonitoredCache {

    /** Estimated memory held by the entries, in bytes. */
    long sizeBytes();

    /** Evict entries, oldest first, until {@link #sizeBytes()} is at or below {@code targetSizeBytes}. */
    void clean(long targetSizeBytes);

    void clear();

    CacheStats stats();
}
