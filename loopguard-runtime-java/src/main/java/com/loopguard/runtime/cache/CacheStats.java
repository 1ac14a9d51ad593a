package com.loopguard.runtime.cache;

import com.google.gson.annotations.SerializedName;

public record CacheStats(
    @SerializedName("size_bytes") long sizeBytes,
    @SerializedName("count")      int count,
    @SerializedName("hits")       long hits,
    @SerializedName("misses")     long misses,
    @SerializedName("hit_rate")   double hitRate
) {

    public static CacheStats of(long sizeBytes, int count, long hits, long misses) {
        long lookups = hits + misses;
        return new CacheStats(sizeBytes, count, hits, misses, lookups == 0 ? 0.0 : (double) hits / lookups);
    }
}
