package com.loopguard.runtime.memory;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Delivered to leak callbacks. A {@link Type#CRITICAL_MEMORY} alert carries the threshold that
 * was crossed; a {@link Type#MEMORY_LEAK} alert carries the growth rate and the window it was
 * computed from.
 */
public record MemoryAlert(
    @SerializedName("type")         Type type,
    @SerializedName("current")      long currentBytes,
    @SerializedName("threshold")    long thresholdBytes,
    @SerializedName("growth_rate")  double growthRateBytesPerSecond,
    @SerializedName("snapshots")    List<MemorySnapshot> snapshots
) {

    public enum Type {
        @SerializedName("critical_memory") CRITICAL_MEMORY,
        @SerializedName("memory_leak")     MEMORY_LEAK
    }

    static MemoryAlert critical(long currentBytes, long thresholdBytes) {
        return new MemoryAlert(Type.CRITICAL_MEMORY, currentBytes, thresholdBytes, 0.0, List.of());
    }

    static MemoryAlert leak(long currentBytes, double growthRateBytesPerSecond, List<MemorySnapshot> snapshots) {
        return new MemoryAlert(Type.MEMORY_LEAK, currentBytes, 0L, growthRateBytesPerSecond, snapshots);
    }
}
