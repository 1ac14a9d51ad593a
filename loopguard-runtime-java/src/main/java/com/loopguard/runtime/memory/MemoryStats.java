package com.loopguard.runtime.memory;

import com.google.gson.annotations.SerializedName;

/**
 * Memory guard status for a health endpoint.
 */
public record MemoryStats(
    @SerializedName("current_memory") long currentMemory,
    @SerializedName("peak_memory")    long peakMemory,
    @SerializedName("gc_runs")        long gcRuns,
    @SerializedName("uptime")         String uptime,
    @SerializedName("uptime_seconds") long uptimeSeconds,
    @SerializedName("tracked_caches") int trackedCaches,
    @SerializedName("snapshots")      int snapshots,
    @SerializedName("monitoring")     boolean monitoring
) {

    /** {@code "2d 3h 4m"}, {@code "3h 4m"} or {@code "4m"}. */
    static String formatUptime(long seconds) {
        long days = seconds / 86_400;
        long hours = (seconds % 86_400) / 3_600;
        long minutes = (seconds % 3_600) / 60;
        if (days > 0) return days + "d " + hours + "h " + minutes + "m";
        if (hours > 0) return hours + "h " + minutes + "m";
        return minutes + "m";
    }
}
