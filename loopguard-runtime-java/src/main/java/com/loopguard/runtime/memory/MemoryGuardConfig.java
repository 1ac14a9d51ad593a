package com.loopguard.runtime.memory;

import com.loopguard.runtime.GuardConfigurationException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Memory guard thresholds and schedule. Built through {@link #builder()}; {@code build()}
 * rejects thresholds that are not strictly increasing and non-positive sizes or intervals.
 */
public final class MemoryGuardConfig {

    public static final long MIB = 1024L * 1024L;

    private final long gcThresholdBytes;
    private final long warningThresholdBytes;
    private final long criticalThresholdBytes;
    private final Duration checkInterval;
    private final Duration cacheCheckInterval;
    private final boolean leakDetectionEnabled;
    private final int windowCapacity;
    private final int minLeakSamples;
    private final long leakGrowthBytesPerMinute;
    private final long defaultCacheSizeLimitBytes;
    private final Map<String, Long> cacheSizeLimits;
    private final Duration restartDelay;
    private final boolean collectOnSample;

    private MemoryGuardConfig(Builder b) {
        this.gcThresholdBytes = b.gcThresholdBytes;
        this.warningThresholdBytes = b.warningThresholdBytes;
        this.criticalThresholdBytes = b.criticalThresholdBytes;
        this.checkInterval = b.checkInterval;
        this.cacheCheckInterval = b.cacheCheckInterval;
        this.leakDetectionEnabled = b.leakDetectionEnabled;
        this.windowCapacity = b.windowCapacity;
        this.minLeakSamples = b.minLeakSamples;
        this.leakGrowthBytesPerMinute = b.leakGrowthBytesPerMinute;
        this.defaultCacheSizeLimitBytes = b.defaultCacheSizeLimitBytes;
        this.cacheSizeLimits = Map.copyOf(b.cacheSizeLimits);
        this.restartDelay = b.restartDelay;
        this.collectOnSample = b.collectOnSample;
    }

    public static MemoryGuardConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long gcThresholdBytes()           { return gcThresholdBytes; }
    public long warningThresholdBytes()      { return warningThresholdBytes; }
    public long criticalThresholdBytes()     { return criticalThresholdBytes; }
    public Duration checkInterval()          { return checkInterval; }
    public Duration cacheCheckInterval()     { return cacheCheckInterval; }
    public boolean leakDetectionEnabled()    { return leakDetectionEnabled; }
    public int windowCapacity()              { return windowCapacity; }
    public int minLeakSamples()              { return minLeakSamples; }
    public long leakGrowthBytesPerMinute()   { return leakGrowthBytesPerMinute; }
    public long defaultCacheSizeLimitBytes() { return defaultCacheSizeLimitBytes; }
    public Duration restartDelay()           { return restartDelay; }
    public boolean collectOnSample()         { return collectOnSample; }

    /** Configured limit for {@code cacheName}, or the default limit. */
    public long cacheSizeLimit(String cacheName) {
        return cacheSizeLimits.getOrDefault(cacheName, defaultCacheSizeLimitBytes);
    }

    public static final class Builder {

        private long gcThresholdBytes = 100 * MIB;
        private long warningThresholdBytes = 200 * MIB;
        private long criticalThresholdBytes = 300 * MIB;
        private Duration checkInterval = Duration.ofSeconds(10);
        private Duration cacheCheckInterval = Duration.ofSeconds(2);
        private boolean leakDetectionEnabled = true;
        private int windowCapacity = 60;
        private int minLeakSamples = 6;
        private long leakGrowthBytesPerMinute = MIB;
        private long defaultCacheSizeLimitBytes = 10 * MIB;
        private final Map<String, Long> cacheSizeLimits = new HashMap<>();
        private Duration restartDelay = Duration.ofSeconds(1);
        private boolean collectOnSample = true;

        private Builder() {}

        public Builder gcThresholdBytes(long v)           { this.gcThresholdBytes = v; return this; }
        public Builder warningThresholdBytes(long v)      { this.warningThresholdBytes = v; return this; }
        public Builder criticalThresholdBytes(long v)     { this.criticalThresholdBytes = v; return this; }
        public Builder checkInterval(Duration v)          { this.checkInterval = v; return this; }
        public Builder cacheCheckInterval(Duration v)     { this.cacheCheckInterval = v; return this; }
        public Builder leakDetectionEnabled(boolean v)    { this.leakDetectionEnabled = v; return this; }
        public Builder windowCapacity(int v)              { this.windowCapacity = v; return this; }
        public Builder minLeakSamples(int v)              { this.minLeakSamples = v; return this; }
        public Builder leakGrowthBytesPerMinute(long v)   { this.leakGrowthBytesPerMinute = v; return this; }
        public Builder defaultCacheSizeLimitBytes(long v) { this.defaultCacheSizeLimitBytes = v; return this; }
        public Builder cacheSizeLimit(String name, long v) { this.cacheSizeLimits.put(name, v); return this; }
        public Builder restartDelay(Duration v)           { this.restartDelay = v; return this; }
        public Builder collectOnSample(boolean v)         { this.collectOnSample = v; return this; }

        public MemoryGuardConfig build() {
            requirePositive("gcThresholdBytes", gcThresholdBytes);
            if (!(gcThresholdBytes < warningThresholdBytes && warningThresholdBytes < criticalThresholdBytes)) {
                throw new GuardConfigurationException(String.format(
                    "Thresholds must be strictly increasing: gc=%d warning=%d critical=%d",
                    gcThresholdBytes, warningThresholdBytes, criticalThresholdBytes));
            }
            requirePositive("checkInterval", checkInterval);
            requirePositive("cacheCheckInterval", cacheCheckInterval);
            requirePositive("restartDelay", restartDelay);
            if (windowCapacity < 2) {
                throw new GuardConfigurationException("windowCapacity must be at least 2: " + windowCapacity);
            }
            if (minLeakSamples < 2 || minLeakSamples > windowCapacity) {
                throw new GuardConfigurationException(
                    "minLeakSamples must be between 2 and windowCapacity (" + windowCapacity + "): " + minLeakSamples);
            }
            requirePositive("leakGrowthBytesPerMinute", leakGrowthBytesPerMinute);
            requirePositive("defaultCacheSizeLimitBytes", defaultCacheSizeLimitBytes);
            cacheSizeLimits.forEach((name, limit) -> requirePositive("cacheSizeLimit[" + name + "]", limit));
            return new MemoryGuardConfig(this);
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) throw new GuardConfigurationException(name + " must be positive: " + value);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new GuardConfigurationException(name + " must be positive: " + value);
            }
        }
    }
}
