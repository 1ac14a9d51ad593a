package com.loopguard.runtime.config;

import com.google.gson.annotations.SerializedName;
import com.loopguard.runtime.blocking.SamplerConfig;
import com.loopguard.runtime.isolation.IsolationConfig;
import com.loopguard.runtime.memory.MemoryGuardConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Deserialized form of the guard configuration file. Every value is optional; absent values
 * take the component defaults. The {@code to*Config()} methods validate.
 */
public class GuardSettings {

    @SerializedName("blocking")
    private Blocking blocking;

    @SerializedName("memory")
    private Memory memory;

    @SerializedName("isolation")
    private Isolation isolation;

    public static GuardSettings defaults() {
        return new GuardSettings();
    }

    public Blocking getBlocking()   { return blocking != null ? blocking : new Blocking(); }
    public Memory getMemory()       { return memory != null ? memory : new Memory(); }
    public Isolation getIsolation() { return isolation != null ? isolation : new Isolation(); }

    public SamplerConfig toSamplerConfig()          { return getBlocking().toConfig(); }
    public MemoryGuardConfig toMemoryGuardConfig()  { return getMemory().toConfig(); }
    public IsolationConfig toIsolationConfig()      { return getIsolation().toConfig(); }

    public static class Blocking {

        @SerializedName("enabled")
        private Boolean enabled;

        @SerializedName("threshold_seconds")
        private Double thresholdSeconds;

        @SerializedName("sampling_interval_seconds")
        private Double samplingIntervalSeconds;

        @SerializedName("max_consecutive_blocks")
        private Integer maxConsecutiveBlocks;

        public boolean isEnabled() { return enabled == null || enabled; }

        SamplerConfig toConfig() {
            SamplerConfig d = SamplerConfig.DEFAULTS;
            return new SamplerConfig(
                thresholdSeconds != null ? thresholdSeconds : d.thresholdSeconds(),
                samplingIntervalSeconds != null ? samplingIntervalSeconds : d.samplingIntervalSeconds(),
                maxConsecutiveBlocks != null ? maxConsecutiveBlocks : d.maxConsecutiveBlocks());
        }
    }

    public static class Memory {

        @SerializedName("enabled")
        private Boolean enabled;

        @SerializedName("gc_threshold_mb")
        private Long gcThresholdMb;

        @SerializedName("warning_threshold_mb")
        private Long warningThresholdMb;

        @SerializedName("critical_threshold_mb")
        private Long criticalThresholdMb;

        @SerializedName("check_interval_seconds")
        private Double checkIntervalSeconds;

        @SerializedName("cache_check_interval_seconds")
        private Double cacheCheckIntervalSeconds;

        @SerializedName("leak_detection_enabled")
        private Boolean leakDetectionEnabled;

        @SerializedName("window_capacity")
        private Integer windowCapacity;

        @SerializedName("min_leak_samples")
        private Integer minLeakSamples;

        @SerializedName("leak_growth_mb_per_minute")
        private Double leakGrowthMbPerMinute;

        @SerializedName("default_cache_limit_mb")
        private Long defaultCacheLimitMb;

        /** Per-cache limits in MiB, keyed by cache name. */
        @SerializedName("cache_limits_mb")
        private Map<String, Long> cacheLimitsMb;

        @SerializedName("restart_delay_seconds")
        private Double restartDelaySeconds;

        @SerializedName("collect_on_sample")
        private Boolean collectOnSample;

        public boolean isEnabled() { return enabled == null || enabled; }

        public Map<String, Long> getCacheLimitsMb() {
            return cacheLimitsMb != null ? cacheLimitsMb : Collections.emptyMap();
        }

        MemoryGuardConfig toConfig() {
            MemoryGuardConfig.Builder b = MemoryGuardConfig.builder();
            if (gcThresholdMb != null)             b.gcThresholdBytes(gcThresholdMb * MemoryGuardConfig.MIB);
            if (warningThresholdMb != null)        b.warningThresholdBytes(warningThresholdMb * MemoryGuardConfig.MIB);
            if (criticalThresholdMb != null)       b.criticalThresholdBytes(criticalThresholdMb * MemoryGuardConfig.MIB);
            if (checkIntervalSeconds != null)      b.checkInterval(seconds(checkIntervalSeconds));
            if (cacheCheckIntervalSeconds != null) b.cacheCheckInterval(seconds(cacheCheckIntervalSeconds));
            if (leakDetectionEnabled != null)      b.leakDetectionEnabled(leakDetectionEnabled);
            if (windowCapacity != null)            b.windowCapacity(windowCapacity);
            if (minLeakSamples != null)            b.minLeakSamples(minLeakSamples);
            if (leakGrowthMbPerMinute != null) {
                b.leakGrowthBytesPerMinute((long) (leakGrowthMbPerMinute * MemoryGuardConfig.MIB));
            }
            if (defaultCacheLimitMb != null)       b.defaultCacheSizeLimitBytes(defaultCacheLimitMb * MemoryGuardConfig.MIB);
            getCacheLimitsMb().forEach((name, mb) -> b.cacheSizeLimit(name, mb * MemoryGuardConfig.MIB));
            if (restartDelaySeconds != null)       b.restartDelay(seconds(restartDelaySeconds));
            if (collectOnSample != null)           b.collectOnSample(collectOnSample);
            return b.build();
        }
    }

    public static class Isolation {

        @SerializedName("max_context_duration_seconds")
        private Double maxContextDurationSeconds;

        @SerializedName("max_memory_growth_mb")
        private Long maxMemoryGrowthMb;

        @SerializedName("server_allow_list")
        private Set<String> serverAllowList;

        @SerializedName("environment_allow_list")
        private Set<String> environmentAllowList;

        @SerializedName("collect_on_destroy")
        private Boolean collectOnDestroy;

        @SerializedName("leak_sweep_interval_seconds")
        private Double leakSweepIntervalSeconds;

        IsolationConfig toConfig() {
            IsolationConfig.Builder b = IsolationConfig.builder();
            if (maxContextDurationSeconds != null) b.maxContextDuration(seconds(maxContextDurationSeconds));
            if (maxMemoryGrowthMb != null)         b.maxMemoryGrowthBytes(maxMemoryGrowthMb * MemoryGuardConfig.MIB);
            if (serverAllowList != null)           b.serverAllowList(serverAllowList);
            if (environmentAllowList != null)      b.environmentAllowList(environmentAllowList);
            if (collectOnDestroy != null)          b.collectOnDestroy(collectOnDestroy);
            if (leakSweepIntervalSeconds != null)  b.leakSweepInterval(seconds(leakSweepIntervalSeconds));
            return b.build();
        }
    }

    private static Duration seconds(double value) {
        return Duration.ofNanos((long) (value * 1_000_000_000L));
    }
}
