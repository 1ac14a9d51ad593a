package com.loopguard.runtime.blocking;

import com.google.gson.annotations.SerializedName;

/**
 * Point-in-time view of a {@link RuntimeBlockingSampler}.
 */
public record SamplerState(
    @SerializedName("threshold_seconds")         double thresholdSeconds,
    @SerializedName("sampling_interval_seconds") double samplingIntervalSeconds,
    @SerializedName("last_activity_nanos")       long lastActivityNanos,
    @SerializedName("consecutive_block_count")   int consecutiveBlockCount,
    @SerializedName("max_consecutive_blocks")    int maxConsecutiveBlocks,
    @SerializedName("enabled")                   boolean enabled
) {}
