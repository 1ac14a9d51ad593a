package com.loopguard.runtime.isolation;

import com.google.gson.annotations.SerializedName;

/**
 * A context that has lived too long or grown memory too much. Reporting a leak does not
 * destroy the context.
 */
public record ContextLeak(
    @SerializedName("context_id")    String contextId,
    @SerializedName("duration")      double durationSeconds,
    @SerializedName("memory_growth") long memoryGrowthBytes
) {}
