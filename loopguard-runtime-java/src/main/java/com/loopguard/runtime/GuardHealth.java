package com.loopguard.runtime;

import com.google.gson.annotations.SerializedName;
import com.loopguard.runtime.blocking.SamplerState;
import com.loopguard.runtime.memory.MemoryStats;

public record GuardHealth(
    @SerializedName("memory")             MemoryStats memory,
    @SerializedName("sampler")            SamplerState sampler,
    @SerializedName("event_loop_lag_ms")  double eventLoopLagMillis,
    @SerializedName("active_contexts")    int activeContexts,
    @SerializedName("leaked_contexts")    int leakedContexts,
    @SerializedName("requests_handled")   long requestsHandled,
    @SerializedName("requests_failed")    long requestsFailed,
    @SerializedName("error_rate_percent") double errorRatePercent
) {}
