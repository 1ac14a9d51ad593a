package com.loopguard.runtime.memory;

import com.google.gson.annotations.SerializedName;

public record MemorySnapshot(
    @SerializedName("timestamp_nanos") long timestampNanos,
    @SerializedName("current_bytes")   long currentBytes,
    @SerializedName("peak_bytes")      long peakBytes
) {}
