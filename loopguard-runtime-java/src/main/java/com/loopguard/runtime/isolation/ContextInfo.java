package com.loopguard.runtime.isolation;

import com.google.gson.annotations.SerializedName;

/**
 * Read-only view of a live request context.
 */
public record ContextInfo(
    @SerializedName("context_id")        String contextId,
    @SerializedName("method")            String method,
    @SerializedName("path")              String path,
    @SerializedName("age_seconds")       double ageSeconds,
    @SerializedName("memory_at_start")   long memoryAtStartBytes,
    @SerializedName("tracked_mutations") int trackedMutations
) {}
