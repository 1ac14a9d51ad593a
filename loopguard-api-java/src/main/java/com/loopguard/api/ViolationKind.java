package com.loopguard.api;

import com.google.gson.annotations.SerializedName;

/**
 * Category of a finding produced by static or runtime detection.
 */
public enum ViolationKind {
    /** An operation that halts the whole event loop (sleep, synchronous I/O, process exit). */
    @SerializedName("blocking_call")         BLOCKING_CALL,
    /** An operation that is safe on its own but dangerous under shared execution. */
    @SerializedName("unsafe_call")           UNSAFE_CALL,
    /** Access to process-wide ambient state. */
    @SerializedName("global_state_access")   GLOBAL_STATE_ACCESS,
    /** State that outlives a single invocation (static mutable fields). */
    @SerializedName("static_mutable_access") STATIC_MUTABLE_ACCESS,
    /** A loop with a constant-true condition and no visible exit. */
    @SerializedName("unbounded_loop")        UNBOUNDED_LOOP
}
