package com.loopguard.runtime.blocking;

import com.google.gson.annotations.SerializedName;
import com.loopguard.api.BlockingViolation;
import com.loopguard.api.Severity;
import com.loopguard.api.SourceLocation;
import com.loopguard.api.ViolationKind;

import java.util.Locale;

/**
 * Raised when the event loop stayed busy past the threshold for enough consecutive samples.
 *
 * @param durationSeconds         time since the last recorded activity
 * @param frame                   first application frame seen by the sampling task
 * @param samplingIntervalSeconds sampler period
 * @param consecutiveBlocks       blocked samples counted before this event
 */
public record RuntimeBlockingEvent(
    @SerializedName("duration_seconds")          double durationSeconds,
    @SerializedName("frame")                     SourceLocation frame,
    @SerializedName("sampling_interval_seconds") double samplingIntervalSeconds,
    @SerializedName("consecutive_blocks")        int consecutiveBlocks
) {

    public BlockingViolation toViolation() {
        String symbol = frame.function() != null ? frame.function() : "unknown";
        return new BlockingViolation(
            ViolationKind.BLOCKING_CALL,
            Severity.ERROR,
            symbol,
            frame,
            String.format(Locale.ROOT, "Event loop blocked for %.3fs (%d consecutive samples)",
                durationSeconds, consecutiveBlocks),
            "Move the blocking work off the event loop or split it into scheduled chunks");
    }
}
