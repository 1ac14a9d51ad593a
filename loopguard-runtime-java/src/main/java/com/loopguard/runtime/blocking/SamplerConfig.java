package com.loopguard.runtime.blocking;

import com.loopguard.runtime.GuardConfigurationException;

/**
 * Sampler tuning. A non-positive {@code maxConsecutiveBlocks} is raised to 1; the two
 * durations must be positive.
 *
 * @param thresholdSeconds        idle gap above which a sample counts as blocked
 * @param samplingIntervalSeconds period of the sampling task
 * @param maxConsecutiveBlocks    blocked samples needed before an event fires
 */
public record SamplerConfig(double thresholdSeconds, double samplingIntervalSeconds, int maxConsecutiveBlocks) {

    public static final SamplerConfig DEFAULTS = new SamplerConfig(0.1, 0.01, 5);

    public SamplerConfig {
        if (!(thresholdSeconds > 0) || Double.isInfinite(thresholdSeconds)) {
            throw new GuardConfigurationException("thresholdSeconds must be positive: " + thresholdSeconds);
        }
        if (!(samplingIntervalSeconds > 0) || Double.isInfinite(samplingIntervalSeconds)) {
            throw new GuardConfigurationException(
                "samplingIntervalSeconds must be positive: " + samplingIntervalSeconds);
        }
        maxConsecutiveBlocks = Math.max(1, maxConsecutiveBlocks);
    }

    public SamplerConfig(double thresholdSeconds, double samplingIntervalSeconds) {
        this(thresholdSeconds, samplingIntervalSeconds, DEFAULTS.maxConsecutiveBlocks());
    }

    long thresholdNanos() {
        return (long) (thresholdSeconds * 1_000_000_000L);
    }

    long samplingIntervalNanos() {
        return Math.max(1L, (long) (samplingIntervalSeconds * 1_000_000_000L));
    }
}
