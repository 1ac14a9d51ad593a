package com.loopguard.runtime.blocking;

import com.loopguard.runtime.GuardConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SamplerConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        assertEquals(0.1, SamplerConfig.DEFAULTS.thresholdSeconds());
        assertEquals(0.01, SamplerConfig.DEFAULTS.samplingIntervalSeconds());
        assertEquals(5, SamplerConfig.DEFAULTS.maxConsecutiveBlocks());
    }

    @Test
    void nonPositiveMaxIsRaisedToOne() {
        assertEquals(1, new SamplerConfig(0.1, 0.01, 0).maxConsecutiveBlocks());
        assertEquals(1, new SamplerConfig(0.1, 0.01, -3).maxConsecutiveBlocks());
    }

    @Test
    void twoArgumentConstructorUsesDefaultMax() {
        assertEquals(5, new SamplerConfig(0.5, 0.05).maxConsecutiveBlocks());
    }

    @Test
    void nonPositiveDurationsAreRejected() {
        assertThrows(GuardConfigurationException.class, () -> new SamplerConfig(0, 0.01, 5));
        assertThrows(GuardConfigurationException.class, () -> new SamplerConfig(0.1, -1, 5));
        assertThrows(GuardConfigurationException.class, () -> new SamplerConfig(Double.NaN, 0.01, 5));
        assertThrows(GuardConfigurationException.class, () -> new SamplerConfig(Double.POSITIVE_INFINITY, 0.01, 5));
    }

    @Test
    void convertsToNanos() {
        SamplerConfig config = new SamplerConfig(0.25, 0.01, 5);
        assertEquals(250_000_000L, config.thresholdNanos());
        assertEquals(10_000_000L, config.samplingIntervalNanos());
    }
}
