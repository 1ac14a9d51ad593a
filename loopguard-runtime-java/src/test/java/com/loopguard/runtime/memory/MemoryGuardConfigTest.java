package com.loopguard.runtime.memory;

import com.loopguard.runtime.GuardConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.loopguard.runtime.memory.MemoryGuardConfig.MIB;
import static org.junit.jupiter.api.Assertions.*;

class MemoryGuardConfigTest {

    @Test
    void defaults() {
        MemoryGuardConfig config = MemoryGuardConfig.defaults();
        assertEquals(100 * MIB, config.gcThresholdBytes());
        assertEquals(200 * MIB, config.warningThresholdBytes());
        assertEquals(300 * MIB, config.criticalThresholdBytes());
        assertEquals(Duration.ofSeconds(10), config.checkInterval());
        assertEquals(Duration.ofSeconds(2), config.cacheCheckInterval());
        assertEquals(60, config.windowCapacity());
        assertEquals(6, config.minLeakSamples());
        assertEquals(MIB, config.leakGrowthBytesPerMinute());
        assertEquals(Duration.ofSeconds(1), config.restartDelay());
    }

    @Test
    void perCacheLimitOverridesDefault() {
        MemoryGuardConfig config = MemoryGuardConfig.builder()
            .defaultCacheSizeLimitBytes(4 * MIB)
            .cacheSizeLimit("sessions", 512 * 1024)
            .build();
        assertEquals(512 * 1024, config.cacheSizeLimit("sessions"));
        assertEquals(4 * MIB, config.cacheSizeLimit("templates"));
    }

    @Test
    void thresholdsMustBeStrictlyIncreasing() {
        assertThrows(GuardConfigurationException.class, () -> MemoryGuardConfig.builder()
            .gcThresholdBytes(200 * MIB).warningThresholdBytes(200 * MIB).build());
        assertThrows(GuardConfigurationException.class, () -> MemoryGuardConfig.builder()
            .warningThresholdBytes(400 * MIB).build());
    }

    @Test
    void nonPositiveValuesAreRejected() {
        assertThrows(GuardConfigurationException.class,
            () -> MemoryGuardConfig.builder().gcThresholdBytes(0).build());
        assertThrows(GuardConfigurationException.class,
            () -> MemoryGuardConfig.builder().checkInterval(Duration.ZERO).build());
        assertThrows(GuardConfigurationException.class,
            () -> MemoryGuardConfig.builder().cacheSizeLimit("users", -1).build());
    }

    @Test
    void minLeakSamplesMustFitTheWindow() {
        assertThrows(GuardConfigurationException.class,
            () -> MemoryGuardConfig.builder().windowCapacity(5).build());
        assertThrows(GuardConfigurationException.class,
            () -> MemoryGuardConfig.builder().minLeakSamples(1).build());
    }
}
