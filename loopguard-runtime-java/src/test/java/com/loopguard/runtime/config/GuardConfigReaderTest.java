package com.loopguard.runtime.config;

import com.loopguard.runtime.GuardConfigurationException;
import com.loopguard.runtime.blocking.SamplerConfig;
import com.loopguard.runtime.isolation.IsolationConfig;
import com.loopguard.runtime.memory.MemoryGuardConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

import static com.loopguard.runtime.memory.MemoryGuardConfig.MIB;
import static org.junit.jupiter.api.Assertions.*;

class GuardConfigReaderTest {

    private final GuardConfigReader reader = new GuardConfigReader();

    @Test
    void readsSnakeCaseSettings(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("loopguard.json");
        Files.writeString(file, """
            {
              "blocking": {"threshold_seconds": 0.25, "max_consecutive_blocks": 3},
              "memory": {
                "gc_threshold_mb": 64,
                "warning_threshold_mb": 128,
                "critical_threshold_mb": 256,
                "check_interval_seconds": 5,
                "cache_limits_mb": {"sessions": 2}
              },
              "isolation": {
                "max_context_duration_seconds": 12.5,
                "environment_allow_list": ["PATH"]
              }
            }
            """);

        GuardSettings settings = reader.read(file);

        SamplerConfig sampler = settings.toSamplerConfig();
        assertEquals(0.25, sampler.thresholdSeconds());
        assertEquals(0.01, sampler.samplingIntervalSeconds());
        assertEquals(3, sampler.maxConsecutiveBlocks());

        MemoryGuardConfig memory = settings.toMemoryGuardConfig();
        assertEquals(64 * MIB, memory.gcThresholdBytes());
        assertEquals(256 * MIB, memory.criticalThresholdBytes());
        assertEquals(Duration.ofSeconds(5), memory.checkInterval());
        assertEquals(2 * MIB, memory.cacheSizeLimit("sessions"));
        assertEquals(10 * MIB, memory.cacheSizeLimit("other"));

        IsolationConfig isolation = settings.toIsolationConfig();
        assertEquals(Duration.ofMillis(12_500), isolation.maxContextDuration());
        assertEquals(Set.of("PATH"), isolation.environmentAllowList());
        assertEquals(IsolationConfig.DEFAULT_SERVER_ALLOW_LIST, isolation.serverAllowList());
    }

    @Test
    void missingSectionsUseDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("loopguard.json");
        Files.writeString(file, "{}");

        GuardSettings settings = reader.read(file);

        assertTrue(settings.getBlocking().isEnabled());
        assertTrue(settings.getMemory().isEnabled());
        assertEquals(SamplerConfig.DEFAULTS, settings.toSamplerConfig());
        assertEquals(300 * MIB, settings.toMemoryGuardConfig().criticalThresholdBytes());
        assertEquals(Duration.ofSeconds(30), settings.toIsolationConfig().maxContextDuration());
    }

    @Test
    void disabledFlagsAreRead(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("loopguard.json");
        Files.writeString(file, "{\"blocking\": {\"enabled\": false}, \"memory\": {\"enabled\": false}}");

        GuardSettings settings = reader.read(file);
        assertFalse(settings.getBlocking().isEnabled());
        assertFalse(settings.getMemory().isEnabled());
    }

    @Test
    void invalidThresholdsFailWhenConverted(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("loopguard.json");
        Files.writeString(file, "{\"memory\": {\"gc_threshold_mb\": 500}}");

        GuardSettings settings = reader.read(file);
        assertThrows(GuardConfigurationException.class, settings::toMemoryGuardConfig);
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        var e = assertThrows(GuardConfigReader.GuardConfigReadException.class,
            () -> reader.read(dir.resolve("absent.json")));
        assertTrue(e.getMessage().startsWith("Config file not found"));
    }

    @Test
    void emptyFileFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.json");
        Files.writeString(file, "");
        var e = assertThrows(GuardConfigReader.GuardConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().startsWith("Config file is empty or invalid JSON"));
    }

    @Test
    void malformedFileFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{\"memory\": {\"gc_threshold_mb\": \"lots\"}}");
        var e = assertThrows(GuardConfigReader.GuardConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().startsWith("Malformed config file"));
    }
}
