package com.loopguard.runtime.blocking;

import com.loopguard.api.BlockingViolation;
import com.loopguard.api.Severity;
import com.loopguard.api.SourceLocation;
import com.loopguard.api.ViolationKind;
import com.loopguard.runtime.loop.FakeClock;
import com.loopguard.runtime.loop.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeBlockingSamplerTest {

    private FakeClock clock;
    private ManualEventLoop loop;
    private RuntimeBlockingSampler sampler;
    private List<RuntimeBlockingEvent> events;

    @BeforeEach
    void setUp() {
        clock = new FakeClock();
        loop = new ManualEventLoop(clock);
        sampler = new RuntimeBlockingSampler(SamplerConfig.DEFAULTS, clock);
        events = new ArrayList<>();
    }

    @Test
    void idleGapsBelowThresholdNeverFire() {
        sampler.enable(events::add, loop);
        for (int i = 0; i < 50; i++) {
            clock.advanceMillis(50);
            sampler.sample();
            sampler.recordActivity();
        }
        assertTrue(events.isEmpty());
        assertEquals(0, sampler.state().consecutiveBlockCount());
    }

    @Test
    void firesOnceAfterMaxConsecutiveBlockedSamples() {
        sampler.enable(events::add, loop);
        clock.advanceMillis(200);

        for (int i = 0; i < 4; i++) sampler.sample();
        assertTrue(events.isEmpty());
        assertEquals(4, sampler.state().consecutiveBlockCount());

        sampler.sample();
        assertEquals(1, events.size());
        assertEquals(5, events.get(0).consecutiveBlocks());
        assertEquals(0.2, events.get(0).durationSeconds(), 1e-9);
        assertEquals(0.01, events.get(0).samplingIntervalSeconds());
        assertEquals(0, sampler.state().consecutiveBlockCount());

        for (int i = 0; i < 4; i++) sampler.sample();
        assertEquals(1, events.size());
    }

    @Test
    void activityBetweenBlockedSamplesResetsTheCount() {
        sampler.enable(events::add, loop);
        clock.advanceMillis(200);
        sampler.sample();
        sampler.sample();

        sampler.recordActivity();
        assertEquals(0, sampler.state().consecutiveBlockCount());
        sampler.sample();
        assertEquals(0, sampler.state().consecutiveBlockCount());
        assertTrue(events.isEmpty());
    }

    @Test
    void periodicTaskDetectsABlockedLoop() {
        sampler.enable(events::add, loop);
        // Without any recorded activity the 10ms ticks see an ever-growing gap.
        loop.advance(Duration.ofMillis(150));
        assertEquals(1, events.size());
        assertTrue(events.get(0).durationSeconds() > 0.1);
    }

    @Test
    void concurrentSamplesAreAllCounted() throws Exception {
        sampler.setMaxConsecutiveBlocks(Integer.MAX_VALUE);
        sampler.enable(events::add, loop);
        clock.advanceMillis(200);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> runs = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                runs.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) sampler.sample();
                }));
            }
            for (Future<?> run : runs) run.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(4_000, sampler.state().consecutiveBlockCount());
        assertTrue(events.isEmpty());
    }

    @Test
    void loopLagIsHowLateTheTickRan() {
        sampler.enable(events::add, loop);
        clock.advanceMillis(10);
        sampler.sample();
        assertEquals(0, sampler.loopLagNanos());

        clock.advanceMillis(45);
        sampler.sample();
        assertEquals(35_000_000L, sampler.loopLagNanos());

        clock.advanceMillis(10);
        sampler.sample();
        assertEquals(0, sampler.loopLagNanos());
    }

    @Test
    void maxConsecutiveBlocksIsClampedToOne() {
        sampler.setMaxConsecutiveBlocks(0);
        assertEquals(1, sampler.state().maxConsecutiveBlocks());

        sampler.enable(events::add, loop);
        clock.advanceMillis(200);
        sampler.sample();
        assertEquals(1, events.size());
    }

    @Test
    void recordActivityIsIgnoredWhileDisabled() {
        long before = sampler.state().lastActivityNanos();
        clock.advanceSeconds(3);
        sampler.recordActivity();
        assertEquals(before, sampler.state().lastActivityNanos());
        assertFalse(sampler.state().enabled());
    }

    @Test
    void disableIsIdempotentAndCancelsSampling() {
        sampler.enable(events::add, loop);
        assertEquals(1, loop.pendingTasks());

        sampler.disable();
        sampler.disable();
        assertFalse(sampler.isEnabled());
        assertEquals(0, loop.pendingTasks());

        clock.advanceSeconds(1);
        sampler.sample();
        assertTrue(events.isEmpty());
    }

    @Test
    void enablingTwiceKeepsASingleSamplingTask() {
        sampler.enable(events::add, loop);
        List<RuntimeBlockingEvent> second = new ArrayList<>();
        sampler.enable(second::add, loop);
        assertEquals(1, loop.pendingTasks());

        clock.advanceMillis(200);
        for (int i = 0; i < 5; i++) sampler.sample();
        assertTrue(events.isEmpty());
        assertEquals(1, second.size());
    }

    @Test
    void failingCallbackDoesNotStopSampling() {
        List<Integer> calls = new ArrayList<>();
        sampler.setMaxConsecutiveBlocks(1);
        sampler.enable(e -> {
            calls.add(e.consecutiveBlocks());
            throw new IllegalStateException("listener bug");
        }, loop);
        clock.advanceMillis(200);

        assertDoesNotThrow(sampler::sample);
        sampler.sample();
        assertEquals(2, calls.size());
        assertTrue(sampler.isEnabled());
    }

    @Test
    void eventFrameSkipsSamplerAndLoopFrames() {
        sampler.setMaxConsecutiveBlocks(1);
        sampler.enable(events::add, loop);
        clock.advanceMillis(200);
        sampler.sample();

        SourceLocation frame = events.get(0).frame();
        assertTrue(frame.file().endsWith("RuntimeBlockingSamplerTest.java"), frame.toString());
        assertTrue(frame.function().contains("eventFrameSkipsSamplerAndLoopFrames"), frame.toString());
    }

    @Test
    void wrappedRunnableRecordsActivityAfterItFinishes() {
        sampler.enable(events::add, loop);
        clock.advanceSeconds(1);

        sampler.wrap(() -> clock.advanceMillis(500)).run();

        assertEquals(clock.nanoTime(), sampler.state().lastActivityNanos());
    }

    @Test
    void wrappedRunnableRecordsActivityEvenWhenItThrows() {
        sampler.enable(events::add, loop);
        Runnable failing = sampler.wrap((Runnable) () -> {
            clock.advanceMillis(300);
            throw new IllegalArgumentException("bad request");
        });

        assertThrows(IllegalArgumentException.class, failing::run);
        assertEquals(clock.nanoTime(), sampler.state().lastActivityNanos());
    }

    @Test
    void wrappedSupplierAndFunctionPassValuesThrough() {
        sampler.enable(events::add, loop);
        Supplier<String> supplier = sampler.wrap(() -> "ok");
        Function<Integer, Integer> doubler = sampler.wrap((Integer x) -> x * 2);

        assertEquals("ok", supplier.get());
        assertEquals(42, doubler.apply(21));
    }

    @Test
    void eventConvertsToBlockingViolation() {
        SourceLocation frame = new SourceLocation("Handler.java", 17, "com.acme.Handler.handle");
        BlockingViolation violation = new RuntimeBlockingEvent(0.4, frame, 0.01, 5).toViolation();

        assertEquals(ViolationKind.BLOCKING_CALL, violation.kind());
        assertEquals(Severity.ERROR, violation.severity());
        assertEquals("com.acme.Handler.handle", violation.symbol());
        assertEquals(17, violation.line());
    }
}
