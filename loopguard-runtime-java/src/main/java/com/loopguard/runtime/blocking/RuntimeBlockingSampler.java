package com.loopguard.runtime.blocking;

import com.loopguard.api.SourceLocation;
import com.loopguard.runtime.loop.EventLoop;
import com.loopguard.runtime.loop.MonotonicClock;
import com.loopguard.runtime.loop.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Detects a blocked event loop by sampling it from a periodic task scheduled on that same loop.
 *
 * A loop that is busy cannot run the sampling task, so the task observes the block as a large
 * gap since the last recorded activity once it finally runs. Application code marks progress
 * through {@link #recordActivity()}, usually via one of the {@code wrap} decorators. An event is
 * raised only after {@code maxConsecutiveBlocks} blocked samples in a row, after which the count
 * starts over.
 */
public class RuntimeBlockingSampler {

    private static final Logger log = LoggerFactory.getLogger(RuntimeBlockingSampler.class);

    private static final StackWalker WALKER = StackWalker.getInstance();
    private static final String LOOP_PACKAGE = "com.loopguard.runtime.loop.";

    private final SamplerConfig config;
    private final MonotonicClock clock;

    private volatile int maxConsecutiveBlocks;
    private volatile long lastActivityNanos;
    private final AtomicInteger consecutiveBlockCount = new AtomicInteger();
    private volatile long lastSampleNanos;
    private volatile long loopLagNanos;
    private volatile boolean enabled;
    private volatile Consumer<RuntimeBlockingEvent> onViolation;
    private ScheduledTask samplingTask;

    public RuntimeBlockingSampler() {
        this(SamplerConfig.DEFAULTS, MonotonicClock.system());
    }

    public RuntimeBlockingSampler(SamplerConfig config, MonotonicClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxConsecutiveBlocks = config.maxConsecutiveBlocks();
        this.lastActivityNanos = clock.nanoTime();
    }

    /**
     * Start sampling on {@code loop}. Calling this while enabled replaces the callback and
     * restarts the sampling task.
     */
    public synchronized void enable(Consumer<RuntimeBlockingEvent> onViolation, EventLoop loop) {
        Objects.requireNonNull(onViolation, "onViolation");
        Objects.requireNonNull(loop, "loop");
        cancelSamplingTask();
        this.onViolation = onViolation;
        this.lastActivityNanos = clock.nanoTime();
        this.lastSampleNanos = lastActivityNanos;
        this.loopLagNanos = 0;
        this.consecutiveBlockCount.set(0);
        this.enabled = true;
        this.samplingTask = loop.schedulePeriodic(Duration.ofNanos(config.samplingIntervalNanos()), this::sample);
        log.info("Blocking sampler enabled: threshold={}s interval={}s maxConsecutive={}",
            config.thresholdSeconds(), config.samplingIntervalSeconds(), maxConsecutiveBlocks);
    }

    public synchronized void disable() {
        boolean wasEnabled = enabled;
        enabled = false;
        cancelSamplingTask();
        consecutiveBlockCount.set(0);
        onViolation = null;
        if (wasEnabled) log.info("Blocking sampler disabled");
    }

    /** Mark progress. No-op while disabled. */
    public void recordActivity() {
        if (!enabled) return;
        lastActivityNanos = clock.nanoTime();
        consecutiveBlockCount.set(0);
    }

    /** One sampling tick; called by the periodic task. */
    public void sample() {
        if (!enabled) return;

        long now = clock.nanoTime();
        loopLagNanos = Math.max(0, now - lastSampleNanos - config.samplingIntervalNanos());
        lastSampleNanos = now;

        long elapsedNanos = now - lastActivityNanos;
        if (elapsedNanos > config.thresholdNanos()) {
            int count = consecutiveBlockCount.incrementAndGet();
            if (count >= maxConsecutiveBlocks && consecutiveBlockCount.compareAndSet(count, 0)) {
                report(elapsedNanos / 1_000_000_000.0, count);
            }
        } else {
            consecutiveBlockCount.set(0);
        }
    }

    /**
     * How late the most recent sampling tick ran compared with its schedule, in nanoseconds.
     * A loop that keeps up reports 0.
     */
    public long loopLagNanos() {
        return loopLagNanos;
    }

    public void setMaxConsecutiveBlocks(int max) {
        this.maxConsecutiveBlocks = Math.max(1, max);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public SamplerState state() {
        return new SamplerState(config.thresholdSeconds(), config.samplingIntervalSeconds(),
            lastActivityNanos, consecutiveBlockCount.get(), maxConsecutiveBlocks, enabled);
    }

    public Runnable wrap(Runnable task) {
        return () -> {
            recordActivity();
            try {
                task.run();
            } finally {
                recordActivity();
            }
        };
    }

    public <T> Supplier<T> wrap(Supplier<T> supplier) {
        return () -> {
            recordActivity();
            try {
                return supplier.get();
            } finally {
                recordActivity();
            }
        };
    }

    public <T, R> Function<T, R> wrap(Function<T, R> function) {
        return arg -> {
            recordActivity();
            try {
                return function.apply(arg);
            } finally {
                recordActivity();
            }
        };
    }

    /**
     * Proxy implementing {@code iface} whose every method records activity before and after
     * delegating to {@code target}.
     */
    public <T> T wrapInterface(Class<T> iface, T target) {
        return ActivityProxyFactory.create(iface, target, this::recordActivity);
    }

    private void report(double durationSeconds, int consecutiveBlocks) {
        RuntimeBlockingEvent event = new RuntimeBlockingEvent(durationSeconds, captureFrame(),
            config.samplingIntervalSeconds(), consecutiveBlocks);
        log.warn("Event loop blocked for {}s at {}", String.format(Locale.ROOT, "%.3f", durationSeconds), event.frame());

        Consumer<RuntimeBlockingEvent> callback = onViolation;
        if (callback == null) return;
        try {
            callback.accept(event);
        } catch (RuntimeException e) {
            log.error("Blocking callback failed", e);
        }
    }

    static SourceLocation captureFrame() {
        return WALKER.walk(frames -> frames
                .filter(f -> !isInternal(f.getClassName()))
                .findFirst()
                .map(f -> SourceLocation.ofFrame(f.toStackTraceElement()))
                .orElse(SourceLocation.UNKNOWN));
    }

    private static boolean isInternal(String className) {
        return className.startsWith(RuntimeBlockingSampler.class.getName())
            || className.startsWith(LOOP_PACKAGE)
            || className.startsWith("java.")
            || className.startsWith("jdk.")
            || className.startsWith("sun.");
    }

    private void cancelSamplingTask() {
        if (samplingTask != null) {
            samplingTask.cancel();
            samplingTask = null;
        }
    }
}
