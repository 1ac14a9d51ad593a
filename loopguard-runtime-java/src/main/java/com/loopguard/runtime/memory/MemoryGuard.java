package com.loopguard.runtime.memory;

import com.loopguard.runtime.GuardConfigurationException;
import com.loopguard.runtime.cache.MonitoredCache;
import com.loopguard.runtime.loop.EventLoop;
import com.loopguard.runtime.loop.MonotonicClock;
import com.loopguard.runtime.loop.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Periodically samples process memory and reacts to it.
 *
 * Each check appends a snapshot to a rolling window, then walks a threshold ladder from the
 * top: above the critical threshold every cache is cleared, leak callbacks receive a
 * {@link MemoryAlert.Type#CRITICAL_MEMORY} alert and a restart request is scheduled once;
 * above the warning threshold garbage is collected and every cache is cleaned to half its
 * limit; above the gc threshold garbage is collected. Independently, sustained growth across
 * the window raises a {@link MemoryAlert.Type#MEMORY_LEAK} alert.
 *
 * The guard never terminates the process. Restart requests are signals for a supervisor.
 */
public class MemoryGuard {

    private static final Logger log = LoggerFactory.getLogger(MemoryGuard.class);

    private static final long GC_LOG_MIN_FREED_BYTES = MemoryGuardConfig.MIB;

    private final EventLoop loop;
    private final MemoryGuardConfig config;
    private final MemoryProbe probe;
    private final MonotonicClock clock;
    private final MemoryWindow window;
    private final long startNanos;

    private final Map<String, TrackedCache> trackedCaches = new ConcurrentHashMap<>();
    private final List<Consumer<MemoryAlert>> leakCallbacks = new CopyOnWriteArrayList<>();
    private final List<Consumer<RestartRequest>> restartCallbacks = new CopyOnWriteArrayList<>();
    private final List<ScheduledTask> tasks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean monitoring = new AtomicBoolean(false);
    private final AtomicBoolean restartScheduled = new AtomicBoolean(false);
    private final AtomicLong gcRuns = new AtomicLong();

    public MemoryGuard(EventLoop loop) {
        this(loop, MemoryGuardConfig.defaults(), new JvmMemoryProbe(), MonotonicClock.system());
    }

    public MemoryGuard(EventLoop loop, MemoryGuardConfig config, MemoryProbe probe, MonotonicClock clock) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.config = Objects.requireNonNull(config, "config");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = new MemoryWindow(config.windowCapacity());
        this.startNanos = clock.nanoTime();
    }

    /** Schedule the memory and cache checks. Calling it again has no effect. */
    public void startMonitoring() {
        if (!monitoring.compareAndSet(false, true)) {
            return;
        }
        tasks.add(loop.schedulePeriodic(config.checkInterval(), this::performCheck));
        tasks.add(loop.schedulePeriodic(config.cacheCheckInterval(), this::checkCacheSizes));
        log.info("Memory guard started: critical={} warning={} gc={} interval={}s",
            Bytes.format(config.criticalThresholdBytes()), Bytes.format(config.warningThresholdBytes()),
            Bytes.format(config.gcThresholdBytes()), config.checkInterval().toSeconds());
    }

    public void stopMonitoring() {
        if (!monitoring.compareAndSet(true, false)) {
            return;
        }
        tasks.forEach(ScheduledTask::cancel);
        tasks.clear();
        log.info("Memory guard stopped");
    }

    /** Track {@code cache} under the limit configured for {@code name}, or the default limit. */
    public void registerCache(String name, Object cache) {
        registerCache(name, cache, config.cacheSizeLimit(name));
    }

    /**
     * Track {@code cache} under {@code name}, replacing any cache already registered there.
     *
     * @throws CacheRegistrationException if {@code cache} does not implement {@link MonitoredCache}
     */
    public void registerCache(String name, Object cache, long maxSizeBytes) {
        Objects.requireNonNull(name, "name");
        if (!(cache instanceof MonitoredCache monitored)) {
            String type = cache == null ? "null" : cache.getClass().getName();
            throw new CacheRegistrationException("Cache '" + name + "' of type " + type
                + " cannot be observed or shrunk: implement MonitoredCache, use InMemoryCache, "
                + "or wrap the container with CacheAdapters.forMap/forCollection");
        }
        if (maxSizeBytes <= 0) {
            throw new GuardConfigurationException("maxSizeBytes for cache '" + name + "' must be positive: " + maxSizeBytes);
        }
        trackedCaches.put(name, new TrackedCache(name, monitored, maxSizeBytes));
        log.debug("Registered cache '{}' with limit {}", name, Bytes.format(maxSizeBytes));
    }

    public boolean unregisterCache(String name) {
        return trackedCaches.remove(name) != null;
    }

    public void onMemoryLeak(Consumer<MemoryAlert> callback) {
        leakCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public void onRestartRequested(Consumer<RestartRequest> callback) {
        restartCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public MemoryStats getStats() {
        long uptimeSeconds = Math.max(0, (clock.nanoTime() - startNanos) / 1_000_000_000L);
        return new MemoryStats(probe.currentBytes(), probe.peakBytes(), gcRuns.get(),
            MemoryStats.formatUptime(uptimeSeconds), uptimeSeconds,
            trackedCaches.size(), window.size(), monitoring.get());
    }

    public List<MemorySnapshot> snapshots() {
        return window.toList();
    }

    // -----------------------------------------------------------------------
    // Periodic checks
    // -----------------------------------------------------------------------

    void performCheck() {
        long current = probe.currentBytes();
        long peak = probe.peakBytes();
        window.add(new MemorySnapshot(clock.nanoTime(), current, peak));
        if (config.collectOnSample()) {
            probe.collectGarbage();
        }

        if (current > config.criticalThresholdBytes()) {
            handleCriticalMemory(current);
        } else if (current > config.warningThresholdBytes()) {
            handleHighMemory(current);
        } else if (current > config.gcThresholdBytes()) {
            triggerGarbageCollection();
        }

        if (config.leakDetectionEnabled()) {
            detectMemoryLeak();
        }
    }

    void checkCacheSizes() {
        for (TrackedCache tracked : trackedCaches.values()) {
            long size;
            try {
                size = tracked.cache().sizeBytes();
            } catch (RuntimeException | StackOverflowError e) {
                log.error("Could not read size of cache '{}'", tracked.name(), e);
                continue;
            }
            if (size > tracked.maxSizeBytes()) {
                log.warn("Cache '{}' exceeds its limit: {} > {}",
                    tracked.name(), Bytes.format(size), Bytes.format(tracked.maxSizeBytes()));
                cleanCache(tracked, tracked.maxSizeBytes());
            }
        }
    }

    private void handleHighMemory(long current) {
        log.warn("High memory usage: {} (warning threshold {}, uptime {})",
            Bytes.format(current), Bytes.format(config.warningThresholdBytes()), uptime());
        triggerGarbageCollection();
        for (TrackedCache tracked : trackedCaches.values()) {
            cleanCache(tracked, tracked.maxSizeBytes() / 2);
        }
    }

    private void handleCriticalMemory(long current) {
        long threshold = config.criticalThresholdBytes();
        log.error("Critical memory usage, restart required: {} (threshold {}, uptime {})",
            Bytes.format(current), Bytes.format(threshold), uptime());

        notifyLeakCallbacks(MemoryAlert.critical(current, threshold));

        for (TrackedCache tracked : trackedCaches.values()) {
            try {
                tracked.cache().clear();
            } catch (RuntimeException | StackOverflowError e) {
                log.error("Could not clear cache '{}'", tracked.name(), e);
            }
        }
        triggerGarbageCollection();

        if (restartScheduled.compareAndSet(false, true)) {
            loop.scheduleOnce(config.restartDelay(), () -> requestRestart(current, threshold));
        }
    }

    private void requestRestart(long current, long threshold) {
        log.error("Requesting graceful restart: memory {} exceeded {}", Bytes.format(current), Bytes.format(threshold));
        RestartRequest request = new RestartRequest(current, threshold, Instant.now());
        for (Consumer<RestartRequest> callback : restartCallbacks) {
            try {
                callback.accept(request);
            } catch (RuntimeException e) {
                log.error("Restart listener failed", e);
            }
        }
    }

    private void triggerGarbageCollection() {
        long before = probe.currentBytes();
        probe.collectGarbage();
        long after = probe.currentBytes();
        long runs = gcRuns.incrementAndGet();
        long freed = before - after;
        if (freed > GC_LOG_MIN_FREED_BYTES) {
            log.info("Garbage collection freed {} (run {})", Bytes.format(freed), runs);
        }
    }

    private void detectMemoryLeak() {
        if (window.size() < config.minLeakSamples()) {
            return;
        }
        MemorySnapshot first = window.first();
        MemorySnapshot last = window.last();
        long elapsedNanos = last.timestampNanos() - first.timestampNanos();
        if (elapsedNanos <= 0) {
            return;
        }
        double elapsedSeconds = elapsedNanos / 1_000_000_000.0;
        long growth = last.currentBytes() - first.currentBytes();
        double growthRate = growth / elapsedSeconds;

        if (growthRate * 60 > config.leakGrowthBytesPerMinute()) {
            log.warn("Potential memory leak: {}/min over {}s (total growth {})",
                Bytes.format((long) (growthRate * 60)),
                String.format(Locale.ROOT, "%.0f", elapsedSeconds), Bytes.format(growth));
            notifyLeakCallbacks(MemoryAlert.leak(last.currentBytes(), growthRate, window.toList()));
        }
    }

    private void cleanCache(TrackedCache tracked, long targetBytes) {
        try {
            tracked.cache().clean(targetBytes);
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Could not clean cache '{}'", tracked.name(), e);
        }
    }

    private void notifyLeakCallbacks(MemoryAlert alert) {
        for (Consumer<MemoryAlert> callback : leakCallbacks) {
            try {
                callback.accept(alert);
            } catch (RuntimeException e) {
                log.error("Memory alert callback failed", e);
            }
        }
    }

    private String uptime() {
        return MemoryStats.formatUptime(Math.max(0, (clock.nanoTime() - startNanos) / 1_000_000_000L));
    }
}
