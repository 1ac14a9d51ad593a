package com.loopguard.runtime.isolation;

import com.loopguard.runtime.loop.EventLoop;
import com.loopguard.runtime.loop.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Periodically asks a {@link RequestIsolation} for leaked contexts, logs them and notifies
 * listeners. Leaked contexts are left open.
 */
public class ContextLeakSweeper {

    private static final Logger log = LoggerFactory.getLogger(ContextLeakSweeper.class);

    private final RequestIsolation isolation;
    private final EventLoop loop;
    private final Duration interval;
    private final List<Consumer<ContextLeak>> listeners = new CopyOnWriteArrayList<>();
    private volatile List<ContextLeak> lastLeaks = List.of();
    private ScheduledTask task;

    public ContextLeakSweeper(RequestIsolation isolation, EventLoop loop, Duration interval) {
        this.isolation = Objects.requireNonNull(isolation, "isolation");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    public void onLeak(Consumer<ContextLeak> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public synchronized void start() {
        if (task != null) return;
        task = loop.schedulePeriodic(interval, this::sweep);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel();
            task = null;
        }
    }

    public List<ContextLeak> sweep() {
        List<ContextLeak> leaks = isolation.checkContextLeaks();
        lastLeaks = List.copyOf(leaks);
        for (ContextLeak leak : leaks) {
            log.warn("Request context {} still open after {}s (memory growth {} bytes)",
                leak.contextId(), String.format(Locale.ROOT, "%.1f", leak.durationSeconds()), leak.memoryGrowthBytes());
            for (Consumer<ContextLeak> listener : listeners) {
                try {
                    listener.accept(leak);
                } catch (RuntimeException e) {
                    log.error("Context leak listener failed", e);
                }
            }
        }
        return leaks;
    }

    /** Leaks found by the most recent sweep. */
    public List<ContextLeak> lastLeaks() {
        return lastLeaks;
    }
}
