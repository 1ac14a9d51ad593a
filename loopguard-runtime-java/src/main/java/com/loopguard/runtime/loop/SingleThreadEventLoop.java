package com.loopguard.runtime.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single daemon thread. A task that throws is logged and keeps
 * its schedule, unless it throws an error the JVM cannot recover from.
 */
public class SingleThreadEventLoop implements EventLoop, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ScheduledExecutorService scheduler;

    public SingleThreadEventLoop() {
        this("loopguard-event-loop");
    }

    public SingleThreadEventLoop(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledTask schedulePeriodic(Duration interval, Runnable task) {
        long nanos = positiveNanos(interval);
        return new FutureTask(scheduler.scheduleAtFixedRate(guarded(task), nanos, nanos, TimeUnit.NANOSECONDS));
    }

    @Override
    public ScheduledTask scheduleOnce(Duration delay, Runnable task) {
        return new FutureTask(scheduler.schedule(guarded(task), Math.max(delay.toNanos(), 0), TimeUnit.NANOSECONDS));
    }

    /** Run {@code task} on the loop thread as soon as it is free. */
    public void execute(Runnable task) {
        scheduler.execute(guarded(task));
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Event loop task failed", e);
            } catch (Error e) {
                if (isFatal(e)) {
                    log.error("Event loop task failed with a fatal error, its schedule stops", e);
                    throw e;
                }
                log.error("Event loop task failed", e);
            }
        };
    }

    /** Errors after which the JVM cannot be trusted to keep running tasks. */
    static boolean isFatal(Error e) {
        return e instanceof OutOfMemoryError || e instanceof InternalError || e instanceof UnknownError;
    }

    private static long positiveNanos(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        return interval.toNanos();
    }

    private record FutureTask(Future<?> future) implements ScheduledTask {
        @Override public void cancel()         { future.cancel(false); }
        @Override public boolean isCancelled() { return future.isCancelled(); }
    }
}
