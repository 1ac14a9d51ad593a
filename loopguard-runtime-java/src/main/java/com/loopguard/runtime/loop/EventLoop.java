package com.loopguard.runtime.loop;

import java.time.Duration;

/**
 * The cooperative scheduler the guards run on. Every periodic check is a short task scheduled
 * here, on the same loop that serves requests.
 */
public interface EventLoop {

    /** Run {@code task} every {@code interval}, first after one interval. */
    ScheduledTask schedulePeriodic(Duration interval, Runnable task);

    /** Run {@code task} once after {@code delay}. */
    ScheduledTask scheduleOnce(Duration delay, Runnable task);
}
