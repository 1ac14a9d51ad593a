package com.loopguard.runtime.loop;

/** Handle to a task scheduled on an {@link EventLoop}. Cancelling twice is harmless. */
public interface ScheduledTask {

    void cancel();

    boolean isCancelled();
}
