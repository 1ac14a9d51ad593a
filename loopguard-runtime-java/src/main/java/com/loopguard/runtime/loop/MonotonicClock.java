package com.loopguard.runtime.loop;

/** Monotonic nanosecond time source. */
@FunctionalInterface
public interface MonotonicClock {

    long nanoTime();

    static MonotonicClock system() {
        return System::nanoTime;
    }
}
