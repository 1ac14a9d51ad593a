package com.loopguard.runtime.memory;

/**
 * Source of process memory readings and the collection trigger.
 */
public interface MemoryProbe {

    long currentBytes();

    long peakBytes();

    void collectGarbage();
}
