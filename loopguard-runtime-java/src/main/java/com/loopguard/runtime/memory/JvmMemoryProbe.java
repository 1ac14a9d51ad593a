package com.loopguard.runtime.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.util.List;

/**
 * Reads JVM heap usage from the platform MXBeans. Peak is the sum of the heap pools' peak
 * usage, which is an upper bound for the heap's true peak.
 */
public class JvmMemoryProbe implements MemoryProbe {

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final List<MemoryPoolMXBean> heapPools = ManagementFactory.getMemoryPoolMXBeans().stream()
        .filter(pool -> pool.getType() == MemoryType.HEAP)
        .toList();

    @Override
    public long currentBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed();
    }

    @Override
    public long peakBytes() {
        long peak = 0;
        for (MemoryPoolMXBean pool : heapPools) {
            MemoryUsage usage = pool.getPeakUsage();
            if (usage != null) peak += usage.getUsed();
        }
        return Math.max(peak, currentBytes());
    }

    @Override
    public void collectGarbage() {
        System.gc();
    }
}
