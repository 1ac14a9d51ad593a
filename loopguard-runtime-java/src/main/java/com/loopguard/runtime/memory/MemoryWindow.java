package com.loopguard.runtime.memory;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Bounded rolling window of snapshots; the oldest is evicted once capacity is reached.
 */
public class MemoryWindow {

    private final int capacity;
    private final ArrayDeque<MemorySnapshot> snapshots;

    public MemoryWindow(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(capacity);
    }

    public synchronized void add(MemorySnapshot snapshot) {
        if (snapshots.size() == capacity) {
            snapshots.removeFirst();
        }
        snapshots.addLast(snapshot);
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized MemorySnapshot first() {
        return snapshots.peekFirst();
    }

    public synchronized MemorySnapshot last() {
        return snapshots.peekLast();
    }

    public synchronized List<MemorySnapshot> toList() {
        return List.copyOf(snapshots);
    }
}
