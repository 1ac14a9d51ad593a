package com.loopguard.fixture;

import java.util.Queue;

public class PollingWorker {

    private final Queue<String> queue;

    public PollingWorker(Queue<String> queue) {
        this.queue = queue;
    }

    public void spin() {
        while (true) {
            String next = queue.poll();
            if (next != null) {
                process(next);
            }
        }
    }

    public String drainOne() {
        for (;;) {
            String next = queue.poll();
            if (next != null) {
                return next;
            }
        }
    }

    public void drainAll() {
        while ((true)) {
            if (queue.poll() == null) break;
        }
    }

    private void process(String item) {
        item.length();
    }
}
