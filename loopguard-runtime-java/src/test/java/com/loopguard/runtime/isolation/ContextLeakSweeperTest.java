package com.loopguard.runtime.isolation;

import com.loopguard.runtime.loop.FakeClock;
import com.loopguard.runtime.loop.ManualEventLoop;
import com.loopguard.runtime.memory.ScriptedMemoryProbe;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextLeakSweeperTest {

    @Test
    void periodicSweepReportsLeakedContexts() {
        FakeClock clock = new FakeClock();
        ManualEventLoop loop = new ManualEventLoop(clock);
        RequestIsolationManager manager = new RequestIsolationManager(new SharedState(),
            IsolationConfig.defaults(), new ScriptedMemoryProbe(0), clock);
        ContextLeakSweeper sweeper = new ContextLeakSweeper(manager, loop, Duration.ofSeconds(10));
        List<ContextLeak> reported = new ArrayList<>();
        sweeper.onLeak(reported::add);
        sweeper.onLeak(leak -> { throw new IllegalStateException("listener bug"); });

        String stuck = manager.createContext(new RequestDescriptor("GET", "/stream"));
        sweeper.start();
        sweeper.start();
        assertEquals(1, loop.pendingTasks());

        loop.advance(Duration.ofSeconds(30));
        assertTrue(reported.isEmpty());

        loop.advance(Duration.ofSeconds(10));
        assertEquals(1, reported.size());
        assertEquals(stuck, reported.get(0).contextId());
        assertEquals(1, sweeper.lastLeaks().size());
        assertTrue(manager.hasContext(stuck));

        sweeper.stop();
        assertEquals(0, loop.pendingTasks());
    }
}
