package com.loopguard.runtime.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleThreadEventLoopTest {

    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new SingleThreadEventLoop("test-loop");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void periodicTaskRunsRepeatedly() throws Exception {
        CountDownLatch ran = new CountDownLatch(3);
        loop.schedulePeriodic(Duration.ofMillis(5), ran::countDown);
        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void failingTaskKeepsItsSchedule() throws Exception {
        CountDownLatch ran = new CountDownLatch(3);
        loop.schedulePeriodic(Duration.ofMillis(5), () -> {
            ran.countDown();
            throw new IllegalStateException("boom");
        });
        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void recoverableErrorKeepsItsSchedule() throws Exception {
        CountDownLatch ran = new CountDownLatch(3);
        loop.schedulePeriodic(Duration.ofMillis(5), () -> {
            ran.countDown();
            throw new StackOverflowError();
        });
        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void onlyVirtualMachineBreakdownsAreFatal() {
        assertTrue(SingleThreadEventLoop.isFatal(new OutOfMemoryError()));
        assertTrue(SingleThreadEventLoop.isFatal(new InternalError()));
        assertFalse(SingleThreadEventLoop.isFatal(new StackOverflowError()));
        assertFalse(SingleThreadEventLoop.isFatal(new AssertionError()));
    }

    @Test
    void oneShotTaskRunsOnTheLoopThread() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        String[] threadName = new String[1];
        loop.scheduleOnce(Duration.ofMillis(1), () -> {
            threadName[0] = Thread.currentThread().getName();
            ran.countDown();
        });
        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertEquals("test-loop", threadName[0]);
    }

    @Test
    void cancelledTaskStopsRunning() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        ScheduledTask task = loop.schedulePeriodic(Duration.ofMillis(2), runs::incrementAndGet);
        task.cancel();
        task.cancel();
        assertTrue(task.isCancelled());
        int afterCancel = runs.get();
        Thread.sleep(30);
        assertTrue(runs.get() <= afterCancel + 1);
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> loop.schedulePeriodic(Duration.ZERO, () -> {}));
    }

    @Test
    void closeShutsDownTheLoop() {
        loop.close();
        assertTrue(loop.isClosed());
    }
}
