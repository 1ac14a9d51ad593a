package com.loopguard.runtime;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.loopguard.runtime.blocking.RuntimeBlockingEvent;
import com.loopguard.runtime.blocking.RuntimeBlockingSampler;
import com.loopguard.runtime.config.GuardSettings;
import com.loopguard.runtime.isolation.ContextLeakSweeper;
import com.loopguard.runtime.isolation.IsolatedRequestHandler;
import com.loopguard.runtime.isolation.IsolationConfig;
import com.loopguard.runtime.isolation.RequestIsolationManager;
import com.loopguard.runtime.isolation.SharedState;
import com.loopguard.runtime.loop.EventLoop;
import com.loopguard.runtime.loop.MonotonicClock;
import com.loopguard.runtime.memory.JvmMemoryProbe;
import com.loopguard.runtime.memory.MemoryGuard;
import com.loopguard.runtime.memory.MemoryProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Wires the runtime guards onto one event loop from {@link GuardSettings}. Intended to be built
 * once by the server's composition root.
 */
public class RuntimeGuard {

    private static final Logger log = LoggerFactory.getLogger(RuntimeGuard.class);

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final GuardSettings settings;
    private final EventLoop loop;
    private final RuntimeBlockingSampler sampler;
    private final MemoryGuard memoryGuard;
    private final RequestIsolationManager isolation;
    private final ContextLeakSweeper leakSweeper;
    private final IsolatedRequestHandler requestHandler;
    private boolean started;

    public RuntimeGuard(GuardSettings settings, EventLoop loop) {
        this(settings, loop, new SharedState(), new JvmMemoryProbe(), MonotonicClock.system());
    }

    public RuntimeGuard(GuardSettings settings, EventLoop loop, SharedState sharedState,
                        MemoryProbe probe, MonotonicClock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.loop = Objects.requireNonNull(loop, "loop");
        IsolationConfig isolationConfig = settings.toIsolationConfig();
        this.sampler = new RuntimeBlockingSampler(settings.toSamplerConfig(), clock);
        this.memoryGuard = new MemoryGuard(loop, settings.toMemoryGuardConfig(), probe, clock);
        this.isolation = new RequestIsolationManager(sharedState, isolationConfig, probe, clock);
        this.leakSweeper = new ContextLeakSweeper(isolation, loop, isolationConfig.leakSweepInterval());
        this.requestHandler = new IsolatedRequestHandler(isolation);
    }

    /**
     * Start the enabled guards. {@code onBlocking} receives runtime blocking events.
     */
    public synchronized void start(Consumer<RuntimeBlockingEvent> onBlocking) {
        if (started) return;
        if (settings.getBlocking().isEnabled()) {
            sampler.enable(onBlocking, loop);
        }
        if (settings.getMemory().isEnabled()) {
            memoryGuard.startMonitoring();
        }
        leakSweeper.start();
        started = true;
        log.info("Runtime guard started");
    }

    public synchronized void stop() {
        if (!started) return;
        sampler.disable();
        memoryGuard.stopMonitoring();
        leakSweeper.stop();
        started = false;
        log.info("Runtime guard stopped");
    }

    public GuardHealth health() {
        return new GuardHealth(memoryGuard.getStats(), sampler.state(),
            sampler.loopLagNanos() / 1_000_000.0,
            isolation.activeContexts(), leakSweeper.lastLeaks().size(),
            requestHandler.requestsHandled(), requestHandler.requestsFailed(),
            requestHandler.errorRatePercent());
    }

    public String healthJson() {
        return GSON.toJson(health());
    }

    public RuntimeBlockingSampler sampler()        { return sampler; }
    public MemoryGuard memoryGuard()               { return memoryGuard; }
    public RequestIsolationManager isolation()     { return isolation; }
    public ContextLeakSweeper leakSweeper()        { return leakSweeper; }
    public IsolatedRequestHandler requestHandler() { return requestHandler; }
}
