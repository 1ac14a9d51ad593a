package com.loopguard.runtime.isolation;

import com.loopguard.runtime.GuardConfigurationException;
import com.loopguard.runtime.loop.MonotonicClock;
import com.loopguard.runtime.memory.JvmMemoryProbe;
import com.loopguard.runtime.memory.MemoryProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link RequestIsolation}. Every context restores the snapshot taken at its own
 * creation, so interleaved contexts never restore each other's values.
 */
public class RequestIsolationManager implements RequestIsolation {

    private static final Logger log = LoggerFactory.getLogger(RequestIsolationManager.class);

    private final SharedState sharedState;
    private final IsolationConfig config;
    private final MemoryProbe probe;
    private final MonotonicClock clock;
    private final Map<String, RequestContext> contexts = new ConcurrentHashMap<>();

    public RequestIsolationManager(SharedState sharedState) {
        this(sharedState, IsolationConfig.defaults(), new JvmMemoryProbe(), MonotonicClock.system());
    }

    public RequestIsolationManager(SharedState sharedState, IsolationConfig config,
                                   MemoryProbe probe, MonotonicClock clock) {
        this.sharedState = Objects.requireNonNull(sharedState, "sharedState");
        this.config = Objects.requireNonNull(config, "config");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String createContext(RequestDescriptor request) {
        Objects.requireNonNull(request, "request");
        String contextId = generateContextId(request);
        SharedStateSnapshot backup = sharedState.isolate(config.serverAllowList(), config.environmentAllowList());
        contexts.put(contextId, new RequestContext(contextId, request, clock.nanoTime(), backup, probe.currentBytes()));
        log.debug("Opened context {}", contextId);
        return contextId;
    }

    @Override
    public void destroyContext(String contextId) {
        if (contextId == null) return;
        RequestContext context = contexts.remove(contextId);
        if (context == null) return;

        sharedState.restore(context.backup);
        for (Restorable mutation : context.mutations) {
            try {
                mutation.restore();
            } catch (Exception e) {
                log.warn("Could not restore {} for context {}", mutation.describe(), contextId, e);
            }
        }
        if (config.collectOnDestroy()) {
            probe.collectGarbage();
        }
        log.debug("Closed context {}", contextId);
    }

    @Override
    public boolean hasContext(String contextId) {
        return contextId != null && contexts.containsKey(contextId);
    }

    @Override
    public Optional<ContextInfo> getContextInfo(String contextId) {
        if (contextId == null) return Optional.empty();
        RequestContext context = contexts.get(contextId);
        if (context == null) return Optional.empty();
        return Optional.of(new ContextInfo(context.id, context.request.method(), context.request.path(),
            ageSeconds(context), context.memoryAtStart, context.mutations.size()));
    }

    @Override
    public List<ContextLeak> checkContextLeaks() {
        double maxSeconds = config.maxContextDuration().toNanos() / 1_000_000_000.0;
        long maxGrowth = config.maxMemoryGrowthBytes();
        long currentMemory = probe.currentBytes();

        List<ContextLeak> leaks = new ArrayList<>();
        for (RequestContext context : contexts.values()) {
            double duration = ageSeconds(context);
            long growth = currentMemory - context.memoryAtStart;
            boolean tooOld = duration > maxSeconds;
            boolean tooHungry = maxGrowth > 0 && growth > maxGrowth;
            if (tooOld || tooHungry) {
                leaks.add(new ContextLeak(context.id, duration, growth));
            }
        }
        leaks.sort(Comparator.comparingDouble(ContextLeak::durationSeconds).reversed());
        return leaks;
    }

    @Override
    public boolean trackSlot(String contextId, StateSlot<?> slot) {
        Objects.requireNonNull(slot, "slot");
        RequestContext context = contextId != null ? contexts.get(contextId) : null;
        if (context == null) return false;
        context.mutations.add(slotRestorer(slot));
        return true;
    }

    @Override
    public boolean trackStaticField(String contextId, Class<?> owner, String fieldName) {
        Field field = staticMutableField(owner, fieldName);
        RequestContext context = contextId != null ? contexts.get(contextId) : null;
        if (context == null) return false;

        Object original;
        try {
            original = field.get(null);
        } catch (IllegalAccessException e) {
            throw new GuardConfigurationException("Cannot read " + owner.getName() + "." + fieldName, e);
        }
        context.mutations.add(new Restorable() {
            @Override public void restore() throws IllegalAccessException { field.set(null, original); }
            @Override public String describe() { return "static field " + owner.getName() + "." + fieldName; }
        });
        return true;
    }

    @Override
    public int activeContexts() {
        return contexts.size();
    }

    private static <T> Restorable slotRestorer(StateSlot<T> slot) {
        T original = slot.get();
        return new Restorable() {
            @Override public void restore() { slot.set(original); }
            @Override public String describe() { return slot.toString(); }
        };
    }

    private static Field staticMutableField(Class<?> owner, String fieldName) {
        Objects.requireNonNull(owner, "owner");
        Field field;
        try {
            field = owner.getDeclaredField(fieldName);
        } catch (NoSuchFieldException e) {
            throw new GuardConfigurationException("No field " + owner.getName() + "." + fieldName, e);
        }
        int modifiers = field.getModifiers();
        if (!Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers)) {
            throw new GuardConfigurationException(owner.getName() + "." + fieldName + " is not a static non-final field");
        }
        try {
            field.setAccessible(true);
        } catch (RuntimeException e) {
            throw new GuardConfigurationException("Cannot access " + owner.getName() + "." + fieldName, e);
        }
        return field;
    }

    private double ageSeconds(RequestContext context) {
        return (clock.nanoTime() - context.startedAtNanos) / 1_000_000_000.0;
    }

    static String generateContextId(RequestDescriptor request) {
        String unique = UUID.randomUUID().toString().replace("-", "");
        return "ctx_" + unique + "_" + request.method() + "_" + md5Hex(request.path());
    }

    private static String md5Hex(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private interface Restorable {
        void restore() throws Exception;
        String describe();
    }

    private static final class RequestContext {
        final String id;
        final RequestDescriptor request;
        final long startedAtNanos;
        final SharedStateSnapshot backup;
        final long memoryAtStart;
        final List<Restorable> mutations = new CopyOnWriteArrayList<>();

        RequestContext(String id, RequestDescriptor request, long startedAtNanos,
                       SharedStateSnapshot backup, long memoryAtStart) {
            this.id = id;
            this.request = request;
            this.startedAtNanos = startedAtNanos;
            this.backup = backup;
            this.memoryAtStart = memoryAtStart;
        }
    }
}
