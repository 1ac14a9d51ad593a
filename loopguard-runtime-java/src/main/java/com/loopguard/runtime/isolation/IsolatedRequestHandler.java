package com.loopguard.runtime.isolation;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs request handling between {@link RequestIsolation#createContext} and
 * {@link RequestIsolation#destroyContext}. The context is destroyed in a {@code finally} block;
 * exceptions from the handler propagate unchanged. Counts handled and failed requests.
 */
public class IsolatedRequestHandler {

    @FunctionalInterface
    public interface RequestCall<T> {
        T call(String contextId) throws Exception;
    }

    private final RequestIsolation isolation;
    private final AtomicLong handled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public IsolatedRequestHandler(RequestIsolation isolation) {
        this.isolation = Objects.requireNonNull(isolation, "isolation");
    }

    public <T> T handle(RequestDescriptor request, RequestCall<T> call) throws Exception {
        String contextId = isolation.createContext(request);
        handled.incrementAndGet();
        try {
            return call.call(contextId);
        } catch (Exception e) {
            failed.incrementAndGet();
            throw e;
        } finally {
            isolation.destroyContext(contextId);
        }
    }

    public long requestsHandled() {
        return handled.get();
    }

    /** Requests whose handler threw an exception. */
    public long requestsFailed() {
        return failed.get();
    }

    /** Failed requests as a percentage of handled ones; 0 before the first request. */
    public double errorRatePercent() {
        long total = handled.get();
        return total == 0 ? 0.0 : failed.get() * 100.0 / total;
    }
}
