package com.loopguard.runtime.isolation;

import java.util.List;
import java.util.Optional;

/**
 * Per-request hook pair around shared mutable state. Callers invoke {@link #createContext}
 * before dispatching a request and {@link #destroyContext} from a {@code finally} block after
 * it, on the error path too.
 */
public interface RequestIsolation {

    /**
     * Snapshot shared state, reset it to request-safe defaults and open a context.
     *
     * @return opaque context id
     */
    String createContext(RequestDescriptor request);

    /** Restore the state captured by {@code contextId}'s creation. Unknown ids are ignored. */
    void destroyContext(String contextId);

    boolean hasContext(String contextId);

    Optional<ContextInfo> getContextInfo(String contextId);

    /** Contexts over the age or memory-growth limit. Nothing is destroyed. */
    List<ContextLeak> checkContextLeaks();

    /**
     * Restore {@code slot} to its current value when {@code contextId} is destroyed.
     *
     * @return false if no such context is open
     */
    boolean trackSlot(String contextId, StateSlot<?> slot);

    /**
     * Restore the static field {@code owner.fieldName} to its current value when
     * {@code contextId} is destroyed.
     *
     * @return false if no such context is open
     */
    boolean trackStaticField(String contextId, Class<?> owner, String fieldName);

    int activeContexts();
}
