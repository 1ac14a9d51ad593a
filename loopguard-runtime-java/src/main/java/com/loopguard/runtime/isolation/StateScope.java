package com.loopguard.runtime.isolation;

/**
 * Named areas of process-wide mutable state. Transient scopes hold per-request input and are
 * emptied when a request context is created; the others are filtered to an allow-list.
 */
public enum StateScope {
    SERVER(false),
    QUERY(true),
    BODY(true),
    FILES(true),
    COOKIES(true),
    SESSION(true),
    ENVIRONMENT(false),
    REQUEST(true);

    private final boolean transientScope;

    StateScope(boolean transientScope) {
        this.transientScope = transientScope;
    }

    public boolean isTransient() {
        return transientScope;
    }
}
