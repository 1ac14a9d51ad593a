package com.loopguard.runtime.isolation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Deep copy of every scope of a {@link SharedState}, taken at one instant. Restoring a snapshot
 * copies it again, so one snapshot can be restored any number of times.
 */
public final class SharedStateSnapshot {

    private final EnumMap<StateScope, Map<String, Object>> scopes;

    SharedStateSnapshot(EnumMap<StateScope, Map<String, Object>> scopes) {
        this.scopes = scopes;
    }

    public Map<String, Object> scope(StateScope scope) {
        return Collections.unmodifiableMap(scopes.getOrDefault(scope, Map.of()));
    }

    Map<String, Object> copyOf(StateScope scope) {
        return StateCopies.copyScope(scopes.getOrDefault(scope, Map.of()));
    }
}
