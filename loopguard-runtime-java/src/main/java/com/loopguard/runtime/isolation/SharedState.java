package com.loopguard.runtime.isolation;

import java.util.*;

/**
 * The process-wide mutable key space that request contexts isolate: one {@code String -> Object}
 * map per {@link StateScope}. All access is synchronized on the instance.
 */
public class SharedState {

    private final EnumMap<StateScope, Map<String, Object>> scopes = new EnumMap<>(StateScope.class);

    public SharedState() {
        for (StateScope scope : StateScope.values()) {
            scopes.put(scope, new LinkedHashMap<>());
        }
    }

    public synchronized Object get(StateScope scope, String key) {
        return scopes.get(scope).get(key);
    }

    public synchronized void put(StateScope scope, String key, Object value) {
        scopes.get(scope).put(Objects.requireNonNull(key, "key"), value);
    }

    public synchronized Object remove(StateScope scope, String key) {
        return scopes.get(scope).remove(key);
    }

    /** Read-only copy of one scope. */
    public synchronized Map<String, Object> view(StateScope scope) {
        return Collections.unmodifiableMap(StateCopies.copyScope(scopes.get(scope)));
    }

    public synchronized void replace(StateScope scope, Map<String, ?> values) {
        scopes.put(scope, StateCopies.copyScope(values));
    }

    public synchronized SharedStateSnapshot snapshot() {
        EnumMap<StateScope, Map<String, Object>> copy = new EnumMap<>(StateScope.class);
        scopes.forEach((scope, values) -> copy.put(scope, StateCopies.copyScope(values)));
        return new SharedStateSnapshot(copy);
    }

    public synchronized void restore(SharedStateSnapshot snapshot) {
        for (StateScope scope : StateScope.values()) {
            scopes.put(scope, snapshot.copyOf(scope));
        }
    }

    /**
     * Snapshot all scopes, then empty the transient ones and keep only allow-listed keys in
     * {@link StateScope#SERVER} and {@link StateScope#ENVIRONMENT}. Atomic with respect to other
     * callers.
     */
    synchronized SharedStateSnapshot isolate(Set<String> serverAllowList, Set<String> environmentAllowList) {
        SharedStateSnapshot backup = snapshot();
        for (StateScope scope : StateScope.values()) {
            if (scope.isTransient()) {
                scopes.put(scope, new LinkedHashMap<>());
            }
        }
        scopes.get(StateScope.SERVER).keySet().retainAll(serverAllowList);
        scopes.get(StateScope.ENVIRONMENT).keySet().retainAll(environmentAllowList);
        return backup;
    }
}
