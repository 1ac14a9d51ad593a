package com.loopguard.runtime.isolation;

import java.util.*;

/**
 * Structural deep copies of state values: maps, lists, sets and arrays are copied recursively.
 * Shared and cyclic references are preserved; a container reached twice is copied once.
 */
final class StateCopies {

    private StateCopies() {}

    static Map<String, Object> copyScope(Map<String, ?> scope) {
        Map<Object, Object> copies = new IdentityHashMap<>();
        Map<String, Object> copy = new LinkedHashMap<>();
        scope.forEach((k, v) -> copy.put(k, copy(v, copies)));
        return copy;
    }

    static Object copy(Object value) {
        return copy(value, new IdentityHashMap<>());
    }

    // copies: original container -> its copy, registered before the children are walked
    private static Object copy(Object value, Map<Object, Object> copies) {
        if (value == null) return null;
        Object known = copies.get(value);
        if (known != null) return known;

        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            copies.put(value, copy);
            map.forEach((k, v) -> copy.put(k, copy(v, copies)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            copies.put(value, copy);
            list.forEach(v -> copy.add(copy(v, copies)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            copies.put(value, copy);
            set.forEach(v -> copy.add(copy(v, copies)));
            return copy;
        }
        if (value instanceof Object[] array) {
            Object[] copy = array.clone();
            copies.put(value, copy);
            for (int i = 0; i < copy.length; i++) copy[i] = copy(copy[i], copies);
            return copy;
        }
        return value;
    }
}
