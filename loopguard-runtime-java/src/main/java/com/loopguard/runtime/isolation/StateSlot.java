package com.loopguard.runtime.isolation;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An explicitly owned mutable holder, used in place of a static mutable field. Tracking a slot
 * with {@link RequestIsolation#trackSlot} restores its value when the context is destroyed.
 */
public final class StateSlot<T> {

    private final String name;
    private final AtomicReference<T> value;

    public StateSlot(String name, T initialValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = new AtomicReference<>(initialValue);
    }

    public String name() { return name; }

    public T get() { return value.get(); }

    public void set(T newValue) { value.set(newValue); }

    @Override
    public String toString() {
        return "StateSlot[" + name + "]";
    }
}
