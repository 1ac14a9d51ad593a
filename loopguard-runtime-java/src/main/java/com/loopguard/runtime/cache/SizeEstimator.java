package com.loopguard.runtime.cache;

import com.google.gson.Gson;

import java.nio.charset.StandardCharsets;

/**
 * Estimates the memory held by one cache entry.
 */
@FunctionalInterface
public interface SizeEstimator {

    long estimate(Object key, Object value);

    /** Charged for a value that neither Gson nor {@code toString()} can render, e.g. a cyclic graph. */
    long UNRENDERABLE_ENTRY_BYTES = 64;

    /**
     * UTF-8 length of the JSON form of key and value. Values Gson cannot serialize fall back to
     * their {@code toString()}, then to {@link #UNRENDERABLE_ENTRY_BYTES}.
     */
    static SizeEstimator json() {
        Gson gson = new Gson();
        return (key, value) -> utf8Length(gson, key) + utf8Length(gson, value);
    }

    private static long utf8Length(Gson gson, Object o) {
        if (o == null) return 0;
        String text;
        try {
            text = gson.toJson(o);
        } catch (RuntimeException | StackOverflowError e) {
            try {
                text = String.valueOf(o);
            } catch (RuntimeException | StackOverflowError again) {
                return UNRENDERABLE_ENTRY_BYTES;
            }
        }
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
