package com.loopguard.runtime.isolation;

import java.util.Locale;

/**
 * The request facts a context needs: its HTTP method and path.
 */
public record RequestDescriptor(String method, String path) {

    public RequestDescriptor {
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase(Locale.ROOT);
        path = path == null || path.isEmpty() ? "/" : path;
    }
}
