package com.loopguard.fixture;

import java.util.Locale;
import java.util.Map;

public class SessionHandler {

    private static int requestCount = 0;
    private static final ThreadLocal<String> CURRENT_USER = new ThreadLocal<>();

    public String handle(Map<String, String> query) {
        requestCount++;
        Locale.setDefault(Locale.GERMANY);
        System.setProperty("last.user", query.get("user"));
        String home = System.getenv("HOME");
        CURRENT_USER.set(query.get("user"));
        return home + requestCount;
    }
}
