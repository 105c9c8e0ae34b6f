package com.aetherclaw.shared.config;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide view of environment variables. Values set here shadow {@link System#getenv}
 * for the rest of the process; they are not persisted anywhere.
 */
public final class RuntimeEnv {

    private static final Map<String, String> overrides = new ConcurrentHashMap<>();

    private RuntimeEnv() {}

    public static String get(String name) {
        var val = overrides.get(name);
        return val != null ? val : System.getenv(name);
    }

    public static String getOrDefault(String name, String fallback) {
        var val = get(name);
        return val != null ? val : fallback;
    }

    public static void set(String name, String value) {
        overrides.put(name, value);
    }

    /** Drops every override; tests use it to keep one case's values out of the next. */
    public static void clear() {
        overrides.clear();
    }
}
