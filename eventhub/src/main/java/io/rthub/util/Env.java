package io.rthub.util;

import java.time.Duration;

/**
 * Environment variable utilities.
 * Lookup order: environment variable, then system property, then default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Positive int; zero, negative or unparseable values fall back to the default.
     */
    public static int getPositiveInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        return value > 0 ? value : defaultValue;
    }

    public static Duration getSeconds(String key, Duration defaultValue) {
        int seconds = getPositiveInt(key, -1);
        return seconds > 0 ? Duration.ofSeconds(seconds) : defaultValue;
    }

    private Env() {}
}
