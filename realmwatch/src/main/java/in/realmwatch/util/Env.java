package in.realmwatch.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Environment variable utilities.
 * Environment wins over system properties; blank values count as unset.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static String require(String key) {
        String value = get(key, null);
        if (value == null) {
            throw new IllegalStateException("Missing required setting: " + key);
        }
        return value;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Setting " + key + " is not an integer: " + value, e);
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Read an integer setting expressed in the given unit.
     */
    public static Duration getDuration(String key, ChronoUnit unit, long defaultAmount) {
        return Duration.of(getInt(key, (int) defaultAmount), unit);
    }

    private Env() {}
}
