package villagecompute.orchestrator.jobs;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed reads of trigger options. Options arrive as parsed JSON, so values may be strings, booleans, numbers or
 * lists.
 */
final class JobOptions {

    private JobOptions() {
    }

    static boolean flag(Map<String, Object> options, String key) {
        Object value = options.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }

    static int integer(Map<String, Object> options, String key, int defaultValue) {
        Object value = options.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + key + " must be an integer, was '" + value + "'", e);
        }
    }

    /**
     * Reads a list option given either as a JSON array or as a comma-separated string.
     */
    static List<String> strings(Map<String, Object> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?>) {
            return ((Collection<?>) value).stream().filter(v -> v != null).map(v -> v.toString().trim())
                    .filter(v -> !v.isEmpty()).toList();
        }
        return Arrays.stream(value.toString().split(",")).map(String::trim).filter(v -> !v.isEmpty()).toList();
    }
}
