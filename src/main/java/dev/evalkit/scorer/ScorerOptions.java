package dev.evalkit.scorer;

import dev.evalkit.error.EvalException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Typed reads over the loosely typed option map of a {@link ScorerSpec}. */
final class ScorerOptions {
    private final String scorerName;
    private final Map<String, Object> options;

    ScorerOptions(String scorerName, Map<String, Object> options) {
        this.scorerName = scorerName;
        this.options = options;
    }

    double getDouble(String key, double defaultValue) {
        var value = options.get(key);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw invalid(key, "a number", value);
        }
    }

    int getInt(String key, int defaultValue) {
        var value = options.get(key);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, "an integer", value);
        }
    }

    boolean getBoolean(String key, boolean defaultValue) {
        var value = options.get(key);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString());
    }

    String getString(String key, String defaultValue) {
        var value = options.get(key);
        return value == null ? defaultValue : value.toString();
    }

    List<String> getStringList(String key) {
        var value = options.get(key);
        if (value == null) {
            return List.of();
        } else if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of(value.toString());
    }

    boolean has(String key) {
        return options.containsKey(key);
    }

    Object raw(String key) {
        return options.get(key);
    }

    private EvalException invalid(String key, String expected, Object value) {
        return EvalException.configuration(
                "option '%s' of scorer '%s' must be %s but was '%s'"
                        .formatted(key, scorerName, expected, value));
    }
}
