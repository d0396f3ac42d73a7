package dev.evalkit.metrics;

import dev.evalkit.error.EvalException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum ReportFormat {
    CONSOLE,
    MARKDOWN,
    JSON,
    CSV;

    public static ReportFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw EvalException.configuration(
                    "unknown report format '%s', expected one of %s"
                            .formatted(
                                    name,
                                    Arrays.stream(values())
                                            .map(f -> f.name().toLowerCase(Locale.ROOT))
                                            .collect(Collectors.joining(", "))));
        }
    }
}
