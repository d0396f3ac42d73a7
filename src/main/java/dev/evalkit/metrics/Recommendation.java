package dev.evalkit.metrics;

/** An advisory finding attached to a report. */
public record Recommendation(Level level, String title, String detail) {
    public enum Level {
        CRITICAL,
        WARNING,
        INFO
    }
}
