package dev.evalkit.scorer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The verdict of one scorer on one test case. */
public record ScorerResult(
        String scorerName,
        /**
         * Normalized score.
         *
         * <p>Always between 0.0 (inclusive) and 1.0 (inclusive). Out of range or NaN values are
         * clamped on construction.
         */
        double score,
        boolean passed,
        /** Human readable explanation of the score. */
        String reason,
        /** Named sub-metrics, e.g. per-criterion scores or precision and recall. */
        Map<String, Double> breakdown,
        Map<String, Object> metadata) {

    public ScorerResult {
        score = clamp(score);
        reason = reason == null ? "" : reason;
        breakdown =
                breakdown == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ScorerResult of(String scorerName, double score, boolean passed, String reason) {
        return new ScorerResult(scorerName, score, passed, reason, Map.of(), Map.of());
    }

    /** A failed result recording why the scorer could not produce a score. */
    public static ScorerResult error(String scorerName, String prefix, Throwable error) {
        var message =
                error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new ScorerResult(
                scorerName,
                0.0,
                false,
                prefix + ": " + message,
                Map.of(),
                Map.of("error", message));
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
