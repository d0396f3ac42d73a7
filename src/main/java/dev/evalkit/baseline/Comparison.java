package dev.evalkit.baseline;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Result of comparing a report with a dataset's active baseline. */
public record Comparison(
        /** Absent when the dataset had no active baseline. */
        Optional<String> baselineId,
        /** True on the first run of a dataset: nothing to compare with, capture a baseline. */
        boolean needsBaseline,
        List<Regression> regressions,
        List<Improvement> improvements) {

    public Comparison {
        regressions = List.copyOf(regressions);
        improvements = List.copyOf(improvements);
    }

    public static Comparison noBaseline() {
        return new Comparison(Optional.empty(), true, List.of(), List.of());
    }

    /** No comparison was made, e.g. for a cancelled run with partial results. */
    public static Comparison skipped() {
        return new Comparison(Optional.empty(), false, List.of(), List.of());
    }

    public Optional<Severity> worstSeverity() {
        return regressions.stream().map(Regression::severity).max(Comparator.naturalOrder());
    }

    public boolean hasRegressionAtLeast(Severity severity) {
        return worstSeverity().map(s -> s.atLeast(severity)).orElse(false);
    }
}
