package dev.evalkit.baseline;

import java.util.ArrayList;
import java.util.List;

/**
 * Severity boundaries.
 *
 * <p>Accuracy and pass rate drops are measured in percentage points. Latency and cost increases
 * are measured in percent of the baseline value.
 */
public record RegressionThresholds(
        double criticalPoints,
        double majorPoints,
        double latencyCriticalPercent,
        double latencyMajorPercent,
        double costCriticalPercent,
        double costMajorPercent) {

    public static final RegressionThresholds DEFAULTS =
            new RegressionThresholds(10, 5, 50, 25, 40, 20);

    /** Problems with these thresholds, empty when they are usable. */
    public List<String> problems() {
        var problems = new ArrayList<String>();
        check(problems, "points", criticalPoints, majorPoints);
        check(problems, "latency percent", latencyCriticalPercent, latencyMajorPercent);
        check(problems, "cost percent", costCriticalPercent, costMajorPercent);
        return problems;
    }

    private static void check(List<String> problems, String name, double critical, double major) {
        if (!(major > 0)) {
            problems.add("major %s threshold must be positive, was %s".formatted(name, major));
        }
        if (critical < major) {
            problems.add(
                    "critical %s threshold (%s) must not be below major (%s)"
                            .formatted(name, critical, major));
        }
    }
}
