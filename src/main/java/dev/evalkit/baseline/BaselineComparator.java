package dev.evalkit.baseline;

import dev.evalkit.metrics.EvalReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Diffs a report against the active baseline of its dataset.
 *
 * <p>Accuracy and pass rate (overall and per category) regress when they drop; the drop in
 * percentage points decides the severity. Average latency and cost regress when they rise; the
 * increase in percent of the baseline value decides the severity. Any drop or rise smaller than
 * the major threshold is MINOR. Unchanged or better metrics produce no regression.
 */
public final class BaselineComparator {
    public static final String ACCURACY = "accuracy";
    public static final String PASS_RATE = "pass_rate";
    public static final String AVG_LATENCY = "avg_latency_ms";
    public static final String AVG_COST = "avg_cost_usd";

    private final RegressionThresholds thresholds;

    public BaselineComparator(RegressionThresholds thresholds) {
        var problems = thresholds.problems();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", problems));
        }
        this.thresholds = thresholds;
    }

    public static BaselineComparator withDefaults() {
        return new BaselineComparator(RegressionThresholds.DEFAULTS);
    }

    public Comparison compare(EvalReport current, Optional<Baseline> baseline) {
        if (baseline.isEmpty()) {
            return Comparison.noBaseline();
        }
        var base = baseline.get().metrics();
        var summary = current.summary();
        var regressions = new ArrayList<Regression>();
        var improvements = new ArrayList<Improvement>();

        comparePoints(ACCURACY, base.accuracy(), summary.accuracy(), regressions, improvements);
        comparePoints(PASS_RATE, base.passRate(), summary.passRate(), regressions, improvements);
        compareIncrease(
                AVG_LATENCY,
                base.avgLatencyMs(),
                summary.avgLatencyMs(),
                thresholds.latencyCriticalPercent(),
                thresholds.latencyMajorPercent(),
                regressions,
                improvements);
        compareIncrease(
                AVG_COST,
                base.avgCostUsd(),
                summary.avgCostUsd(),
                thresholds.costCriticalPercent(),
                thresholds.costMajorPercent(),
                regressions,
                improvements);
        current.metrics()
                .byCategory()
                .forEach(
                        (category, metrics) -> {
                            var baselineAccuracy = base.categoryAccuracy().get(category);
                            if (baselineAccuracy != null) {
                                comparePoints(
                                        "category.%s.accuracy".formatted(category),
                                        baselineAccuracy,
                                        metrics.accuracy(),
                                        regressions,
                                        improvements);
                            }
                        });
        return new Comparison(Optional.of(baseline.get().id()), false, regressions, improvements);
    }

    /** Severity of a change in percentage points, null when nothing dropped. */
    @Nullable
    Severity classifyDrop(double deltaPoints) {
        var points = round(deltaPoints);
        if (points >= 0) {
            return null;
        }
        return tier(-points, thresholds.criticalPoints(), thresholds.majorPoints());
    }

    private void comparePoints(
            String metric,
            double baselineValue,
            double currentValue,
            List<Regression> regressions,
            List<Improvement> improvements) {
        double delta = currentValue - baselineValue;
        var severity = classifyDrop(delta * 100);
        if (severity != null) {
            regressions.add(
                    new Regression(metric, baselineValue, currentValue, delta, severity));
        } else if (round(delta * 100) > 0) {
            improvements.add(new Improvement(metric, baselineValue, currentValue, delta));
        }
    }

    private void compareIncrease(
            String metric,
            double baselineValue,
            double currentValue,
            double criticalPercent,
            double majorPercent,
            List<Regression> regressions,
            List<Improvement> improvements) {
        if (baselineValue <= 0) {
            return;
        }
        double delta = currentValue - baselineValue;
        double percent = round(delta / baselineValue * 100);
        if (percent > 0) {
            regressions.add(
                    new Regression(
                            metric,
                            baselineValue,
                            currentValue,
                            delta,
                            tier(percent, criticalPercent, majorPercent)));
        } else if (percent < 0) {
            improvements.add(new Improvement(metric, baselineValue, currentValue, delta));
        }
    }

    private static Severity tier(double magnitude, double critical, double major) {
        if (magnitude >= critical) {
            return Severity.CRITICAL;
        } else if (magnitude >= major) {
            return Severity.MAJOR;
        }
        return Severity.MINOR;
    }

    /** Drops floating point noise so that a 10.0 point drop is not read as 9.999999. */
    private static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
