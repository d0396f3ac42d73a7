package dev.evalkit.baseline;

import dev.evalkit.metrics.EvalReport;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** The metrics a baseline captures from the report of the promoted run. */
public record BaselineMetrics(
        double accuracy,
        double passRate,
        double avgLatencyMs,
        double avgCostUsd,
        Map<String, Double> categoryAccuracy) {

    public BaselineMetrics {
        categoryAccuracy =
                categoryAccuracy == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new TreeMap<>(categoryAccuracy));
    }

    public static BaselineMetrics from(EvalReport report) {
        var summary = report.summary();
        var categories = new TreeMap<String, Double>();
        report.metrics().byCategory().forEach((name, m) -> categories.put(name, m.accuracy()));
        return new BaselineMetrics(
                summary.accuracy(),
                summary.passRate(),
                summary.avgLatencyMs(),
                summary.avgCostUsd(),
                categories);
    }
}
