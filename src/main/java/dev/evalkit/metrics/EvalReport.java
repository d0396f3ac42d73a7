package dev.evalkit.metrics;

import dev.evalkit.baseline.Regression;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view of a run's results. Derived entirely from the run's {@code TestCaseResult}s and
 * the regressions found for it, so it can be recomputed at any time.
 */
public record EvalReport(
        String runId,
        Summary summary,
        Metrics metrics,
        List<Recommendation> recommendations,
        List<Regression> regressions) {

    public EvalReport {
        recommendations = List.copyOf(recommendations);
        regressions = List.copyOf(regressions);
    }

    public record Summary(
            int totalTests,
            int passed,
            int failed,
            /** Test cases whose model call failed. Counted in {@code failed} too. */
            int errored,
            /** passed / totalTests */
            double accuracy,
            /** passed / test cases that produced an output */
            double passRate,
            double avgScore,
            double avgLatencyMs,
            double avgCostUsd,
            double totalCostUsd,
            long totalTokens) {}

    public record Metrics(
            Map<String, CategoryMetrics> byCategory,
            Map<String, ScorerMetrics> byScorer,
            Distribution scoreDistribution) {}

    public record CategoryMetrics(
            int total,
            int passed,
            double accuracy,
            double avgScore,
            double avgLatencyMs,
            double avgCostUsd,
            double totalCostUsd) {}

    public record ScorerMetrics(int count, double avgScore, double passRate) {}

    /** Distribution of per-test aggregate scores. */
    public record Distribution(
            double p25,
            double p50,
            double p75,
            double p95,
            double mean,
            double min,
            double max,
            double stdDev) {
        public static final Distribution EMPTY = new Distribution(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
