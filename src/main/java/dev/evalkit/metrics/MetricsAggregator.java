package dev.evalkit.metrics;

import dev.evalkit.baseline.Regression;
import dev.evalkit.baseline.Severity;
import dev.evalkit.eval.TestCaseResult;
import dev.evalkit.scorer.ScorerResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Reduces a run's test case results into an {@link EvalReport}.
 *
 * <p>A pure function: the same results always give an equal report. Results are ordered by test
 * case id before summing so that completion order does not leak into floating point totals.
 */
public final class MetricsAggregator {
    static final double LOW_ACCURACY = 0.8;
    static final double LOW_CATEGORY_ACCURACY = 0.7;
    static final double HIGH_LATENCY_MS = 5000;
    static final double HIGH_TOTAL_COST_USD = 10.0;

    public EvalReport aggregate(String runId, List<TestCaseResult> results) {
        return aggregate(runId, results, List.of());
    }

    public EvalReport aggregate(
            String runId, List<TestCaseResult> results, List<Regression> regressions) {
        var ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparing(TestCaseResult::testCaseId));

        var summary = summarize(ordered);
        var metrics =
                new EvalReport.Metrics(
                        byCategory(ordered), byScorer(ordered), distribution(ordered));
        var recommendations = recommend(summary, metrics, ordered, regressions);
        return new EvalReport(runId, summary, metrics, recommendations, regressions);
    }

    private static EvalReport.Summary summarize(List<TestCaseResult> results) {
        int total = results.size();
        int passed = (int) results.stream().filter(TestCaseResult::passed).count();
        int errored = (int) results.stream().filter(TestCaseResult::errored).count();
        int executed = total - errored;
        double totalCost = sum(results, r -> r.metadata().costUsd());
        return new EvalReport.Summary(
                total,
                passed,
                total - passed,
                errored,
                ratio(passed, total),
                ratio(passed, executed),
                mean(results, TestCaseResult::aggregateScore),
                mean(results, r -> (double) r.metadata().latencyMs()),
                total == 0 ? 0.0 : totalCost / total,
                totalCost,
                results.stream().mapToLong(r -> r.metadata().totalTokens()).sum());
    }

    private static Map<String, EvalReport.CategoryMetrics> byCategory(
            List<TestCaseResult> results) {
        var groups =
                results.stream()
                        .collect(
                                Collectors.groupingBy(
                                        TestCaseResult::category,
                                        TreeMap::new,
                                        Collectors.toList()));
        var metrics = new TreeMap<String, EvalReport.CategoryMetrics>();
        groups.forEach(
                (category, group) -> {
                    int passed = (int) group.stream().filter(TestCaseResult::passed).count();
                    double totalCost = sum(group, r -> r.metadata().costUsd());
                    metrics.put(
                            category,
                            new EvalReport.CategoryMetrics(
                                    group.size(),
                                    passed,
                                    ratio(passed, group.size()),
                                    mean(group, TestCaseResult::aggregateScore),
                                    mean(group, r -> (double) r.metadata().latencyMs()),
                                    totalCost / group.size(),
                                    totalCost));
                });
        return Collections.unmodifiableMap(metrics);
    }

    private static Map<String, EvalReport.ScorerMetrics> byScorer(List<TestCaseResult> results) {
        var groups = new TreeMap<String, List<ScorerResult>>();
        for (var result : results) {
            for (var scorerResult : result.scorerResults()) {
                groups.computeIfAbsent(scorerResult.scorerName(), k -> new ArrayList<>())
                        .add(scorerResult);
            }
        }
        var metrics = new TreeMap<String, EvalReport.ScorerMetrics>();
        groups.forEach(
                (name, group) -> {
                    int passed = (int) group.stream().filter(ScorerResult::passed).count();
                    double avg =
                            group.stream().mapToDouble(ScorerResult::score).sum() / group.size();
                    metrics.put(
                            name,
                            new EvalReport.ScorerMetrics(
                                    group.size(), avg, ratio(passed, group.size())));
                });
        return Collections.unmodifiableMap(metrics);
    }

    static EvalReport.Distribution distribution(List<TestCaseResult> results) {
        if (results.isEmpty()) {
            return EvalReport.Distribution.EMPTY;
        }
        double[] scores = results.stream().mapToDouble(TestCaseResult::aggregateScore).toArray();
        Arrays.sort(scores);
        double mean = Arrays.stream(scores).sum() / scores.length;
        double variance = 0;
        for (double score : scores) {
            variance += (score - mean) * (score - mean);
        }
        variance /= scores.length;
        return new EvalReport.Distribution(
                percentile(scores, 25),
                percentile(scores, 50),
                percentile(scores, 75),
                percentile(scores, 95),
                mean,
                scores[0],
                scores[scores.length - 1],
                Math.sqrt(variance));
    }

    /** Linear interpolation between closest ranks over sorted values. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        double index = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    private static List<Recommendation> recommend(
            EvalReport.Summary summary,
            EvalReport.Metrics metrics,
            List<TestCaseResult> results,
            List<Regression> regressions) {
        var recommendations = new ArrayList<Recommendation>();
        var critical =
                regressions.stream()
                        .filter(r -> r.severity() == Severity.CRITICAL)
                        .map(Regression::metric)
                        .collect(Collectors.toList());
        if (!critical.isEmpty()) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.CRITICAL,
                            "Critical regressions detected",
                            "Investigate before promoting this model: "
                                    + String.join(", ", critical)));
        }
        if (summary.totalTests() > 0 && summary.accuracy() < LOW_ACCURACY) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.WARNING,
                            "Accuracy below 80%",
                            "Accuracy is %.1f%%. Review failing test cases and prompts."
                                    .formatted(summary.accuracy() * 100)));
        }
        if (summary.avgLatencyMs() > HIGH_LATENCY_MS) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.WARNING,
                            "High average latency",
                            "Average latency is %.0f ms. Consider a faster model."
                                    .formatted(summary.avgLatencyMs())));
        }
        if (summary.totalCostUsd() > HIGH_TOTAL_COST_USD) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.WARNING,
                            "High run cost",
                            "This run cost $%.2f. Consider a cheaper model or a smaller dataset."
                                    .formatted(summary.totalCostUsd())));
        }
        var weakCategories = new LinkedHashMap<String, Double>();
        metrics.byCategory()
                .forEach(
                        (name, m) -> {
                            if (m.accuracy() < LOW_CATEGORY_ACCURACY) {
                                weakCategories.put(name, m.accuracy());
                            }
                        });
        if (!weakCategories.isEmpty()) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.WARNING,
                            "Weak categories",
                            weakCategories.entrySet().stream()
                                    .map(
                                            e ->
                                                    "%s (%.1f%%)"
                                                            .formatted(
                                                                    e.getKey(),
                                                                    e.getValue() * 100))
                                    .collect(Collectors.joining(", "))));
        }
        if (summary.errored() > 0) {
            var ids =
                    results.stream()
                            .filter(TestCaseResult::errored)
                            .map(TestCaseResult::testCaseId)
                            .collect(Collectors.toList());
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.WARNING,
                            "Model errors",
                            "%d test case(s) got no model output: %s"
                                    .formatted(ids.size(), String.join(", ", ids))));
        }
        if (recommendations.isEmpty()) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Level.INFO,
                            "All metrics within acceptable range",
                            "No action needed."));
        }
        return recommendations;
    }

    private static double sum(
            List<TestCaseResult> results, ToDoubleFunction<TestCaseResult> fn) {
        return results.stream().mapToDouble(fn).sum();
    }

    private static double mean(
            List<TestCaseResult> results, ToDoubleFunction<TestCaseResult> fn) {
        return results.isEmpty() ? 0.0 : sum(results, fn) / results.size();
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
