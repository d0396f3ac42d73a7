package dev.evalkit.metrics;

import dev.evalkit.baseline.Regression;
import dev.evalkit.json.EvalJsonMapper;
import java.util.Locale;
import java.util.Map;

/** Renders an {@link EvalReport} as text. */
public final class ReportRenderer {
    private ReportRenderer() {}

    public static String render(EvalReport report, ReportFormat format) {
        return switch (format) {
            case CONSOLE -> console(report);
            case MARKDOWN -> markdown(report);
            case JSON -> EvalJsonMapper.toPrettyJson(report);
            case CSV -> csv(report);
        };
    }

    private static String console(EvalReport report) {
        var s = report.summary();
        var out = new StringBuilder();
        out.append("Evaluation report for run ").append(report.runId()).append('\n');
        out.append("=".repeat(60)).append('\n');
        row(out, "Total tests", Integer.toString(s.totalTests()));
        row(out, "Passed", Integer.toString(s.passed()));
        row(out, "Failed", Integer.toString(s.failed()));
        row(out, "Errored", Integer.toString(s.errored()));
        row(out, "Accuracy", percent(s.accuracy()));
        row(out, "Pass rate", percent(s.passRate()));
        row(out, "Average score", number(s.avgScore()));
        row(out, "Average latency", "%.0f ms".formatted(s.avgLatencyMs()));
        row(out, "Total cost", usd(s.totalCostUsd()));
        row(out, "Total tokens", Long.toString(s.totalTokens()));

        var categories = report.metrics().byCategory();
        if (!categories.isEmpty()) {
            out.append('\n').append("By category").append('\n');
            out.append("-".repeat(60)).append('\n');
            categories.forEach(
                    (name, m) ->
                            out.append(
                                    "  %-24s %4d/%-4d %8s %10s\n"
                                            .formatted(
                                                    name,
                                                    m.passed(),
                                                    m.total(),
                                                    percent(m.accuracy()),
                                                    usd(m.totalCostUsd()))));
        }

        var scorers = report.metrics().byScorer();
        if (!scorers.isEmpty()) {
            out.append('\n').append("By scorer").append('\n');
            out.append("-".repeat(60)).append('\n');
            scorers.forEach(
                    (name, m) ->
                            out.append(
                                    "  %-24s avg %-8s pass %s\n"
                                            .formatted(
                                                    name,
                                                    number(m.avgScore()),
                                                    percent(m.passRate()))));
        }

        if (!report.regressions().isEmpty()) {
            out.append('\n').append("Regressions").append('\n');
            out.append("-".repeat(60)).append('\n');
            for (var r : report.regressions()) {
                out.append(
                        "  [%s] %s: %s -> %s\n"
                                .formatted(
                                        r.severity(),
                                        r.metric(),
                                        number(r.baselineValue()),
                                        number(r.currentValue())));
            }
        }

        out.append('\n').append("Recommendations").append('\n');
        out.append("-".repeat(60)).append('\n');
        for (var rec : report.recommendations()) {
            out.append("  [%s] %s: %s\n".formatted(rec.level(), rec.title(), rec.detail()));
        }
        return out.toString();
    }

    private static String markdown(EvalReport report) {
        var s = report.summary();
        var out = new StringBuilder();
        out.append("# Evaluation report: ").append(report.runId()).append("\n\n");
        out.append("## Summary\n\n");
        out.append("| Metric | Value |\n|---|---|\n");
        mdRow(out, "Total tests", Integer.toString(s.totalTests()));
        mdRow(out, "Passed", Integer.toString(s.passed()));
        mdRow(out, "Failed", Integer.toString(s.failed()));
        mdRow(out, "Errored", Integer.toString(s.errored()));
        mdRow(out, "Accuracy", percent(s.accuracy()));
        mdRow(out, "Pass rate", percent(s.passRate()));
        mdRow(out, "Average score", number(s.avgScore()));
        mdRow(out, "Average latency", "%.0f ms".formatted(s.avgLatencyMs()));
        mdRow(out, "Total cost", usd(s.totalCostUsd()));

        var d = report.metrics().scoreDistribution();
        out.append("\n## Score distribution\n\n");
        out.append("| p25 | p50 | p75 | p95 | mean | std dev |\n|---|---|---|---|---|---|\n");
        out.append(
                "| %s | %s | %s | %s | %s | %s |\n"
                        .formatted(
                                number(d.p25()),
                                number(d.p50()),
                                number(d.p75()),
                                number(d.p95()),
                                number(d.mean()),
                                number(d.stdDev())));

        var categories = report.metrics().byCategory();
        if (!categories.isEmpty()) {
            out.append("\n## By category\n\n");
            out.append("| Category | Passed | Total | Accuracy | Avg score | Cost |\n");
            out.append("|---|---|---|---|---|---|\n");
            categories.forEach(
                    (name, m) ->
                            out.append(
                                    "| %s | %d | %d | %s | %s | %s |\n"
                                            .formatted(
                                                    name,
                                                    m.passed(),
                                                    m.total(),
                                                    percent(m.accuracy()),
                                                    number(m.avgScore()),
                                                    usd(m.totalCostUsd()))));
        }

        if (!report.regressions().isEmpty()) {
            out.append("\n## Regressions\n\n");
            out.append("| Metric | Baseline | Current | Change | Severity |\n");
            out.append("|---|---|---|---|---|\n");
            for (Regression r : report.regressions()) {
                out.append(
                        "| %s | %s | %s | %+.1f%% | %s |\n"
                                .formatted(
                                        r.metric(),
                                        number(r.baselineValue()),
                                        number(r.currentValue()),
                                        r.percentChange(),
                                        r.severity()));
            }
        }

        out.append("\n## Recommendations\n\n");
        for (var rec : report.recommendations()) {
            out.append(
                    "- **%s** %s: %s\n".formatted(rec.level(), rec.title(), rec.detail()));
        }
        return out.toString();
    }

    private static String csv(EvalReport report) {
        var s = report.summary();
        var out = new StringBuilder();
        out.append("scope,name,total,passed,accuracy,avg_score,avg_latency_ms,total_cost_usd\n");
        out.append(
                "overall,%s,%d,%d,%s,%s,%s,%s\n"
                        .formatted(
                                csvField(report.runId()),
                                s.totalTests(),
                                s.passed(),
                                plain(s.accuracy()),
                                plain(s.avgScore()),
                                plain(s.avgLatencyMs()),
                                plain(s.totalCostUsd())));
        for (Map.Entry<String, EvalReport.CategoryMetrics> e :
                report.metrics().byCategory().entrySet()) {
            var m = e.getValue();
            out.append(
                    "category,%s,%d,%d,%s,%s,%s,%s\n"
                            .formatted(
                                    csvField(e.getKey()),
                                    m.total(),
                                    m.passed(),
                                    plain(m.accuracy()),
                                    plain(m.avgScore()),
                                    plain(m.avgLatencyMs()),
                                    plain(m.totalCostUsd())));
        }
        return out.toString();
    }

    static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static void row(StringBuilder out, String label, String value) {
        out.append("  %-20s %s\n".formatted(label, value));
    }

    private static void mdRow(StringBuilder out, String label, String value) {
        out.append("| ").append(label).append(" | ").append(value).append(" |\n");
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100);
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private static String usd(double value) {
        return String.format(Locale.ROOT, "$%.4f", value);
    }

    private static String plain(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
