package dev.evalkit.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import dev.evalkit.alert.AlertDispatcher;
import dev.evalkit.alert.AlertPolicy;
import dev.evalkit.baseline.RegressionThresholds;
import dev.evalkit.baseline.Severity;
import dev.evalkit.cost.Budget;
import dev.evalkit.cost.BudgetPeriod;
import dev.evalkit.eval.PassPolicy;
import dev.evalkit.eval.RetryPolicy;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.scorer.ExactMatchScorer;
import dev.evalkit.scorer.ScorerSpec;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Run settings read from {@code evalkit.yaml} (or {@code .yml}, {@code .json}). Every field is
 * optional in the file; missing values take the defaults below.
 */
public record EvalSettings(
        List<ModelConfig> models,
        Runner runner,
        List<ScorerSpec> scorers,
        Baseline baseline,
        List<BudgetSettings> budgets,
        Alerts alerts) {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public EvalSettings {
        models = models == null ? List.of(ModelConfig.of(DEFAULT_MODEL)) : List.copyOf(models);
        runner = runner == null ? Runner.DEFAULTS : runner;
        scorers =
                scorers == null
                        ? List.of(ScorerSpec.of(ExactMatchScorer.NAME))
                        : List.copyOf(scorers);
        baseline = baseline == null ? Baseline.DEFAULTS : baseline;
        budgets = budgets == null ? List.of() : List.copyOf(budgets);
        alerts = alerts == null ? Alerts.DEFAULTS : alerts;
    }

    public static EvalSettings defaults() {
        return new EvalSettings(null, null, null, null, null, null);
    }

    /** The first configured model, used when a command names none. */
    public ModelConfig defaultModel() {
        return models.isEmpty() ? ModelConfig.of(DEFAULT_MODEL) : models.get(0);
    }

    /** Problems with these settings, empty when they are usable. */
    public List<String> problems() {
        var problems = new ArrayList<String>();
        problems.addAll(runner.problems());
        problems.addAll(baseline.toThresholds().problems());
        var periods = EnumSet.noneOf(BudgetPeriod.class);
        for (var budget : budgets) {
            problems.addAll(budget.problems());
            if (budget.period() != null && !periods.add(budget.period())) {
                problems.add(
                        "budgets: %s budget is configured more than once"
                                .formatted(budget.period().label()));
            }
        }
        if (alerts.historySize() < 1) {
            problems.add("alerts.history_size must be >= 1, got " + alerts.historySize());
        }
        if (scorers.isEmpty()) {
            problems.add("at least one scorer must be configured");
        }
        return problems;
    }

    public List<Budget> toBudgets() {
        return budgets.stream().map(BudgetSettings::toBudget).toList();
    }

    public record Runner(
            Integer concurrency,
            Integer maxRetries,
            Integer timeoutSeconds,
            Integer judgeTimeoutSeconds,
            Long initialBackoffMillis,
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_VALUES)
                    PassPolicy passPolicy) {
        public static final Runner DEFAULTS = new Runner(null, null, null, null, null, null);

        public Runner {
            concurrency = concurrency == null ? 5 : concurrency;
            maxRetries = maxRetries == null ? 3 : maxRetries;
            timeoutSeconds = timeoutSeconds == null ? 60 : timeoutSeconds;
            judgeTimeoutSeconds = judgeTimeoutSeconds == null ? 120 : judgeTimeoutSeconds;
            initialBackoffMillis = initialBackoffMillis == null ? 1000L : initialBackoffMillis;
            passPolicy = passPolicy == null ? PassPolicy.ALL : passPolicy;
        }

        List<String> problems() {
            var problems = new ArrayList<String>();
            if (concurrency < 1) {
                problems.add("runner.concurrency must be >= 1, got " + concurrency);
            }
            if (maxRetries < 0) {
                problems.add("runner.max_retries must be >= 0, got " + maxRetries);
            }
            if (timeoutSeconds < 1) {
                problems.add("runner.timeout_seconds must be >= 1, got " + timeoutSeconds);
            }
            if (judgeTimeoutSeconds < 1) {
                problems.add(
                        "runner.judge_timeout_seconds must be >= 1, got " + judgeTimeoutSeconds);
            }
            if (initialBackoffMillis < 0) {
                problems.add(
                        "runner.initial_backoff_millis must be >= 0, got "
                                + initialBackoffMillis);
            }
            return problems;
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(
                    maxRetries,
                    Duration.ofMillis(initialBackoffMillis),
                    RetryPolicy.DEFAULT.maxBackoff());
        }

        public Duration testTimeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }

        public Duration judgeTimeout() {
            return Duration.ofSeconds(judgeTimeoutSeconds);
        }
    }

    /** Regression thresholds. Points for accuracy and pass rate, percent for latency and cost. */
    public record Baseline(
            Double criticalPoints,
            Double majorPoints,
            Double latencyCriticalPercent,
            Double latencyMajorPercent,
            Double costCriticalPercent,
            Double costMajorPercent) {
        public static final Baseline DEFAULTS = new Baseline(null, null, null, null, null, null);

        public Baseline {
            var d = RegressionThresholds.DEFAULTS;
            criticalPoints = criticalPoints == null ? d.criticalPoints() : criticalPoints;
            majorPoints = majorPoints == null ? d.majorPoints() : majorPoints;
            latencyCriticalPercent =
                    latencyCriticalPercent == null
                            ? d.latencyCriticalPercent()
                            : latencyCriticalPercent;
            latencyMajorPercent =
                    latencyMajorPercent == null ? d.latencyMajorPercent() : latencyMajorPercent;
            costCriticalPercent =
                    costCriticalPercent == null ? d.costCriticalPercent() : costCriticalPercent;
            costMajorPercent = costMajorPercent == null ? d.costMajorPercent() : costMajorPercent;
        }

        public RegressionThresholds toThresholds() {
            return new RegressionThresholds(
                    criticalPoints,
                    majorPoints,
                    latencyCriticalPercent,
                    latencyMajorPercent,
                    costCriticalPercent,
                    costMajorPercent);
        }
    }

    public record BudgetSettings(
            BudgetPeriod period, Double limitUsd, Double alertThresholdPercent) {
        public BudgetSettings {
            alertThresholdPercent =
                    alertThresholdPercent == null
                            ? Budget.DEFAULT_ALERT_THRESHOLD_PERCENT
                            : alertThresholdPercent;
        }

        List<String> problems() {
            return Budget.problems(
                    period, limitUsd == null ? 0.0 : limitUsd, alertThresholdPercent);
        }

        public Budget toBudget() {
            return new Budget(period, limitUsd == null ? 0.0 : limitUsd, alertThresholdPercent);
        }
    }

    public record Alerts(
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_VALUES)
                    Severity minRegressionSeverity,
            Integer historySize) {
        public static final Alerts DEFAULTS = new Alerts(null, null);

        public Alerts {
            minRegressionSeverity =
                    minRegressionSeverity == null ? Severity.MINOR : minRegressionSeverity;
            historySize = historySize == null ? AlertDispatcher.DEFAULT_HISTORY_SIZE : historySize;
        }

        public AlertPolicy policy() {
            return AlertPolicy.of(minRegressionSeverity);
        }
    }
}
