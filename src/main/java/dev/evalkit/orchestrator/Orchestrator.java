package dev.evalkit.orchestrator;

import dev.evalkit.alert.AlertDispatcher;
import dev.evalkit.alert.AlertRecord;
import dev.evalkit.baseline.Baseline;
import dev.evalkit.baseline.BaselineComparator;
import dev.evalkit.baseline.BaselineStore;
import dev.evalkit.baseline.Comparison;
import dev.evalkit.cost.CostTracker;
import dev.evalkit.dataset.Dataset;
import dev.evalkit.dataset.DatasetStore;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.EvalRun;
import dev.evalkit.eval.EvalRunner;
import dev.evalkit.eval.RunStatus;
import dev.evalkit.eval.TestCaseResult;
import dev.evalkit.metrics.EvalReport;
import dev.evalkit.metrics.MetricsAggregator;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.provider.ModelProvider;
import dev.evalkit.scorer.Scorer;
import dev.evalkit.scorer.ScorerRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a dataset end to end: load, execute, aggregate, compare with the baseline, account for
 * cost, alert, store.
 */
@Slf4j
public final class Orchestrator {
    private final DatasetStore datasets;
    private final RunRepository runs;
    private final BaselineStore baselines;
    private final BaselineComparator comparator;
    private final MetricsAggregator aggregator;
    private final CostTracker costTracker;
    private final AlertDispatcher alerts;
    private final ScorerRegistry scorers;
    private final Function<ModelConfig, ModelProvider> providers;
    private final EvalRunner runner;
    private final Clock clock;

    private Orchestrator(Builder builder) {
        this.datasets = Objects.requireNonNull(builder.datasets, "datasets");
        this.runs = Objects.requireNonNull(builder.runs, "runs");
        this.baselines = Objects.requireNonNull(builder.baselines, "baselines");
        this.comparator = Objects.requireNonNull(builder.comparator, "comparator");
        this.aggregator = new MetricsAggregator();
        this.costTracker = Objects.requireNonNull(builder.costTracker, "costTracker");
        this.alerts = Objects.requireNonNull(builder.alerts, "alerts");
        this.scorers = Objects.requireNonNull(builder.scorers, "scorers");
        this.providers = Objects.requireNonNull(builder.providers, "providers");
        this.runner = Objects.requireNonNull(builder.runner, "runner");
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluates one model on one dataset.
     *
     * <p>When the dataset, scorers or provider cannot be set up, a FAILED run is stored, a run
     * failure alert is sent and the error is rethrown.
     */
    public OrchestratorResult run(RunRequest request) {
        Dataset dataset;
        List<Scorer> resolved;
        ModelProvider provider;
        try {
            dataset = datasets.load(request.datasetId(), request.datasetVersion());
            resolved = scorers.createAll(request.scorers());
            provider = providers.apply(request.model());
        } catch (EvalException e) {
            var failed =
                    EvalRun.failedBeforeStart(
                            request.datasetId(),
                            request.datasetVersion(),
                            request.model(),
                            request.passPolicy(),
                            e.getMessage(),
                            clock);
            runs.save(failed, null);
            log.warn(
                    "run {} for dataset {} failed: {}",
                    failed.id(),
                    failed.datasetId(),
                    e.describe());
            alerts.runFailure(request.datasetId(), failed.id(), e.describe());
            throw e;
        }

        var run = runner.prepare(dataset, request.model(), resolved, request.passPolicy());
        runs.save(run, null);
        try {
            runner.execute(run, dataset, provider, resolved);
        } catch (RuntimeException e) {
            run.fail(String.valueOf(e.getMessage()));
            runs.save(run, null);
            var reason =
                    e instanceof EvalException evalException
                            ? evalException.describe()
                            : e.toString();
            alerts.runFailure(dataset.id(), run.id(), reason);
            throw e;
        }

        var results = run.results();
        var firstPass = aggregator.aggregate(run.id(), results);
        var comparison =
                run.status() == RunStatus.COMPLETED
                        ? comparator.compare(firstPass, baselines.active(dataset.id()))
                        : Comparison.skipped();
        var report = aggregator.aggregate(run.id(), results, comparison.regressions());

        var budgetEvents = costTracker.recordAll(run.id(), dataset.id(), results);
        var sent = new ArrayList<AlertRecord>();
        sent.addAll(alerts.regressions(comparison.regressions(), dataset.id(), run.id()));
        sent.addAll(alerts.budgetEvents(budgetEvents));

        runs.save(run, report);
        log.info(
                "run {} {}: {}/{} passed, accuracy {}",
                run.id(),
                run.status().name().toLowerCase(Locale.ROOT),
                report.summary().passed(),
                report.summary().totalTests(),
                "%.3f".formatted(report.summary().accuracy()));
        if (comparison.needsBaseline()) {
            log.info(
                    "dataset {} has no active baseline; promote run {} to set one",
                    dataset.id(),
                    run.id());
        }
        return new OrchestratorResult(run, report, comparison, budgetEvents, sent);
    }

    /** Requests cancellation of a stored run. */
    public EvalRun cancel(String runId) {
        var run = findRun(runId);
        run.cancel();
        log.info("cancellation requested for run {}", runId);
        return run;
    }

    public Baseline promoteBaseline(String runId, @Nullable String name) {
        return baselines.promote(findRun(runId), report(runId), name);
    }

    public EvalReport report(String runId) {
        return runs.report(runId)
                .orElseThrow(
                        () ->
                                EvalException.of(
                                        ErrorKind.NOT_FOUND,
                                        "no report for run " + runId,
                                        Map.of("run_id", runId)));
    }

    public Optional<EvalRun> latestRun(String datasetId) {
        return runs.latest(datasetId);
    }

    public Optional<Baseline> activeBaseline(String datasetId) {
        return baselines.active(datasetId);
    }

    /** Runs every model in {@code models} against the same dataset and ranks them. */
    public ModelComparison compareModels(RunRequest request, List<ModelConfig> models) {
        if (models.isEmpty()) {
            throw EvalException.configuration("compare needs at least one model");
        }
        var outcomes = new ArrayList<OrchestratorResult>();
        for (var model : models) {
            outcomes.add(run(request.withModel(model)));
        }

        var ranking =
                outcomes.stream()
                        .map(
                                o ->
                                        new ModelComparison.Entry(
                                                o.run().modelConfig(),
                                                o.run().id(),
                                                o.report().summary().accuracy(),
                                                o.report().summary().avgScore(),
                                                o.report().summary().avgLatencyMs(),
                                                o.report().summary().totalCostUsd()))
                        .sorted(
                                Comparator.comparingDouble(ModelComparison.Entry::accuracy)
                                        .thenComparingDouble(ModelComparison.Entry::avgScore)
                                        .reversed())
                        .toList();

        var winners = new LinkedHashMap<String, String>();
        var wins = new LinkedHashMap<String, Integer>();
        for (var model : models) {
            wins.put(model.toString(), 0);
        }
        for (var testCaseId : outcomes.get(0).run().testCaseOrder()) {
            String winner = null;
            double best = Double.NEGATIVE_INFINITY;
            for (var outcome : outcomes) {
                var score =
                        outcome.run()
                                .result(testCaseId)
                                .map(TestCaseResult::aggregateScore)
                                .orElse(Double.NEGATIVE_INFINITY);
                if (score > best) {
                    best = score;
                    winner = outcome.run().modelConfig().toString();
                }
            }
            if (winner != null) {
                winners.put(testCaseId, winner);
                wins.merge(winner, 1, Integer::sum);
            }
        }
        return new ModelComparison(request.datasetId(), ranking, winners, wins);
    }

    private EvalRun findRun(String runId) {
        return runs.find(runId)
                .orElseThrow(
                        () ->
                                EvalException.of(
                                        ErrorKind.NOT_FOUND,
                                        "run not found: " + runId,
                                        Map.of("run_id", runId)));
    }

    public static final class Builder {
        private DatasetStore datasets;
        private RunRepository runs = RunRepository.inMemory();
        private BaselineStore baselines;
        private BaselineComparator comparator = BaselineComparator.withDefaults();
        private CostTracker costTracker;
        private AlertDispatcher alerts = AlertDispatcher.builder().build();
        private ScorerRegistry scorers = ScorerRegistry.withDefaults(null, null);
        private Function<ModelConfig, ModelProvider> providers;
        private EvalRunner runner;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder datasets(DatasetStore datasets) {
            this.datasets = datasets;
            return this;
        }

        public Builder runs(RunRepository runs) {
            this.runs = runs;
            return this;
        }

        public Builder baselines(BaselineStore baselines) {
            this.baselines = baselines;
            return this;
        }

        public Builder comparator(BaselineComparator comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder costTracker(CostTracker costTracker) {
            this.costTracker = costTracker;
            return this;
        }

        public Builder alerts(AlertDispatcher alerts) {
            this.alerts = alerts;
            return this;
        }

        public Builder scorers(ScorerRegistry scorers) {
            this.scorers = scorers;
            return this;
        }

        public Builder providers(Function<ModelConfig, ModelProvider> providers) {
            this.providers = providers;
            return this;
        }

        public Builder runner(EvalRunner runner) {
            this.runner = runner;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Orchestrator build() {
            if (baselines == null) {
                baselines = BaselineStore.inMemory(clock);
            }
            if (costTracker == null) {
                costTracker = CostTracker.withoutBudgets(clock);
            }
            if (runner == null) {
                runner = EvalRunner.builder().clock(clock).build();
            }
            return new Orchestrator(this);
        }
    }
}
