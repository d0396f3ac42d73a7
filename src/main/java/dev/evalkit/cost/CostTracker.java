package dev.evalkit.cost;

import dev.evalkit.eval.TestCaseResult;
import dev.evalkit.json.EvalJsonMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates spend and enforces budgets.
 *
 * <p>Each budget keeps a running total for its current window. When a recorded entry falls in a
 * later window the total starts again from zero. The threshold event and the exceeded event each
 * fire at most once per window.
 *
 * <p>Instances are owned by whoever constructs them. There is no shared process-wide tracker.
 */
@Slf4j
@ThreadSafe
public final class CostTracker {
    private final Clock clock;
    private final Map<BudgetPeriod, Window> windows = new EnumMap<>(BudgetPeriod.class);
    private final List<CostEntry> entries = new ArrayList<>();
    private final List<Consumer<BudgetEvent>> listeners = new CopyOnWriteArrayList<>();

    public CostTracker(Clock clock, List<Budget> budgets) {
        this.clock = clock;
        for (var budget : budgets) {
            if (windows.putIfAbsent(budget.period(), new Window(budget)) != null) {
                throw new IllegalArgumentException(
                        "more than one %s budget".formatted(budget.period().label()));
            }
        }
    }

    public static CostTracker withoutBudgets(Clock clock) {
        return new CostTracker(clock, List.of());
    }

    public void addListener(Consumer<BudgetEvent> listener) {
        listeners.add(listener);
    }

    public List<Budget> budgets() {
        synchronized (this) {
            return windows.values().stream().map(w -> w.budget).toList();
        }
    }

    /** Records one entry and returns the budget events it caused, in budget period order. */
    public List<BudgetEvent> record(CostEntry entry) {
        List<BudgetEvent> events;
        synchronized (this) {
            events = accumulate(entry);
        }
        notifyListeners(events);
        return events;
    }

    /** Records the cost of every result of a run. */
    public List<BudgetEvent> recordAll(
            String runId, String datasetId, List<TestCaseResult> results) {
        var events = new ArrayList<BudgetEvent>();
        synchronized (this) {
            for (var result : results) {
                var meta = result.metadata();
                events.addAll(
                        accumulate(
                                new CostEntry(
                                        runId,
                                        result.testCaseId(),
                                        meta.modelId(),
                                        datasetId,
                                        meta.costUsd(),
                                        meta.promptTokens(),
                                        meta.completionTokens(),
                                        meta.timestampUtc())));
            }
        }
        notifyListeners(events);
        return events;
    }

    private List<BudgetEvent> accumulate(CostEntry entry) {
        entries.add(entry);
        var events = new ArrayList<BudgetEvent>();
        for (var window : windows.values()) {
            window.add(entry).forEach(events::add);
        }
        return events;
    }

    private void notifyListeners(List<BudgetEvent> events) {
        for (var event : events) {
            for (var listener : listeners) {
                try {
                    listener.accept(event);
                } catch (RuntimeException e) {
                    log.warn("budget listener failed for {} event", event.type(), e);
                }
            }
        }
    }

    /** Spend against the budget for {@code period} in the window containing now. */
    public Optional<BudgetStatus> budgetStatus(BudgetPeriod period) {
        synchronized (this) {
            var window = windows.get(period);
            if (window == null) {
                return Optional.empty();
            }
            var start = period.windowStart(clock.instant());
            var end = period.nextWindowStart(start);
            double used =
                    entries.stream()
                            .filter(e -> !e.timestamp().isBefore(start))
                            .filter(e -> e.timestamp().isBefore(end))
                            .mapToDouble(CostEntry::costUsd)
                            .sum();
            double limit = window.budget.limitUsd();
            return Optional.of(
                    new BudgetStatus(
                            period,
                            start,
                            limit,
                            used,
                            Math.max(0.0, limit - used),
                            used / limit * 100,
                            used >= limit));
        }
    }

    public double totalSpend() {
        synchronized (this) {
            return entries.stream().mapToDouble(CostEntry::costUsd).sum();
        }
    }

    public List<CostEntry> entries() {
        synchronized (this) {
            return List.copyOf(entries);
        }
    }

    /** Spend grouped by {@code dimension}, highest spend first. */
    public List<CostBreakdown> breakdown(CostDimension dimension) {
        return group(keyFor(dimension));
    }

    /** The {@code n} highest-spend model and dataset pairs. */
    public List<CostBreakdown> topCostDrivers(int n) {
        var all = group(e -> e.modelId() + ":" + e.datasetId());
        return all.subList(0, Math.min(n, all.size()));
    }

    /** Spend per time bucket, oldest first. */
    public List<CostBreakdown> trend(ChronoUnit granularity) {
        var buckets = new TreeMap<Instant, Acc>();
        synchronized (this) {
            for (var e : entries) {
                buckets.computeIfAbsent(bucket(e.timestamp(), granularity), k -> new Acc())
                        .add(e);
            }
        }
        double total = buckets.values().stream().mapToDouble(a -> a.cost).sum();
        var trend = new ArrayList<CostBreakdown>();
        buckets.forEach((start, acc) -> trend.add(acc.toBreakdown(start.toString(), total)));
        return trend;
    }

    public String exportCsv() {
        var out =
                new StringBuilder(
                        "timestamp,run_id,test_case_id,model_id,dataset_id,cost_usd,"
                                + "prompt_tokens,completion_tokens\n");
        for (var e : entries()) {
            out.append(e.timestamp())
                    .append(',')
                    .append(csv(e.runId()))
                    .append(',')
                    .append(csv(e.testCaseId()))
                    .append(',')
                    .append(csv(e.modelId()))
                    .append(',')
                    .append(csv(e.datasetId()))
                    .append(',')
                    .append(String.format(Locale.ROOT, "%.6f", e.costUsd()))
                    .append(',')
                    .append(e.promptTokens())
                    .append(',')
                    .append(e.completionTokens())
                    .append('\n');
        }
        return out.toString();
    }

    public String exportJson() {
        var export = new LinkedHashMap<String, Object>();
        export.put("total_cost_usd", totalSpend());
        export.put("by_model", breakdown(CostDimension.MODEL));
        export.put("by_dataset", breakdown(CostDimension.DATASET));
        export.put("entries", entries());
        return EvalJsonMapper.toPrettyJson(export);
    }

    private List<CostBreakdown> group(Function<CostEntry, String> key) {
        var groups = new TreeMap<String, Acc>();
        synchronized (this) {
            for (var e : entries) {
                groups.computeIfAbsent(key.apply(e), k -> new Acc()).add(e);
            }
        }
        double total = groups.values().stream().mapToDouble(a -> a.cost).sum();
        var result = new ArrayList<CostBreakdown>();
        groups.forEach((k, acc) -> result.add(acc.toBreakdown(k, total)));
        result.sort(Comparator.comparingDouble(CostBreakdown::costUsd).reversed());
        return result;
    }

    private static Function<CostEntry, String> keyFor(CostDimension dimension) {
        return switch (dimension) {
            case MODEL -> CostEntry::modelId;
            case DATASET -> CostEntry::datasetId;
            case RUN -> CostEntry::runId;
            case TIME -> e -> bucket(e.timestamp(), ChronoUnit.DAYS).toString();
        };
    }

    private static Instant bucket(Instant at, ChronoUnit granularity) {
        return at.atOffset(ZoneOffset.UTC).truncatedTo(granularity).toInstant();
    }

    private static String csv(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static final class Acc {
        double cost;
        long tokens;
        final HashSet<String> runs = new HashSet<>();

        void add(CostEntry e) {
            cost += e.costUsd();
            tokens += e.totalTokens();
            runs.add(e.runId());
        }

        CostBreakdown toBreakdown(String key, double total) {
            return new CostBreakdown(
                    key, cost, tokens, runs.size(), total == 0 ? 0.0 : cost / total * 100);
        }
    }

    /** Running total for one budget. Guarded by the tracker's monitor. */
    private static final class Window {
        final Budget budget;
        Instant start;
        double spend;
        boolean thresholdFired;
        boolean exceededFired;

        Window(Budget budget) {
            this.budget = budget;
        }

        List<BudgetEvent> add(CostEntry entry) {
            var period = budget.period();
            var entryWindow = period.windowStart(entry.timestamp());
            if (start == null || entryWindow.isAfter(start)) {
                if (start != null) {
                    log.debug("{} budget window reset at {}", period.label(), entryWindow);
                }
                start = entryWindow;
                spend = 0;
                thresholdFired = false;
                exceededFired = false;
            } else if (entryWindow.isBefore(start)) {
                return List.of();
            }
            spend += entry.costUsd();

            var events = new ArrayList<BudgetEvent>(2);
            double percent = spend / budget.limitUsd() * 100;
            if (!thresholdFired && percent >= budget.alertThresholdPercent()) {
                thresholdFired = true;
                log.warn(
                        "{} budget at {}% of ${} limit",
                        period.label(),
                        String.format(Locale.ROOT, "%.1f", percent),
                        budget.limitUsd());
                events.add(event(BudgetEvent.Type.THRESHOLD_CROSSED, percent, entry));
            }
            if (!exceededFired && spend >= budget.limitUsd()) {
                exceededFired = true;
                log.warn("{} budget of ${} exceeded", period.label(), budget.limitUsd());
                events.add(event(BudgetEvent.Type.EXCEEDED, percent, entry));
            }
            return events;
        }

        private BudgetEvent event(BudgetEvent.Type type, double percent, CostEntry entry) {
            return new BudgetEvent(
                    type,
                    budget.period(),
                    spend,
                    budget.limitUsd(),
                    percent,
                    start,
                    entry.runId(),
                    entry.datasetId());
        }
    }
}
