package dev.evalkit.eval;

import dev.evalkit.dataset.Dataset;
import dev.evalkit.dataset.TestCase;
import dev.evalkit.provider.ModelConfig;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One execution of a dataset version against a model.
 *
 * <p>Holds at most one {@link TestCaseResult} per test case. Recording a result for a test case
 * that already has one replaces it.
 */
@ThreadSafe
@Getter
@Accessors(fluent = true)
public final class EvalRun {
    private final @Nonnull String id;
    private final @Nonnull String datasetId;
    private final @Nonnull String datasetVersion;
    private final @Nonnull ModelConfig modelConfig;
    private final @Nonnull PassPolicy passPolicy;
    private final @Nonnull List<String> scorerNames;
    private final @Nonnull List<String> testCaseOrder;

    @Getter(AccessLevel.NONE)
    private final Set<String> knownTestCaseIds;

    @Getter(AccessLevel.NONE)
    private final Map<String, TestCaseResult> results = new ConcurrentHashMap<>();

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    private volatile @Nonnull RunStatus status = RunStatus.PENDING;
    private volatile @Nullable Instant startedAt;
    private volatile @Nullable Instant completedAt;
    @Getter(AccessLevel.NONE)
    private volatile @Nullable String failureReason;
    private volatile boolean cancellationRequested;

    private EvalRun(
            String id,
            String datasetId,
            String datasetVersion,
            ModelConfig modelConfig,
            PassPolicy passPolicy,
            List<String> scorerNames,
            List<String> testCaseOrder,
            Clock clock) {
        this.id = id;
        this.datasetId = datasetId;
        this.datasetVersion = datasetVersion;
        this.modelConfig = modelConfig;
        this.passPolicy = passPolicy;
        this.scorerNames = List.copyOf(scorerNames);
        this.testCaseOrder = List.copyOf(testCaseOrder);
        this.knownTestCaseIds = Set.copyOf(testCaseOrder);
        this.clock = clock;
    }

    public static EvalRun create(
            Dataset dataset,
            ModelConfig modelConfig,
            PassPolicy passPolicy,
            List<String> scorerNames,
            Clock clock) {
        return new EvalRun(
                UUID.randomUUID().toString(),
                dataset.id(),
                dataset.version(),
                modelConfig,
                passPolicy,
                scorerNames,
                dataset.testCases().stream().map(TestCase::id).collect(Collectors.toList()),
                clock);
    }

    /** A run that failed before its dataset could be loaded. */
    public static EvalRun failedBeforeStart(
            String datasetId,
            @Nullable String datasetVersion,
            ModelConfig modelConfig,
            PassPolicy passPolicy,
            String reason,
            Clock clock) {
        var run =
                new EvalRun(
                        UUID.randomUUID().toString(),
                        datasetId,
                        datasetVersion == null ? "unknown" : datasetVersion,
                        modelConfig,
                        passPolicy,
                        List.of(),
                        List.of(),
                        clock);
        run.fail(reason);
        return run;
    }

    /** Rebuilds a run read back from storage, with its results and the state it was saved in. */
    public static EvalRun restore(
            String id,
            String datasetId,
            String datasetVersion,
            ModelConfig modelConfig,
            PassPolicy passPolicy,
            List<String> scorerNames,
            List<String> testCaseOrder,
            RunStatus status,
            @Nullable Instant startedAt,
            @Nullable Instant completedAt,
            @Nullable String failureReason,
            List<TestCaseResult> results,
            Clock clock) {
        var run =
                new EvalRun(
                        id,
                        datasetId,
                        datasetVersion,
                        modelConfig,
                        passPolicy,
                        scorerNames,
                        testCaseOrder,
                        clock);
        results.forEach(run::record);
        run.status = status;
        run.startedAt = startedAt;
        run.completedAt = completedAt;
        run.failureReason = failureReason;
        return run;
    }

    synchronized void start() {
        transition(RunStatus.RUNNING);
        startedAt = clock.instant();
    }

    synchronized void complete() {
        transition(cancellationRequested ? RunStatus.CANCELLED : RunStatus.COMPLETED);
        completedAt = clock.instant();
    }

    /** Marks the run FAILED. Has no effect on a run that already ended. */
    public synchronized void fail(String reason) {
        if (status.terminal()) {
            return;
        }
        failureReason = reason;
        transition(RunStatus.FAILED);
        completedAt = clock.instant();
    }

    /**
     * Requests cooperative cancellation. Test cases already dispatched finish; no new ones start.
     * A run that has not started yet is cancelled immediately.
     */
    public synchronized void cancel() {
        cancellationRequested = true;
        if (status == RunStatus.PENDING) {
            transition(RunStatus.CANCELLED);
            completedAt = clock.instant();
        }
    }

    void record(TestCaseResult result) {
        if (!knownTestCaseIds.contains(result.testCaseId())) {
            throw new IllegalArgumentException(
                    "test case %s is not part of dataset %s@%s"
                            .formatted(result.testCaseId(), datasetId, datasetVersion));
        }
        results.put(result.testCaseId(), result);
    }

    /** Results in dataset order. Test cases without a result yet are skipped. */
    public List<TestCaseResult> results() {
        var ordered = new ArrayList<TestCaseResult>(results.size());
        for (var testCaseId : testCaseOrder) {
            var result = results.get(testCaseId);
            if (result != null) {
                ordered.add(result);
            }
        }
        return ordered;
    }

    public Optional<TestCaseResult> result(String testCaseId) {
        return Optional.ofNullable(results.get(testCaseId));
    }

    public int completedCount() {
        return results.size();
    }

    public int totalCount() {
        return testCaseOrder.size();
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failureReason);
    }

    private void transition(RunStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "run %s cannot move from %s to %s".formatted(id, status, next));
        }
        status = next;
    }
}
