package dev.evalkit.eval;

import dev.evalkit.dataset.Dataset;
import dev.evalkit.dataset.TestCase;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.provider.ModelPricing;
import dev.evalkit.provider.ModelProvider;
import dev.evalkit.provider.ModelRequest;
import dev.evalkit.provider.ModelResponse;
import dev.evalkit.scorer.Scorer;
import dev.evalkit.scorer.ScorerResult;
import dev.evalkit.scorer.ScoringContext;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives every test case of a dataset through a model and the run's scorers.
 *
 * <p>At most {@code concurrency} test cases are in flight at once. Each model call and each scorer
 * call is bounded by the per-test timeout. Retryable model errors are retried with exponential
 * backoff; once retries are exhausted the test case is recorded as failed and the run continues.
 * Cancellation is checked before each dispatch.
 */
@Slf4j
public final class EvalRunner {
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final Duration DEFAULT_TEST_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_JUDGE_TIMEOUT = Duration.ofSeconds(120);

    /** Waits between retries. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final @Nonnull Tracer tracer;
    private final int concurrency;
    private final @Nonnull RetryPolicy retryPolicy;
    private final @Nonnull Duration testTimeout;
    private final @Nonnull Duration judgeTimeout;
    private final @Nonnull Clock clock;
    private final @Nonnull Sleeper sleeper;

    private EvalRunner(Builder builder) {
        this.tracer = Objects.requireNonNull(builder.tracer);
        this.concurrency = builder.concurrency;
        this.retryPolicy = builder.retryPolicy;
        this.testTimeout = builder.testTimeout;
        this.judgeTimeout = builder.judgeTimeout;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Creates a PENDING run for the dataset. */
    public EvalRun prepare(
            Dataset dataset, ModelConfig modelConfig, List<Scorer> scorers, PassPolicy policy) {
        return EvalRun.create(
                dataset,
                modelConfig,
                policy,
                scorers.stream().map(Scorer::getName).collect(Collectors.toList()),
                clock);
    }

    /** Prepares and executes a run, blocking until every dispatched test case has settled. */
    public EvalRun run(
            Dataset dataset,
            ModelConfig modelConfig,
            ModelProvider provider,
            List<Scorer> scorers,
            PassPolicy policy) {
        var run = prepare(dataset, modelConfig, scorers, policy);
        execute(run, dataset, provider, scorers);
        return run;
    }

    /**
     * Executes a prepared run. Returns once every dispatched test case has a result.
     *
     * @throws EvalException of kind CONFIGURATION if no scorers are given; the run is then FAILED
     *     and never reached RUNNING
     */
    public void execute(
            EvalRun run, Dataset dataset, ModelProvider provider, List<Scorer> scorers) {
        if (!run.datasetId().equals(dataset.id())
                || !run.datasetVersion().equals(dataset.version())) {
            throw new IllegalArgumentException(
                    "run %s was prepared for %s@%s, not %s@%s"
                            .formatted(
                                    run.id(),
                                    run.datasetId(),
                                    run.datasetVersion(),
                                    dataset.id(),
                                    dataset.version()));
        }
        if (scorers.isEmpty()) {
            var error = EvalException.configuration("a run needs at least one scorer");
            run.fail(error.getMessage());
            throw error;
        }
        if (run.status() == RunStatus.CANCELLED) {
            log.info("run {} was cancelled before it started", run.id());
            return;
        }
        run.start();
        var perTestTimeout =
                scorers.stream().anyMatch(Scorer::callsModel) ? judgeTimeout : testTimeout;
        log.info(
                "run {} started: dataset {}@{} ({} test cases), model {}, concurrency {}",
                run.id(),
                dataset.id(),
                dataset.version(),
                dataset.size(),
                run.modelConfig(),
                concurrency);

        var workers = Executors.newFixedThreadPool(concurrency, threadFactory("evalkit-worker"));
        var calls = Executors.newCachedThreadPool(threadFactory("evalkit-call"));
        var permits = new Semaphore(concurrency);
        boolean interrupted = false;
        try {
            for (var testCase : dataset.testCases()) {
                if (run.cancellationRequested()) {
                    break;
                }
                permits.acquire();
                if (run.cancellationRequested()) {
                    permits.release();
                    break;
                }
                workers.execute(
                        () -> {
                            try {
                                run.record(
                                        evaluate(
                                                run,
                                                testCase,
                                                provider,
                                                scorers,
                                                calls,
                                                perTestTimeout));
                            } finally {
                                permits.release();
                            }
                        });
            }
        } catch (InterruptedException e) {
            log.info("run {} interrupted while dispatching, cancelling", run.id());
            interrupted = true;
            run.cancel();
        } finally {
            workers.shutdown();
            interrupted |= awaitSettled(run, workers);
            calls.shutdownNow();
        }
        run.complete();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        log.info(
                "run {} {}: {}/{} test cases have results",
                run.id(),
                run.status().name().toLowerCase(Locale.ROOT),
                run.completedCount(),
                run.totalCount());
    }

    /** Runs one test case end to end. Never throws: failures become a failed result. */
    private TestCaseResult evaluate(
            EvalRun run,
            TestCase testCase,
            ModelProvider provider,
            List<Scorer> scorers,
            ExecutorService calls,
            Duration timeout) {
        var rootSpan =
                tracer.spanBuilder("eval")
                        .setNoParent() // each test case is its own trace
                        .setSpanKind(SpanKind.INTERNAL)
                        .setAttribute("evalkit.run_id", run.id())
                        .setAttribute("evalkit.dataset_id", run.datasetId())
                        .setAttribute("evalkit.test_case_id", testCase.id())
                        .setAttribute("evalkit.category", testCase.categoryOrDefault())
                        .startSpan();
        try (var rootScope = rootSpan.makeCurrent()) {
            var invocation = invokeModel(run, testCase, provider, calls, timeout);
            var context =
                    new ScoringContext(
                            testCase.input(), testCase.id(), testCase.categoryOrDefault());
            var scorerResults = new ArrayList<ScorerResult>(scorers.size());
            for (var scorer : scorers) {
                if (invocation.error() != null) {
                    scorerResults.add(
                            ScorerResult.error(
                                    scorer.getName(), "Model error", invocation.error()));
                } else {
                    scorerResults.add(
                            runScorer(
                                    scorer,
                                    invocation.response().text(),
                                    testCase,
                                    context,
                                    calls,
                                    timeout));
                }
            }
            boolean passed = invocation.error() == null && run.passPolicy().combine(scorerResults);
            rootSpan.setAttribute("evalkit.passed", passed);
            var response = invocation.response();
            long promptTokens = response == null ? 0 : response.promptTokens();
            long completionTokens = response == null ? 0 : response.completionTokens();
            var metadata =
                    new ResultMetadata(
                            run.modelConfig().model(),
                            invocation.latencyMs(),
                            ModelPricing.costUsd(
                                    run.modelConfig().model(), promptTokens, completionTokens),
                            clock.instant(),
                            Optional.ofNullable(invocation.error()).map(Throwable::getMessage),
                            promptTokens,
                            completionTokens,
                            invocation.attempts());
            return new TestCaseResult(
                    testCase.id(), testCase.categoryOrDefault(), scorerResults, passed, metadata);
        } catch (RuntimeException e) {
            rootSpan.setStatus(StatusCode.ERROR, e.getMessage());
            rootSpan.recordException(e);
            log.warn("unexpected failure evaluating test case {}", testCase.id(), e);
            var scorerResults =
                    scorers.stream()
                            .map(s -> ScorerResult.error(s.getName(), "Evaluation error", e))
                            .collect(Collectors.toList());
            var metadata =
                    new ResultMetadata(
                            run.modelConfig().model(),
                            0,
                            0.0,
                            clock.instant(),
                            Optional.of(String.valueOf(e.getMessage())),
                            0,
                            0,
                            0);
            return new TestCaseResult(
                    testCase.id(), testCase.categoryOrDefault(), scorerResults, false, metadata);
        } finally {
            rootSpan.end();
        }
    }

    private record Invocation(
            @Nullable ModelResponse response,
            @Nullable EvalException error,
            long latencyMs,
            int attempts) {}

    private Invocation invokeModel(
            EvalRun run,
            TestCase testCase,
            ModelProvider provider,
            ExecutorService calls,
            Duration timeout) {
        var modelConfig = run.modelConfig();
        var request = ModelRequest.of(modelConfig, promptFor(testCase.input()));
        var taskSpan = tracer.spanBuilder("task").startSpan();
        int attempts = 0;
        try (var unused = taskSpan.makeCurrent()) {
            while (true) {
                attempts++;
                long started = System.nanoTime();
                try {
                    var response =
                            callWithTimeout(
                                    calls,
                                    () -> provider.complete(request),
                                    timeout,
                                    () -> EvalException.timeout(modelConfig.model(), timeout),
                                    e -> modelFailure(modelConfig, e));
                    taskSpan.setAttribute("evalkit.attempts", attempts);
                    return new Invocation(response, null, elapsedMillis(started), attempts);
                } catch (EvalException e) {
                    long latency = elapsedMillis(started);
                    int retry = attempts - 1;
                    if (!e.retryable() || retry >= retryPolicy.maxRetries()) {
                        if (e.retryable()) {
                            log.warn(
                                    "test case {} failed after {} attempts: {}",
                                    testCase.id(),
                                    attempts,
                                    e.getMessage());
                        } else {
                            log.debug("test case {} failed: {}", testCase.id(), e.getMessage());
                        }
                        recordError(taskSpan, e, attempts);
                        return new Invocation(null, e, latency, attempts);
                    }
                    var delay = retryPolicy.backoff(retry, e.retryAfter());
                    log.debug(
                            "test case {} attempt {} failed ({}), retrying in {} ms",
                            testCase.id(),
                            attempts,
                            e.kind(),
                            delay.toMillis());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        recordError(taskSpan, e, attempts);
                        return new Invocation(null, e, latency, attempts);
                    }
                }
            }
        } finally {
            taskSpan.end();
        }
    }

    private ScorerResult runScorer(
            Scorer scorer,
            String output,
            TestCase testCase,
            ScoringContext context,
            ExecutorService calls,
            Duration timeout) {
        var scoreSpan =
                tracer.spanBuilder("score")
                        .setAttribute("evalkit.scorer", scorer.getName())
                        .startSpan();
        try (var unused = scoreSpan.makeCurrent()) {
            var result =
                    callWithTimeout(
                            calls,
                            () -> scorer.score(output, testCase.expected(), context),
                            timeout,
                            () ->
                                    EvalException.scoring(
                                            scorer.getName(),
                                            "scorer timed out after %d ms"
                                                    .formatted(timeout.toMillis())),
                            e ->
                                    EvalException.of(
                                            ErrorKind.SCORING,
                                            String.valueOf(e.getMessage()),
                                            Map.of("scorer", scorer.getName()),
                                            e));
            scoreSpan.setAttribute("evalkit.score", result.score());
            scoreSpan.setAttribute("evalkit.passed", result.passed());
            return result;
        } catch (EvalException e) {
            scoreSpan.setStatus(StatusCode.ERROR, e.getMessage());
            scoreSpan.recordException(e);
            log.debug("scorer '{}' failed on test case {}", scorer.getName(), testCase.id(), e);
            return ScorerResult.error(scorer.getName(), "Scorer error", e);
        } finally {
            scoreSpan.end();
        }
    }

    /**
     * Runs {@code call} on the call pool and waits at most {@code timeout}. Failures come back as
     * {@link EvalException}; other exceptions are converted with {@code wrap}.
     */
    private static <T> T callWithTimeout(
            ExecutorService calls,
            Callable<T> call,
            Duration timeout,
            Supplier<EvalException> onTimeout,
            Function<Throwable, EvalException> wrap) {
        var future = calls.submit(Context.current().wrap(call));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw onTimeout.get();
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof EvalException evalException) {
                throw evalException;
            }
            throw wrap.apply(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw wrap.apply(e);
        }
    }

    private static EvalException modelFailure(ModelConfig modelConfig, Throwable e) {
        return EvalException.of(
                ErrorKind.MODEL_UNAVAILABLE,
                "model call failed: " + e.getMessage(),
                Map.of("model", modelConfig.model()),
                e);
    }

    private static void recordError(Span span, EvalException e, int attempts) {
        span.setAttribute("evalkit.attempts", attempts);
        span.setAttribute("evalkit.error_kind", e.kind().name());
        span.setStatus(StatusCode.ERROR, e.getMessage());
        span.recordException(e);
    }

    /** Strings are sent as-is, a map's {@code prompt} entry alone, anything else as JSON. */
    static String promptFor(@Nullable Object input) {
        if (input == null) {
            return "";
        } else if (input instanceof String text) {
            return text;
        } else if (input instanceof Map<?, ?> map && map.get("prompt") instanceof String prompt) {
            return prompt;
        }
        return EvalJsonMapper.toJson(input);
    }

    private static boolean awaitSettled(EvalRun run, ExecutorService workers) {
        boolean interrupted = false;
        while (true) {
            try {
                if (workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    return interrupted;
                }
                log.debug(
                        "run {} waiting for in-flight test cases ({}/{} done)",
                        run.id(),
                        run.completedCount(),
                        run.totalCount());
            } catch (InterruptedException e) {
                // in-flight test cases finish within their own timeouts
                interrupted = true;
                run.cancel();
            }
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static ThreadFactory threadFactory(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static final class Builder {
        private @Nullable Tracer tracer;
        private int concurrency = DEFAULT_CONCURRENCY;
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private Duration testTimeout = DEFAULT_TEST_TIMEOUT;
        private Duration judgeTimeout = DEFAULT_JUDGE_TIMEOUT;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be at least 1");
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy);
            return this;
        }

        public Builder testTimeout(Duration testTimeout) {
            this.testTimeout = Objects.requireNonNull(testTimeout);
            return this;
        }

        public Builder judgeTimeout(Duration judgeTimeout) {
            this.judgeTimeout = Objects.requireNonNull(judgeTimeout);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        public EvalRunner build() {
            if (tracer == null) {
                tracer = GlobalOpenTelemetry.getTracer("evalkit");
            }
            return new EvalRunner(this);
        }
    }
}
