package dev.evalkit.eval;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.TestClock;
import dev.evalkit.TestHarness;
import dev.evalkit.dataset.Dataset;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.provider.ModelProvider;
import dev.evalkit.provider.ModelResponse;
import dev.evalkit.scorer.ExactMatchScorer;
import dev.evalkit.scorer.Scorer;
import dev.evalkit.scorer.ScorerResult;
import dev.evalkit.scorer.ScoringContext;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EvalRunnerTest {
    private static final ModelConfig MODEL = ModelConfig.of("gpt-4o-mini");

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private TestClock clock;
    private List<Duration> sleeps;

    @BeforeEach
    void beforeEach() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                        .build();
        clock = TestClock.at(TestHarness.START);
        sleeps = new CopyOnWriteArrayList<>();
    }

    private EvalRunner.Builder runner() {
        return EvalRunner.builder()
                .tracer(tracerProvider.get("evalkit-test"))
                .clock(clock)
                .retryPolicy(new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1)))
                .sleeper(sleeps::add);
    }

    private static List<Scorer> exactMatch() {
        return List.of(ExactMatchScorer.of());
    }

    @Test
    void boundedConcurrencyAndOneResultPerTestCase() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 30, 20);
        var inFlight = new AtomicInteger();
        var maxInFlight = new AtomicInteger();
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            int now = inFlight.incrementAndGet();
                            maxInFlight.accumulateAndGet(now, Math::max);
                            try {
                                Thread.sleep(10);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            } finally {
                                inFlight.decrementAndGet();
                            }
                            return new ModelResponse("yes", 100, 50);
                        });

        var run =
                runner().concurrency(5)
                        .build()
                        .run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertTrue(maxInFlight.get() <= 5, "max in flight was " + maxInFlight.get());
        assertEquals(50, run.results().size());
        assertEquals(
                run.testCaseOrder(),
                run.results().stream()
                        .map(TestCaseResult::testCaseId)
                        .collect(Collectors.toList()));
        assertEquals(30, run.results().stream().filter(TestCaseResult::passed).count());
        assertEquals(clock.instant(), run.startedAt());
        assertEquals(clock.instant(), run.completedAt());
    }

    @Test
    void recordsCostTokensAndAttempts() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var run =
                runner().build()
                        .run(
                                dataset,
                                MODEL,
                                TestHarness.answering("yes"),
                                exactMatch(),
                                PassPolicy.ALL);

        var metadata = run.results().get(0).metadata();
        assertEquals("gpt-4o-mini", metadata.modelId());
        assertEquals(100, metadata.promptTokens());
        assertEquals(50, metadata.completionTokens());
        assertEquals(0.000045, metadata.costUsd(), 1e-12);
        assertEquals(1, metadata.attempts());
        assertEquals(clock.instant(), metadata.timestampUtc());
        assertTrue(metadata.error().isEmpty());
    }

    @Test
    void retriesRetryableErrorsWithBackoff() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var calls = new AtomicInteger();
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            if (calls.incrementAndGet() < 3) {
                                throw EvalException.of(ErrorKind.MODEL_UNAVAILABLE, "busy");
                            }
                            return ModelResponse.of("yes");
                        });

        var run = runner().build().run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        var result = run.results().get(0);
        assertTrue(result.passed());
        assertEquals(3, result.metadata().attempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void retryAfterHintIsHonored() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var calls = new AtomicInteger();
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            if (calls.incrementAndGet() == 1) {
                                throw EvalException.rateLimited(
                                        "gpt-4o-mini", Duration.ofSeconds(2), null);
                            }
                            return ModelResponse.of("yes");
                        });

        runner().build().run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void exhaustedRetriesFailTheTestCaseButNotTheRun() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 2, 0);
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            if (request.prompt().equals("question 0")) {
                                throw EvalException.of(ErrorKind.MODEL_UNAVAILABLE, "down");
                            }
                            return ModelResponse.of("yes");
                        });

        var run = runner().build().run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        assertEquals(RunStatus.COMPLETED, run.status());
        var failed = run.result("tc-000").orElseThrow();
        assertFalse(failed.passed());
        assertTrue(failed.errored());
        assertEquals(4, failed.metadata().attempts());
        assertEquals("down", failed.metadata().error().orElseThrow());
        assertEquals("Model error: down", failed.scorerResults().get(0).reason());
        assertEquals(0.0, failed.scorerResults().get(0).score());
        assertTrue(run.result("tc-001").orElseThrow().passed());
    }

    @Test
    void nonRetryableErrorsAreNotRetried() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var calls = new AtomicInteger();
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            calls.incrementAndGet();
                            throw EvalException.of(ErrorKind.MODEL_AUTHENTICATION, "bad key");
                        });

        var run = runner().build().run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, run.results().get(0).metadata().attempts());
    }

    @Test
    void slowModelCallsTimeOut() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            try {
                                Thread.sleep(5_000);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            return ModelResponse.of("yes");
                        });

        var run =
                runner().retryPolicy(RetryPolicy.none())
                        .testTimeout(Duration.ofMillis(50))
                        .build()
                        .run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        var result = run.results().get(0);
        assertFalse(result.passed());
        assertTrue(result.metadata().error().orElseThrow().contains("did not respond"));
    }

    @Test
    void unexpectedProviderExceptionsBecomeModelErrors() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            throw new IllegalStateException("socket closed");
                        });

        var run =
                runner().retryPolicy(RetryPolicy.none())
                        .build()
                        .run(dataset, MODEL, provider, exactMatch(), PassPolicy.ALL);

        var result = run.results().get(0);
        assertTrue(result.errored());
        assertEquals(
                "model call failed: socket closed", result.metadata().error().orElseThrow());
    }

    @Test
    void scorerFailuresAreRecordedOnTheResult() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        Scorer broken =
                new Scorer() {
                    @Override
                    public String getName() {
                        return "broken";
                    }

                    @Override
                    public ScorerResult score(
                            Object actual, Object expected, ScoringContext context) {
                        throw EvalException.scoring("broken", "cannot parse output");
                    }
                };

        var run =
                runner().build()
                        .run(
                                dataset,
                                MODEL,
                                TestHarness.answering("yes"),
                                List.of(ExactMatchScorer.of(), broken),
                                PassPolicy.ALL);

        var result = run.results().get(0);
        assertFalse(result.passed());
        assertFalse(result.errored());
        var brokenResult = result.scorerResults().get(1);
        assertEquals("Scorer error: cannot parse output", brokenResult.reason());
        assertEquals("cannot parse output", brokenResult.metadata().get("error"));
    }

    @Test
    void passPolicyCombinesScorerVerdicts() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var scorers =
                List.of(
                        Scorer.of("always", 0.5, (actual, expected) -> 1.0),
                        Scorer.of("never", 0.5, (actual, expected) -> 0.0));

        var all =
                runner().build()
                        .run(
                                dataset,
                                MODEL,
                                TestHarness.answering("yes"),
                                scorers,
                                PassPolicy.ALL);
        var any =
                runner().build()
                        .run(
                                dataset,
                                MODEL,
                                TestHarness.answering("yes"),
                                scorers,
                                PassPolicy.ANY);

        assertFalse(all.results().get(0).passed());
        assertTrue(any.results().get(0).passed());
        assertEquals(0.5, any.results().get(0).aggregateScore());
    }

    @Test
    void cancellationStopsDispatching() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 10, 0);
        var runner = runner().concurrency(1).build();
        var runRef = new AtomicReference<EvalRun>();
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            runRef.get().cancel();
                            return ModelResponse.of("yes");
                        });
        var run = runner.prepare(dataset, MODEL, exactMatch(), PassPolicy.ALL);
        runRef.set(run);

        runner.execute(run, dataset, provider, exactMatch());

        assertEquals(RunStatus.CANCELLED, run.status());
        assertEquals(1, run.results().size());
        assertEquals(10, run.totalCount());
    }

    @Test
    void cancelledBeforeStartNeverRuns() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 3, 0);
        var runner = runner().build();
        var calls = new AtomicInteger();
        var run = runner.prepare(dataset, MODEL, exactMatch(), PassPolicy.ALL);
        run.cancel();

        runner.execute(
                run,
                dataset,
                ModelProvider.of(
                        request -> {
                            calls.incrementAndGet();
                            return ModelResponse.of("yes");
                        }),
                exactMatch());

        assertEquals(RunStatus.CANCELLED, run.status());
        assertEquals(0, calls.get());
        assertNull(run.startedAt());
    }

    @Test
    void runWithoutScorersFails() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var runner = runner().build();
        var run = runner.prepare(dataset, MODEL, List.of(), PassPolicy.ALL);

        var error =
                assertThrows(
                        EvalException.class,
                        () ->
                                runner.execute(
                                        run, dataset, TestHarness.answering("yes"), List.of()));

        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals("a run needs at least one scorer", run.failure().orElseThrow());
    }

    @Test
    void runRejectsAMismatchedDataset() {
        var runner = runner().build();
        var run =
                runner.prepare(
                        TestHarness.yesNoDataset("qa", "1.0.0", 1, 0),
                        MODEL,
                        exactMatch(),
                        PassPolicy.ALL);
        var other = TestHarness.yesNoDataset("qa", "2.0.0", 1, 0);
        assertThrows(
                IllegalArgumentException.class,
                () -> runner.execute(run, other, TestHarness.answering("yes"), exactMatch()));
    }

    @Test
    void emitsOneTracePerTestCase() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 1);
        var run =
                runner().build()
                        .run(
                                dataset,
                                MODEL,
                                TestHarness.answering("yes"),
                                exactMatch(),
                                PassPolicy.ALL);
        tracerProvider.forceFlush();
        var spans = spanExporter.getFinishedSpanItems();

        var roots =
                spans.stream().filter(s -> s.getName().equals("eval")).collect(Collectors.toList());
        assertEquals(2, roots.size());
        assertNotEquals(roots.get(0).getTraceId(), roots.get(1).getTraceId());
        for (SpanData root : roots) {
            assertEquals(
                    run.id(), root.getAttributes().get(AttributeKey.stringKey("evalkit.run_id")));
            var children =
                    spans.stream()
                            .filter(s -> s.getParentSpanId().equals(root.getSpanId()))
                            .map(SpanData::getName)
                            .collect(Collectors.toList());
            assertEquals(List.of("task", "score"), children);
        }
        var testCaseId = AttributeKey.stringKey("evalkit.test_case_id");
        var failing =
                roots.stream()
                        .filter(s -> "tc-001".equals(s.getAttributes().get(testCaseId)))
                        .findFirst()
                        .orElseThrow();
        assertEquals(
                false, failing.getAttributes().get(AttributeKey.booleanKey("evalkit.passed")));
    }

    @Test
    void providerSpansNestUnderTheTaskSpan() {
        var tracer = tracerProvider.get("provider-test");
        ModelProvider provider =
                ModelProvider.of(
                        request -> {
                            var span = tracer.spanBuilder("completion").startSpan();
                            span.end();
                            return new ModelResponse("yes", 10, 5);
                        });
        runner().build()
                .run(
                        TestHarness.yesNoDataset("qa", "1.0.0", 1, 0),
                        MODEL,
                        provider,
                        exactMatch(),
                        PassPolicy.ALL);
        tracerProvider.forceFlush();
        var spans = spanExporter.getFinishedSpanItems();

        var task = spans.stream().filter(s -> s.getName().equals("task")).findFirst().orElseThrow();
        var completion =
                spans.stream()
                        .filter(s -> s.getName().equals("completion"))
                        .findFirst()
                        .orElseThrow();
        assertEquals(task.getTraceId(), completion.getTraceId());
        assertEquals(task.getSpanId(), completion.getParentSpanId());
    }

    @Test
    void modelErrorsMarkTheTaskSpan() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        runner().retryPolicy(RetryPolicy.none())
                .build()
                .run(
                        dataset,
                        MODEL,
                        ModelProvider.of(
                                request -> {
                                    throw EvalException.of(ErrorKind.MODEL_REJECTED, "too long");
                                }),
                        exactMatch(),
                        PassPolicy.ALL);
        tracerProvider.forceFlush();

        var task =
                spanExporter.getFinishedSpanItems().stream()
                        .filter(s -> s.getName().equals("task"))
                        .findFirst()
                        .orElseThrow();
        assertEquals(StatusCode.ERROR, task.getStatus().getStatusCode());
        assertEquals(
                "MODEL_REJECTED",
                task.getAttributes().get(AttributeKey.stringKey("evalkit.error_kind")));
    }

    @Test
    void promptFromInput() {
        assertEquals("plain", EvalRunner.promptFor("plain"));
        assertEquals("hi", EvalRunner.promptFor(Map.of("prompt", "hi")));
        assertEquals("{\"question\":\"why\"}", EvalRunner.promptFor(Map.of("question", "why")));
        assertEquals("", EvalRunner.promptFor(null));
    }

    @Test
    void rejectsInvalidConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> EvalRunner.builder().concurrency(0));
    }

    @Test
    void retryBackoffIsCapped() {
        var policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(1), policy.backoff(0, Optional.empty()));
        assertEquals(Duration.ofSeconds(4), policy.backoff(2, Optional.empty()));
        assertEquals(Duration.ofSeconds(5), policy.backoff(6, Optional.empty()));
    }

    @Test
    void datasetWithNoTestCasesCompletes() {
        var empty = Dataset.of("qa", "1.0.0", List.of());
        var run =
                runner().build()
                        .run(
                                empty,
                                MODEL,
                                TestHarness.answering("yes"),
                                exactMatch(),
                                PassPolicy.ALL);
        assertEquals(RunStatus.COMPLETED, run.status());
        assertTrue(run.results().isEmpty());
    }
}
