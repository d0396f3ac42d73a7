package dev.evalkit.baseline;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.TestClock;
import dev.evalkit.TestHarness;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.EvalRun;
import dev.evalkit.eval.EvalRunner;
import dev.evalkit.eval.PassPolicy;
import dev.evalkit.metrics.EvalReport;
import dev.evalkit.metrics.MetricsAggregator;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.scorer.ExactMatchScorer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BaselineStoreTest {
    private TestClock clock;
    private EvalRunner runner;
    private BaselineStore store;

    @BeforeEach
    void beforeEach() {
        clock = TestClock.at(TestHarness.START);
        runner = EvalRunner.builder().clock(clock).build();
        store = BaselineStore.inMemory(clock);
    }

    private EvalRun completedRun(int passing, int failing) {
        return runner.run(
                TestHarness.yesNoDataset("qa", "1.0.0", passing, failing),
                ModelConfig.of("gpt-4o-mini"),
                TestHarness.answering("yes"),
                List.of(ExactMatchScorer.of()),
                PassPolicy.ALL);
    }

    private static EvalReport reportFor(EvalRun run) {
        return new MetricsAggregator().aggregate(run.id(), run.results());
    }

    @Test
    void promoteCapturesMetrics() {
        var run = completedRun(9, 1);

        var baseline = store.promote(run, reportFor(run), "prod");

        assertEquals("prod", baseline.name());
        assertEquals(run.id(), baseline.runId());
        assertEquals("qa", baseline.datasetId());
        assertEquals("1.0.0", baseline.datasetVersion());
        assertTrue(baseline.active());
        assertEquals(clock.instant(), baseline.capturedAt());
        assertEquals(0.9, baseline.metrics().accuracy(), 1e-9);
        assertEquals(0.8, baseline.metrics().categoryAccuracy().get("facts"), 1e-9);
        assertEquals(baseline, store.active("qa").orElseThrow());
    }

    @Test
    void newBaselineSupersedesTheOldOne() {
        var first = completedRun(5, 5);
        var second = completedRun(8, 2);
        var old = store.promote(first, reportFor(first), null);
        clock.advance(Duration.ofHours(1));
        var current = store.promote(second, reportFor(second), null);

        assertEquals("baseline-" + first.id(), old.name());
        assertEquals(current.id(), store.active("qa").orElseThrow().id());
        var history = store.history("qa");
        assertEquals(2, history.size());
        assertEquals(current.id(), history.get(0).id());
        assertEquals(old.id(), history.get(1).id());
        assertFalse(history.get(1).active());
        assertEquals(1, history.stream().filter(Baseline::active).count());
    }

    @Test
    void onlyCompletedRunsCanBePromoted() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 1, 0);
        var run =
                runner.prepare(
                        dataset,
                        ModelConfig.of("gpt-4o-mini"),
                        List.of(ExactMatchScorer.of()),
                        PassPolicy.ALL);
        run.cancel();

        var error =
                assertThrows(EvalException.class, () -> store.promote(run, reportFor(run), null));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertTrue(store.active("qa").isEmpty());
    }

    @Test
    void reportMustBelongToTheRun() {
        var run = completedRun(1, 0);
        var other = completedRun(1, 0);
        assertThrows(
                IllegalArgumentException.class,
                () -> store.promote(run, reportFor(other), null));
    }

    @Test
    void unknownDatasetHasNoBaseline() {
        assertTrue(store.active("nope").isEmpty());
        assertTrue(store.history("nope").isEmpty());
    }

    @Test
    void fileStoreKeepsHistoryAcrossInstances(@TempDir Path dir) throws Exception {
        var file = dir.resolve("store/baselines.json");
        var fileStore = BaselineStore.of(file, clock);
        assertTrue(fileStore.active("qa").isEmpty());

        var first = completedRun(5, 5);
        var second = completedRun(8, 2);
        var old = fileStore.promote(first, reportFor(first), null);
        clock.advance(Duration.ofHours(1));
        var current = BaselineStore.of(file, clock).promote(second, reportFor(second), "release");
        assertTrue(Files.isRegularFile(file));

        var reopened = BaselineStore.of(file, clock);
        assertEquals(current, reopened.active("qa").orElseThrow());
        assertEquals("release", current.name());
        assertEquals(0.8, reopened.active("qa").orElseThrow().metrics().accuracy(), 1e-9);
        var history = reopened.history("qa");
        assertEquals(
                List.of(current.id(), old.id()),
                history.stream().map(Baseline::id).collect(Collectors.toList()));
        assertEquals(1, history.stream().filter(Baseline::active).count());
        assertFalse(history.get(1).active());
    }

    @Test
    void malformedBaselineFileIsAStorageError(@TempDir Path dir) throws Exception {
        var file = Files.writeString(dir.resolve("baselines.json"), "{not json");

        var error =
                assertThrows(EvalException.class, () -> BaselineStore.of(file, clock).active("qa"));
        assertEquals(ErrorKind.STORAGE_FAILED, error.kind());
        assertEquals(8, error.kind().exitCode());
    }
}
