package dev.evalkit.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.TestClock;
import dev.evalkit.TestHarness;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.EvalRun;
import dev.evalkit.eval.EvalRunner;
import dev.evalkit.eval.PassPolicy;
import dev.evalkit.eval.RunStatus;
import dev.evalkit.metrics.MetricsAggregator;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.scorer.ExactMatchScorer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunRepositoryTest {
    @TempDir Path dir;

    private TestClock clock;
    private EvalRunner runner;

    @BeforeEach
    void beforeEach() {
        clock = TestClock.at(TestHarness.START);
        runner = EvalRunner.builder().clock(clock).build();
    }

    private EvalRun completedRun(String datasetId, int passing, int failing) {
        return runner.run(
                TestHarness.yesNoDataset(datasetId, "1.0.0", passing, failing),
                ModelConfig.of("gpt-4o-mini"),
                TestHarness.answering("yes"),
                List.of(ExactMatchScorer.of()),
                PassPolicy.ALL);
    }

    @Test
    void runsAndReportsSurviveANewRepository() {
        var run = completedRun("qa", 3, 1);
        var report = new MetricsAggregator().aggregate(run.id(), run.results());
        RunRepository.of(dir, clock).save(run, report);

        var reopened = RunRepository.of(dir, clock);
        var loaded = reopened.find(run.id()).orElseThrow();
        assertEquals(RunStatus.COMPLETED, loaded.status());
        assertEquals("qa", loaded.datasetId());
        assertEquals("1.0.0", loaded.datasetVersion());
        assertEquals(ModelConfig.of("gpt-4o-mini"), loaded.modelConfig());
        assertEquals(run.startedAt(), loaded.startedAt());
        assertEquals(run.completedAt(), loaded.completedAt());
        assertEquals(run.results(), loaded.results());
        assertEquals(4, loaded.totalCount());
        assertEquals(report, reopened.report(run.id()).orElseThrow());
        assertEquals(0.75, reopened.report(run.id()).orElseThrow().summary().accuracy(), 1e-9);
    }

    @Test
    void latestFollowsCreationOrderAcrossInstances() {
        var first = completedRun("qa", 1, 0);
        var second = completedRun("qa", 1, 0);
        var unrelated = completedRun("other", 1, 0);
        RunRepository.of(dir, clock).save(first, null);
        RunRepository.of(dir, clock).save(second, null);
        RunRepository.of(dir, clock).save(unrelated, null);
        // saving again keeps the original position
        RunRepository.of(dir, clock).save(first, null);

        var reopened = RunRepository.of(dir, clock);
        assertEquals(
                List.of(first.id(), second.id()),
                reopened.runs("qa").stream().map(EvalRun::id).collect(Collectors.toList()));
        assertEquals(second.id(), reopened.latest("qa").orElseThrow().id());
        assertTrue(reopened.latest("missing").isEmpty());
    }

    @Test
    void savingWithoutAReportKeepsTheStoredOne() {
        var run = completedRun("qa", 2, 0);
        var report = new MetricsAggregator().aggregate(run.id(), run.results());
        var runs = RunRepository.of(dir, clock);
        runs.save(run, report);
        runs.save(run, null);

        assertEquals(report, RunRepository.of(dir, clock).report(run.id()).orElseThrow());
    }

    @Test
    void runsSavedInThisProcessStayLive() {
        var dataset = TestHarness.yesNoDataset("qa", "1.0.0", 2, 0);
        var pending =
                runner.prepare(
                        dataset,
                        ModelConfig.of("gpt-4o-mini"),
                        List.of(ExactMatchScorer.of()),
                        PassPolicy.ALL);
        var runs = RunRepository.of(dir, clock);
        runs.save(pending, null);

        assertSame(pending, runs.find(pending.id()).orElseThrow());
        assertTrue(runs.report(pending.id()).isEmpty());
        assertEquals(
                RunStatus.PENDING,
                RunRepository.of(dir, clock).find(pending.id()).orElseThrow().status());
    }

    @Test
    void unknownAndUnsafeIdsAreNotFound() {
        var runs = RunRepository.of(dir, clock);
        assertTrue(runs.find("nope").isEmpty());
        assertTrue(runs.find("../escape").isEmpty());
        assertTrue(runs.report("").isEmpty());
        assertTrue(runs.runs("qa").isEmpty());
    }

    @Test
    void unreadableFilesAreSkippedWhenListing() throws Exception {
        var run = completedRun("qa", 1, 0);
        RunRepository.of(dir, clock).save(run, null);
        Files.writeString(dir.resolve("broken.json"), "{\"id\": ");

        var runs = RunRepository.of(dir, clock);
        assertEquals(1, runs.runs("qa").size());
        var error = assertThrows(EvalException.class, () -> runs.find("broken"));
        assertEquals(ErrorKind.STORAGE_FAILED, error.kind());
    }
}
