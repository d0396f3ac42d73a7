package dev.evalkit.config;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.baseline.Severity;
import dev.evalkit.cost.BudgetPeriod;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.PassPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsLoaderTest {
    @TempDir Path dir;

    @Test
    void defaultsWhenNoFileExists() {
        var settings = SettingsLoader.load(null, dir);
        assertEquals(EvalSettings.defaults(), settings);
        assertEquals("gpt-4o-mini", settings.defaultModel().model());
        assertEquals(5, settings.runner().concurrency());
        assertEquals(PassPolicy.ALL, settings.runner().passPolicy());
        assertEquals("exact_match", settings.scorers().get(0).name());
        assertTrue(settings.budgets().isEmpty());
    }

    @Test
    void readsYamlFromTheWorkingDirectory() throws Exception {
        Files.writeString(
                dir.resolve("evalkit.yaml"),
                """
                models:
                  - model: gpt-4o
                    temperature: 0.0
                runner:
                  concurrency: 8
                  max_retries: 1
                  timeout_seconds: 30
                  pass_policy: any
                scorers:
                  - name: exact_match
                  - name: recall_at_k
                    options:
                      k: 3
                baseline:
                  critical_points: 8.0
                budgets:
                  - period: daily
                    limit_usd: 25
                alerts:
                  min_regression_severity: major
                """);

        var settings = SettingsLoader.load(null, dir);

        assertEquals("openai/gpt-4o", settings.defaultModel().toString());
        assertEquals(0.0, settings.defaultModel().temperature());
        assertEquals(8, settings.runner().concurrency());
        assertEquals(1, settings.runner().retryPolicy().maxRetries());
        assertEquals(Duration.ofSeconds(30), settings.runner().testTimeout());
        assertEquals(Duration.ofSeconds(120), settings.runner().judgeTimeout());
        assertEquals(PassPolicy.ANY, settings.runner().passPolicy());
        assertEquals(2, settings.scorers().size());
        assertEquals(3, settings.scorers().get(1).options().get("k"));
        assertEquals(8.0, settings.baseline().toThresholds().criticalPoints());
        assertEquals(
                settings.baseline().majorPoints(),
                EvalSettings.Baseline.DEFAULTS.majorPoints());
        var budget = settings.toBudgets().get(0);
        assertEquals(BudgetPeriod.DAILY, budget.period());
        assertEquals(25.0, budget.limitUsd());
        assertEquals(80.0, budget.alertThresholdPercent());
        assertEquals(Severity.MAJOR, settings.alerts().minRegressionSeverity());
    }

    @Test
    void yamlWinsOverJson() throws Exception {
        Files.writeString(dir.resolve("evalkit.json"), "{}");
        Files.writeString(dir.resolve("evalkit.yaml"), "runner: {concurrency: 2}");
        assertEquals(dir.resolve("evalkit.yaml"), SettingsLoader.resolve(null, dir).orElseThrow());
    }

    @Test
    void readsJson() throws Exception {
        var path = dir.resolve("custom.json");
        Files.writeString(path, "{\"runner\": {\"concurrency\": 3}}");
        assertEquals(3, SettingsLoader.load(path, dir).runner().concurrency());
    }

    @Test
    void blankFileMeansDefaults() throws Exception {
        var path = dir.resolve("evalkit.yml");
        Files.writeString(path, "\n");
        assertEquals(EvalSettings.defaults(), SettingsLoader.load(null, dir));
    }

    @Test
    void missingExplicitFileIsAConfigurationError() {
        var error =
                assertThrows(
                        EvalException.class,
                        () -> SettingsLoader.load(dir.resolve("nope.yaml"), dir));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
    }

    @Test
    void everyProblemIsReportedAtOnce() throws Exception {
        Files.writeString(
                dir.resolve("evalkit.yaml"),
                """
                runner:
                  concurrency: 0
                  max_retries: -1
                budgets:
                  - period: weekly
                    limit_usd: 0
                    alert_threshold_percent: 120
                scorers: []
                """);

        var error = assertThrows(EvalException.class, () -> SettingsLoader.load(null, dir));

        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        @SuppressWarnings("unchecked")
        var problems = (List<String>) error.context().get("errors");
        assertEquals(5, problems.size(), problems.toString());
        assertTrue(error.getMessage().contains("runner.concurrency must be >= 1"));
    }

    @Test
    void aPeriodMayHaveOnlyOneBudget() throws Exception {
        Files.writeString(
                dir.resolve("evalkit.yaml"),
                """
                budgets:
                  - period: daily
                    limit_usd: 10
                  - period: weekly
                    limit_usd: 50
                  - period: daily
                    limit_usd: 20
                """);
        var error = assertThrows(EvalException.class, () -> SettingsLoader.load(null, dir));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertEquals(
                List.of("budgets: daily budget is configured more than once"),
                error.context().get("errors"));
    }

    @Test
    void unknownBudgetPeriodIsAConfigurationError() throws Exception {
        Files.writeString(
                dir.resolve("evalkit.yaml"),
                """
                budgets:
                  - period: fortnightly
                    limit_usd: 10
                """);
        var error = assertThrows(EvalException.class, () -> SettingsLoader.load(null, dir));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertTrue(error.getMessage().contains("fortnightly"), error.getMessage());
    }

    @Test
    void writtenSettingsReadBack() {
        var path = dir.resolve("evalkit.yaml");
        SettingsLoader.write(path, EvalSettings.defaults());
        assertEquals(EvalSettings.defaults(), SettingsLoader.load(null, dir));

        var again =
                assertThrows(
                        EvalException.class,
                        () -> SettingsLoader.write(path, EvalSettings.defaults()));
        assertEquals(ErrorKind.CONFIGURATION, again.kind());
    }

    @Test
    void renderPicksFormatFromExtension() {
        var json = SettingsLoader.render(EvalSettings.defaults(), Path.of("evalkit.json"));
        assertTrue(json.startsWith("{"));
        var yaml = SettingsLoader.render(EvalSettings.defaults(), Path.of("evalkit.yaml"));
        assertTrue(yaml.contains("concurrency: 5"), yaml);
    }
}
