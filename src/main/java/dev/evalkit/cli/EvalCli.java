package dev.evalkit.cli;

import dev.evalkit.EvalKit;
import dev.evalkit.EvalKitUtils;
import dev.evalkit.baseline.Comparison;
import dev.evalkit.baseline.Severity;
import dev.evalkit.config.EvalKitConfig;
import dev.evalkit.config.EvalSettings;
import dev.evalkit.config.SettingsLoader;
import dev.evalkit.dataset.Dataset;
import dev.evalkit.dataset.DatasetStore;
import dev.evalkit.dataset.DatasetValidator;
import dev.evalkit.dataset.ValidationResult;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.RunStatus;
import dev.evalkit.json.EvalJsonMapper;
import dev.evalkit.metrics.ReportFormat;
import dev.evalkit.metrics.ReportRenderer;
import dev.evalkit.orchestrator.ModelComparison;
import dev.evalkit.provider.ModelConfig;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line surface.
 *
 * <pre>
 * evalkit run --dataset &lt;id&gt; [--version v] [--model m] [--format f] [--fail-on-regression]
 * evalkit compare --dataset &lt;id&gt; --models a,b[,c]
 * evalkit report (--run &lt;id&gt; | --latest --dataset &lt;id&gt;) [--format f]
 * evalkit baseline promote --run &lt;id&gt; [--name n] | list --dataset &lt;id&gt;
 * evalkit dataset list | show &lt;id&gt; | validate &lt;id|file&gt; | create &lt;id&gt; --name n
 * evalkit config init | show
 * </pre>
 *
 * Runs and baselines are kept under {@code EVALKIT_STORAGE_DIR}, by default {@code .evalkit} in
 * the working directory, so a later command can report on or promote an earlier run.
 *
 * <p>Global options: {@code --config <file>}, {@code --verbose}. Exit codes: 0 success, 1 failed
 * run or failed validation, 2 usage error, otherwise the error category's code.
 */
@Slf4j
public final class EvalCli {
    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int USAGE = 2;
    public static final String DEFAULT_STORAGE_DIR = ".evalkit";

    static final String USAGE_TEXT =
            """
            usage: evalkit <command> [options]

            commands:
              run --dataset <id> [--version v] [--model m] [--format f] [--fail-on-regression]
              compare --dataset <id> --models a,b[,c]
              report (--run <id> | --latest --dataset <id>) [--format f]
              baseline promote --run <id> [--name <n>] | list --dataset <id>
              dataset list | show <id> | validate <id|file> | create <id> --name <n>
              config init | show

            options:
              --config <file>   settings file (default ./evalkit.yaml, .yml, .json)
              --format <f>      console, markdown, json or csv
              --verbose         print stack traces
            """;

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDir;
    private final Function<EvalSettings, EvalKit> kits;

    public EvalCli(
            PrintStream out,
            PrintStream err,
            Path workingDir,
            Function<EvalSettings, EvalKit> kits) {
        this.out = out;
        this.err = err;
        this.workingDir = workingDir;
        this.kits = kits;
    }

    public static void main(String[] args) {
        var workingDir = Path.of("").toAbsolutePath();
        var cli = new EvalCli(System.out, System.err, workingDir, kits(workingDir));
        System.exit(cli.execute(args));
    }

    /** Builds a kit per command from the environment, storing runs under the working directory. */
    static Function<EvalSettings, EvalKit> kits(Path workingDir) {
        return settings -> {
            var config = EvalKitConfig.fromEnvironment();
            var storage =
                    config.storageDir()
                            .map(workingDir::resolve)
                            .orElse(workingDir.resolve(DEFAULT_STORAGE_DIR));
            return EvalKit.builder(config, settings).storageDir(storage).build();
        };
    }

    /** Runs one command and returns its exit code. Never throws. */
    public int execute(String... args) {
        CommandLine cmd;
        try {
            cmd = CommandLine.parse(args);
        } catch (CommandLine.UsageException e) {
            return usage(e.getMessage());
        }
        if (cmd.flag("help") || cmd.positional(0).isEmpty()) {
            out.print(USAGE_TEXT);
            return cmd.flag("help") ? OK : USAGE;
        }
        try {
            return dispatch(cmd);
        } catch (CommandLine.UsageException e) {
            return usage(e.getMessage());
        } catch (EvalException e) {
            err.println(e.describe());
            if (verbose(cmd)) {
                e.printStackTrace(err);
            }
            log.debug("command failed", e);
            return e.kind().exitCode();
        } catch (RuntimeException e) {
            err.println("error[internal]: " + e);
            if (verbose(cmd)) {
                e.printStackTrace(err);
            }
            log.debug("command failed", e);
            return FAILURE;
        }
    }

    private int dispatch(CommandLine cmd) {
        var command = cmd.positional(0).orElseThrow();
        return switch (command) {
            case "run" -> run(cmd);
            case "compare" -> compare(cmd);
            case "report" -> report(cmd);
            case "baseline" -> baseline(cmd);
            case "dataset" -> dataset(cmd);
            case "config" -> config(cmd);
            default -> usage("unknown command '%s'".formatted(command));
        };
    }

    private int run(CommandLine cmd) {
        var kit = kit(cmd);
        var datasetId = cmd.requireOption("dataset");
        var model =
                cmd.option("model")
                        .map(ModelConfig::of)
                        .orElse(kit.settings().defaultModel());
        var format = format(cmd);

        var result =
                kit.orchestrator()
                        .run(kit.request(datasetId, cmd.option("version").orElse(null), model));

        out.println("run %s %s".formatted(result.run().id(), status(result.run().status())));
        out.print(ReportRenderer.render(result.report(), format));
        if (format == ReportFormat.CONSOLE || format == ReportFormat.MARKDOWN) {
            printComparison(result.comparison());
            EvalKitUtils.reportUri(kit.config().dashboardUrl(), result.run().id())
                    .ifPresent(uri -> out.println("report: " + uri));
        }

        if (result.run().status() == RunStatus.FAILED) {
            return FAILURE;
        }
        if (cmd.flag("fail-on-regression")
                && result.comparison().hasRegressionAtLeast(Severity.MAJOR)) {
            err.println(
                    "error[regression]: %s regression against the active baseline"
                            .formatted(result.comparison().worstSeverity().orElseThrow()));
            return FAILURE;
        }
        return OK;
    }

    private void printComparison(Comparison comparison) {
        if (comparison.needsBaseline()) {
            out.println("no active baseline; promote this run to capture one");
            return;
        }
        if (comparison.baselineId().isEmpty()) {
            return;
        }
        if (comparison.regressions().isEmpty()) {
            out.println("no regressions against baseline " + comparison.baselineId().get());
        }
        for (var improvement : comparison.improvements()) {
            out.println(
                    "improved %s: %.4f -> %.4f"
                            .formatted(
                                    improvement.metric(),
                                    improvement.baselineValue(),
                                    improvement.currentValue()));
        }
    }

    private int compare(CommandLine cmd) {
        var kit = kit(cmd);
        var datasetId = cmd.requireOption("dataset");
        var models =
                EvalKitUtils.parseCsv(cmd.requireOption("models")).stream()
                        .map(ModelConfig::of)
                        .collect(Collectors.toList());
        if (models.size() < 2) {
            throw new CommandLine.UsageException("--models needs at least two models");
        }
        var request = kit.request(datasetId, cmd.option("version").orElse(null), models.get(0));
        var comparison = kit.orchestrator().compareModels(request, models);
        if (format(cmd) == ReportFormat.JSON) {
            out.println(EvalJsonMapper.toPrettyJson(comparison));
        } else {
            printModelComparison(comparison);
        }
        return OK;
    }

    private void printModelComparison(ModelComparison comparison) {
        out.println("Model comparison on " + comparison.datasetId());
        int rank = 1;
        for (var entry : comparison.ranking()) {
            out.println(
                    ("  %d. %-32s accuracy %5.1f%%  avg score %.3f"
                                    + "  latency %.0f ms  cost $%.4f  wins %d")
                            .formatted(
                                    rank++,
                                    entry.model(),
                                    entry.accuracy() * 100,
                                    entry.avgScore(),
                                    entry.avgLatencyMs(),
                                    entry.totalCostUsd(),
                                    comparison.wins().getOrDefault(entry.model().toString(), 0)));
        }
    }

    private int report(CommandLine cmd) {
        var kit = kit(cmd);
        String runId;
        if (cmd.option("run").isPresent()) {
            runId = cmd.option("run").get();
        } else if (cmd.flag("latest")) {
            var datasetId = cmd.requireOption("dataset");
            runId =
                    kit.orchestrator()
                            .latestRun(datasetId)
                            .orElseThrow(
                                    () ->
                                            EvalException.of(
                                                    ErrorKind.NOT_FOUND,
                                                    "no runs for dataset " + datasetId,
                                                    Map.of("dataset_id", datasetId)))
                            .id();
        } else {
            throw new CommandLine.UsageException("report needs --run <id> or --latest");
        }
        out.print(ReportRenderer.render(kit.orchestrator().report(runId), format(cmd)));
        return OK;
    }

    private int baseline(CommandLine cmd) {
        var sub = cmd.requirePositional(1, "baseline subcommand");
        switch (sub) {
            case "promote" -> {
                var runId = cmd.requireOption("run");
                var baseline =
                        kit(cmd).orchestrator()
                                .promoteBaseline(runId, cmd.option("name").orElse(null));
                out.println(
                        "run %s is now baseline %s (%s) for dataset %s"
                                .formatted(
                                        runId,
                                        baseline.id(),
                                        baseline.name(),
                                        baseline.datasetId()));
                return OK;
            }
            case "list" -> {
                var datasetId = cmd.requireOption("dataset");
                var history = kit(cmd).baselines().history(datasetId);
                if (history.isEmpty()) {
                    out.println("no baselines for dataset " + datasetId);
                }
                for (var b : history) {
                    out.println(
                            "%s %-24s run %s  accuracy %5.1f%%  %s"
                                    .formatted(
                                            b.active() ? "*" : " ",
                                            b.name(),
                                            b.runId(),
                                            b.metrics().accuracy() * 100,
                                            b.capturedAt()));
                }
                return OK;
            }
            default -> {
                return usage("unknown baseline subcommand '%s'".formatted(sub));
            }
        }
    }

    private int dataset(CommandLine cmd) {
        var sub = cmd.requirePositional(1, "dataset subcommand");
        return switch (sub) {
            case "list" -> datasetList(cmd);
            case "show" -> datasetShow(cmd);
            case "validate" -> datasetValidate(cmd);
            case "create" -> datasetCreate(cmd);
            default -> usage("unknown dataset subcommand '%s'".formatted(sub));
        };
    }

    private int datasetList(CommandLine cmd) {
        var summaries = kit(cmd).datasets().list();
        if (summaries.isEmpty()) {
            out.println("no datasets");
        }
        for (var s : summaries) {
            out.println(
                    "%-24s %-10s %4d test cases  %s"
                            .formatted(s.id(), s.version(), s.testCaseCount(), s.name()));
        }
        return OK;
    }

    private int datasetShow(CommandLine cmd) {
        var id = cmd.requirePositional(2, "dataset id");
        var dataset = kit(cmd).datasets().load(id, cmd.option("version").orElse(null));
        if (format(cmd) == ReportFormat.JSON) {
            out.println(EvalJsonMapper.toPrettyJson(dataset));
            return OK;
        }
        out.println("%s@%s: %s".formatted(dataset.id(), dataset.version(), dataset.name()));
        if (!dataset.description().isEmpty()) {
            out.println(dataset.description());
        }
        var byCategory =
                dataset.testCases().stream()
                        .collect(
                                Collectors.groupingBy(
                                        tc -> tc.categoryOrDefault(),
                                        TreeMap::new,
                                        Collectors.counting()));
        out.println("test cases: " + dataset.size());
        byCategory.forEach(
                (category, count) -> out.println("  %-24s %d".formatted(category, count)));
        return OK;
    }

    private int datasetValidate(CommandLine cmd) {
        var target = cmd.requirePositional(2, "dataset id or file");
        var file = workingDir.resolve(target);
        ValidationResult result;
        if (Files.isRegularFile(file)) {
            result = DatasetValidator.validate(DatasetStore.read(file));
        } else {
            try {
                result = DatasetValidator.validate(kit(cmd).datasets().load(target));
            } catch (EvalException e) {
                if (e.kind() != ErrorKind.DATASET_INVALID) {
                    throw e;
                }
                result = new ValidationResult(errors(e), List.of());
            }
        }
        result.errors().forEach(error -> out.println("error: " + error));
        result.warnings().forEach(warning -> out.println("warning: " + warning));
        if (result.valid()) {
            out.println("valid (%d warning(s))".formatted(result.warnings().size()));
            return OK;
        }
        out.println("invalid (%d error(s))".formatted(result.errors().size()));
        return FAILURE;
    }

    @SuppressWarnings("unchecked")
    private static List<String> errors(EvalException e) {
        var errors = e.context().get("errors");
        return errors instanceof List<?> list ? (List<String>) list : List.of(e.getMessage());
    }

    private int datasetCreate(CommandLine cmd) {
        var id = cmd.requirePositional(2, "dataset id");
        var dataset =
                new Dataset(
                        id,
                        cmd.requireOption("name"),
                        cmd.option("description").orElse(""),
                        cmd.option("version").orElse("1.0.0"),
                        List.of());
        kit(cmd).datasets().save(dataset);
        out.println("created dataset %s@%s".formatted(dataset.id(), dataset.version()));
        return OK;
    }

    private int config(CommandLine cmd) {
        var sub = cmd.requirePositional(1, "config subcommand");
        switch (sub) {
            case "init" -> {
                var path =
                        cmd.option("config")
                                .map(workingDir::resolve)
                                .orElse(
                                        workingDir.resolve(
                                                SettingsLoader.DEFAULT_FILE_NAMES.get(0)));
                SettingsLoader.write(path, EvalSettings.defaults());
                out.println("wrote " + path);
                return OK;
            }
            case "show" -> {
                var explicit = cmd.option("config").map(workingDir::resolve).orElse(null);
                var source = SettingsLoader.resolve(explicit, workingDir);
                var settings = settings(cmd);
                out.println("# source: " + source.map(Path::toString).orElse("built-in defaults"));
                out.print(EvalJsonMapper.toYaml(settings));
                return OK;
            }
            default -> {
                return usage("unknown config subcommand '%s'".formatted(sub));
            }
        }
    }

    private EvalSettings settings(CommandLine cmd) {
        var explicit = cmd.option("config").map(workingDir::resolve).orElse(null);
        return SettingsLoader.load(explicit, workingDir);
    }

    private EvalKit kit(CommandLine cmd) {
        return kits.apply(settings(cmd));
    }

    private static ReportFormat format(CommandLine cmd) {
        return cmd.option("format").map(ReportFormat::fromName).orElse(ReportFormat.CONSOLE);
    }

    private static boolean verbose(CommandLine cmd) {
        return cmd.flag("verbose") || Boolean.parseBoolean(System.getenv("EVALKIT_DEBUG"));
    }

    private static String status(RunStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private int usage(String message) {
        err.println("error[usage]: " + message);
        err.print(USAGE_TEXT);
        return USAGE;
    }
}
