package dev.evalkit.orchestrator;

import com.fasterxml.jackson.core.JacksonException;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.EvalRun;
import dev.evalkit.eval.PassPolicy;
import dev.evalkit.eval.RunStatus;
import dev.evalkit.eval.TestCaseResult;
import dev.evalkit.json.EvalJsonMapper;
import dev.evalkit.metrics.EvalReport;
import dev.evalkit.provider.ModelConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/** Stores runs and their reports. */
public interface RunRepository {
    /** Saves or replaces a run, and its report when one is given. */
    void save(EvalRun run, @Nullable EvalReport report);

    Optional<EvalRun> find(String runId);

    Optional<EvalReport> report(String runId);

    /** Runs of a dataset, oldest first. */
    List<EvalRun> runs(String datasetId);

    /** The most recently created run of a dataset. */
    default Optional<EvalRun> latest(String datasetId) {
        var runs = runs(datasetId);
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(runs.size() - 1));
    }

    static RunRepository inMemory() {
        return new InMemoryImpl();
    }

    /** Runs kept as JSON files in {@code directory}, so they outlive the process. */
    static RunRepository of(Path directory, Clock clock) {
        return new FileImpl(directory, clock);
    }

    /** Implementation for test doubling and single-process use. */
    @ThreadSafe
    class InMemoryImpl implements RunRepository {
        private final Map<String, EvalRun> runs = new LinkedHashMap<>();
        private final Map<String, EvalReport> reports = new LinkedHashMap<>();

        @Override
        public synchronized void save(EvalRun run, @Nullable EvalReport report) {
            runs.put(run.id(), run);
            if (report != null) {
                reports.put(run.id(), report);
            }
        }

        @Override
        public synchronized Optional<EvalRun> find(String runId) {
            return Optional.ofNullable(runs.get(runId));
        }

        @Override
        public synchronized Optional<EvalReport> report(String runId) {
            return Optional.ofNullable(reports.get(runId));
        }

        @Override
        public synchronized List<EvalRun> runs(String datasetId) {
            var matching = new ArrayList<EvalRun>();
            for (var run : runs.values()) {
                if (run.datasetId().equals(datasetId)) {
                    matching.add(run);
                }
            }
            return matching;
        }
    }

    /**
     * One {@code <run id>.json} file per run, holding the run state, its results and its report.
     *
     * <p>Runs saved by this instance are also kept in memory, so cancelling a run in progress
     * reaches the instance the runner is working on. Creation order is kept in a sequence number
     * assigned on the first save.
     */
    @Slf4j
    @ThreadSafe
    class FileImpl implements RunRepository {
        private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

        private final Path directory;
        private final Clock clock;
        private final Map<String, EvalRun> live = new ConcurrentHashMap<>();

        FileImpl(Path directory, Clock clock) {
            this.directory = directory;
            this.clock = clock;
        }

        @Override
        public synchronized void save(EvalRun run, @Nullable EvalReport report) {
            var file = file(run.id());
            var previous =
                    Files.exists(file) ? Optional.of(read(file)) : Optional.<StoredRun>empty();
            long sequence = previous.map(StoredRun::sequence).orElseGet(this::nextSequence);
            var kept = report != null ? report : previous.map(StoredRun::report).orElse(null);
            try {
                Files.createDirectories(directory);
                Files.writeString(
                        file, EvalJsonMapper.toPrettyJson(StoredRun.of(sequence, run, kept)));
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "could not write run file %s: %s".formatted(file, e.getMessage()),
                        Map.of("file", file.toString()),
                        e);
            }
            live.put(run.id(), run);
            log.debug("saved run {} ({}) to {}", run.id(), run.status(), file);
        }

        @Override
        public Optional<EvalRun> find(String runId) {
            var cached = live.get(runId);
            if (cached != null) {
                return Optional.of(cached);
            }
            return stored(runId).map(stored -> stored.toRun(clock));
        }

        @Override
        public Optional<EvalReport> report(String runId) {
            return stored(runId).map(StoredRun::report);
        }

        @Override
        public List<EvalRun> runs(String datasetId) {
            return scan().stream()
                    .filter(stored -> datasetId.equals(stored.datasetId()))
                    .sorted(Comparator.comparingLong(StoredRun::sequence))
                    .map(
                            stored ->
                                    Optional.ofNullable(live.get(stored.id()))
                                            .orElseGet(() -> stored.toRun(clock)))
                    .collect(Collectors.toList());
        }

        private Optional<StoredRun> stored(String runId) {
            if (!RUN_ID.matcher(runId).matches()) {
                return Optional.empty();
            }
            var file = file(runId);
            return Files.isRegularFile(file) ? Optional.of(read(file)) : Optional.empty();
        }

        private long nextSequence() {
            return scan().stream().mapToLong(StoredRun::sequence).max().orElse(0) + 1;
        }

        private Path file(String runId) {
            return directory.resolve(runId + ".json");
        }

        private StoredRun read(Path file) {
            try {
                return EvalJsonMapper.get().readValue(file.toFile(), StoredRun.class);
            } catch (JacksonException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "run file %s is malformed: %s".formatted(file, e.getOriginalMessage()),
                        Map.of("file", file.toString()),
                        e);
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "could not read run file %s: %s".formatted(file, e.getMessage()),
                        Map.of("file", file.toString()),
                        e);
            }
        }

        private List<StoredRun> scan() {
            if (!Files.isDirectory(directory)) {
                return List.of();
            }
            try (Stream<Path> files = Files.list(directory)) {
                var stored = new ArrayList<StoredRun>();
                for (var file : files.sorted().collect(Collectors.toList())) {
                    if (!file.getFileName().toString().endsWith(".json")) {
                        continue;
                    }
                    try {
                        stored.add(read(file));
                    } catch (EvalException e) {
                        log.warn("skipping unreadable run file {}: {}", file, e.getMessage());
                    }
                }
                return stored;
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "could not list run directory %s: %s".formatted(directory, e.getMessage()),
                        Map.of("directory", directory.toString()),
                        e);
            }
        }
    }

    /** File form of a run. */
    record StoredRun(
            long sequence,
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
            @Nullable String failure,
            List<TestCaseResult> results,
            @Nullable EvalReport report) {

        public StoredRun {
            scorerNames = scorerNames == null ? List.of() : scorerNames;
            testCaseOrder = testCaseOrder == null ? List.of() : testCaseOrder;
            results = results == null ? List.of() : results;
        }

        static StoredRun of(long sequence, EvalRun run, @Nullable EvalReport report) {
            return new StoredRun(
                    sequence,
                    run.id(),
                    run.datasetId(),
                    run.datasetVersion(),
                    run.modelConfig(),
                    run.passPolicy(),
                    run.scorerNames(),
                    run.testCaseOrder(),
                    run.status(),
                    run.startedAt(),
                    run.completedAt(),
                    run.failure().orElse(null),
                    run.results(),
                    report);
        }

        EvalRun toRun(Clock clock) {
            return EvalRun.restore(
                    id,
                    datasetId,
                    datasetVersion,
                    modelConfig,
                    passPolicy,
                    scorerNames,
                    testCaseOrder,
                    status,
                    startedAt,
                    completedAt,
                    failure,
                    results,
                    clock);
        }
    }
}
