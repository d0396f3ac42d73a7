package dev.evalkit.baseline;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.eval.EvalRun;
import dev.evalkit.eval.RunStatus;
import dev.evalkit.json.EvalJsonMapper;
import dev.evalkit.metrics.EvalReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the baseline history of each dataset. At most one baseline per dataset is active.
 * Superseded baselines are deactivated and kept.
 */
public interface BaselineStore {
    Optional<Baseline> active(String datasetId);

    /** All baselines of a dataset, newest first. */
    List<Baseline> history(String datasetId);

    /**
     * Makes a completed run the active baseline of its dataset.
     *
     * @throws EvalException of kind CONFIGURATION if the run did not complete
     */
    Baseline promote(EvalRun run, EvalReport report, @Nullable String name);

    static BaselineStore inMemory(Clock clock) {
        return new InMemoryImpl(clock);
    }

    /** Baselines of every dataset kept in one JSON file, so they outlive the process. */
    static BaselineStore of(Path file, Clock clock) {
        return new FileImpl(file, clock);
    }

    private static Baseline capture(
            EvalRun run, EvalReport report, @Nullable String name, Clock clock) {
        if (run.status() != RunStatus.COMPLETED) {
            throw EvalException.of(
                    ErrorKind.CONFIGURATION,
                    "only completed runs can become a baseline, run %s is %s"
                            .formatted(run.id(), run.status()),
                    Map.of("runId", run.id(), "status", run.status().name()));
        }
        if (!report.runId().equals(run.id())) {
            throw new IllegalArgumentException(
                    "report %s does not belong to run %s".formatted(report.runId(), run.id()));
        }
        return new Baseline(
                UUID.randomUUID().toString(),
                run.id(),
                run.datasetId(),
                run.datasetVersion(),
                name == null ? "baseline-" + run.id() : name,
                BaselineMetrics.from(report),
                true,
                clock.instant());
    }

    @Slf4j
    @ThreadSafe
    class InMemoryImpl implements BaselineStore {
        private final Map<String, List<Baseline>> baselines = new HashMap<>();
        private final Clock clock;

        InMemoryImpl(Clock clock) {
            this.clock = clock;
        }

        @Override
        public synchronized Optional<Baseline> active(String datasetId) {
            return baselines.getOrDefault(datasetId, List.of()).stream()
                    .filter(Baseline::active)
                    .findFirst();
        }

        @Override
        public synchronized List<Baseline> history(String datasetId) {
            var history = new ArrayList<>(baselines.getOrDefault(datasetId, List.of()));
            Collections.reverse(history);
            return history;
        }

        @Override
        public synchronized Baseline promote(
                EvalRun run, EvalReport report, @Nullable String name) {
            var baseline = capture(run, report, name, clock);
            var history = baselines.computeIfAbsent(run.datasetId(), k -> new ArrayList<>());
            history.replaceAll(b -> b.active() ? b.deactivated() : b);
            history.add(baseline);
            log.info(
                    "run {} promoted to baseline {} for dataset {}",
                    run.id(),
                    baseline.id(),
                    run.datasetId());
            return baseline;
        }
    }

    /** Every baseline in one file, oldest first. The file is rewritten on each promotion. */
    @Slf4j
    @ThreadSafe
    class FileImpl implements BaselineStore {
        private static final TypeReference<List<Baseline>> BASELINES = new TypeReference<>() {};

        private final Path file;
        private final Clock clock;

        FileImpl(Path file, Clock clock) {
            this.file = file;
            this.clock = clock;
        }

        @Override
        public synchronized Optional<Baseline> active(String datasetId) {
            return read().stream()
                    .filter(b -> b.datasetId().equals(datasetId) && b.active())
                    .findFirst();
        }

        @Override
        public synchronized List<Baseline> history(String datasetId) {
            var history =
                    read().stream()
                            .filter(b -> b.datasetId().equals(datasetId))
                            .collect(Collectors.toCollection(ArrayList::new));
            Collections.reverse(history);
            return history;
        }

        @Override
        public synchronized Baseline promote(
                EvalRun run, EvalReport report, @Nullable String name) {
            var baseline = capture(run, report, name, clock);
            var all = new ArrayList<Baseline>();
            for (var b : read()) {
                all.add(b.active() && b.datasetId().equals(run.datasetId()) ? b.deactivated() : b);
            }
            all.add(baseline);
            try {
                if (file.getParent() != null) {
                    Files.createDirectories(file.getParent());
                }
                Files.writeString(file, EvalJsonMapper.toPrettyJson(all));
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "could not write baselines to %s: %s".formatted(file, e.getMessage()),
                        Map.of("file", file.toString()),
                        e);
            }
            log.debug("wrote {} baselines to {}", all.size(), file);
            log.info(
                    "run {} promoted to baseline {} for dataset {}",
                    run.id(),
                    baseline.id(),
                    run.datasetId());
            return baseline;
        }

        private List<Baseline> read() {
            if (!Files.isRegularFile(file)) {
                return List.of();
            }
            try {
                return EvalJsonMapper.get().readValue(file.toFile(), BASELINES);
            } catch (JacksonException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "baseline file %s is malformed: %s".formatted(file, e.getOriginalMessage()),
                        Map.of("file", file.toString()),
                        e);
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.STORAGE_FAILED,
                        "could not read baseline file %s: %s".formatted(file, e.getMessage()),
                        Map.of("file", file.toString()),
                        e);
            }
        }
    }
}
