package dev.evalkit.dataset;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads and stores versioned datasets.
 *
 * <p>Loading validates the dataset and fails with a DATASET_* error listing every problem. A
 * published version is never overwritten; edits are saved as a new version.
 */
public interface DatasetStore {
    List<DatasetSummary> list();

    /**
     * Loads a dataset version.
     *
     * @param version the version to load, or null for the latest
     * @throws EvalException of kind DATASET_NOT_FOUND or DATASET_INVALID
     */
    Dataset load(@Nonnull String datasetId, @Nullable String version);

    /**
     * @throws EvalException of kind DATASET_INVALID if the dataset fails validation or the version
     *     already exists
     */
    void save(@Nonnull Dataset dataset);

    default Dataset load(@Nonnull String datasetId) {
        return load(datasetId, null);
    }

    static DatasetStore of(Path directory) {
        return new FileImpl(directory);
    }

    static DatasetStore of(Dataset... datasets) {
        var store = new InMemoryImpl();
        for (var dataset : datasets) {
            store.save(dataset);
        }
        return store;
    }

    /**
     * Reads a dataset file (JSON, or YAML by extension) without validating it.
     *
     * @throws EvalException of kind DATASET_NOT_FOUND or DATASET_INVALID
     */
    static Dataset read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw EvalException.of(
                    ErrorKind.DATASET_NOT_FOUND,
                    "dataset file not found: " + file,
                    Map.of("file", file.toString()));
        }
        try {
            return mapperFor(file).readValue(file.toFile(), Dataset.class);
        } catch (JacksonException e) {
            throw EvalException.of(
                    ErrorKind.DATASET_INVALID,
                    "dataset file %s is malformed: %s".formatted(file, e.getOriginalMessage()),
                    Map.of("file", file.toString()),
                    e);
        } catch (IOException e) {
            throw EvalException.of(
                    ErrorKind.DATASET_NOT_FOUND,
                    "dataset file %s could not be read: %s".formatted(file, e.getMessage()),
                    Map.of("file", file.toString()),
                    e);
        }
    }

    private static ObjectMapper mapperFor(Path file) {
        var name = file.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml")
                ? EvalJsonMapper.yaml()
                : EvalJsonMapper.get();
    }

    private static void requireValid(Dataset dataset) {
        var result = DatasetValidator.validate(dataset);
        if (!result.valid()) {
            throw EvalException.datasetInvalid(
                    dataset.id() == null ? "(no id)" : dataset.id(), result.errors());
        }
    }

    private static Dataset latest(String datasetId, List<Dataset> versions) {
        return versions.stream()
                .max((a, b) -> Dataset.compareVersions(a.version(), b.version()))
                .orElseThrow(() -> EvalException.datasetNotFound(datasetId, null));
    }

    /**
     * Datasets stored as files in one directory, one file per version.
     *
     * <p>Files are named {@code <id>-<version>.json} when saved; any {@code .json}, {@code .yaml}
     * or {@code .yml} file in the directory is picked up regardless of its name.
     */
    @Slf4j
    @ThreadSafe
    class FileImpl implements DatasetStore {
        private final Path directory;

        FileImpl(Path directory) {
            this.directory = directory;
        }

        @Override
        public List<DatasetSummary> list() {
            return scan().stream()
                    .map(Dataset::summary)
                    .sorted(
                            Comparator.comparing(DatasetSummary::id)
                                    .thenComparing(
                                            (a, b) ->
                                                    Dataset.compareVersions(
                                                            a.version(), b.version())))
                    .collect(Collectors.toList());
        }

        @Override
        public Dataset load(@Nonnull String datasetId, @Nullable String version) {
            var candidates =
                    scan().stream()
                            .filter(d -> datasetId.equals(d.id()))
                            .collect(Collectors.toList());
            Dataset dataset;
            if (version == null) {
                if (candidates.isEmpty()) {
                    throw EvalException.datasetNotFound(datasetId, null);
                }
                dataset = latest(datasetId, candidates);
            } else {
                dataset =
                        candidates.stream()
                                .filter(d -> version.equals(d.version()))
                                .findFirst()
                                .orElseThrow(
                                        () -> EvalException.datasetNotFound(datasetId, version));
            }
            requireValid(dataset);
            log.debug(
                    "loaded dataset {}@{} with {} test cases",
                    dataset.id(),
                    dataset.version(),
                    dataset.size());
            return dataset;
        }

        @Override
        public synchronized void save(@Nonnull Dataset dataset) {
            requireValid(dataset);
            var target =
                    directory.resolve("%s-%s.json".formatted(dataset.id(), dataset.version()));
            boolean exists =
                    Files.exists(target)
                            || scan().stream()
                                    .anyMatch(
                                            d ->
                                                    dataset.id().equals(d.id())
                                                            && dataset.version()
                                                                    .equals(d.version()));
            if (exists) {
                throw EvalException.of(
                        ErrorKind.DATASET_INVALID,
                        "dataset %s@%s already exists; publish a new version instead"
                                .formatted(dataset.id(), dataset.version()),
                        Map.of("datasetId", dataset.id(), "version", dataset.version()));
            }
            try {
                Files.createDirectories(directory);
                Files.writeString(target, EvalJsonMapper.toPrettyJson(dataset));
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.DATASET_INVALID,
                        "could not write dataset file %s: %s".formatted(target, e.getMessage()),
                        Map.of("file", target.toString()),
                        e);
            }
            log.info("saved dataset {}@{} to {}", dataset.id(), dataset.version(), target);
        }

        private List<Dataset> scan() {
            if (!Files.isDirectory(directory)) {
                return List.of();
            }
            try (Stream<Path> files = Files.list(directory)) {
                var datasets = new ArrayList<Dataset>();
                for (var file : files.sorted().collect(Collectors.toList())) {
                    var name = file.getFileName().toString();
                    if (!(name.endsWith(".json")
                            || name.endsWith(".yaml")
                            || name.endsWith(".yml"))) {
                        continue;
                    }
                    try {
                        datasets.add(read(file));
                    } catch (EvalException e) {
                        log.warn("skipping unreadable dataset file {}: {}", file, e.getMessage());
                    }
                }
                return datasets;
            } catch (IOException e) {
                throw EvalException.of(
                        ErrorKind.DATASET_NOT_FOUND,
                        "could not list dataset directory %s: %s"
                                .formatted(directory, e.getMessage()),
                        Map.of("directory", directory.toString()),
                        e);
            }
        }
    }

    /** Implementation for test doubling */
    @ThreadSafe
    class InMemoryImpl implements DatasetStore {
        private final Map<String, List<Dataset>> datasets = new ConcurrentHashMap<>();

        @Override
        public List<DatasetSummary> list() {
            return datasets.values().stream()
                    .flatMap(List::stream)
                    .map(Dataset::summary)
                    .sorted(Comparator.comparing(DatasetSummary::id))
                    .collect(Collectors.toList());
        }

        @Override
        public Dataset load(@Nonnull String datasetId, @Nullable String version) {
            var versions = Optional.ofNullable(datasets.get(datasetId)).orElse(List.of());
            if (versions.isEmpty()) {
                throw EvalException.datasetNotFound(datasetId, version);
            }
            if (version == null) {
                return latest(datasetId, versions);
            }
            return versions.stream()
                    .filter(d -> version.equals(d.version()))
                    .findFirst()
                    .orElseThrow(() -> EvalException.datasetNotFound(datasetId, version));
        }

        @Override
        public synchronized void save(@Nonnull Dataset dataset) {
            requireValid(dataset);
            var versions =
                    datasets.computeIfAbsent(dataset.id(), k -> new CopyOnWriteArrayList<>());
            if (versions.stream().anyMatch(d -> d.version().equals(dataset.version()))) {
                throw EvalException.of(
                        ErrorKind.DATASET_INVALID,
                        "dataset %s@%s already exists; publish a new version instead"
                                .formatted(dataset.id(), dataset.version()),
                        Map.of("datasetId", dataset.id(), "version", dataset.version()));
            }
            versions.add(dataset);
        }
    }
}
