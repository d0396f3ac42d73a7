package dev.evalkit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds, reads, validates and writes {@link EvalSettings}.
 *
 * <p>Resolution order: an explicit path, then {@code evalkit.yaml}, {@code evalkit.yml} and
 * {@code evalkit.json} in the working directory, then built-in defaults.
 */
@Slf4j
public final class SettingsLoader {
    public static final List<String> DEFAULT_FILE_NAMES =
            List.of("evalkit.yaml", "evalkit.yml", "evalkit.json");

    private SettingsLoader() {}

    /** The settings file to use, empty when defaults apply. */
    public static Optional<Path> resolve(@Nullable Path explicit, Path workingDir) {
        if (explicit != null) {
            if (!Files.isRegularFile(explicit)) {
                throw EvalException.configuration("settings file not found: " + explicit);
            }
            return Optional.of(explicit);
        }
        return DEFAULT_FILE_NAMES.stream()
                .map(workingDir::resolve)
                .filter(Files::isRegularFile)
                .findFirst();
    }

    /** Resolves, reads and validates settings. */
    public static EvalSettings load(@Nullable Path explicit, Path workingDir) {
        var path = resolve(explicit, workingDir);
        if (path.isEmpty()) {
            log.debug("no settings file in {}, using defaults", workingDir);
            return EvalSettings.defaults();
        }
        log.debug("loading settings from {}", path.get());
        return validate(read(path.get()));
    }

    public static EvalSettings read(Path path) {
        try {
            var content = Files.readString(path);
            if (content.isBlank()) {
                return EvalSettings.defaults();
            }
            var settings = mapperFor(path).readValue(content, EvalSettings.class);
            return settings == null ? EvalSettings.defaults() : settings;
        } catch (IOException e) {
            var cause = e.getCause() instanceof EvalException evalException ? evalException : e;
            throw EvalException.configuration(
                    "could not read settings file %s: %s".formatted(path, cause.getMessage()));
        }
    }

    /** Returns {@code settings} unchanged, or throws one error listing every problem. */
    public static EvalSettings validate(EvalSettings settings) {
        var problems = settings.problems();
        if (!problems.isEmpty()) {
            throw EvalException.configuration("invalid settings", problems);
        }
        return settings;
    }

    /** Writes {@code settings} to a new file. An existing file is never overwritten. */
    public static void write(Path path, EvalSettings settings) {
        if (Files.exists(path)) {
            throw EvalException.configuration("settings file already exists: " + path);
        }
        try {
            Files.writeString(path, render(settings, path));
        } catch (IOException e) {
            throw EvalException.configuration(
                    "could not write settings file %s: %s".formatted(path, e.getMessage()));
        }
    }

    /** Settings serialized in the format matching {@code path}'s extension. */
    public static String render(EvalSettings settings, Path path) {
        return isJson(path)
                ? EvalJsonMapper.toPrettyJson(settings)
                : EvalJsonMapper.toYaml(settings);
    }

    private static ObjectMapper mapperFor(Path path) {
        return isJson(path) ? EvalJsonMapper.get() : EvalJsonMapper.yaml();
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().toLowerCase().endsWith(".json");
    }
}
