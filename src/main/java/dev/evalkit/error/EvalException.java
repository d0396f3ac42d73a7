package dev.evalkit.error;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The single unchecked exception type of the engine.
 *
 * <p>Callers branch on {@link #kind()} rather than on subclasses. Structured details (dataset id,
 * model, status code, validation problems) travel in {@link #context()}.
 */
public final class EvalException extends RuntimeException {
    private final @Nonnull ErrorKind kind;
    private final @Nonnull Map<String, Object> context;
    private final @Nullable Duration retryAfter;

    private EvalException(
            @Nonnull ErrorKind kind,
            @Nonnull String message,
            @Nonnull Map<String, Object> context,
            @Nullable Duration retryAfter,
            @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.retryAfter = retryAfter;
    }

    public static EvalException of(ErrorKind kind, String message) {
        return new EvalException(kind, message, Map.of(), null, null);
    }

    public static EvalException of(ErrorKind kind, String message, Map<String, ?> context) {
        return new EvalException(kind, message, copy(context), null, null);
    }

    public static EvalException of(
            ErrorKind kind, String message, Map<String, ?> context, @Nullable Throwable cause) {
        return new EvalException(kind, message, copy(context), null, cause);
    }

    public static EvalException datasetInvalid(String datasetId, List<String> problems) {
        return of(
                ErrorKind.DATASET_INVALID,
                "dataset '%s' failed validation with %d error(s): %s"
                        .formatted(datasetId, problems.size(), String.join("; ", problems)),
                Map.of("datasetId", datasetId, "errors", List.copyOf(problems)));
    }

    public static EvalException datasetNotFound(String datasetId, @Nullable String version) {
        var context = new LinkedHashMap<String, Object>();
        context.put("datasetId", datasetId);
        if (version != null) {
            context.put("version", version);
        }
        return of(
                ErrorKind.DATASET_NOT_FOUND,
                version == null
                        ? "dataset not found: " + datasetId
                        : "dataset not found: %s@%s".formatted(datasetId, version),
                context);
    }

    public static EvalException rateLimited(
            String model, @Nullable Duration retryAfter, @Nullable Throwable cause) {
        return new EvalException(
                ErrorKind.MODEL_RATE_LIMITED,
                "rate limited by provider for model " + model,
                Map.of("model", model),
                retryAfter,
                cause);
    }

    public static EvalException timeout(String model, Duration timeout) {
        return of(
                ErrorKind.MODEL_TIMEOUT,
                "model %s did not respond within %d ms".formatted(model, timeout.toMillis()),
                Map.of("model", model, "timeoutMs", timeout.toMillis()));
    }

    public static EvalException scoring(String scorerName, String message) {
        return of(ErrorKind.SCORING, message, Map.of("scorer", scorerName));
    }

    public static EvalException configuration(String message) {
        return of(ErrorKind.CONFIGURATION, message);
    }

    public static EvalException configuration(String message, List<String> problems) {
        return of(
                ErrorKind.CONFIGURATION,
                message + ": " + String.join("; ", problems),
                Map.of("errors", List.copyOf(problems)));
    }

    public @Nonnull ErrorKind kind() {
        return kind;
    }

    public @Nonnull Map<String, Object> context() {
        return context;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    public int httpStatus() {
        return kind.httpStatus();
    }

    /** Provider supplied hint for how long to wait before retrying. */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /** One-line categorized message, e.g. {@code error[dataset]: dataset not found: qa}. */
    public String describe() {
        return "error[%s]: %s".formatted(kind.category().label(), getMessage());
    }

    private static Map<String, Object> copy(Map<String, ?> context) {
        return context == null ? Map.of() : new LinkedHashMap<>(context);
    }
}
