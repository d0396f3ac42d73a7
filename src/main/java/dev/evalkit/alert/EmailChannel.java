package dev.evalkit.alert;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sends alerts through an HTTP email API that accepts {@code {from, to, subject, text}} with a
 * bearer key.
 */
public final class EmailChannel implements NotificationChannel {
    public static final String NAME = "email";

    private final URI apiUrl;
    private final String apiKey;
    private final String from;
    private final List<String> to;
    private final JsonPoster poster;

    public EmailChannel(
            String apiUrl, String apiKey, String from, List<String> to, Duration timeout) {
        this(apiUrl, apiKey, from, to, new JsonPoster(timeout));
    }

    EmailChannel(String apiUrl, String apiKey, String from, List<String> to, JsonPoster poster) {
        if (to.isEmpty()) {
            throw new IllegalArgumentException("email channel needs at least one recipient");
        }
        this.apiUrl = URI.create(apiUrl);
        this.apiKey = Objects.requireNonNull(apiKey);
        this.from = from;
        this.to = List.copyOf(to);
        this.poster = poster;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(Alert alert) {
        poster.post(
                NAME,
                apiUrl,
                Map.of("from", from, "to", to, "subject", subject(alert), "text", body(alert)),
                apiKey);
    }

    static String subject(Alert alert) {
        return "[evalkit %s] %s".formatted(alert.level(), alert.title());
    }

    static String body(Alert alert) {
        var text = new StringBuilder(alert.message()).append("\n\n");
        alert.datasetId().ifPresent(v -> text.append("Dataset: ").append(v).append('\n'));
        alert.runId().ifPresent(v -> text.append("Run: ").append(v).append('\n'));
        alert.metric().ifPresent(v -> text.append("Metric: ").append(v).append('\n'));
        alert.delta().ifPresent(v -> text.append("Delta: ").append(v).append('\n'));
        alert.spendUsd().ifPresent(v -> text.append("Spend: $").append(v).append('\n'));
        alert.limitUsd().ifPresent(v -> text.append("Limit: $").append(v).append('\n'));
        alert.reportUrl().ifPresent(v -> text.append("Report: ").append(v).append('\n'));
        text.append("Time: ").append(alert.timestamp()).append('\n');
        return text.toString();
    }
}
