package dev.evalkit.alert;

import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Synchronous JSON POST shared by the HTTP channels. Non-2xx responses are delivery errors. */
@Slf4j
final class JsonPoster {
    private final HttpClient httpClient;
    private final Duration timeout;

    JsonPoster(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), timeout);
    }

    JsonPoster(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    void post(String channel, URI uri, Object body, @Nullable String bearerToken) {
        var builder =
                HttpRequest.newBuilder()
                        .uri(uri)
                        .header("Content-Type", "application/json")
                        .header("Accept", "application/json")
                        .timeout(timeout)
                        .POST(HttpRequest.BodyPublishers.ofString(EvalJsonMapper.toJson(body)));
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        var request = builder.build();
        log.debug("{} request: {} {}", channel, request.method(), request.uri());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw EvalException.of(
                    ErrorKind.DELIVERY,
                    "%s delivery to %s failed: %s".formatted(channel, uri, e.getMessage()),
                    Map.of("channel", channel),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw EvalException.of(
                    ErrorKind.DELIVERY,
                    "%s delivery interrupted".formatted(channel),
                    Map.of("channel", channel),
                    e);
        }

        log.debug("{} response: {} - {}", channel, response.statusCode(), response.body());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw EvalException.of(
                    ErrorKind.DELIVERY,
                    "%s delivery failed with status %d: %s"
                            .formatted(channel, response.statusCode(), response.body()),
                    Map.of("channel", channel, "status", response.statusCode()));
        }
    }
}
