package dev.evalkit.alert;

import java.net.URI;
import java.time.Duration;

/** Posts the alert JSON to a webhook URL. */
public final class WebhookChannel implements NotificationChannel {
    public static final String NAME = "webhook";

    private final URI url;
    private final JsonPoster poster;

    public WebhookChannel(String url, Duration timeout) {
        this(url, new JsonPoster(timeout));
    }

    WebhookChannel(String url, JsonPoster poster) {
        this.url = URI.create(url);
        this.poster = poster;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(Alert alert) {
        poster.post(NAME, url, alert, null);
    }
}
