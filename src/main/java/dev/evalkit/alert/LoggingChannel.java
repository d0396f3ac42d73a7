package dev.evalkit.alert;

import lombok.extern.slf4j.Slf4j;

/** Writes alerts to the log. Always configured. */
@Slf4j
public final class LoggingChannel implements NotificationChannel {
    public static final String NAME = "console";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(Alert alert) {
        switch (alert.level()) {
            case CRITICAL, WARNING ->
                    log.warn("[{}] {}: {}", alert.level(), alert.title(), alert.message());
            case INFO -> log.info("[{}] {}: {}", alert.level(), alert.title(), alert.message());
        }
    }
}
