package dev.evalkit.alert;

/** A transport that delivers alerts. Implementations throw when delivery fails. */
public interface NotificationChannel {
    String name();

    void send(Alert alert);
}
