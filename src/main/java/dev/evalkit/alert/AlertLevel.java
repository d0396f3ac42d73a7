package dev.evalkit.alert;

import dev.evalkit.baseline.Severity;

/** Declared from least to most urgent. */
public enum AlertLevel {
    INFO,
    WARNING,
    CRITICAL;

    public static AlertLevel of(Severity severity) {
        return switch (severity) {
            case MINOR -> INFO;
            case MAJOR -> WARNING;
            case CRITICAL -> CRITICAL;
        };
    }
}
