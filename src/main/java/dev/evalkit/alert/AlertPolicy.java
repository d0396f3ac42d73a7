package dev.evalkit.alert;

import dev.evalkit.baseline.Severity;
import java.util.Map;

/**
 * Decides which alerts are delivered and where.
 *
 * <p>CRITICAL alerts always go to every channel. A regression below {@code
 * minRegressionSeverity} is suppressed. Otherwise a channel receives an alert when the alert's
 * level is at least the channel's minimum level, INFO when the channel has no entry.
 */
public record AlertPolicy(Severity minRegressionSeverity, Map<String, AlertLevel> channelMinLevel) {
    public static final AlertPolicy DEFAULT = new AlertPolicy(Severity.MINOR, Map.of());

    public AlertPolicy {
        channelMinLevel = Map.copyOf(channelMinLevel);
    }

    public static AlertPolicy of(Severity minRegressionSeverity) {
        return new AlertPolicy(minRegressionSeverity, Map.of());
    }

    public boolean suppressed(Alert alert) {
        if (alert.level() == AlertLevel.CRITICAL) {
            return false;
        }
        return alert.type() == AlertType.REGRESSION
                && alert.severity().map(s -> !s.atLeast(minRegressionSeverity)).orElse(false);
    }

    public boolean routes(Alert alert, NotificationChannel channel) {
        if (alert.level() == AlertLevel.CRITICAL) {
            return true;
        }
        var min = channelMinLevel.getOrDefault(channel.name(), AlertLevel.INFO);
        return alert.level().compareTo(min) >= 0;
    }
}
