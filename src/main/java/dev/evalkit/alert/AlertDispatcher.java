package dev.evalkit.alert;

import dev.evalkit.baseline.Regression;
import dev.evalkit.cost.BudgetEvent;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns regressions, budget events and run failures into notifications.
 *
 * <p>Each channel is tried independently. A channel that throws is recorded as a failed delivery
 * and the remaining channels are still tried. Every dispatched alert lands in a bounded history,
 * whether or not it was delivered or suppressed.
 */
@Slf4j
@ThreadSafe
public final class AlertDispatcher {
    public static final int DEFAULT_HISTORY_SIZE = 100;

    private final List<NotificationChannel> channels;
    private final AlertPolicy policy;
    private final Optional<String> dashboardUrl;
    private final Clock clock;
    private final int historySize;
    private final Deque<AlertRecord> history = new ArrayDeque<>();

    private AlertDispatcher(Builder builder) {
        this.channels = List.copyOf(builder.channels);
        this.policy = builder.policy;
        this.dashboardUrl = Optional.ofNullable(builder.dashboardUrl);
        this.clock = builder.clock;
        this.historySize = builder.historySize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> channelNames() {
        return channels.stream().map(NotificationChannel::name).toList();
    }

    public AlertRecord dispatch(Alert alert) {
        var deliveries = new ArrayList<DeliveryResult>();
        boolean suppressed = policy.suppressed(alert);
        if (suppressed) {
            log.debug("suppressed {} alert: {}", alert.level(), alert.title());
        } else {
            for (var channel : channels) {
                if (!policy.routes(alert, channel)) {
                    continue;
                }
                deliveries.add(deliver(channel, alert));
            }
        }
        var record = new AlertRecord(alert, suppressed, deliveries);
        synchronized (history) {
            history.addFirst(record);
            while (history.size() > historySize) {
                history.removeLast();
            }
        }
        return record;
    }

    private static DeliveryResult deliver(NotificationChannel channel, Alert alert) {
        try {
            channel.send(alert);
            return DeliveryResult.ok(channel.name());
        } catch (RuntimeException e) {
            log.warn("alert delivery via {} failed: {}", channel.name(), e.getMessage());
            log.debug("alert delivery failure", e);
            return DeliveryResult.failed(channel.name(), String.valueOf(e.getMessage()));
        }
    }

    public List<AlertRecord> regressions(
            List<Regression> regressions, String datasetId, String runId) {
        var records = new ArrayList<AlertRecord>();
        for (var regression : regressions) {
            records.add(
                    dispatch(
                            Alert.regression(
                                    regression, datasetId, runId, dashboardUrl, clock.instant())));
        }
        return records;
    }

    public List<AlertRecord> budgetEvents(List<BudgetEvent> events) {
        var records = new ArrayList<AlertRecord>();
        for (var event : events) {
            records.add(dispatch(Alert.budget(event, dashboardUrl, clock.instant())));
        }
        return records;
    }

    public AlertRecord runFailure(String datasetId, @Nullable String runId, String reason) {
        return dispatch(Alert.runFailure(datasetId, runId, reason, dashboardUrl, clock.instant()));
    }

    /** Newest first. */
    public List<AlertRecord> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /** The {@code limit} most recent alerts, newest first. */
    public List<AlertRecord> history(int limit) {
        synchronized (history) {
            return history.stream().limit(limit).toList();
        }
    }

    public static final class Builder {
        private final List<NotificationChannel> channels = new ArrayList<>();
        private AlertPolicy policy = AlertPolicy.DEFAULT;
        private @Nullable String dashboardUrl;
        private Clock clock = Clock.systemUTC();
        private int historySize = DEFAULT_HISTORY_SIZE;

        private Builder() {}

        public Builder channel(NotificationChannel channel) {
            channels.add(channel);
            return this;
        }

        public Builder policy(AlertPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder dashboardUrl(@Nullable String dashboardUrl) {
            this.dashboardUrl = dashboardUrl;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder historySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public AlertDispatcher build() {
            if (historySize < 1) {
                throw new IllegalArgumentException("history size must be >= 1");
            }
            return new AlertDispatcher(this);
        }
    }
}
