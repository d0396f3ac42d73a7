package dev.evalkit.alert;

import dev.evalkit.EvalKitUtils;
import dev.evalkit.baseline.Regression;
import dev.evalkit.baseline.Severity;
import dev.evalkit.cost.BudgetEvent;
import dev.evalkit.cost.BudgetPeriod;
import java.net.URI;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * An outbound notification. This is also the webhook payload, so optional fields are left out of
 * the JSON when absent.
 *
 * @param severity regression severity, only for {@link AlertType#REGRESSION}
 * @param reportUrl deep link to the run's report, when a dashboard URL is configured
 */
public record Alert(
        String id,
        AlertType type,
        AlertLevel level,
        String title,
        String message,
        Optional<String> datasetId,
        Optional<String> runId,
        Optional<Severity> severity,
        Optional<String> metric,
        Optional<Double> baselineValue,
        Optional<Double> currentValue,
        Optional<Double> delta,
        Optional<Double> spendUsd,
        Optional<Double> limitUsd,
        Optional<BudgetPeriod> period,
        Optional<String> reportUrl,
        Instant timestamp) {

    public static Alert regression(
            Regression regression,
            String datasetId,
            String runId,
            Optional<String> dashboardUrl,
            Instant timestamp) {
        return new Alert(
                newId(),
                AlertType.REGRESSION,
                AlertLevel.of(regression.severity()),
                "%s regression in %s".formatted(regression.severity(), regression.metric()),
                "%s on dataset %s moved from %.4f to %.4f (%+.1f%%)"
                        .formatted(
                                regression.metric(),
                                datasetId,
                                regression.baselineValue(),
                                regression.currentValue(),
                                regression.percentChange()),
                Optional.of(datasetId),
                Optional.of(runId),
                Optional.of(regression.severity()),
                Optional.of(regression.metric()),
                Optional.of(regression.baselineValue()),
                Optional.of(regression.currentValue()),
                Optional.of(regression.delta()),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                reportUrl(dashboardUrl, runId),
                timestamp);
    }

    public static Alert budget(
            BudgetEvent event, Optional<String> dashboardUrl, Instant timestamp) {
        boolean exceeded = event.type() == BudgetEvent.Type.EXCEEDED;
        return new Alert(
                newId(),
                exceeded ? AlertType.BUDGET_EXCEEDED : AlertType.BUDGET_THRESHOLD,
                exceeded ? AlertLevel.CRITICAL : AlertLevel.WARNING,
                exceeded
                        ? "%s budget exceeded".formatted(event.period().label())
                        : "%s budget at %.0f%%"
                                .formatted(event.period().label(), event.percentUsed()),
                "Spent $%.2f of $%.2f for the %s window starting %s"
                        .formatted(
                                event.spendUsd(),
                                event.limitUsd(),
                                event.period().label(),
                                event.windowStart()),
                Optional.ofNullable(event.datasetId()),
                Optional.ofNullable(event.runId()),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.of(event.spendUsd()),
                Optional.of(event.limitUsd()),
                Optional.of(event.period()),
                reportUrl(dashboardUrl, event.runId()),
                timestamp);
    }

    public static Alert runFailure(
            String datasetId,
            @Nullable String runId,
            String reason,
            Optional<String> dashboardUrl,
            Instant timestamp) {
        return new Alert(
                newId(),
                AlertType.RUN_FAILURE,
                AlertLevel.CRITICAL,
                "Evaluation run failed for " + datasetId,
                reason,
                Optional.of(datasetId),
                Optional.ofNullable(runId),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                reportUrl(dashboardUrl, runId),
                timestamp);
    }

    private static Optional<String> reportUrl(
            Optional<String> dashboardUrl, @Nullable String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return EvalKitUtils.reportUri(dashboardUrl, runId).map(URI::toString);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
