package dev.evalkit.cost;

import dev.evalkit.error.EvalException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A spending limit for one period.
 *
 * @param period the window the limit applies to
 * @param limitUsd maximum spend per window, strictly positive
 * @param alertThresholdPercent percentage of the limit at which a warning is raised, in (0, 100]
 */
public record Budget(BudgetPeriod period, double limitUsd, double alertThresholdPercent) {
    public static final double DEFAULT_ALERT_THRESHOLD_PERCENT = 80.0;

    public Budget {
        var problems = problems(period, limitUsd, alertThresholdPercent);
        if (!problems.isEmpty()) {
            throw EvalException.configuration("invalid budget", problems);
        }
    }

    public static Budget of(BudgetPeriod period, double limitUsd) {
        return new Budget(period, limitUsd, DEFAULT_ALERT_THRESHOLD_PERCENT);
    }

    /** Problems with these budget settings, empty when they are usable. */
    public static List<String> problems(
            @Nullable BudgetPeriod period, double limitUsd, double alertThresholdPercent) {
        var problems = new ArrayList<String>();
        if (period == null) {
            problems.add("budget period is required");
        }
        if (!(limitUsd > 0)) {
            problems.add("budget limit_usd must be > 0, got " + limitUsd);
        }
        if (!(alertThresholdPercent > 0 && alertThresholdPercent <= 100)) {
            problems.add(
                    "budget alert_threshold_percent must be in (0, 100], got "
                            + alertThresholdPercent);
        }
        return problems;
    }
}
