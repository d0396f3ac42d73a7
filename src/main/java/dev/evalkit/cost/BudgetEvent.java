package dev.evalkit.cost;

import java.time.Instant;

/** Raised the first time a budget window crosses its alert threshold or its limit. */
public record BudgetEvent(
        Type type,
        BudgetPeriod period,
        double spendUsd,
        double limitUsd,
        double percentUsed,
        Instant windowStart,
        String runId,
        String datasetId) {

    public enum Type {
        THRESHOLD_CROSSED,
        EXCEEDED
    }
}
