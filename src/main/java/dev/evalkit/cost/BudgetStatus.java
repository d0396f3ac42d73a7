package dev.evalkit.cost;

import java.time.Instant;

public record BudgetStatus(
        BudgetPeriod period,
        Instant windowStart,
        double limitUsd,
        double usedUsd,
        double remainingUsd,
        double percentUsed,
        boolean exceeded) {}
