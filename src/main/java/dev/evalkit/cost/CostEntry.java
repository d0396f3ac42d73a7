package dev.evalkit.cost;

import java.time.Instant;

/** Spend attributed to a single test case execution. */
public record CostEntry(
        String runId,
        String testCaseId,
        String modelId,
        String datasetId,
        double costUsd,
        long promptTokens,
        long completionTokens,
        Instant timestamp) {

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
