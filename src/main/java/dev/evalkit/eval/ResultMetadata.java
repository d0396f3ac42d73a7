package dev.evalkit.eval;

import java.time.Instant;
import java.util.Optional;

/** Execution facts recorded with each test case result. */
public record ResultMetadata(
        String modelId,
        long latencyMs,
        double costUsd,
        Instant timestampUtc,
        /** Set when the model could not produce an output for this test case. */
        Optional<String> error,
        long promptTokens,
        long completionTokens,
        /** Number of model invocations made, including retries. */
        int attempts) {

    public ResultMetadata {
        error = error == null ? Optional.empty() : error;
    }

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
