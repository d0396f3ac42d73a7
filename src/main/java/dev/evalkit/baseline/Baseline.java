package dev.evalkit.baseline;

import java.time.Instant;

/** A snapshot of a completed run's metrics used as the comparison point for later runs. */
public record Baseline(
        String id,
        String runId,
        String datasetId,
        String datasetVersion,
        String name,
        BaselineMetrics metrics,
        boolean active,
        Instant capturedAt) {

    Baseline deactivated() {
        return new Baseline(
                id, runId, datasetId, datasetVersion, name, metrics, false, capturedAt);
    }
}
