package dev.evalkit.orchestrator;

import dev.evalkit.provider.ModelConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Several models run on the same dataset.
 *
 * @param ranking best first: by accuracy, then by average score
 * @param winners per test case id, the model with the highest aggregate score. Ties go to the
 *     model listed first in the request
 * @param wins per model, the number of test cases it won
 */
public record ModelComparison(
        String datasetId,
        List<Entry> ranking,
        Map<String, String> winners,
        Map<String, Integer> wins) {

    public ModelComparison {
        ranking = List.copyOf(ranking);
        winners = Collections.unmodifiableMap(new LinkedHashMap<>(winners));
        wins = Collections.unmodifiableMap(new LinkedHashMap<>(wins));
    }

    public Entry best() {
        return ranking.get(0);
    }

    public record Entry(
            ModelConfig model,
            String runId,
            double accuracy,
            double avgScore,
            double avgLatencyMs,
            double totalCostUsd) {}
}
