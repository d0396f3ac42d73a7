package dev.evalkit.orchestrator;

import dev.evalkit.eval.PassPolicy;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.scorer.ScorerSpec;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * What to evaluate.
 *
 * @param datasetVersion exact version to load, or null for the latest
 */
public record RunRequest(
        String datasetId,
        @Nullable String datasetVersion,
        ModelConfig model,
        List<ScorerSpec> scorers,
        PassPolicy passPolicy) {

    public RunRequest {
        Objects.requireNonNull(datasetId, "datasetId");
        Objects.requireNonNull(model, "model");
        scorers = List.copyOf(scorers);
        passPolicy = passPolicy == null ? PassPolicy.ALL : passPolicy;
    }

    public static RunRequest of(String datasetId, ModelConfig model, List<ScorerSpec> scorers) {
        return new RunRequest(datasetId, null, model, scorers, PassPolicy.ALL);
    }

    public RunRequest withModel(ModelConfig other) {
        return new RunRequest(datasetId, datasetVersion, other, scorers, passPolicy);
    }
}
