package dev.evalkit.scorer;

import dev.evalkit.error.EvalException;
import dev.evalkit.provider.EmbeddingProvider;
import dev.evalkit.provider.ModelConfig;
import dev.evalkit.provider.ModelProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Maps scorer names to factories so runs can name their scorers in configuration.
 *
 * <p>Each {@link #create} call builds a fresh scorer, so caches such as the embedding cache are
 * scoped to the run that created them.
 */
@ThreadSafe
public final class ScorerRegistry {
    /** Builds a scorer from the options of a {@link ScorerSpec}. */
    @FunctionalInterface
    public interface Factory {
        Scorer create(Map<String, Object> options);
    }

    private final Map<String, Factory> factories = new ConcurrentHashMap<>();

    public ScorerRegistry register(String name, Factory factory) {
        factories.put(name, factory);
        return this;
    }

    public Set<String> names() {
        return new TreeSet<>(factories.keySet());
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    /**
     * @throws EvalException of kind CONFIGURATION for unknown names or invalid options
     */
    public Scorer create(ScorerSpec spec) {
        var factory = factories.get(spec.name());
        if (factory == null) {
            throw EvalException.configuration(
                    "unknown scorer '%s', known scorers: %s".formatted(spec.name(), names()));
        }
        try {
            return factory.create(spec.options());
        } catch (IllegalArgumentException e) {
            throw EvalException.configuration(
                    "invalid options for scorer '%s': %s".formatted(spec.name(), e.getMessage()));
        }
    }

    public List<Scorer> createAll(List<ScorerSpec> specs) {
        var scorers = new ArrayList<Scorer>(specs.size());
        for (var spec : specs) {
            scorers.add(create(spec));
        }
        return scorers;
    }

    /**
     * A registry with the built-in scorers.
     *
     * @param embeddings supplies the embedding provider the first time a semantic scorer is built
     * @param judge supplies the judge provider the first time an LLM judge is built
     */
    public static ScorerRegistry withDefaults(
            @Nullable Supplier<EmbeddingProvider> embeddings,
            @Nullable Supplier<ModelProvider> judge) {
        var registry = new ScorerRegistry();
        registry.register(
                ExactMatchScorer.NAME,
                options -> {
                    var o = new ScorerOptions(ExactMatchScorer.NAME, options);
                    return ExactMatchScorer.builder()
                            .ignoreKeyOrder(o.getBoolean("ignore_key_order", true))
                            .trimWhitespace(o.getBoolean("trim_whitespace", true))
                            .caseInsensitive(o.getBoolean("case_insensitive", false))
                            .ignorePaths(o.getStringList("ignore_paths"))
                            .build();
                });
        registry.register(
                SemanticSimilarityScorer.NAME,
                options -> {
                    var o = new ScorerOptions(SemanticSimilarityScorer.NAME, options);
                    if (embeddings == null) {
                        throw EvalException.configuration(
                                "scorer 'semantic_similarity' needs an embedding provider");
                    }
                    return SemanticSimilarityScorer.builder(embeddings.get())
                            .model(o.getString("model", SemanticSimilarityScorer.DEFAULT_MODEL))
                            .threshold(
                                    o.getDouble(
                                            "threshold",
                                            SemanticSimilarityScorer.DEFAULT_THRESHOLD))
                            .cacheEnabled(o.getBoolean("cache", true))
                            .cacheSize(o.getInt("cache_size", EmbeddingCache.DEFAULT_MAX_SIZE))
                            .build();
                });
        registry.register(
                LlmJudgeScorer.NAME,
                options -> {
                    var o = new ScorerOptions(LlmJudgeScorer.NAME, options);
                    if (judge == null) {
                        throw EvalException.configuration(
                                "scorer 'llm_judge' needs a judge model provider");
                    }
                    var builder =
                            LlmJudgeScorer.builder(judge.get())
                                    .judgeModel(
                                            ModelConfig.of(
                                                    o.getString(
                                                            "model",
                                                            LlmJudgeScorer.DEFAULT_JUDGE_MODEL)))
                                    .threshold(
                                            o.getDouble(
                                                    "threshold", LlmJudgeScorer.DEFAULT_THRESHOLD));
                    if (o.has("criteria")) {
                        builder.rubric(rubricFrom(o));
                    }
                    return builder.build();
                });
        registry.register(
                PrecisionRecallScorer.NAME,
                options -> {
                    var o = new ScorerOptions(PrecisionRecallScorer.NAME, options);
                    var metric =
                            PrecisionRecallScorer.Metric.valueOf(
                                    o.getString("metric", "f1").toUpperCase(Locale.ROOT));
                    return new PrecisionRecallScorer(
                            metric,
                            o.getDouble("min_score", PrecisionRecallScorer.DEFAULT_MIN_SCORE));
                });
        registry.register(
                "recall_at_k",
                options -> {
                    var o = new ScorerOptions("recall_at_k", options);
                    if (o.has("preset")) {
                        return RecallPreset.fromName(o.getString("preset", "rag")).scorer();
                    }
                    return new RecallAtKScorer(
                            o.getInt("k", RecallPreset.RAG.k()),
                            o.getDouble("min_recall", RecallAtKScorer.DEFAULT_MIN_RECALL));
                });
        return registry;
    }

    /** Reads {@code criteria: {name: weight}} and optional {@code instructions}. */
    private static Rubric rubricFrom(ScorerOptions o) {
        if (!(o.raw("criteria") instanceof Map<?, ?> criteria) || criteria.isEmpty()) {
            throw new IllegalArgumentException("criteria must map criterion names to weights");
        }
        var list = new ArrayList<Rubric.Criterion>();
        for (var entry : criteria.entrySet()) {
            if (!(entry.getValue() instanceof Number weight)) {
                throw new IllegalArgumentException(
                        "weight of criterion '%s' must be a number".formatted(entry.getKey()));
            }
            list.add(
                    new Rubric.Criterion(
                            String.valueOf(entry.getKey()), "", weight.doubleValue()));
        }
        return new Rubric(list, o.getString("instructions", ""));
    }
}
