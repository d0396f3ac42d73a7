package dev.evalkit.scorer;

import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import dev.evalkit.provider.EmbeddingProvider;
import java.util.LinkedHashMap;
import java.util.Objects;
import javax.annotation.Nullable;

/** Cosine similarity between embeddings of the actual and expected text. */
public final class SemanticSimilarityScorer implements Scorer {
    public static final String NAME = "semantic_similarity";
    public static final double DEFAULT_THRESHOLD = 0.85;
    public static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final EmbeddingProvider embeddings;
    private final String model;
    private final double threshold;
    private final EmbeddingCache cache;

    private SemanticSimilarityScorer(Builder builder) {
        this.embeddings = Objects.requireNonNull(builder.embeddings, "embedding provider");
        this.model = builder.model;
        this.threshold = builder.threshold;
        this.cache = new EmbeddingCache(builder.cacheSize, builder.cacheEnabled);
    }

    public static Builder builder(EmbeddingProvider embeddings) {
        return new Builder(embeddings);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ScorerResult score(
            @Nullable Object actual, @Nullable Object expected, ScoringContext context) {
        var actualText = asText(actual);
        var expectedText = asText(expected);
        if (actualText.isBlank() || expectedText.isBlank()) {
            boolean bothBlank = actualText.isBlank() && expectedText.isBlank();
            return ScorerResult.of(
                    NAME,
                    bothBlank ? 1.0 : 0.0,
                    bothBlank,
                    bothBlank ? "Both values are empty" : "One value is empty");
        }
        var actualVector = embed(actualText);
        var expectedVector = embed(expectedText);
        double similarity = ScorerResult.clamp(cosine(actualVector, expectedVector));
        boolean passed = similarity >= threshold;
        var reason =
                "Semantic similarity %.1f%% %s threshold %.1f%%"
                        .formatted(
                                similarity * 100,
                                passed ? "meets" : "is below",
                                threshold * 100);
        var breakdown = new LinkedHashMap<String, Double>();
        breakdown.put("similarity", similarity);
        breakdown.put("threshold", threshold);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("model", model);
        return new ScorerResult(NAME, similarity, passed, reason, breakdown, metadata);
    }

    public int cacheSize() {
        return cache.size();
    }

    public boolean cacheEnabled() {
        return cache.enabled();
    }

    public void clearCache() {
        cache.clear();
    }

    EmbeddingCache cache() {
        return cache;
    }

    private double[] embed(String text) {
        return cache.getOrCompute(model, text, () -> embeddings.embed(text, model));
    }

    /** Cosine similarity; zero vectors are dissimilar to everything. */
    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw EvalException.scoring(
                    NAME,
                    "embedding dimensions differ: %d vs %d".formatted(a.length, b.length));
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static String asText(@Nullable Object value) {
        if (value == null) {
            return "";
        } else if (value instanceof String text) {
            return text;
        }
        return EvalJsonMapper.toJson(value);
    }

    public static final class Builder {
        private final EmbeddingProvider embeddings;
        private String model = DEFAULT_MODEL;
        private double threshold = DEFAULT_THRESHOLD;
        private int cacheSize = EmbeddingCache.DEFAULT_MAX_SIZE;
        private boolean cacheEnabled = true;

        private Builder(EmbeddingProvider embeddings) {
            this.embeddings = embeddings;
        }

        public Builder model(String model) {
            this.model = Objects.requireNonNull(model);
            return this;
        }

        public Builder threshold(double threshold) {
            if (threshold < 0 || threshold > 1) {
                throw new IllegalArgumentException("threshold must be within [0,1]: " + threshold);
            }
            this.threshold = threshold;
            return this;
        }

        public Builder cacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public SemanticSimilarityScorer build() {
            return new SemanticSimilarityScorer(this);
        }
    }
}
