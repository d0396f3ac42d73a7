package dev.evalkit.scorer;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import dev.evalkit.provider.EmbeddingProvider;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SemanticSimilarityScorerTest {
    private final AtomicInteger calls = new AtomicInteger();

    private final Map<String, double[]> vectors =
            Map.of(
                    "The cat sat on the mat", new double[] {1.0, 0.0, 0.0},
                    "A cat was sitting on the mat", new double[] {0.95, 0.31, 0.0},
                    "Stock prices fell sharply", new double[] {0.0, 0.0, 1.0},
                    "opposite", new double[] {-1.0, 0.0, 0.0},
                    "zero", new double[] {0.0, 0.0, 0.0});

    private final EmbeddingProvider embeddings =
            (text, model) -> {
                calls.incrementAndGet();
                var vector = vectors.get(text);
                return vector != null ? vector : new double[] {0.5, 0.5, 0.5};
            };

    @Test
    void paraphrasePassesDefaultThreshold() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).build();
        var result =
                scorer.score(
                        "A cat was sitting on the mat",
                        "The cat sat on the mat",
                        ScoringContext.empty());
        assertTrue(result.score() > 0.9, "score was " + result.score());
        assertTrue(result.passed());
        assertTrue(result.reason().contains("meets threshold 85.0%"), result.reason());
        assertEquals(SemanticSimilarityScorer.DEFAULT_MODEL, result.metadata().get("model"));
    }

    @Test
    void unrelatedTextFails() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).build();
        var result =
                scorer.score(
                        "Stock prices fell sharply",
                        "The cat sat on the mat",
                        ScoringContext.empty());
        assertEquals(0.0, result.score(), 1e-9);
        assertFalse(result.passed());
        assertTrue(result.reason().contains("is below threshold"), result.reason());
    }

    @Test
    void negativeSimilarityClampsToZero() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).build();
        var result = scorer.score("opposite", "The cat sat on the mat", ScoringContext.empty());
        assertEquals(0.0, result.score());
    }

    @Test
    void zeroVectorIsDissimilar() {
        assertEquals(
                0.0,
                SemanticSimilarityScorer.cosine(new double[] {0, 0}, new double[] {1, 1}));
    }

    @Test
    void dimensionMismatchIsAScoringError() {
        var error =
                assertThrows(
                        EvalException.class,
                        () ->
                                SemanticSimilarityScorer.cosine(
                                        new double[] {1, 0}, new double[] {1, 0, 0}));
        assertEquals(ErrorKind.SCORING, error.kind());
    }

    @Test
    void blankValues() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).build();
        assertTrue(scorer.score("", "  ", ScoringContext.empty()).passed());
        var oneBlank = scorer.score("", "The cat sat on the mat", ScoringContext.empty());
        assertFalse(oneBlank.passed());
        assertEquals(0.0, oneBlank.score());
        assertEquals(0, calls.get());
    }

    @Test
    void embeddingsAreCached() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).build();
        var ctx = ScoringContext.empty();
        scorer.score("A cat was sitting on the mat", "The cat sat on the mat", ctx);
        scorer.score("A cat was sitting on the mat", "The cat sat on the mat", ctx);

        assertEquals(2, calls.get());
        assertEquals(2, scorer.cacheSize());
        assertTrue(scorer.cacheEnabled());

        scorer.clearCache();
        assertEquals(0, scorer.cacheSize());
    }

    @Test
    void cacheCanBeDisabled() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).cacheEnabled(false).build();
        var ctx = ScoringContext.empty();
        scorer.score("A cat was sitting on the mat", "The cat sat on the mat", ctx);
        scorer.score("A cat was sitting on the mat", "The cat sat on the mat", ctx);
        assertEquals(4, calls.get());
        assertEquals(0, scorer.cacheSize());
        assertFalse(scorer.cacheEnabled());
    }

    @Test
    void customThreshold() {
        var scorer = SemanticSimilarityScorer.builder(embeddings).threshold(0.99).build();
        var result =
                scorer.score(
                        "A cat was sitting on the mat",
                        "The cat sat on the mat",
                        ScoringContext.empty());
        assertFalse(result.passed());
        assertThrows(
                IllegalArgumentException.class,
                () -> SemanticSimilarityScorer.builder(embeddings).threshold(1.5));
    }
}
