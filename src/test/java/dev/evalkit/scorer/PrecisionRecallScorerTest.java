package dev.evalkit.scorer;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalkit.error.ErrorKind;
import dev.evalkit.error.EvalException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PrecisionRecallScorerTest {
    private final ScoringContext ctx = ScoringContext.empty();

    @Test
    void confusionMatrixStatistics() {
        var matrix = new PrecisionRecallScorer.ConfusionMatrix(4, 2, 3, 1);
        assertEquals(4.0 / 6, matrix.precision(), 1e-9);
        assertEquals(4.0 / 5, matrix.recall(), 1e-9);
        assertEquals(0.7273, matrix.f1(), 1e-4);
        assertEquals(0.7, matrix.accuracy(), 1e-9);
    }

    @Test
    void scoresBinaryPredictions() {
        var predictions = List.of(1, 1, 0, 0, 1, 0, 1, 0, 0, 1);
        var labels = List.of(1, 1, 1, 0, 0, 0, 1, 0, 0, 0);

        var result = PrecisionRecallScorer.of().score(predictions, labels, ctx);

        assertEquals(3.0, result.breakdown().get("tp"));
        assertEquals(2.0, result.breakdown().get("fp"));
        assertEquals(4.0, result.breakdown().get("tn"));
        assertEquals(1.0, result.breakdown().get("fn"));
        assertEquals(0.6, result.breakdown().get("precision"), 1e-9);
        assertEquals(0.75, result.breakdown().get("recall"), 1e-9);
        assertEquals(2.0 / 3, result.score(), 1e-9);
        assertTrue(result.passed());
    }

    @Test
    void acceptsPredictionsAndLabelsInOneMap() {
        var actual =
                Map.of(
                        "predictions", List.of(true, false, true),
                        "labels", List.of(true, false, false));
        var result = PrecisionRecallScorer.of().score(actual, null, ctx);
        assertEquals(1.0, result.breakdown().get("tp"));
        assertEquals(1.0, result.breakdown().get("fp"));
    }

    @Test
    void parsesJsonTextAndStringLabels() {
        var result =
                PrecisionRecallScorer.of()
                        .score("[\"yes\", \"no\", \"positive\"]", List.of("true", "0", "1"), ctx);
        assertEquals(1.0, result.score(), 1e-9);
    }

    @Test
    void metricSelectsTheHeadlineScore() {
        var predictions = List.of(1, 1, 0, 0, 1, 0, 1, 0, 0, 1);
        var labels = List.of(1, 1, 1, 0, 0, 0, 1, 0, 0, 0);
        var recall =
                new PrecisionRecallScorer(PrecisionRecallScorer.Metric.RECALL, 0.8)
                        .score(predictions, labels, ctx);
        assertEquals(0.75, recall.score(), 1e-9);
        assertFalse(recall.passed());

        var accuracy =
                new PrecisionRecallScorer(PrecisionRecallScorer.Metric.ACCURACY, 0.5)
                        .score(predictions, labels, ctx);
        assertEquals(0.7, accuracy.score(), 1e-9);
    }

    @Test
    void allNegativeIsPerfect() {
        var result = PrecisionRecallScorer.of().score(List.of(0, 0), List.of(0, 0), ctx);
        assertEquals(1.0, result.score());
    }

    @Test
    void noTruePositivesScoresZero() {
        var result = PrecisionRecallScorer.of().score(List.of(0, 0), List.of(1, 1), ctx);
        assertEquals(0.0, result.score());
        assertFalse(result.passed());
    }

    @Test
    void lengthMismatchIsAScoringError() {
        var error =
                assertThrows(
                        EvalException.class,
                        () -> PrecisionRecallScorer.of().score(List.of(1), List.of(1, 0), ctx));
        assertEquals(ErrorKind.SCORING, error.kind());
    }

    @Test
    void emptyAndInvalidInputsAreScoringErrors() {
        assertThrows(
                EvalException.class,
                () -> PrecisionRecallScorer.of().score(List.of(), List.of(), ctx));
        assertThrows(
                EvalException.class,
                () -> PrecisionRecallScorer.of().score(List.of("maybe"), List.of(1), ctx));
        assertThrows(
                EvalException.class,
                () -> PrecisionRecallScorer.of().score("[1,", List.of(1), ctx));
    }
}
