package dev.evalkit.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Binary classification quality from a confusion matrix.
 *
 * <p>The actual value holds the predictions and the expected value the ground-truth labels, both
 * as equal-length lists. A map with {@code predictions} and {@code labels} may be passed as the
 * actual value instead. Labels may be booleans, 0/1 numbers or "true"/"false" strings.
 */
public final class PrecisionRecallScorer implements Scorer {
    public static final String NAME = "f1";
    public static final double DEFAULT_MIN_SCORE = 0.5;

    /** Which statistic is reported as the score and compared with {@code minScore}. */
    public enum Metric {
        F1,
        PRECISION,
        RECALL,
        ACCURACY
    }

    /** Counts of true/false positives and negatives. */
    public record ConfusionMatrix(int tp, int fp, int tn, int fn) {
        public int total() {
            return tp + fp + tn + fn;
        }

        /** Defined as 1.0 when nothing was predicted positive and nothing was positive. */
        public double precision() {
            if (tp + fp == 0) {
                return tp + fn == 0 ? 1.0 : 0.0;
            }
            return (double) tp / (tp + fp);
        }

        public double recall() {
            if (tp + fn == 0) {
                return tp + fp == 0 ? 1.0 : 0.0;
            }
            return (double) tp / (tp + fn);
        }

        public double f1() {
            double p = precision();
            double r = recall();
            return p + r == 0 ? 0.0 : 2 * p * r / (p + r);
        }

        public double accuracy() {
            return total() == 0 ? 0.0 : (double) (tp + tn) / total();
        }

        public static ConfusionMatrix of(List<Boolean> predictions, List<Boolean> labels) {
            int tp = 0;
            int fp = 0;
            int tn = 0;
            int fn = 0;
            for (int i = 0; i < predictions.size(); i++) {
                boolean predicted = predictions.get(i);
                boolean actual = labels.get(i);
                if (predicted && actual) {
                    tp++;
                } else if (predicted) {
                    fp++;
                } else if (actual) {
                    fn++;
                } else {
                    tn++;
                }
            }
            return new ConfusionMatrix(tp, fp, tn, fn);
        }
    }

    private final Metric metric;
    private final double minScore;

    public PrecisionRecallScorer(Metric metric, double minScore) {
        this.metric = metric;
        this.minScore = minScore;
    }

    public static PrecisionRecallScorer of() {
        return new PrecisionRecallScorer(Metric.F1, DEFAULT_MIN_SCORE);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ScorerResult score(
            @Nullable Object actual, @Nullable Object expected, ScoringContext context) {
        Object predictionsValue = parseIfJson(actual);
        Object labelsValue = parseIfJson(expected);
        if (predictionsValue instanceof Map<?, ?> map && map.containsKey("predictions")) {
            predictionsValue = map.get("predictions");
            labelsValue = map.containsKey("labels") ? map.get("labels") : labelsValue;
        }
        var predictions = toBooleans("predictions", predictionsValue);
        var labels = toBooleans("labels", labelsValue);
        if (predictions.size() != labels.size()) {
            throw EvalException.scoring(
                    NAME,
                    "predictions (%d) and labels (%d) differ in length"
                            .formatted(predictions.size(), labels.size()));
        }
        if (predictions.isEmpty()) {
            throw EvalException.scoring(NAME, "predictions and labels are empty");
        }

        var matrix = ConfusionMatrix.of(predictions, labels);
        double value =
                switch (metric) {
                    case F1 -> matrix.f1();
                    case PRECISION -> matrix.precision();
                    case RECALL -> matrix.recall();
                    case ACCURACY -> matrix.accuracy();
                };
        boolean passed = value >= minScore;

        var breakdown = new LinkedHashMap<String, Double>();
        breakdown.put("tp", (double) matrix.tp());
        breakdown.put("fp", (double) matrix.fp());
        breakdown.put("tn", (double) matrix.tn());
        breakdown.put("fn", (double) matrix.fn());
        breakdown.put("precision", matrix.precision());
        breakdown.put("recall", matrix.recall());
        breakdown.put("f1", matrix.f1());
        breakdown.put("accuracy", matrix.accuracy());
        var reason =
                "%s %.4f (precision %.4f, recall %.4f) %s minimum %.2f"
                        .formatted(
                                metric.name().toLowerCase(Locale.ROOT),
                                value,
                                matrix.precision(),
                                matrix.recall(),
                                passed ? "meets" : "is below",
                                minScore);
        return new ScorerResult(
                NAME, value, passed, reason, breakdown, Map.of("metric", metric.name()));
    }

    /** Model output arrives as text; JSON arrays and objects are parsed. */
    private static @Nullable Object parseIfJson(@Nullable Object value) {
        if (value instanceof String text) {
            var trimmed = text.strip();
            if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
                try {
                    return EvalJsonMapper.get().readValue(trimmed, Object.class);
                } catch (JsonProcessingException e) {
                    throw EvalException.scoring(NAME, "output is not valid JSON: " + trimmed);
                }
            }
        }
        return value;
    }

    private static List<Boolean> toBooleans(String field, @Nullable Object value) {
        if (!(value instanceof Collection<?> values)) {
            throw EvalException.scoring(
                    NAME, "%s must be a list of binary labels but was %s".formatted(field, value));
        }
        var result = new ArrayList<Boolean>(values.size());
        for (var item : values) {
            result.add(toBoolean(field, item));
        }
        return result;
    }

    private static boolean toBoolean(String field, @Nullable Object item) {
        if (item instanceof Boolean bool) {
            return bool;
        } else if (item instanceof Number number) {
            return number.doubleValue() != 0.0;
        } else if (item instanceof String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true", "1", "yes", "positive":
                    return true;
                case "false", "0", "no", "negative":
                    return false;
                default:
                    break;
            }
        }
        throw EvalException.scoring(
                NAME, "%s contains a value that is not a binary label: %s".formatted(field, item));
    }
}
