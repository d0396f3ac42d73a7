package dev.evalkit.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.evalkit.EvalKitUtils;
import dev.evalkit.error.EvalException;
import dev.evalkit.json.EvalJsonMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Fraction of relevant documents found among the first K retrieved.
 *
 * <p>The actual value is the ranked list of retrieved ids (or a map with {@code retrieved}); the
 * expected value is the collection of relevant ids (or a map with {@code relevant}). With no
 * relevant documents recall is 1.0, since nothing can be missed.
 */
public final class RecallAtKScorer implements Scorer {
    public static final double DEFAULT_MIN_RECALL = 0.8;

    private final int k;
    private final double minRecall;
    private final String name;

    public RecallAtKScorer(int k, double minRecall) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1: " + k);
        }
        this.k = k;
        this.minRecall = minRecall;
        this.name = "recall_at_" + k;
    }

    public static RecallAtKScorer of(RecallPreset preset) {
        return preset.scorer();
    }

    /** Scores at several K values at once. The largest K is the headline score. */
    public static Scorer multiLevel(double minRecall, int... ks) {
        if (ks.length == 0) {
            throw new IllegalArgumentException("at least one k is required");
        }
        var sorted = Arrays.stream(ks).sorted().distinct().toArray();
        var scorers =
                Arrays.stream(sorted).mapToObj(k -> new RecallAtKScorer(k, minRecall)).toList();
        return new Scorer() {
            @Override
            public String getName() {
                return "recall_at_k";
            }

            @Override
            public ScorerResult score(Object actual, Object expected, ScoringContext context) {
                var breakdown = new LinkedHashMap<String, Double>();
                ScorerResult headline = null;
                for (var scorer : scorers) {
                    headline = scorer.score(actual, expected, context);
                    breakdown.put("recall@" + scorer.k(), headline.score());
                }
                return new ScorerResult(
                        getName(),
                        headline.score(),
                        headline.passed(),
                        headline.reason(),
                        breakdown,
                        headline.metadata());
            }
        };
    }

    public int k() {
        return k;
    }

    public double minRecall() {
        return minRecall;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ScorerResult score(
            @Nullable Object actual, @Nullable Object expected, ScoringContext context) {
        var retrieved = toIds("retrieved", unwrap(actual, "retrieved"));
        var relevant = new LinkedHashSet<>(toIds("relevant", unwrap(expected, "relevant")));

        var topK = retrieved.subList(0, Math.min(k, retrieved.size()));
        Set<String> found = new LinkedHashSet<>();
        for (var id : topK) {
            if (relevant.contains(id)) {
                found.add(id);
            }
        }
        var missed = new ArrayList<String>();
        for (var id : relevant) {
            if (!found.contains(id)) {
                missed.add(id);
            }
        }
        double recall = relevant.isEmpty() ? 1.0 : (double) found.size() / relevant.size();
        boolean passed = recall >= minRecall;

        var breakdown = new LinkedHashMap<String, Double>();
        breakdown.put("recall", recall);
        breakdown.put("relevantInTopK", (double) found.size());
        breakdown.put("totalRelevant", (double) relevant.size());
        breakdown.put("k", (double) k);
        breakdown.put("retrievedCount", (double) retrieved.size());
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("retrievedDocuments", List.copyOf(topK));
        metadata.put("relevantDocuments", List.copyOf(relevant));
        metadata.put("missedDocuments", missed);

        String reason;
        if (relevant.isEmpty()) {
            reason = "No relevant documents, recall is trivially 1.0";
        } else {
            reason =
                    "Recall@%d %.2f (%d of %d relevant in top %d) %s minimum %.2f"
                            .formatted(
                                    k,
                                    recall,
                                    found.size(),
                                    relevant.size(),
                                    k,
                                    passed ? "meets" : "is below",
                                    minRecall);
        }
        return new ScorerResult(name, recall, passed, reason, breakdown, metadata);
    }

    private static @Nullable Object unwrap(@Nullable Object value, String key) {
        if (value instanceof Map<?, ?> map) {
            return map.get(key);
        }
        return value;
    }

    private List<String> toIds(String field, @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String text) {
            // model output: a JSON array or a comma separated list
            if (text.strip().startsWith("[")) {
                try {
                    value = EvalJsonMapper.get().readValue(text.strip(), List.class);
                } catch (JsonProcessingException e) {
                    throw EvalException.scoring(
                            name, "%s is not a valid JSON array: %s".formatted(field, text));
                }
            } else {
                return EvalKitUtils.parseCsv(text);
            }
        }
        if (!(value instanceof Collection<?> values)) {
            throw EvalException.scoring(
                    name, "%s must be a list of document ids but was %s".formatted(field, value));
        }
        var ids = new ArrayList<String>(values.size());
        for (var item : values) {
            ids.add(String.valueOf(item));
        }
        return ids;
    }
}
