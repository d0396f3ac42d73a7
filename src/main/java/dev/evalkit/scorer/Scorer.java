package dev.evalkit.scorer;

import java.util.function.BiFunction;
import javax.annotation.Nullable;

/**
 * A scorer compares a model's actual output with the expected output.
 *
 * <p>Implementations must be safe to call from several runner workers at once and must not have
 * side effects other than read-through caching.
 */
public interface Scorer {
    String getName();

    /**
     * @throws dev.evalkit.error.EvalException of kind SCORING when the inputs cannot be scored
     */
    ScorerResult score(
            @Nullable Object actual, @Nullable Object expected, ScoringContext context);

    /** Whether scoring calls a judge model, which gets a longer per-test timeout. */
    default boolean callsModel() {
        return false;
    }

    /** Creates a scorer from a function returning a raw score, passing at {@code threshold}. */
    static Scorer of(
            String scorerName, double threshold, BiFunction<Object, Object, Double> scorerFn) {
        return new Scorer() {
            @Override
            public String getName() {
                return scorerName;
            }

            @Override
            public ScorerResult score(Object actual, Object expected, ScoringContext context) {
                double value = ScorerResult.clamp(scorerFn.apply(actual, expected));
                return ScorerResult.of(
                        scorerName,
                        value,
                        value >= threshold,
                        "score %.3f against threshold %.3f".formatted(value, threshold));
            }
        };
    }
}
