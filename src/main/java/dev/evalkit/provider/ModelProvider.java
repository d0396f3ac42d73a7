package dev.evalkit.provider;

import java.util.function.Function;

/**
 * Invokes a model and returns its completion.
 *
 * <p>Implementations report failures as {@link dev.evalkit.error.EvalException} with a
 * MODEL_* kind so the runner can tell retryable errors from permanent ones.
 */
public interface ModelProvider {
    ModelResponse complete(ModelRequest request);

    /** Wraps a function as a provider. Mostly useful for tests and offline runs. */
    static ModelProvider of(Function<ModelRequest, ModelResponse> fn) {
        return fn::apply;
    }
}
