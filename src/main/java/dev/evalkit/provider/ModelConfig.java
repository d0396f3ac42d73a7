package dev.evalkit.provider;

import java.util.Objects;
import javax.annotation.Nonnull;

/** Which model a run calls, and with what sampling settings. */
public record ModelConfig(
        /** Provider key, e.g. {@code openai}. */
        String provider,
        /** Provider-specific model name, e.g. {@code gpt-4o-mini}. */
        String model,
        Double temperature,
        Integer maxTokens) {
    public static final String DEFAULT_PROVIDER = "openai";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2000;

    public ModelConfig {
        if (provider == null || provider.isBlank()) {
            provider = DEFAULT_PROVIDER;
        }
        Objects.requireNonNull(model, "model");
        if (temperature == null) {
            temperature = DEFAULT_TEMPERATURE;
        }
        if (maxTokens == null) {
            maxTokens = DEFAULT_MAX_TOKENS;
        }
    }

    public static ModelConfig of(@Nonnull String model) {
        return new ModelConfig(DEFAULT_PROVIDER, model, null, null);
    }

    public static ModelConfig of(@Nonnull String provider, @Nonnull String model) {
        return new ModelConfig(provider, model, null, null);
    }

    public ModelConfig withTemperature(double value) {
        return new ModelConfig(provider, model, value, maxTokens);
    }

    @Override
    public String toString() {
        return provider + "/" + model;
    }
}
