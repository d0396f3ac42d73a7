package dev.evalkit.provider;

import javax.annotation.Nullable;

/** A single completion request. */
public record ModelRequest(ModelConfig config, @Nullable String systemPrompt, String prompt) {
    public static ModelRequest of(ModelConfig config, String prompt) {
        return new ModelRequest(config, null, prompt);
    }
}
