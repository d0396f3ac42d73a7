package dev.evalkit.provider;

/** Completion text plus the token usage reported by the provider. */
public record ModelResponse(String text, long promptTokens, long completionTokens) {
    public static ModelResponse of(String text) {
        return new ModelResponse(text, 0, 0);
    }

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
