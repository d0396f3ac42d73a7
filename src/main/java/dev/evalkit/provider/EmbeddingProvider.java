package dev.evalkit.provider;

/** Produces embedding vectors for text. */
public interface EmbeddingProvider {
    double[] embed(String text, String model);
}
