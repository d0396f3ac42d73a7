package dev.evalkit.scorer;

import java.util.Locale;

/** Named Recall@K configurations per retrieval use case. */
public enum RecallPreset {
    RAG(5, 0.8),
    SEARCH(10, 0.7),
    RECOMMENDATION(3, 0.9);

    private final int k;
    private final double minRecall;

    RecallPreset(int k, double minRecall) {
        this.k = k;
        this.minRecall = minRecall;
    }

    public int k() {
        return k;
    }

    public double minRecall() {
        return minRecall;
    }

    public RecallAtKScorer scorer() {
        return new RecallAtKScorer(k, minRecall);
    }

    public static RecallPreset fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
