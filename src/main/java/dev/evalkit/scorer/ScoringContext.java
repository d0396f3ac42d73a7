package dev.evalkit.scorer;

import javax.annotation.Nullable;

/** What a scorer may know about the test case beyond the actual and expected values. */
public record ScoringContext(
        /** The input the model was given. */
        @Nullable Object input,
        @Nullable String testCaseId,
        @Nullable String category) {
    private static final ScoringContext EMPTY = new ScoringContext(null, null, null);

    public static ScoringContext empty() {
        return EMPTY;
    }

    public static ScoringContext of(@Nullable Object input) {
        return new ScoringContext(input, null, null);
    }
}
