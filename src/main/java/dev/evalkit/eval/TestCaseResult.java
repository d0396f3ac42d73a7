package dev.evalkit.eval;

import dev.evalkit.scorer.ScorerResult;
import java.util.List;

/** The outcome of one test case in one run. Never modified after the runner creates it. */
public record TestCaseResult(
        String testCaseId,
        String category,
        List<ScorerResult> scorerResults,
        boolean passed,
        ResultMetadata metadata) {

    public TestCaseResult {
        scorerResults = List.copyOf(scorerResults);
    }

    /** Mean of the scorer scores, 0 when there are none. */
    public double aggregateScore() {
        return scorerResults.stream().mapToDouble(ScorerResult::score).average().orElse(0.0);
    }

    public boolean errored() {
        return metadata.error().isPresent();
    }
}
