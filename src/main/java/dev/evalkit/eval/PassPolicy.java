package dev.evalkit.eval;

import dev.evalkit.scorer.ScorerResult;
import java.util.List;

/** How the scorer verdicts of one test case combine into its pass/fail. */
public enum PassPolicy {
    /** Every scorer must pass. */
    ALL,
    /** At least one scorer must pass. */
    ANY;

    /** A test case without scorer results never passes. */
    public boolean combine(List<ScorerResult> results) {
        if (results.isEmpty()) {
            return false;
        }
        return switch (this) {
            case ALL -> results.stream().allMatch(ScorerResult::passed);
            case ANY -> results.stream().anyMatch(ScorerResult::passed);
        };
    }
}
