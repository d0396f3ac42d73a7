package dev.evalkit.dataset;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Checks a dataset and reports every problem found, not just the first. */
public final class DatasetValidator {
    /** Imbalance warnings only apply to datasets larger than this. */
    static final int BALANCE_MIN_SIZE = 10;

    private DatasetValidator() {}

    public static ValidationResult validate(Dataset dataset) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        if (isBlank(dataset.id())) {
            errors.add("dataset id is required");
        }
        if (isBlank(dataset.name())) {
            errors.add("dataset name is required");
        }
        if (isBlank(dataset.version())) {
            errors.add("dataset version is required");
        } else if (!Dataset.SEMVER.matcher(dataset.version()).matches()) {
            errors.add(
                    "dataset version '%s' is not a semantic version (e.g. 1.0.0)"
                            .formatted(dataset.version()));
        }
        if (dataset.testCases().isEmpty()) {
            warnings.add("dataset has no test cases");
        }

        Map<String, Integer> firstIndex = new HashMap<>();
        Map<Difficulty, Integer> difficulties = new LinkedHashMap<>();
        for (int i = 0; i < dataset.testCases().size(); i++) {
            var testCase = dataset.testCases().get(i);
            var label =
                    isBlank(testCase.id()) ? "test case #" + (i + 1) : "test case " + testCase.id();
            if (isBlank(testCase.id())) {
                errors.add(label + ": id is required");
            } else {
                var previous = firstIndex.putIfAbsent(testCase.id(), i);
                if (previous != null) {
                    errors.add(
                            "duplicate test case id '%s' at positions %d and %d"
                                    .formatted(testCase.id(), previous + 1, i + 1));
                }
            }
            if (isBlank(testCase.name())) {
                errors.add(label + ": name is required");
            }
            if (testCase.input() == null) {
                errors.add(label + ": input is required");
            }
            if (testCase.expected() == null) {
                errors.add(label + ": expected is required");
            }
            if (isBlank(testCase.category())) {
                warnings.add(label + ": no category, it will be reported as uncategorized");
            }
            if (testCase.tags().isEmpty()) {
                warnings.add(label + ": no tags");
            }
            if (testCase.difficulty() != null) {
                difficulties.merge(testCase.difficulty(), 1, Integer::sum);
            }
        }

        int total = dataset.testCases().size();
        if (total > BALANCE_MIN_SIZE) {
            double easy = difficulties.getOrDefault(Difficulty.EASY, 0) / (double) total;
            double hard = difficulties.getOrDefault(Difficulty.HARD, 0) / (double) total;
            if (easy < 0.2) {
                warnings.add(
                        "only %.0f%% of test cases are easy, consider at least 20%%"
                                .formatted(easy * 100));
            }
            if (hard < 0.1) {
                warnings.add(
                        "only %.0f%% of test cases are hard, consider at least 10%%"
                                .formatted(hard * 100));
            }
        }
        return new ValidationResult(errors, warnings);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
