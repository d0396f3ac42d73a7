package dev.evalkit.dataset;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DatasetValidatorTest {
    private static TestCase testCase(String id, Difficulty difficulty) {
        return new TestCase(
                id, "case " + id, "general", Map.of("prompt", id), "ok", Set.of("t"), difficulty);
    }

    @Test
    void wellFormedDatasetIsValid() {
        var dataset =
                Dataset.of(
                        "qa",
                        "1.0.0",
                        List.of(testCase("a", Difficulty.EASY), testCase("b", Difficulty.HARD)));
        var result = DatasetValidator.validate(dataset);
        assertTrue(result.valid());
        assertEquals(List.of(), result.errors());
        assertEquals(List.of(), result.warnings());
    }

    @Test
    void reportsEveryError() {
        var dataset =
                new Dataset(
                        "qa",
                        "",
                        null,
                        "v1",
                        List.of(
                                testCase("a", null),
                                testCase("a", null),
                                new TestCase("", "", null, null, null, null, null)));

        var result = DatasetValidator.validate(dataset);

        assertFalse(result.valid());
        assertEquals(
                List.of(
                        "dataset name is required",
                        "dataset version 'v1' is not a semantic version (e.g. 1.0.0)",
                        "duplicate test case id 'a' at positions 1 and 2",
                        "test case #3: id is required",
                        "test case #3: name is required",
                        "test case #3: input is required",
                        "test case #3: expected is required"),
                result.errors());
        assertTrue(result.warnings().contains("test case #3: no tags"));
        assertTrue(
                result.warnings()
                        .contains(
                                "test case #3: no category, it will be reported as uncategorized"));
    }

    @Test
    void emptyDatasetIsValidWithAWarning() {
        var result = DatasetValidator.validate(Dataset.of("qa", "1.0.0", List.of()));
        assertTrue(result.valid());
        assertEquals(List.of("dataset has no test cases"), result.warnings());
    }

    @Test
    void preReleaseVersionsAreSemantic() {
        var result =
                DatasetValidator.validate(
                        Dataset.of("qa", "2.0.0-rc.1", List.of(testCase("a", null))));
        assertTrue(result.valid());
    }

    @Test
    void warnsAboutDifficultyImbalance() {
        var cases = new ArrayList<TestCase>();
        for (int i = 0; i < 11; i++) {
            cases.add(testCase("c" + i, Difficulty.MEDIUM));
        }
        var result = DatasetValidator.validate(Dataset.of("qa", "1.0.0", cases));
        assertTrue(result.valid());
        assertEquals(
                List.of(
                        "only 0% of test cases are easy, consider at least 20%",
                        "only 0% of test cases are hard, consider at least 10%"),
                result.warnings());
    }

    @Test
    void versionsCompareNumerically() {
        assertTrue(Dataset.compareVersions("1.10.0", "1.9.0") > 0);
        assertTrue(Dataset.compareVersions("2.0.0-rc.1", "2.0.0") < 0);
        assertEquals(0, Dataset.compareVersions("1.0.0", "1.0.0"));
    }

    @Test
    void preReleaseIdentifiersCompareNumericallyWhenNumeric() {
        assertTrue(Dataset.compareVersions("1.0.0-rc.10", "1.0.0-rc.2") > 0);
        assertTrue(Dataset.compareVersions("1.0.0-rc.2", "1.0.0-rc.10") < 0);
        assertTrue(Dataset.compareVersions("1.0.0-alpha", "1.0.0-alpha.1") < 0);
        assertTrue(Dataset.compareVersions("1.0.0-alpha.1", "1.0.0-alpha.beta") < 0);
        assertTrue(Dataset.compareVersions("1.0.0-beta", "1.0.0-alpha") > 0);
        assertEquals(0, Dataset.compareVersions("1.0.0-rc.1", "1.0.0-rc.1"));
    }
}
