package dev.evalkit.dataset;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** A versioned, ordered collection of test cases. Read-only once loaded. */
public record Dataset(
        String id, String name, String description, String version, List<TestCase> testCases) {
    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+(-[0-9A-Za-z.-]+)?$");

    public Dataset {
        description = description == null ? "" : description;
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }

    public static Dataset of(String id, String version, List<TestCase> testCases) {
        return new Dataset(id, id, "", version, testCases);
    }

    public Optional<TestCase> testCase(String testCaseId) {
        return testCases.stream().filter(tc -> testCaseId.equals(tc.id())).findFirst();
    }

    public int size() {
        return testCases.size();
    }

    public DatasetSummary summary() {
        return new DatasetSummary(id, name, version, description, testCases.size());
    }

    /** Orders semantic versions numerically; pre-release versions sort before their release. */
    public static int compareVersions(String a, String b) {
        var partsA = a.split("-", 2);
        var partsB = b.split("-", 2);
        var numsA = partsA[0].split("\\.");
        var numsB = partsB[0].split("\\.");
        for (int i = 0; i < Math.max(numsA.length, numsB.length); i++) {
            long na = i < numsA.length ? parse(numsA[i]) : 0;
            long nb = i < numsB.length ? parse(numsB[i]) : 0;
            if (na != nb) {
                return Long.compare(na, nb);
            }
        }
        if (partsA.length != partsB.length) {
            return partsA.length == 1 ? 1 : -1;
        }
        return partsA.length == 1 ? 0 : comparePreRelease(partsA[1], partsB[1]);
    }

    /** Numeric identifiers compare as numbers and sort before alphanumeric ones. */
    private static int comparePreRelease(String a, String b) {
        var idsA = a.split("\\.");
        var idsB = b.split("\\.");
        for (int i = 0; i < Math.min(idsA.length, idsB.length); i++) {
            boolean numericA = NUMERIC.matcher(idsA[i]).matches();
            boolean numericB = NUMERIC.matcher(idsB[i]).matches();
            int cmp;
            if (numericA && numericB) {
                cmp = new BigInteger(idsA[i]).compareTo(new BigInteger(idsB[i]));
            } else if (numericA != numericB) {
                cmp = numericA ? -1 : 1;
            } else {
                cmp = idsA[i].compareTo(idsB[i]);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(idsA.length, idsB.length);
    }

    private static long parse(String number) {
        try {
            return Long.parseLong(number);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
