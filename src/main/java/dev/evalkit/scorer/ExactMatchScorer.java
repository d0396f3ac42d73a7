package dev.evalkit.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.evalkit.json.EvalJsonMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Deep structural equality between the actual and expected values.
 *
 * <p>Values are compared as JSON trees. Numbers compare by value, so {@code 1} equals {@code 1.0}.
 * When the expected value is structured and the model answered with text, the text is parsed as
 * JSON first. Paths are dotted and rooted at {@code root}, array elements use their index as a
 * segment ({@code root.items.0.id}). Ignored paths may use {@code *} for any single segment and
 * may omit the {@code root.} prefix.
 */
public final class ExactMatchScorer implements Scorer {
    public static final String NAME = "exact_match";

    public enum DifferenceKind {
        MISSING,
        EXTRA,
        DIFFERENT,
        TYPE_MISMATCH
    }

    public record Difference(String path, DifferenceKind kind, String detail) {}

    private final boolean ignoreKeyOrder;
    private final boolean trimWhitespace;
    private final boolean caseInsensitive;
    private final List<Pattern> ignorePatterns;
    private final Set<String> ignorePaths;

    private ExactMatchScorer(Builder builder) {
        this.ignoreKeyOrder = builder.ignoreKeyOrder;
        this.trimWhitespace = builder.trimWhitespace;
        this.caseInsensitive = builder.caseInsensitive;
        this.ignorePaths = Set.copyOf(builder.ignorePaths);
        this.ignorePatterns =
                builder.ignorePaths.stream()
                        .map(ExactMatchScorer::toPattern)
                        .collect(Collectors.toList());
    }

    public static ExactMatchScorer of() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ScorerResult score(
            @Nullable Object actual, @Nullable Object expected, ScoringContext context) {
        var expectedNode = toNode(expected, false);
        var actualNode = toNode(actual, expectedNode.isContainerNode());
        var differences = new ArrayList<Difference>();
        if (!bothEmpty(actualNode, expectedNode)) {
            compare(actualNode, expectedNode, "root", differences);
        }

        int leaves = Math.max(1, countLeaves(expectedNode));
        double similarity = Math.max(0.0, 1.0 - (double) differences.size() / leaves);
        var breakdown = new LinkedHashMap<String, Double>();
        breakdown.put("similarity", differences.isEmpty() ? 1.0 : similarity);
        breakdown.put("differenceCount", (double) differences.size());
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(
                "differences",
                differences.stream()
                        .map(
                                d ->
                                        Map.of(
                                                "path", d.path(),
                                                "kind", d.kind().name().toLowerCase(Locale.ROOT),
                                                "detail", d.detail()))
                        .collect(Collectors.toList()));
        if (!ignorePaths.isEmpty()) {
            metadata.put("ignoredPaths", List.copyOf(ignorePaths));
        }

        if (differences.isEmpty()) {
            return new ScorerResult(NAME, 1.0, true, "Exact match", breakdown, metadata);
        }
        var first = differences.get(0);
        var reason = "Mismatch at %s: %s".formatted(first.path(), first.detail());
        if (differences.size() > 1) {
            reason += " (%d more difference%s)"
                    .formatted(differences.size() - 1, differences.size() == 2 ? "" : "s");
        }
        return new ScorerResult(NAME, 0.0, false, reason, breakdown, metadata);
    }

    private void compare(JsonNode actual, JsonNode expected, String path, List<Difference> out) {
        if (isIgnored(path)) {
            return;
        }
        if (expected.isNumber() && actual.isNumber()) {
            if (expected.decimalValue().compareTo(actual.decimalValue()) != 0) {
                out.add(different(path, expected, actual));
            }
        } else if (expected.isTextual() && actual.isTextual()) {
            if (!normalize(expected.asText()).equals(normalize(actual.asText()))) {
                out.add(different(path, expected, actual));
            }
        } else if (expected.isObject() && actual.isObject()) {
            compareObjects(actual, expected, path, out);
        } else if (expected.isArray() && actual.isArray()) {
            compareArrays(actual, expected, path, out);
        } else if (expected.getNodeType() != actual.getNodeType()) {
            out.add(
                    new Difference(
                            path,
                            DifferenceKind.TYPE_MISMATCH,
                            "expected %s, got %s"
                                    .formatted(typeName(expected), typeName(actual))));
        } else if (!expected.equals(actual)) {
            out.add(different(path, expected, actual));
        }
    }

    private void compareObjects(
            JsonNode actual, JsonNode expected, String path, List<Difference> out) {
        var expectedKeys = fieldNames(expected);
        var actualKeys = fieldNames(actual);
        for (var key : expectedKeys) {
            var childPath = path + "." + key;
            if (!actual.has(key)) {
                if (!isIgnored(childPath)) {
                    out.add(new Difference(childPath, DifferenceKind.MISSING, "missing key"));
                }
            } else {
                compare(actual.get(key), expected.get(key), childPath, out);
            }
        }
        for (var key : actualKeys) {
            var childPath = path + "." + key;
            if (!expected.has(key) && !isIgnored(childPath)) {
                out.add(new Difference(childPath, DifferenceKind.EXTRA, "unexpected key"));
            }
        }
        if (!ignoreKeyOrder && expectedKeys.equals(actualKeys)) {
            var expectedOrder = new ArrayList<>(expectedKeys);
            var actualOrder = new ArrayList<>(actualKeys);
            if (!expectedOrder.equals(actualOrder)) {
                out.add(
                        new Difference(
                                path,
                                DifferenceKind.DIFFERENT,
                                "key order %s differs from expected %s"
                                        .formatted(actualOrder, expectedOrder)));
            }
        }
    }

    private void compareArrays(
            JsonNode actual, JsonNode expected, String path, List<Difference> out) {
        int common = Math.min(actual.size(), expected.size());
        for (int i = 0; i < common; i++) {
            compare(actual.get(i), expected.get(i), path + "." + i, out);
        }
        for (int i = common; i < expected.size(); i++) {
            var childPath = path + "." + i;
            if (!isIgnored(childPath)) {
                out.add(new Difference(childPath, DifferenceKind.MISSING, "missing element"));
            }
        }
        for (int i = common; i < actual.size(); i++) {
            var childPath = path + "." + i;
            if (!isIgnored(childPath)) {
                out.add(new Difference(childPath, DifferenceKind.EXTRA, "unexpected element"));
            }
        }
    }

    private boolean isIgnored(String path) {
        if (ignorePatterns.isEmpty()) {
            return false;
        }
        var relative = path.startsWith("root.") ? path.substring("root.".length()) : path;
        for (var pattern : ignorePatterns) {
            if (pattern.matcher(path).matches() || pattern.matcher(relative).matches()) {
                return true;
            }
        }
        return false;
    }

    private String normalize(String value) {
        var normalized = trimWhitespace ? value.strip() : value;
        return caseInsensitive ? normalized.toLowerCase(Locale.ROOT) : normalized;
    }

    private static JsonNode toNode(@Nullable Object value, boolean parseText) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (parseText && value instanceof String text) {
            var trimmed = text.strip();
            if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
                try {
                    return EvalJsonMapper.get().readTree(trimmed);
                } catch (JsonProcessingException e) {
                    // not JSON after all, compare as text
                    return EvalJsonMapper.get().valueToTree(text);
                }
            }
        }
        return EvalJsonMapper.get().valueToTree(value);
    }

    /** Two empty values match only when they are the same kind of empty. */
    private static boolean bothEmpty(JsonNode actual, JsonNode expected) {
        if (isAbsent(actual) || isAbsent(expected)) {
            return isAbsent(actual) && isAbsent(expected);
        }
        return actual.getNodeType() == expected.getNodeType()
                && isEmptyValue(actual)
                && isEmptyValue(expected);
    }

    private static boolean isEmptyValue(JsonNode node) {
        return (node.isTextual() && node.asText().isEmpty())
                || (node.isContainerNode() && node.isEmpty());
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node instanceof MissingNode;
    }

    private static int countLeaves(JsonNode node) {
        if (node.isContainerNode()) {
            int count = 0;
            for (var child : node) {
                count += countLeaves(child);
            }
            return count;
        }
        return 1;
    }

    private static Set<String> fieldNames(JsonNode node) {
        var names = new LinkedHashSet<String>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }

    private static Difference different(String path, JsonNode expected, JsonNode actual) {
        return new Difference(
                path, DifferenceKind.DIFFERENT, "expected %s, got %s".formatted(expected, actual));
    }

    private static String typeName(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private static Pattern toPattern(String ignorePath) {
        var regex = new StringBuilder();
        for (var part : ignorePath.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append("[^.]+");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }

    public static final class Builder {
        private boolean ignoreKeyOrder = true;
        private boolean trimWhitespace = true;
        private boolean caseInsensitive = false;
        private final Set<String> ignorePaths = new LinkedHashSet<>();

        public Builder ignoreKeyOrder(boolean value) {
            this.ignoreKeyOrder = value;
            return this;
        }

        public Builder trimWhitespace(boolean value) {
            this.trimWhitespace = value;
            return this;
        }

        public Builder caseInsensitive(boolean value) {
            this.caseInsensitive = value;
            return this;
        }

        public Builder ignorePaths(String... paths) {
            return ignorePaths(List.of(paths));
        }

        public Builder ignorePaths(Iterable<String> paths) {
            paths.forEach(this.ignorePaths::add);
            return this;
        }

        public ExactMatchScorer build() {
            return new ExactMatchScorer(this);
        }
    }
}
