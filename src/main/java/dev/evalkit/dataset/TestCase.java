package dev.evalkit.dataset;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.annotation.Nullable;

/** A single evaluation example. Immutable once its dataset version is published. */
public record TestCase(
        /** Unique within the dataset. */
        String id,
        String name,
        @Nullable String category,
        /** What the model is given. Any JSON-like value. */
        Object input,
        /** What the scorers compare the model's output with. */
        Object expected,
        Set<String> tags,
        @Nullable Difficulty difficulty) {

    public static final String UNCATEGORIZED = "uncategorized";

    public TestCase {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public static TestCase of(String id, Object input, Object expected) {
        return new TestCase(id, id, null, input, expected, Set.of(), null);
    }

    public static TestCase of(String id, String category, Object input, Object expected) {
        return new TestCase(id, id, category, input, expected, Set.of(), null);
    }

    /** The category, or {@value #UNCATEGORIZED} when none was given. */
    public String categoryOrDefault() {
        return category == null || category.isBlank() ? UNCATEGORIZED : category;
    }
}
