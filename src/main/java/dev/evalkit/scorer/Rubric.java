package dev.evalkit.scorer;

import java.util.List;
import java.util.Objects;

/** Named, weighted criteria an LLM judge grades against. */
public record Rubric(List<Criterion> criteria, String instructions) {

    public record Criterion(String name, String description, double weight) {
        public Criterion {
            Objects.requireNonNull(name, "criterion name");
            description = description == null ? "" : description;
            if (!(weight > 0)) {
                throw new IllegalArgumentException(
                        "criterion '%s' must have a positive weight".formatted(name));
            }
        }
    }

    public Rubric {
        if (criteria == null || criteria.isEmpty()) {
            throw new IllegalArgumentException("rubric needs at least one criterion");
        }
        criteria = List.copyOf(criteria);
        instructions = instructions == null ? "" : instructions;
    }

    public static Rubric of(Criterion... criteria) {
        return new Rubric(List.of(criteria), "");
    }

    /** accuracy 0.5, helpfulness 0.3, tone 0.2 */
    public static Rubric defaultRubric() {
        return of(
                new Criterion(
                        "accuracy",
                        "Is the response factually correct and consistent with the expected"
                                + " answer?",
                        0.5),
                new Criterion(
                        "helpfulness", "Does the response address what the input asked?", 0.3),
                new Criterion("tone", "Is the response clear, polite and appropriate?", 0.2));
    }

    public double totalWeight() {
        return criteria.stream().mapToDouble(Criterion::weight).sum();
    }
}
