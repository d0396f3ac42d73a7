package dev.evalkit.dataset;

import java.util.List;

/** Every problem found in a dataset. Errors block a run, warnings do not. */
public record ValidationResult(List<String> errors, List<String> warnings) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
