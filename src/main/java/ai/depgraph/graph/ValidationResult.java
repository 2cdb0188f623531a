package ai.depgraph.graph;

import java.util.List;

/**
 * Outcome of {@link GraphValidator#validate}; {@code valid} iff {@code errors} is empty.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
