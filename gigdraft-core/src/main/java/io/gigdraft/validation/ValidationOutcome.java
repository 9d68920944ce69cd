package io.gigdraft.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of validating a value, a field or a whole job.
 *
 * <p>Valid when {@code errors} is empty; otherwise Invalid with the errors in evaluation order.
 */
public record ValidationOutcome(List<ValidationError> errors) {

    private static final ValidationOutcome VALID = new ValidationOutcome(List.of());

    public ValidationOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationOutcome valid() {
        return VALID;
    }

    public static ValidationOutcome invalid(ValidationError error) {
        return new ValidationOutcome(List.of(error));
    }

    public static ValidationOutcome invalid(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("an invalid outcome needs at least one error");
        }
        return new ValidationOutcome(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<ValidationError> firstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    /**
     * Errors keyed by field, in the order the fields were evaluated.
     * When a field reports more than once only the first error is kept.
     */
    public Map<String, ValidationError> errorsByField() {
        Map<String, ValidationError> byField = new LinkedHashMap<>();
        for (ValidationError e : errors) {
            byField.putIfAbsent(e.field(), e);
        }
        return Collections.unmodifiableMap(byField);
    }
}
