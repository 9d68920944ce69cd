package io.gigdraft.validation;

/**
 * A single typed predicate over a value.
 *
 * <p>Implementations are pure: the same input always yields the same outcome.
 * The built-in kinds live in {@link Rules}.
 */
public interface ValidationRule<T> {

    ValidationOutcome validate(T value);

    String errorMessage();

    /**
     * Kind reported when this rule fails.
     */
    ValidationErrorKind kind();

    default ValidationOutcome fail() {
        return ValidationOutcome.invalid(ValidationError.of(errorMessage(), kind()));
    }
}
