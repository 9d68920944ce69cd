package io.gigdraft.validation;

import java.util.Objects;

/**
 * A single user-fixable problem with one form field.
 *
 * <p>{@code field} is {@code null} while the error is still attached to a bare rule;
 * {@link Validator} stamps the field name before the error leaves the engine.
 */
public record ValidationError(
        String field,
        String message,
        ValidationErrorKind kind
) {
    public ValidationError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ValidationError of(String message, ValidationErrorKind kind) {
        return new ValidationError(null, message, kind);
    }

    public ValidationError withField(String field) {
        return new ValidationError(field, message, kind);
    }
}
