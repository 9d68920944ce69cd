package io.gigdraft.core;

import io.gigdraft.validation.ValidationError;
import io.gigdraft.validation.ValidationErrorKind;
import io.gigdraft.validation.ValidationOutcome;

import java.util.Map;
import java.util.Objects;

/**
 * Typed error surfaced by the draft workflow.
 *
 * <ul>
 *   <li>NOT_FOUND: referenced draft or job is missing</li>
 *   <li>VALIDATION: user-fixable; {@code fieldErrors} holds one error per offending field</li>
 *   <li>STORE_FAILURE: a primary store call failed; {@code storeError} is passed through unchanged</li>
 *   <li>UNEXPECTED: anything else; {@code cause} keeps the original exception</li>
 * </ul>
 */
public record CoreError(
        Kind kind,
        String message,
        Map<String, ValidationError> fieldErrors,
        StoreError storeError,
        Throwable cause
) {
    public enum Kind {
        NOT_FOUND,
        VALIDATION,
        STORE_FAILURE,
        UNEXPECTED
    }

    public CoreError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        fieldErrors = fieldErrors == null ? Map.of() : fieldErrors;
    }

    public static CoreError notFound(String field, String id) {
        String message = field + " " + id + " not found";
        return new CoreError(Kind.NOT_FOUND, message,
                Map.of(field, new ValidationError(field, message, ValidationErrorKind.INVALID_VALUE)), null, null);
    }

    public static CoreError validation(ValidationOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (outcome.isValid()) {
            throw new IllegalArgumentException("a validation error needs an invalid outcome");
        }
        return new CoreError(Kind.VALIDATION, "Validation failed", outcome.errorsByField(), null, null);
    }

    public static CoreError storeFailure(StoreError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new CoreError(Kind.STORE_FAILURE, error.message(), null, error, error.cause());
    }

    public static CoreError unexpected(String message, Throwable cause) {
        return new CoreError(Kind.UNEXPECTED, message, null, null, cause);
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }
}
