package io.gigdraft.validation;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Built-in rule kinds.
 *
 * <p>String rules treat {@code null} as the empty string. Numeric rules fail on {@code null}.
 */
public final class Rules {

    private static final java.util.regex.Pattern EMAIL = java.util.regex.Pattern.compile(
            "[a-zA-Z0-9+._%\\-]{1,256}"
                    + "@"
                    + "[a-zA-Z0-9][a-zA-Z0-9\\-]{0,64}"
                    + "(\\.[a-zA-Z0-9][a-zA-Z0-9\\-]{0,25})+"
    );

    private Rules() {
    }

    public static NotEmpty notEmpty(String errorMessage) {
        return new NotEmpty(errorMessage);
    }

    public static MinLength minLength(int length, String errorMessage) {
        return new MinLength(length, errorMessage);
    }

    public static MaxLength maxLength(int length, String errorMessage) {
        return new MaxLength(length, errorMessage);
    }

    public static Pattern pattern(String regex, String errorMessage) {
        return new Pattern(java.util.regex.Pattern.compile(regex), errorMessage);
    }

    public static Email email(String errorMessage) {
        return new Email(errorMessage);
    }

    public static Minimum minimum(double min, String errorMessage) {
        return new Minimum(min, errorMessage);
    }

    public static Maximum maximum(double max, String errorMessage) {
        return new Maximum(max, errorMessage);
    }

    public static Range range(double min, double max, String errorMessage) {
        return new Range(min, max, errorMessage);
    }

    public static <T> Custom<T> custom(Predicate<T> predicate, String errorMessage) {
        return new Custom<>(predicate, errorMessage, ValidationErrorKind.INVALID_VALUE);
    }

    public static <T> Custom<T> custom(Predicate<T> predicate, String errorMessage, ValidationErrorKind kind) {
        return new Custom<>(predicate, errorMessage, kind);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    public record NotEmpty(String errorMessage) implements ValidationRule<String> {
        public NotEmpty {
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(String value) {
            return orEmpty(value).isBlank() ? fail() : ValidationOutcome.valid();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.REQUIRED;
        }
    }

    public record MinLength(int length, String errorMessage) implements ValidationRule<String> {
        public MinLength {
            if (length < 0) {
                throw new IllegalArgumentException("length must not be negative");
            }
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(String value) {
            return orEmpty(value).length() >= length ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.TOO_SHORT;
        }
    }

    public record MaxLength(int length, String errorMessage) implements ValidationRule<String> {
        public MaxLength {
            if (length < 0) {
                throw new IllegalArgumentException("length must not be negative");
            }
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(String value) {
            return orEmpty(value).length() <= length ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.TOO_LONG;
        }
    }

    public record Pattern(java.util.regex.Pattern regex, String errorMessage) implements ValidationRule<String> {
        public Pattern {
            Objects.requireNonNull(regex, "regex must not be null");
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(String value) {
            return regex.matcher(orEmpty(value)).matches() ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.PATTERN_MISMATCH;
        }
    }

    public record Email(String errorMessage) implements ValidationRule<String> {
        public Email {
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(String value) {
            return EMAIL.matcher(orEmpty(value)).matches() ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.PATTERN_MISMATCH;
        }
    }

    public record Minimum(double min, String errorMessage) implements ValidationRule<Number> {
        public Minimum {
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(Number value) {
            return value != null && value.doubleValue() >= min ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.OUT_OF_RANGE;
        }
    }

    public record Maximum(double max, String errorMessage) implements ValidationRule<Number> {
        public Maximum {
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(Number value) {
            return value != null && value.doubleValue() <= max ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.OUT_OF_RANGE;
        }
    }

    public record Range(double min, double max, String errorMessage) implements ValidationRule<Number> {
        public Range {
            if (min > max) {
                throw new IllegalArgumentException("min must not be greater than max");
            }
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        }

        @Override
        public ValidationOutcome validate(Number value) {
            if (value == null) {
                return fail();
            }
            double d = value.doubleValue();
            return d >= min && d <= max ? ValidationOutcome.valid() : fail();
        }

        @Override
        public ValidationErrorKind kind() {
            return ValidationErrorKind.OUT_OF_RANGE;
        }
    }

    /**
     * Domain-specific check, e.g. "state and district both present".
     */
    public record Custom<T>(Predicate<T> predicate, String errorMessage, ValidationErrorKind kind)
            implements ValidationRule<T> {
        public Custom {
            Objects.requireNonNull(predicate, "predicate must not be null");
            Objects.requireNonNull(errorMessage, "errorMessage must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public ValidationOutcome validate(T value) {
            return predicate.test(value) ? ValidationOutcome.valid() : fail();
        }
    }
}
