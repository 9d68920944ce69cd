package io.gigdraft.validation;

public enum ValidationErrorKind {
    REQUIRED,
    TOO_SHORT,
    TOO_LONG,
    PATTERN_MISMATCH,
    INVALID_VALUE,
    OUT_OF_RANGE
}
