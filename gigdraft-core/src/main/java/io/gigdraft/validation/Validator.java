package io.gigdraft.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered rule list for one field.
 *
 * <p>Rules run in insertion order and evaluation stops at the first failing rule, so a field
 * reports its most specific problem ("required" before "too short") rather than every violation.
 */
public final class Validator<T> {

    private final String field;
    private final List<ValidationRule<? super T>> rules = new ArrayList<>();

    private Validator(String field) {
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public static <T> Validator<T> forField(String field) {
        return new Validator<>(field);
    }

    public Validator<T> rule(ValidationRule<? super T> rule) {
        rules.add(Objects.requireNonNull(rule, "rule must not be null"));
        return this;
    }

    public String field() {
        return field;
    }

    public List<ValidationRule<? super T>> rules() {
        return List.copyOf(rules);
    }

    public ValidationOutcome validate(T value) {
        for (ValidationRule<? super T> rule : rules) {
            ValidationOutcome outcome = rule.validate(value);
            if (!outcome.isValid()) {
                return ValidationOutcome.invalid(outcome.errors().get(0).withField(field));
            }
        }
        return ValidationOutcome.valid();
    }
}
