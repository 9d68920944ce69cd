package io.gigdraft.validation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidatorTest {

    @Test
    void shouldReportFirstFailingRuleOnly() {
        Validator<String> validator = Validator.<String>forField("title")
                .rule(Rules.notEmpty("Title is required"))
                .rule(Rules.minLength(3, "Title must be at least 3 characters"));

        ValidationOutcome outcome = validator.validate("");

        assertThat(outcome.errors()).hasSize(1);
        ValidationError error = outcome.errors().get(0);
        assertThat(error.field()).isEqualTo("title");
        assertThat(error.message()).isEqualTo("Title is required");
        assertThat(error.kind()).isEqualTo(ValidationErrorKind.REQUIRED);
    }

    @Test
    void shouldNotEvaluateRulesAfterFailure() {
        AtomicInteger calls = new AtomicInteger();
        Validator<String> validator = Validator.<String>forField("title")
                .rule(Rules.minLength(5, "too short"))
                .rule(Rules.custom(v -> calls.incrementAndGet() > 0, "never"));

        validator.validate("abc");
        assertThat(calls.get()).isZero();

        validator.validate("abcdef");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void shouldBeValidWithoutRules() {
        assertThat(Validator.<String>forField("anything").validate(null).isValid()).isTrue();
    }

    @Test
    void rulesShouldBeReadOnlySnapshot() {
        Validator<String> validator = Validator.<String>forField("title").rule(Rules.notEmpty("required"));

        assertThat(validator.field()).isEqualTo("title");
        assertThat(validator.rules()).hasSize(1);
        assertThatThrownBy(() -> validator.rules().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void errorsByFieldShouldKeepFirstErrorPerFieldInOrder() {
        ValidationOutcome outcome = ValidationOutcome.invalid(List.of(
                new ValidationError("salary", "Salary must be greater than 0", ValidationErrorKind.INVALID_VALUE),
                new ValidationError("title", "Title is required", ValidationErrorKind.REQUIRED),
                new ValidationError("salary", "second", ValidationErrorKind.OUT_OF_RANGE)
        ));

        assertThat(outcome.errorsByField()).containsOnlyKeys("salary", "title");
        assertThat(outcome.errorsByField().keySet()).containsExactly("salary", "title");
        assertThat(outcome.errorsByField().get("salary").message()).isEqualTo("Salary must be greater than 0");
    }
}
