package io.gigdraft.validation;

import io.gigdraft.core.DurationUnit;
import io.gigdraft.core.JobPosting;
import io.gigdraft.core.JobPostingDraft;
import io.gigdraft.core.JobStatus;
import io.gigdraft.core.Location;
import io.gigdraft.core.SalaryUnit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fixed rule sets for job fields.
 *
 * <p>Each field short-circuits on its first failing rule. Whole-job validation runs every field
 * independently and collects one error per offending field, in {@link JobField} order.
 */
public class JobFieldValidators {

    public static final int MIN_TITLE_LENGTH = 3;
    public static final int MAX_TITLE_LENGTH = 100;
    public static final int MIN_DESCRIPTION_LENGTH = 10;
    public static final int MAX_DESCRIPTION_LENGTH = 5000;
    public static final double MAX_SALARY = 1_000_000.0;
    public static final int MIN_DURATION = 1;
    public static final int MAX_DURATION = 365;

    private final Validator<String> title = Validator.<String>forField(JobField.TITLE.key())
            .rule(Rules.notEmpty("Title is required"))
            .rule(Rules.minLength(MIN_TITLE_LENGTH, "Title must be at least " + MIN_TITLE_LENGTH + " characters"))
            .rule(Rules.maxLength(MAX_TITLE_LENGTH, "Title must not exceed " + MAX_TITLE_LENGTH + " characters"));

    private final Validator<String> description = Validator.<String>forField(JobField.DESCRIPTION.key())
            .rule(Rules.notEmpty("Description is required"))
            .rule(Rules.minLength(MIN_DESCRIPTION_LENGTH,
                    "Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters"))
            .rule(Rules.maxLength(MAX_DESCRIPTION_LENGTH,
                    "Description must not exceed " + MAX_DESCRIPTION_LENGTH + " characters"));

    private final Validator<Number> salary = Validator.<Number>forField(JobField.SALARY.key())
            .rule(Rules.<Number>custom(v -> v != null && v.doubleValue() > 0, "Salary must be greater than 0",
                    ValidationErrorKind.OUT_OF_RANGE))
            .rule(Rules.maximum(MAX_SALARY, "Salary must not exceed 1,000,000"));

    private final Validator<Object> salaryUnit = Validator.forField(JobField.SALARY_UNIT.key())
            .rule(Rules.custom(v -> asSalaryUnit(v) != null,
                    "Invalid salary unit. Allowed values: " + allowed(SalaryUnit.values())));

    private final Validator<Number> duration = Validator.<Number>forField(JobField.DURATION.key())
            .rule(Rules.minimum(MIN_DURATION, "Duration must be at least " + MIN_DURATION))
            .rule(Rules.maximum(MAX_DURATION, "Duration must not exceed " + MAX_DURATION));

    private final Validator<Object> durationUnit = Validator.forField(JobField.DURATION_UNIT.key())
            .rule(Rules.custom(v -> asDurationUnit(v) != null,
                    "Invalid duration unit. Allowed values: " + allowed(DurationUnit.values())));

    private final Validator<Location> location = Validator.<Location>forField(JobField.LOCATION.key())
            .rule(Rules.<Location>custom(l -> l != null && !isBlank(l.state()) && !isBlank(l.district()),
                    "Both state and district are required", ValidationErrorKind.REQUIRED))
            .rule(Rules.<Location>custom(l -> l.latitude() == null || (l.latitude() >= -90 && l.latitude() <= 90),
                    "Invalid latitude", ValidationErrorKind.OUT_OF_RANGE))
            .rule(Rules.<Location>custom(l -> l.longitude() == null || (l.longitude() >= -180 && l.longitude() <= 180),
                    "Invalid longitude", ValidationErrorKind.OUT_OF_RANGE));

    private final Validator<Object> status = Validator.forField(JobField.STATUS.key())
            .rule(Rules.custom(v -> asStatus(v) != null,
                    "Invalid status. Allowed values: " + Arrays.stream(JobStatus.values())
                            .map(Enum::name)
                            .collect(Collectors.joining(", "))));

    private final Validator<String> employerId = Validator.<String>forField(JobField.EMPLOYER_ID.key())
            .rule(Rules.notEmpty("Employer ID is required"));

    /**
     * Validate a single field value. Returns at most one error.
     *
     * <p>Values are accepted in their typed form (e.g. {@link SalaryUnit}) or as form text
     * (e.g. "hourly", "250.5").
     */
    public ValidationOutcome validateField(JobField field, Object value) {
        Objects.requireNonNull(field, "field must not be null");
        return switch (field) {
            case TITLE -> title.validate(asString(value));
            case DESCRIPTION -> description.validate(asString(value));
            case SALARY -> salary.validate(asNumber(value));
            case SALARY_UNIT -> salaryUnit.validate(value);
            case DURATION -> duration.validate(asNumber(value));
            case DURATION_UNIT -> durationUnit.validate(value);
            case LOCATION -> location.validate(value instanceof Location l ? l : null);
            case STATUS -> status.validate(value);
            case EMPLOYER_ID -> employerId.validate(asString(value));
        };
    }

    /**
     * Validate by field name (e.g. "workDuration").
     *
     * @throws IllegalArgumentException if the name is not a known field
     */
    public ValidationOutcome validateField(String field, Object value) {
        JobField f = JobField.fromKey(field)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job field: " + field));
        return validateField(f, value);
    }

    public ValidationOutcome validateJob(JobPosting job) {
        Objects.requireNonNull(job, "job must not be null");
        List<ValidationError> errors = new ArrayList<>();
        for (JobField field : JobField.values()) {
            validateField(field, valueOf(job, field)).firstError().ifPresent(errors::add);
        }
        return errors.isEmpty() ? ValidationOutcome.valid() : ValidationOutcome.invalid(errors);
    }

    /**
     * Same as {@link #validateJob(JobPosting)} for the fields a draft carries.
     */
    public ValidationOutcome validateDraft(JobPostingDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        List<ValidationError> errors = new ArrayList<>();
        for (JobField field : JobField.values()) {
            if (!field.isOnDraft()) {
                continue;
            }
            validateField(field, valueOf(draft, field)).firstError().ifPresent(errors::add);
        }
        return errors.isEmpty() ? ValidationOutcome.valid() : ValidationOutcome.invalid(errors);
    }

    private static Object valueOf(JobPosting job, JobField field) {
        return switch (field) {
            case TITLE -> job.title();
            case DESCRIPTION -> job.description();
            case SALARY -> job.salaryAmount();
            case SALARY_UNIT -> job.salaryUnit();
            case DURATION -> job.durationAmount();
            case DURATION_UNIT -> job.durationUnit();
            case LOCATION -> job.location();
            case STATUS -> job.status();
            case EMPLOYER_ID -> job.employerId();
        };
    }

    private static Object valueOf(JobPostingDraft draft, JobField field) {
        return switch (field) {
            case TITLE -> draft.title();
            case DESCRIPTION -> draft.description();
            case SALARY -> draft.salaryAmount();
            case SALARY_UNIT -> draft.salaryUnit();
            case DURATION -> draft.durationAmount();
            case DURATION_UNIT -> draft.durationUnit();
            case LOCATION -> draft.location();
            case STATUS, EMPLOYER_ID -> null;
        };
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Number asNumber(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static SalaryUnit asSalaryUnit(Object value) {
        if (value instanceof SalaryUnit u) {
            return u;
        }
        return value instanceof String s ? SalaryUnit.parse(s).orElse(null) : null;
    }

    private static DurationUnit asDurationUnit(Object value) {
        if (value instanceof DurationUnit u) {
            return u;
        }
        return value instanceof String s ? DurationUnit.parse(s).orElse(null) : null;
    }

    private static JobStatus asStatus(Object value) {
        if (value instanceof JobStatus st) {
            return st;
        }
        return value instanceof String s ? JobStatus.parse(s).orElse(null) : null;
    }

    private static String allowed(SalaryUnit[] units) {
        return Arrays.stream(units).map(SalaryUnit::value).collect(Collectors.joining(", "));
    }

    private static String allowed(DurationUnit[] units) {
        return Arrays.stream(units).map(DurationUnit::value).collect(Collectors.joining(", "));
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
