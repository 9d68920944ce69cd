package io.gigdraft.validation;

import java.util.Optional;

/**
 * Validated job fields, in declaration order. Whole-job validation reports errors in this order.
 */
public enum JobField {

    TITLE("title", true),
    DESCRIPTION("description", true),
    SALARY("salary", true),
    SALARY_UNIT("salaryUnit", true),
    DURATION("workDuration", true),
    DURATION_UNIT("workDurationUnit", true),
    LOCATION("location", true),
    STATUS("status", false),
    EMPLOYER_ID("employerId", false);

    private final String key;
    private final boolean onDraft;

    JobField(String key, boolean onDraft) {
        this.key = key;
        this.onDraft = onDraft;
    }

    /**
     * Field name used in error maps (e.g. "workDuration").
     */
    public String key() {
        return key;
    }

    /**
     * Whether a draft carries this field. Status and employer are set at publish time.
     */
    public boolean isOnDraft() {
        return onDraft;
    }

    public static Optional<JobField> fromKey(String key) {
        for (JobField f : values()) {
            if (f.key.equals(key)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
