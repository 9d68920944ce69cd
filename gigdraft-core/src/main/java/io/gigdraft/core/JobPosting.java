package io.gigdraft.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical job posting. Owned by the {@link io.gigdraft.JobStore} once created.
 */
public record JobPosting(

        // identity
        String id,
        String employerId,

        // content
        String title,
        String description,

        // pay
        double salaryAmount,
        SalaryUnit salaryUnit,
        int durationAmount,
        DurationUnit durationUnit,

        Location location,
        JobStatus status,

        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Candidate posting built from a draft. {@code id} is {@code null} when the store assigns it.
     */
    public static JobPosting fromDraft(JobPostingDraft draft, String id, String employerId, JobStatus status, Instant now) {
        Objects.requireNonNull(draft, "draft must not be null");
        return new JobPosting(
                id,
                employerId,
                draft.title().trim(),
                draft.description().trim(),
                draft.salaryAmount(),
                draft.salaryUnit(),
                draft.durationAmount(),
                draft.durationUnit(),
                draft.location(),
                status,
                now,
                now
        );
    }

    public JobPosting withId(String id) {
        return new JobPosting(id, employerId, title, description, salaryAmount, salaryUnit,
                durationAmount, durationUnit, location, status, createdAt, updatedAt);
    }
}
