package io.gigdraft.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Mutable-by-copy scratch version of a job posting. May be invalid at any time.
 */
public record JobPostingDraft(

        // identity
        String id,

        // content
        String title,
        String description,

        // pay
        double salaryAmount,
        SalaryUnit salaryUnit,
        int durationAmount,
        DurationUnit durationUnit,

        Location location,
        Instant lastModified
) {
    private static final String DRAFT_SUFFIX = "_draft";

    public JobPostingDraft {
        Objects.requireNonNull(id, "id must not be null");
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        location = location == null ? Location.empty() : location;
    }

    public static JobPostingDraft empty(String id, Instant now) {
        return new JobPostingDraft(id, "", "", 0.0, SalaryUnit.MONTHLY, 0, DurationUnit.DAYS, Location.empty(), now);
    }

    /**
     * Deterministic id of the draft used to edit an existing posting.
     */
    public static String draftIdForJob(String jobId) {
        return jobId + DRAFT_SUFFIX;
    }

    public static JobPostingDraft fromJob(JobPosting job, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        return new JobPostingDraft(
                draftIdForJob(job.id()),
                job.title(),
                job.description(),
                job.salaryAmount(),
                job.salaryUnit(),
                job.durationAmount(),
                job.durationUnit(),
                job.location(),
                now
        );
    }

    public boolean isEmpty() {
        return title.isBlank()
                && description.isBlank()
                && salaryAmount == 0.0
                && durationAmount == 0
                && location.hasNoContent();
    }
}
