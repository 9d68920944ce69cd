package io.gigdraft;

import io.gigdraft.core.DurationUnit;
import io.gigdraft.core.JobPosting;
import io.gigdraft.core.JobPostingDraft;
import io.gigdraft.core.Result;
import io.gigdraft.core.SalaryUnit;
import io.gigdraft.cost.CostBreakdown;
import io.gigdraft.validation.JobField;
import io.gigdraft.validation.ValidationOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Main draft &amp; publication API.
 *
 * <p>Validation and cost calculation are pure and synchronous. Store-backed operations return a
 * future that always completes normally with a {@link Result}; cancelling it discards the result
 * but does not undo writes already issued.
 *
 * <p>Typical usage:
 * <pre>{@code
 * workflow.saveDraft(draft);
 * Result<JobPosting> published = workflow.publishDraft(draft.id()).join();
 *
 * // later, to edit the posting
 * workflow.createDraftFromJob(published.value().id());
 * }</pre>
 */
public interface JobDraftWorkflow {

    ValidationOutcome validateField(JobField field, Object value);

    ValidationOutcome validateJob(JobPosting job);

    ValidationOutcome validateDraft(JobPostingDraft draft);

    CostBreakdown computeCost(double amount, SalaryUnit amountUnit, int duration, DurationUnit durationUnit);

    /**
     * Validate the stored draft, create a posting from it and then delete the draft.
     *
     * <p>Failing to delete the draft does not fail the publish; the posting already exists.
     */
    CompletableFuture<Result<JobPosting>> publishDraft(String draftId);

    /**
     * Same as {@link #publishDraft(String)} but overwrites the existing posting {@code jobId}.
     */
    CompletableFuture<Result<JobPosting>> updateJobFromDraft(String jobId, String draftId);

    /**
     * Copy a posting into the draft {@code "<jobId>_draft"}, overwriting any previous copy.
     */
    CompletableFuture<Result<JobPostingDraft>> createDraftFromJob(String jobId);

    CompletableFuture<Result<JobPostingDraft>> saveDraft(JobPostingDraft draft);

    CompletableFuture<Result<JobPostingDraft>> loadDraft(String draftId);

    CompletableFuture<Result<Void>> discardDraft(String draftId);
}
