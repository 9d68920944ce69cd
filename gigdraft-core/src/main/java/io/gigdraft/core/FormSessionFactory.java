package io.gigdraft.core;

import io.gigdraft.JobDraftWorkflow;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Opens {@link FormSessionController}s bound to one workflow.
 */
public class FormSessionFactory {

    private final JobDraftWorkflow workflow;
    private final boolean autosaveEnabled;

    public FormSessionFactory(JobDraftWorkflow workflow, boolean autosaveEnabled) {
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
        this.autosaveEnabled = autosaveEnabled;
    }

    /**
     * Blank form for a new posting, backed by a freshly generated draft id.
     */
    public FormSessionController newSession() {
        return new FormSessionController(workflow, newDraftId(), null, autosaveEnabled);
    }

    /**
     * Form pre-filled from a draft the caller already holds.
     */
    public FormSessionController resume(JobPostingDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        FormSessionController session = new FormSessionController(workflow, draft.id(), null, autosaveEnabled);
        session.restore(draft);
        return session;
    }

    public CompletableFuture<Result<FormSessionController>> resumeDraft(String draftId) {
        return workflow.loadDraft(draftId).thenApply(loaded -> loaded.isSuccess()
                ? Result.success(resume(loaded.value()))
                : Result.failure(loaded.error()));
    }

    /**
     * Copies an existing posting into its edit draft and opens a session that, on submit, updates
     * that posting instead of creating a new one.
     */
    public CompletableFuture<Result<FormSessionController>> editJob(String jobId) {
        return workflow.createDraftFromJob(jobId).thenApply(created -> {
            if (created.isFailure()) {
                return Result.<FormSessionController>failure(created.error());
            }
            FormSessionController session =
                    new FormSessionController(workflow, created.value().id(), jobId, autosaveEnabled);
            session.restore(created.value());
            return Result.success(session);
        });
    }

    protected String newDraftId() {
        return UUID.randomUUID().toString();
    }
}
