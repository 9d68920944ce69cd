package io.gigdraft.core;

import io.gigdraft.DraftStore;
import io.gigdraft.EmployerIdProvider;
import io.gigdraft.JobDraftWorkflow;
import io.gigdraft.JobStore;
import io.gigdraft.cost.CostBreakdown;
import io.gigdraft.cost.CostCalculator;
import io.gigdraft.validation.JobField;
import io.gigdraft.validation.JobFieldValidators;
import io.gigdraft.validation.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Store-backed {@link JobDraftWorkflow}.
 *
 * <p>Publishing is a two-step saga, not a transaction:
 * <ol>
 *   <li>primary write: create (or update) the posting; a failure is returned and the draft is kept</li>
 *   <li>cleanup: delete the draft; a failure is logged at WARN and the publish still succeeds</li>
 * </ol>
 * Callers must not assume "job created" and "draft removed" happen together.
 *
 * <p>Validation happens before any write, so an invalid draft never reaches the {@link JobStore}.
 */
public class DraftLifecycleCoordinator implements JobDraftWorkflow {
    private static final Logger log = LoggerFactory.getLogger(DraftLifecycleCoordinator.class);

    private static final String DRAFT_ID = "draftId";
    private static final String JOB_ID = "jobId";

    private final JobStore jobStore;
    private final DraftStore draftStore;
    private final EmployerIdProvider employerIdProvider;
    private final JobFieldValidators validators;
    private final CostCalculator costCalculator;

    public DraftLifecycleCoordinator(JobStore jobStore, DraftStore draftStore, EmployerIdProvider employerIdProvider) {
        this(jobStore, draftStore, employerIdProvider, new JobFieldValidators(), new CostCalculator());
    }

    public DraftLifecycleCoordinator(JobStore jobStore,
                                     DraftStore draftStore,
                                     EmployerIdProvider employerIdProvider,
                                     JobFieldValidators validators,
                                     CostCalculator costCalculator) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.draftStore = Objects.requireNonNull(draftStore, "draftStore must not be null");
        this.employerIdProvider = Objects.requireNonNull(employerIdProvider, "employerIdProvider must not be null");
        this.validators = Objects.requireNonNull(validators, "validators must not be null");
        this.costCalculator = Objects.requireNonNull(costCalculator, "costCalculator must not be null");
    }

    @Override
    public ValidationOutcome validateField(JobField field, Object value) {
        return validators.validateField(field, value);
    }

    @Override
    public ValidationOutcome validateJob(JobPosting job) {
        return validators.validateJob(job);
    }

    @Override
    public ValidationOutcome validateDraft(JobPostingDraft draft) {
        return validators.validateDraft(draft);
    }

    @Override
    public CostBreakdown computeCost(double amount, SalaryUnit amountUnit, int duration, DurationUnit durationUnit) {
        return costCalculator.computeCost(amount, amountUnit, duration, durationUnit);
    }

    @Override
    public CompletableFuture<Result<JobPosting>> publishDraft(String draftId) {
        requireId(draftId, DRAFT_ID);
        return publish(draftId, null, "publish", jobStore::create);
    }

    @Override
    public CompletableFuture<Result<JobPosting>> updateJobFromDraft(String jobId, String draftId) {
        requireId(jobId, JOB_ID);
        requireId(draftId, DRAFT_ID);
        return publish(draftId, jobId, "update", candidate -> jobStore.update(jobId, candidate));
    }

    @Override
    public CompletableFuture<Result<JobPostingDraft>> createDraftFromJob(String jobId) {
        requireId(jobId, JOB_ID);
        return call(() -> jobStore.getById(jobId))
                .thenCompose(fetched -> {
                    if (fetched.isFailure()) {
                        if (fetched.error().isNotFound()) {
                            log.debug("job not found for draft copy jobId={}", jobId);
                            return completed(Result.<JobPostingDraft>failure(CoreError.notFound(JOB_ID, jobId)));
                        }
                        log.error("job fetch failed jobId={} msg={}", jobId, fetched.error().message(), fetched.error().cause());
                        return completed(Result.<JobPostingDraft>failure(CoreError.storeFailure(fetched.error())));
                    }
                    JobPostingDraft draft = JobPostingDraft.fromJob(fetched.value(), nowInstant());
                    return writeDraft(draft).thenApply(result -> {
                        if (result.isSuccess()) {
                            log.debug("draft created from job jobId={} draftId={}", jobId, draft.id());
                        }
                        return result;
                    });
                })
                .exceptionally(ex -> unexpected("Unexpected error creating draft from job " + jobId, ex));
    }

    @Override
    public CompletableFuture<Result<JobPostingDraft>> saveDraft(JobPostingDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        return writeDraft(draft)
                .exceptionally(ex -> unexpected("Unexpected error saving draft " + draft.id(), ex));
    }

    @Override
    public CompletableFuture<Result<JobPostingDraft>> loadDraft(String draftId) {
        requireId(draftId, DRAFT_ID);
        return call(() -> draftStore.get(draftId))
                .thenApply(fetched -> {
                    if (fetched.isFailure()) {
                        log.error("draft fetch failed draftId={} msg={}", draftId, fetched.error().message(), fetched.error().cause());
                        return Result.<JobPostingDraft>failure(CoreError.storeFailure(fetched.error()));
                    }
                    Optional<JobPostingDraft> draft = fetched.value();
                    if (draft == null || draft.isEmpty()) {
                        return Result.<JobPostingDraft>failure(CoreError.notFound(DRAFT_ID, draftId));
                    }
                    return Result.success(draft.get());
                })
                .exceptionally(ex -> unexpected("Unexpected error loading draft " + draftId, ex));
    }

    @Override
    public CompletableFuture<Result<Void>> discardDraft(String draftId) {
        requireId(draftId, DRAFT_ID);
        return call(() -> draftStore.delete(draftId))
                .thenApply(deleted -> {
                    if (deleted.isFailure()) {
                        log.error("draft discard failed draftId={} msg={}", draftId, deleted.error().message(), deleted.error().cause());
                        return Result.<Void>failure(CoreError.storeFailure(deleted.error()));
                    }
                    log.debug("draft discarded draftId={}", draftId);
                    return Result.<Void>success(null);
                })
                .exceptionally(ex -> unexpected("Unexpected error discarding draft " + draftId, ex));
    }

    /**
     * Utility: current time source for posting and draft timestamps (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private CompletableFuture<Result<JobPosting>> publish(
            String draftId,
            String jobId,
            String operation,
            Function<JobPosting, CompletableFuture<StoreResult<JobPosting>>> primaryWrite
    ) {
        return call(() -> draftStore.get(draftId))
                .thenCompose(fetched -> {
                    if (fetched.isFailure()) {
                        log.error("draft fetch failed op={} draftId={} msg={}",
                                operation, draftId, fetched.error().message(), fetched.error().cause());
                        return completed(Result.<JobPosting>failure(CoreError.storeFailure(fetched.error())));
                    }

                    Optional<JobPostingDraft> draft = fetched.value();
                    if (draft == null || draft.isEmpty()) {
                        log.debug("draft not found op={} draftId={}", operation, draftId);
                        return completed(Result.<JobPosting>failure(CoreError.notFound(DRAFT_ID, draftId)));
                    }

                    JobPosting candidate = JobPosting.fromDraft(
                            draft.get(),
                            jobId,
                            employerIdProvider.currentEmployerId(),
                            JobStatus.ACTIVE,
                            nowInstant()
                    );

                    ValidationOutcome outcome = validators.validateJob(candidate);
                    if (!outcome.isValid()) {
                        log.debug("draft rejected op={} draftId={} fields={}",
                                operation, draftId, outcome.errorsByField().keySet());
                        return completed(Result.<JobPosting>failure(CoreError.validation(outcome)));
                    }

                    return call(() -> primaryWrite.apply(candidate))
                            .thenCompose(written -> {
                                if (written.isFailure()) {
                                    // draft stays in place so the user can retry
                                    log.error("job {} failed draftId={} jobId={} msg={}",
                                            operation, draftId, jobId, written.error().message(), written.error().cause());
                                    return completed(Result.<JobPosting>failure(CoreError.storeFailure(written.error())));
                                }

                                JobPosting job = written.value();
                                return cleanupDraft(draftId, job.id(), operation).thenApply(ignored -> {
                                    log.info("draft {} succeeded draftId={} jobId={}", operation, draftId, job.id());
                                    return Result.success(job);
                                });
                            });
                })
                .exceptionally(ex -> unexpected("Unexpected error during " + operation + " of draft " + draftId, ex));
    }

    /**
     * Best-effort draft removal after the primary write succeeded. Never completes exceptionally.
     */
    private CompletableFuture<Void> cleanupDraft(String draftId, String jobId, String operation) {
        return call(() -> draftStore.delete(draftId))
                .handle((deleted, ex) -> {
                    if (ex != null) {
                        Throwable cause = unwrap(ex);
                        log.warn("draft cleanup failed after {} draftId={} jobId={} msg={}",
                                operation, draftId, jobId, cause.getMessage(), cause);
                    } else if (deleted == null || deleted.isFailure()) {
                        StoreError error = deleted == null ? null : deleted.error();
                        log.warn("draft cleanup failed after {} draftId={} jobId={} msg={}",
                                operation, draftId, jobId,
                                error == null ? "no result" : error.message(),
                                error == null ? null : error.cause());
                    }
                    return null;
                });
    }

    private CompletableFuture<Result<JobPostingDraft>> writeDraft(JobPostingDraft draft) {
        return call(() -> draftStore.save(draft))
                .thenApply(saved -> {
                    if (saved.isFailure()) {
                        log.error("draft save failed draftId={} msg={}", draft.id(), saved.error().message(), saved.error().cause());
                        return Result.<JobPostingDraft>failure(CoreError.storeFailure(saved.error()));
                    }
                    return Result.success(draft);
                });
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> invocation) {
        try {
            CompletableFuture<T> future = invocation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("store returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> CompletableFuture<T> completed(T value) {
        return CompletableFuture.completedFuture(value);
    }

    private static <T> Result<T> unexpected(String message, Throwable ex) {
        Throwable cause = unwrap(ex);
        log.error("{} msg={}", message, cause.getMessage(), cause);
        return Result.failure(CoreError.unexpected(message, cause));
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static void requireId(String id, String name) {
        Objects.requireNonNull(id, name + " must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
