package io.gigdraft.core;

import io.gigdraft.JobDraftWorkflow;
import io.gigdraft.cost.CostBreakdown;
import io.gigdraft.validation.JobField;
import io.gigdraft.validation.ValidationError;
import io.gigdraft.validation.ValidationErrorKind;
import io.gigdraft.validation.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Editing state of one job-posting form.
 *
 * <p>Every mutation validates the touched field, updates that field's entry in the error map,
 * recomputes the cost breakdown when pay or duration changed, and autosaves the draft when the
 * form is valid and has unsaved changes. Autosave failures are logged and never block editing.
 *
 * <p>Not thread-safe: the host must call mutators from one thread at a time (e.g. one UI event
 * at a time). Store calls complete on other threads; their callbacks only touch atomics.
 */
public class FormSessionController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FormSessionController.class);

    public static final String DEFAULT_SALARY_UNIT = SalaryUnit.MONTHLY.value();
    public static final String DEFAULT_DURATION_UNIT = DurationUnit.DAYS.value();

    private final JobDraftWorkflow workflow;
    private final String draftId;
    private final String jobId;
    private final boolean autosaveEnabled;

    // form values, as typed
    private String title = "";
    private String description = "";
    private String salary = "";
    private String salaryUnit = DEFAULT_SALARY_UNIT;
    private String duration = "";
    private String durationUnit = DEFAULT_DURATION_UNIT;
    private String state = "";
    private String district = "";
    private Double latitude;
    private Double longitude;

    private final Map<String, ValidationError> errors = new LinkedHashMap<>();
    private CostBreakdown costBreakdown = CostBreakdown.zero();

    // dirty when revision moved past the last revision a save completed for
    private long revision;
    private final AtomicLong savedRevision = new AtomicLong();
    private final AtomicReference<Instant> lastSavedAt = new AtomicReference<>();

    private final AtomicReference<DraftState> draftState = new AtomicReference<>(DraftState.EDITING);
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * @param jobId id of the posting being edited, or {@code null} for a new posting
     */
    public FormSessionController(JobDraftWorkflow workflow, String draftId, String jobId, boolean autosaveEnabled) {
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
        this.draftId = Objects.requireNonNull(draftId, "draftId must not be null");
        if (draftId.isBlank()) {
            throw new IllegalArgumentException("draftId must not be blank");
        }
        this.jobId = jobId;
        this.autosaveEnabled = autosaveEnabled;
    }

    /* ================= mutations ================= */

    public void updateTitle(String title) {
        ensureOpen();
        this.title = nullToEmpty(title);
        touched();
        validate(JobField.TITLE);
        afterMutation(false);
    }

    public void updateDescription(String description) {
        ensureOpen();
        this.description = nullToEmpty(description);
        touched();
        validate(JobField.DESCRIPTION);
        afterMutation(false);
    }

    public void updateSalary(String salary) {
        ensureOpen();
        this.salary = nullToEmpty(salary);
        touched();
        validate(JobField.SALARY);
        afterMutation(true);
    }

    public void updateSalaryUnit(String unit) {
        ensureOpen();
        this.salaryUnit = nullToEmpty(unit);
        touched();
        validate(JobField.SALARY_UNIT);
        afterMutation(true);
    }

    public void updateSalaryUnit(SalaryUnit unit) {
        updateSalaryUnit(unit == null ? null : unit.value());
    }

    public void updateDuration(String duration) {
        ensureOpen();
        this.duration = nullToEmpty(duration);
        touched();
        validate(JobField.DURATION);
        afterMutation(true);
    }

    public void updateDurationUnit(String unit) {
        ensureOpen();
        this.durationUnit = nullToEmpty(unit);
        touched();
        validate(JobField.DURATION_UNIT);
        afterMutation(true);
    }

    public void updateDurationUnit(DurationUnit unit) {
        updateDurationUnit(unit == null ? null : unit.value());
    }

    public void updateLocation(String state, String district) {
        ensureOpen();
        this.state = nullToEmpty(state);
        this.district = nullToEmpty(district);
        touched();
        validate(JobField.LOCATION);
        afterMutation(false);
    }

    public void updateCoordinates(Double latitude, Double longitude) {
        ensureOpen();
        this.latitude = latitude;
        this.longitude = longitude;
        touched();
        validate(JobField.LOCATION);
        afterMutation(false);
    }

    /**
     * Load a stored draft into the form. All fields are validated; the form starts clean.
     */
    public void restore(JobPostingDraft draft) {
        ensureOpen();
        Objects.requireNonNull(draft, "draft must not be null");
        if (!draftId.equals(draft.id())) {
            throw new IllegalArgumentException("draft " + draft.id() + " does not belong to session " + draftId);
        }
        this.title = draft.title();
        this.description = draft.description();
        this.salary = draft.salaryAmount() == 0.0 ? "" : formatAmount(draft.salaryAmount());
        this.salaryUnit = draft.salaryUnit() == null ? DEFAULT_SALARY_UNIT : draft.salaryUnit().value();
        this.duration = draft.durationAmount() == 0 ? "" : Integer.toString(draft.durationAmount());
        this.durationUnit = draft.durationUnit() == null ? DEFAULT_DURATION_UNIT : draft.durationUnit().value();
        this.state = nullToEmpty(draft.location().state());
        this.district = nullToEmpty(draft.location().district());
        this.latitude = draft.location().latitude();
        this.longitude = draft.location().longitude();

        validateAllFields();
        recomputeCost();
        savedRevision.set(revision);
        lastSavedAt.set(draft.lastModified());
    }

    /* ================= persistence ================= */

    /**
     * Validate the whole form and publish it. When any field is invalid the errors are returned and
     * nothing is written. Otherwise the current draft is saved and then published (or, for a session
     * editing an existing posting, applied to that posting).
     *
     * @throws IllegalStateException if the session is closed or not in {@link DraftState#EDITING}
     */
    public CompletableFuture<Result<JobPosting>> submit() {
        ensureOpen();
        if (draftState.get() != DraftState.EDITING) {
            throw new IllegalStateException("cannot submit a draft in state " + draftState.get());
        }

        validateAllFields();
        if (!errors.isEmpty()) {
            log.debug("submit rejected draftId={} fields={}", draftId, errors.keySet());
            ValidationOutcome outcome = ValidationOutcome.invalid(new ArrayList<>(errors.values()));
            return CompletableFuture.completedFuture(Result.failure(CoreError.validation(outcome)));
        }

        draftState.set(DraftState.PUBLISHING);
        long rev = revision;
        JobPostingDraft draft = toDraft();

        CompletableFuture<Result<JobPosting>> published = workflow.saveDraft(draft)
                .thenCompose(saved -> {
                    if (saved.isFailure()) {
                        return CompletableFuture.completedFuture(Result.<JobPosting>failure(saved.error()));
                    }
                    savedRevision.accumulateAndGet(rev, Math::max);
                    return jobId == null
                            ? workflow.publishDraft(draftId)
                            : workflow.updateJobFromDraft(jobId, draftId);
                })
                .thenApply(result -> {
                    if (result.isSuccess()) {
                        draftState.compareAndSet(DraftState.PUBLISHING, DraftState.PUBLISHED);
                    } else {
                        draftState.compareAndSet(DraftState.PUBLISHING, DraftState.EDITING);
                    }
                    return result;
                });
        return track(published);
    }

    /**
     * Save the draft as it is, valid or not.
     */
    public CompletableFuture<Result<JobPostingDraft>> saveDraft() {
        ensureOpen();
        return track(persist(toDraft(), revision, "manual save"));
    }

    /**
     * Delete the stored draft and end the session's editing.
     */
    public CompletableFuture<Result<Void>> discard() {
        ensureOpen();
        if (draftState.get() != DraftState.EDITING) {
            throw new IllegalStateException("cannot discard a draft in state " + draftState.get());
        }
        return track(workflow.discardDraft(draftId).thenApply(result -> {
            if (result.isSuccess()) {
                draftState.compareAndSet(DraftState.EDITING, DraftState.DISCARDED);
            }
            return result;
        }));
    }

    /**
     * Tear the session down. In-flight autosave/submit futures are cancelled and their results
     * discarded (writes already issued may still land). An unpublished empty draft is deleted; an
     * unpublished draft with unsaved content is saved so it can be resumed later.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        for (CompletableFuture<?> f : inFlight) {
            f.cancel(false);
        }
        inFlight.clear();

        if (draftState.get() != DraftState.EDITING) {
            return;
        }

        JobPostingDraft draft = toDraft();
        if (draft.isEmpty()) {
            draftState.set(DraftState.DISCARDED);
            workflow.discardDraft(draftId).whenComplete((result, ex) -> {
                if (ex != null || result.isFailure()) {
                    log.warn("empty draft cleanup on close failed draftId={} msg={}", draftId, describe(result, ex));
                }
            });
        } else if (isDirty()) {
            workflow.saveDraft(draft).whenComplete((result, ex) -> {
                if (ex != null || result.isFailure()) {
                    log.warn("final draft save on close failed draftId={} msg={}", draftId, describe(result, ex));
                }
            });
        }
    }

    /* ================= state ================= */

    /**
     * True when no field has an error and every required field is filled in.
     */
    public boolean isValid() {
        return errors.isEmpty()
                && !title.isBlank()
                && !description.isBlank()
                && !salary.isBlank()
                && !duration.isBlank()
                && !state.isBlank()
                && !district.isBlank();
    }

    public boolean isDirty() {
        return revision != savedRevision.get();
    }

    public boolean canSubmit() {
        return !closed && isValid() && draftState.get() == DraftState.EDITING;
    }

    public Map<String, ValidationError> errors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public ValidationError error(JobField field) {
        return errors.get(field.key());
    }

    public CostBreakdown costBreakdown() {
        return costBreakdown;
    }

    public DraftState draftState() {
        return draftState.get();
    }

    public Instant lastSavedAt() {
        return lastSavedAt.get();
    }

    public boolean isAutosaveEnabled() {
        return autosaveEnabled;
    }

    public boolean isClosed() {
        return closed;
    }

    public String draftId() {
        return draftId;
    }

    public String jobId() {
        return jobId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String salary() {
        return salary;
    }

    public String salaryUnit() {
        return salaryUnit;
    }

    public String duration() {
        return duration;
    }

    public String durationUnit() {
        return durationUnit;
    }

    public Location location() {
        return new Location(state, district, latitude, longitude);
    }

    /**
     * Snapshot of the form as a draft. Unparsable numbers become 0.
     */
    public JobPostingDraft toDraft() {
        return new JobPostingDraft(
                draftId,
                title,
                description,
                parseAmount(salary),
                SalaryUnit.parse(salaryUnit).orElse(null),
                parseDuration(duration),
                DurationUnit.parse(durationUnit).orElse(null),
                location(),
                nowInstant()
        );
    }

    /**
     * Utility: current time source for draft timestamps (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /* ================= helper ================= */

    private void touched() {
        revision++;
    }

    private void afterMutation(boolean costRelevant) {
        if (costRelevant) {
            recomputeCost();
        }
        if (autosaveEnabled && draftState.get() == DraftState.EDITING && isValid() && isDirty()) {
            track(persist(toDraft(), revision, "autosave"));
        }
    }

    private CompletableFuture<Result<JobPostingDraft>> persist(JobPostingDraft draft, long rev, String reason) {
        return workflow.saveDraft(draft).thenApply(result -> {
            if (closed) {
                log.debug("{} result discarded, session closed draftId={}", reason, draftId);
                return result;
            }
            if (result.isSuccess()) {
                savedRevision.accumulateAndGet(rev, Math::max);
                lastSavedAt.set(draft.lastModified());
                log.debug("{} stored draftId={} revision={}", reason, draftId, rev);
            } else {
                log.warn("{} failed draftId={} msg={}", reason, draftId, result.error().message());
            }
            return result;
        });
    }

    private <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        inFlight.add(future);
        future.whenComplete((r, ex) -> inFlight.remove(future));
        return future;
    }

    private void validateAllFields() {
        for (JobField field : JobField.values()) {
            if (field.isOnDraft()) {
                validate(field);
            }
        }
    }

    private void validate(JobField field) {
        ValidationError error = check(field);
        if (error == null) {
            errors.remove(field.key());
        } else {
            errors.put(field.key(), error);
        }
    }

    private ValidationError check(JobField field) {
        return switch (field) {
            case SALARY -> checkNumber(field, salary, "Please enter a valid salary amount", false);
            case DURATION -> checkNumber(field, duration, "Please enter a valid duration", true);
            case TITLE -> firstError(field, title);
            case DESCRIPTION -> firstError(field, description);
            case SALARY_UNIT -> firstError(field, salaryUnit);
            case DURATION_UNIT -> firstError(field, durationUnit);
            case LOCATION -> firstError(field, location());
            case STATUS, EMPLOYER_ID -> null;
        };
    }

    private ValidationError checkNumber(JobField field, String raw, String invalidMessage, boolean wholeNumber) {
        if (raw.isBlank()) {
            return new ValidationError(field.key(), "This field is required", ValidationErrorKind.REQUIRED);
        }
        Number value;
        try {
            value = wholeNumber ? Integer.valueOf(raw.trim()) : Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return new ValidationError(field.key(), invalidMessage, ValidationErrorKind.INVALID_VALUE);
        }
        // "NaN" and "Infinity" parse as doubles but are not amounts
        if (!Double.isFinite(value.doubleValue())) {
            return new ValidationError(field.key(), invalidMessage, ValidationErrorKind.INVALID_VALUE);
        }
        return firstError(field, value);
    }

    private ValidationError firstError(JobField field, Object value) {
        return workflow.validateField(field, value).firstError().orElse(null);
    }

    private void recomputeCost() {
        costBreakdown = workflow.computeCost(
                parseAmount(salary),
                SalaryUnit.parse(salaryUnit).orElse(null),
                parseDuration(duration),
                DurationUnit.parse(durationUnit).orElse(null)
        );
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("form session " + draftId + " is closed");
        }
    }

    private static double parseAmount(String raw) {
        try {
            double amount = raw.isBlank() ? 0.0 : Double.parseDouble(raw.trim());
            return Double.isFinite(amount) ? amount : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static int parseDuration(String raw) {
        try {
            return raw.isBlank() ? 0 : Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String formatAmount(double amount) {
        if (!Double.isFinite(amount)) {
            return "";
        }
        return BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String describe(Result<?> result, Throwable ex) {
        if (ex != null) {
            return ex.getMessage();
        }
        return result == null || result.error() == null ? "no result" : result.error().message();
    }
}
