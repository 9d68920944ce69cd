package io.gigdraft.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.gigdraft.DraftStore;
import io.gigdraft.EmployerIdProvider;
import io.gigdraft.JobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DraftLifecycleCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private JobStore jobStore;

    @Mock
    private DraftStore draftStore;

    private DraftLifecycleCoordinator coordinator;
    private ListAppender<ILoggingEvent> logs;

    @BeforeEach
    void setUp() {
        coordinator = coordinator(() -> "employer-1");
        logs = new ListAppender<>();
        logs.start();
        coordinatorLogger().addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        coordinatorLogger().detachAppender(logs);
    }

    @Test
    void publishShouldCreateActiveJobAndRemoveDraft() {
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "  Warehouse Associate  ")));
        when(jobStore.create(any())).thenAnswer(inv -> created(inv.<JobPosting>getArgument(0).withId("job-9")));
        when(draftStore.delete("d-1")).thenReturn(done());

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.isSuccess()).isTrue();
        JobPosting job = result.value();
        assertThat(job.id()).isEqualTo("job-9");
        assertThat(job.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(job.employerId()).isEqualTo("employer-1");
        assertThat(job.title()).isEqualTo("Warehouse Associate");
        assertThat(job.createdAt()).isEqualTo(NOW);

        ArgumentCaptor<JobPosting> candidate = ArgumentCaptor.forClass(JobPosting.class);
        verify(jobStore).create(candidate.capture());
        assertThat(candidate.getValue().id()).isNull();
        verify(draftStore).delete("d-1");
    }

    @Test
    void publishShouldSucceedAndWarnWhenCleanupFails() {
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "Warehouse Associate")));
        when(jobStore.create(any())).thenAnswer(inv -> created(inv.<JobPosting>getArgument(0).withId("job-9")));
        when(draftStore.delete("d-1")).thenReturn(CompletableFuture.completedFuture(
                StoreResult.failure(StoreError.failure("job_drafts", "delete", "connection reset", null))));

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().id()).isEqualTo("job-9");
        assertThat(warnings()).anySatisfy(message ->
                assertThat(message).contains("draft cleanup failed").contains("d-1").contains("job-9"));
    }

    @Test
    void publishShouldSucceedWhenCleanupThrows() {
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "Warehouse Associate")));
        when(jobStore.create(any())).thenAnswer(inv -> created(inv.<JobPosting>getArgument(0).withId("job-9")));
        when(draftStore.delete("d-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("pool closed")));

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(warnings()).hasSize(1);
    }

    @Test
    void publishShouldReportMissingDraftWithoutWriting() {
        when(draftStore.get("d-404")).thenReturn(CompletableFuture.completedFuture(StoreResult.success(Optional.empty())));

        Result<JobPosting> result = coordinator.publishDraft("d-404").join();

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.NOT_FOUND);
        assertThat(result.error().fieldErrors()).containsKey("draftId");
        verifyNoInteractions(jobStore);
        verify(draftStore, never()).delete(anyString());
        verify(draftStore, never()).save(any());
    }

    @Test
    void publishShouldKeepDraftWhenJobCreateFails() {
        StoreError error = StoreError.failure("job_postings", "create", "write concern timeout", null);
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "Warehouse Associate")));
        when(jobStore.create(any())).thenReturn(CompletableFuture.completedFuture(StoreResult.failure(error)));

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.STORE_FAILURE);
        assertThat(result.error().storeError()).isSameAs(error);
        verify(draftStore, never()).delete(anyString());
    }

    @Test
    void publishShouldRejectInvalidDraftBeforeAnyWrite() {
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "ab")));

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.VALIDATION);
        assertThat(result.error().fieldErrors()).containsOnlyKeys("title");
        verifyNoInteractions(jobStore);
        verify(draftStore, never()).delete(anyString());
    }

    @Test
    void publishShouldRequireAnEmployer() {
        DraftLifecycleCoordinator anonymous = coordinator(EmployerIdProvider.NONE);
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "Warehouse Associate")));

        Result<JobPosting> result = anonymous.publishDraft("d-1").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.VALIDATION);
        assertThat(result.error().fieldErrors()).containsOnlyKeys("employerId");
        verifyNoInteractions(jobStore);
    }

    @Test
    void updateShouldKeepTheExistingJobId() {
        when(draftStore.get("job-7_draft")).thenReturn(found(draft("job-7_draft", "Warehouse Lead")));
        when(jobStore.update(eq("job-7"), any())).thenAnswer(inv -> created(inv.getArgument(1)));
        when(draftStore.delete("job-7_draft")).thenReturn(done());

        Result<JobPosting> result = coordinator.updateJobFromDraft("job-7", "job-7_draft").join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().id()).isEqualTo("job-7");
        assertThat(result.value().title()).isEqualTo("Warehouse Lead");
        verify(jobStore, never()).create(any());
    }

    @Test
    void updateOfMissingJobShouldKeepDraft() {
        when(draftStore.get("job-7_draft")).thenReturn(found(draft("job-7_draft", "Warehouse Lead")));
        when(jobStore.update(eq("job-7"), any())).thenReturn(CompletableFuture.completedFuture(
                StoreResult.failure(StoreError.notFound("job_postings", "update", "job-7"))));

        Result<JobPosting> result = coordinator.updateJobFromDraft("job-7", "job-7_draft").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.STORE_FAILURE);
        assertThat(result.error().storeError().isNotFound()).isTrue();
        verify(draftStore, never()).delete(anyString());
    }

    @Test
    void draftFromJobShouldBeDeterministic() {
        JobPosting job = JobPosting.fromDraft(draft("d-1", "Warehouse Associate"), "job-7", "employer-1", JobStatus.ACTIVE, NOW);
        when(jobStore.getById("job-7")).thenReturn(created(job));
        when(draftStore.save(any())).thenReturn(done());

        Result<JobPostingDraft> first = coordinator.createDraftFromJob("job-7").join();
        Result<JobPostingDraft> second = coordinator.createDraftFromJob("job-7").join();

        assertThat(first.value().id()).isEqualTo("job-7_draft");
        assertThat(second.value()).isEqualTo(first.value());
        assertThat(first.value().title()).isEqualTo("Warehouse Associate");

        ArgumentCaptor<JobPostingDraft> saved = ArgumentCaptor.forClass(JobPostingDraft.class);
        verify(draftStore, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(JobPostingDraft::id).containsOnly("job-7_draft");
    }

    @Test
    void draftFromMissingJobShouldBeNotFound() {
        when(jobStore.getById("job-404")).thenReturn(CompletableFuture.completedFuture(
                StoreResult.failure(StoreError.notFound("job_postings", "getById", "job-404"))));

        Result<JobPostingDraft> result = coordinator.createDraftFromJob("job-404").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.NOT_FOUND);
        assertThat(result.error().fieldErrors()).containsKey("jobId");
        verifyNoInteractions(draftStore);
    }

    @Test
    void throwingStoreShouldSurfaceAsUnexpected() {
        when(draftStore.get("d-1")).thenThrow(new IllegalStateException("driver bug"));

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.UNEXPECTED);
        assertThat(result.error().cause()).hasMessage("driver bug");
        verifyNoInteractions(jobStore);
    }

    @Test
    void failedStoreFutureShouldSurfaceAsUnexpected() {
        when(draftStore.get("d-1")).thenReturn(found(draft("d-1", "Warehouse Associate")));
        when(jobStore.create(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("socket closed")));

        Result<JobPosting> result = coordinator.publishDraft("d-1").join();

        assertThat(result.error().kind()).isEqualTo(CoreError.Kind.UNEXPECTED);
        assertThat(result.error().cause()).isInstanceOf(IllegalStateException.class);
        verify(draftStore, never()).delete(anyString());
    }

    @Test
    void loadAndDiscardShouldMapStoreResults() {
        when(draftStore.get("d-404")).thenReturn(CompletableFuture.completedFuture(StoreResult.success(Optional.empty())));
        when(draftStore.delete("d-1")).thenReturn(CompletableFuture.completedFuture(
                StoreResult.failure(StoreError.failure("job_drafts", "delete", "disk full", null))));

        assertThat(coordinator.loadDraft("d-404").join().error().kind()).isEqualTo(CoreError.Kind.NOT_FOUND);
        assertThat(coordinator.discardDraft("d-1").join().error().kind()).isEqualTo(CoreError.Kind.STORE_FAILURE);
    }

    @Test
    void blankIdsShouldBeRejectedImmediately() {
        assertThatThrownBy(() -> coordinator.publishDraft(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.updateJobFromDraft(null, "d-1")).isInstanceOf(NullPointerException.class);
        verifyNoInteractions(jobStore, draftStore);
    }

    private DraftLifecycleCoordinator coordinator(EmployerIdProvider employer) {
        return new DraftLifecycleCoordinator(jobStore, draftStore, employer) {
            @Override
            protected Instant nowInstant() {
                return NOW;
            }
        };
    }

    private List<String> warnings() {
        return logs.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    private static Logger coordinatorLogger() {
        return (Logger) LoggerFactory.getLogger(DraftLifecycleCoordinator.class);
    }

    static JobPostingDraft draft(String id, String title) {
        return new JobPostingDraft(id, title, "Load and unload delivery trucks", 500, SalaryUnit.DAILY,
                5, DurationUnit.DAYS, Location.of("Karnataka", "Bengaluru"), NOW);
    }

    private static CompletableFuture<StoreResult<Optional<JobPostingDraft>>> found(JobPostingDraft draft) {
        return CompletableFuture.completedFuture(StoreResult.success(Optional.of(draft)));
    }

    private static CompletableFuture<StoreResult<JobPosting>> created(JobPosting job) {
        return CompletableFuture.completedFuture(StoreResult.success(job));
    }

    private static CompletableFuture<StoreResult<Void>> done() {
        return CompletableFuture.completedFuture(StoreResult.done());
    }
}
