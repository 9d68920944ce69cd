package io.gigdraft;

import io.gigdraft.core.JobPostingDraft;
import io.gigdraft.core.StoreResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence of scratch drafts keyed by id.
 *
 * <p>Implementations must not throw; failures are reported as {@link StoreResult#failure}.
 * Concurrent saves of the same id are last-write-wins.
 */
public interface DraftStore {

    /**
     * An empty optional when no draft with this id exists.
     */
    CompletableFuture<StoreResult<Optional<JobPostingDraft>>> get(String id);

    /**
     * Insert or overwrite.
     */
    CompletableFuture<StoreResult<Void>> save(JobPostingDraft draft);

    /**
     * Delete by id. Deleting a missing draft is not an error.
     */
    CompletableFuture<StoreResult<Void>> delete(String id);
}
