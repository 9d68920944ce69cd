package io.gigdraft;

import io.gigdraft.core.JobPosting;
import io.gigdraft.core.StoreResult;

import java.util.concurrent.CompletableFuture;

/**
 * Persistence of canonical job postings.
 *
 * <p>Implementations must not throw; failures are reported as {@link StoreResult#failure}.
 * A missing id is reported with {@link io.gigdraft.core.StoreError.Reason#NOT_FOUND}.
 */
public interface JobStore {

    /**
     * Insert a new posting. The store assigns the id when {@code job.id()} is null or blank.
     */
    CompletableFuture<StoreResult<JobPosting>> create(JobPosting job);

    /**
     * Replace the content of an existing posting, keeping its id and creation time.
     */
    CompletableFuture<StoreResult<JobPosting>> update(String id, JobPosting job);

    CompletableFuture<StoreResult<JobPosting>> getById(String id);
}
