package io.gigdraft.core;

import java.util.Objects;

/**
 * Failure reported by a {@link io.gigdraft.DraftStore} or {@link io.gigdraft.JobStore}.
 *
 * entity    : logical collection (e.g. "job_drafts")
 * operation : store operation that failed (e.g. "delete")
 * reason    : NOT_FOUND when the referenced record does not exist, FAILURE for I/O problems
 */
public record StoreError(
        String entity,
        String operation,
        String message,
        Reason reason,
        Throwable cause
) {
    public enum Reason {
        NOT_FOUND,
        FAILURE
    }

    public StoreError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static StoreError notFound(String entity, String operation, String id) {
        return new StoreError(entity, operation, "No " + entity + " record with id " + id, Reason.NOT_FOUND, null);
    }

    public static StoreError failure(String entity, String operation, String message, Throwable cause) {
        return new StoreError(entity, operation, message, Reason.FAILURE, cause);
    }

    public boolean isNotFound() {
        return reason == Reason.NOT_FOUND;
    }
}
