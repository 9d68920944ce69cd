package io.gigdraft.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gigdraft.core.Location;
import io.gigdraft.core.StoreError;
import io.gigdraft.core.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Shared plumbing of the Mongo stores: every call runs on the worker executor, is bounded by the
 * store timeout and never completes exceptionally.
 */
abstract class MongoStoreSupport {
    private static final Logger log = LoggerFactory.getLogger(MongoStoreSupport.class);

    protected final MongoTemplate mongoTemplate;
    protected final ObjectMapper objectMapper;
    private final Executor executor;
    private final Duration timeout;

    protected MongoStoreSupport(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Executor executor, Duration timeout) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        // documents may carry keys written by other versions of the record
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
    }

    /**
     * Name of the backing collection, used in {@link StoreError#entity()}.
     */
    protected abstract String entity();

    protected <T> CompletableFuture<StoreResult<T>> execute(String operation, String id, Supplier<StoreResult<T>> call) {
        CompletableFuture<StoreResult<T>> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RuntimeException e) {
            // executor rejected the task (e.g. already shut down)
            return CompletableFuture.completedFuture(failed(operation, id, e));
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> failed(operation, id, ex));
    }

    private <T> StoreResult<T> failed(String operation, String id, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String message = cause instanceof TimeoutException
                ? entity() + " " + operation + " timed out after " + timeout
                : entity() + " " + operation + " failed: " + cause.getMessage();
        log.error("mongo store call failed entity={} op={} id={} msg={}", entity(), operation, id, message, cause);
        return StoreResult.failure(StoreError.failure(entity(), operation, message, cause));
    }

    protected Map<String, Object> toLocationMap(Location location) {
        if (location == null) {
            return null;
        }
        return objectMapper.convertValue(location, new TypeReference<>() {
        });
    }

    protected Location toLocation(Map<String, Object> raw) {
        if (raw == null) {
            return Location.empty();
        }
        return objectMapper.convertValue(raw, Location.class);
    }

    protected static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
