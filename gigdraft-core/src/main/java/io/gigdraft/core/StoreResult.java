package io.gigdraft.core;

import java.util.Objects;

/**
 * Tagged success/error value returned by the stores instead of throwing.
 */
public record StoreResult<T>(T value, StoreError error) {

    public static <T> StoreResult<T> success(T value) {
        return new StoreResult<>(value, null);
    }

    public static StoreResult<Void> done() {
        return new StoreResult<>(null, null);
    }

    public static <T> StoreResult<T> failure(StoreError error) {
        return new StoreResult<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }
}
