package io.gigdraft.core;

import java.util.Objects;

/**
 * Outcome of a workflow operation: either a value or a {@link CoreError}.
 */
public record Result<T>(T value, CoreError error) {

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(CoreError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }
}
