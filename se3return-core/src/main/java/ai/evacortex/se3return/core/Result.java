/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.exceptions.ReturnException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a fail-fast construction that does not throw: either a value or a tagged failure.
 *
 * <p>Used on code paths that build many candidates (encoders, batch entries) so that a single
 * invalid input can be recorded and skipped without exception-based control flow.</p>
 *
 * @param <T> type of the successful value
 */
public final class Result<T> {

    public record Failure(ErrorKind kind, String message) {
        public Failure {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }

        public ReturnException toException() {
            return kind.toException(message);
        }
    }

    private final T value;
    private final Failure failure;

    private Result(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Result<>(null, new Failure(kind, message));
    }

    public static <T> Result<T> failure(Failure failure) {
        return new Result<>(null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isOk() {
        return failure == null;
    }

    public T value() {
        if (failure != null) {
            throw new IllegalStateException("No value present: " + failure.message());
        }
        return value;
    }

    public Failure failure() {
        if (failure == null) {
            throw new IllegalStateException("Result is successful");
        }
        return failure;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return failure == null ? Result.ok(mapper.apply(value)) : Result.failure(failure);
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return failure == null ? mapper.apply(value) : Result.failure(failure);
    }

    /** Returns the value or throws the typed exception matching the failure kind. */
    public T orElseThrow() {
        if (failure != null) {
            throw failure.toException();
        }
        return value;
    }

    @Override
    public String toString() {
        return failure == null ? "Ok[" + value + "]" : "Failure[" + failure.kind() + ": " + failure.message() + "]";
    }
}
