/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.util;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The outcome of an operation that can fail in an expected way, such as
 * loading a schema. Exactly one of the success or failure values is present.
 *
 * @param <T> Type of successful result
 * @param <E> Type of failed result
 */
public final class Result<T, E> {
    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    /**
     * @param value The success value, which must not be null
     * @param <T> Type of successful result
     * @param <E> Type of failed result
     * @return The successful result
     */
    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(Objects.requireNonNull(value), null);
    }

    /**
     * @param error The failed value, which must not be null
     * @param <T> Type of successful result
     * @param <E> Type of failed result
     * @return The failed result
     */
    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return value != null;
    }

    public boolean isErr() {
        return error != null;
    }

    /**
     * @return The successful value
     * @throws IllegalStateException if this result is failed
     */
    public T unwrap() {
        if (value == null) {
            throw new IllegalStateException("Called unwrap on an Err Result: " + error);
        }
        return value;
    }

    /**
     * @return The failed value
     * @throws IllegalStateException if this result is successful
     */
    public E unwrapErr() {
        if (error == null) {
            throw new IllegalStateException("Called unwrapErr on an Ok Result: " + value);
        }
        return error;
    }

    public Optional<T> get() {
        return Optional.ofNullable(value);
    }

    /**
     * @param mapper Function to apply to the successful value of this result
     * @param <U> The type to map to
     * @return A new result with {@code mapper} applied, if this result is a
     *  successful one
     */
    public <U> Result<U, E> map(Function<T, U> mapper) {
        if (isOk()) {
            return Result.ok(mapper.apply(value));
        }
        return Result.err(error);
    }

    /**
     * @param mapper Function producing another result from the successful value
     * @param <U> The successful type of the produced result
     * @return The produced result, or this failure
     */
    public <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
        if (isOk()) {
            return mapper.apply(value);
        }
        return Result.err(error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
