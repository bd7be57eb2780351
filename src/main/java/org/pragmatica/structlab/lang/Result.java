package org.pragmatica.structlab.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation which may fail: either a value or a {@link Cause}.
 *
 * <p>Failures travel as values. Code that needs to propagate a failure of another type
 * uses {@code result.fold(Result::failure, value -> ...)}.
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(Objects.requireNonNull(cause, "cause"));
    }

    static Result<Unit> unitResult() {
        return new Success<>(Unit.UNIT);
    }

    /**
     * Collect a list of results into a result of list. The first failure wins.
     */
    static <T> Result<List<T>> allOf(List<Result<T>> results) {
        var values = new ArrayList<T>(results.size());
        for (var result : results) {
            if (result instanceof Failure<T> failure) {
                return failure(failure.cause());
            }
            values.add(((Success<T>) result).value());
        }
        return success(List.copyOf(values));
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Return the value or throw {@link IllegalStateException} if this is a failure.
     */
    T unwrap();

    <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return fold(Result::failure, value -> success(mapper.apply(value)));
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return fold(Result::failure, mapper);
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Cause> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    default T or(T replacement) {
        return fold(cause -> replacement, value -> value);
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Attempt to unwrap failure: " + cause.message());
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
