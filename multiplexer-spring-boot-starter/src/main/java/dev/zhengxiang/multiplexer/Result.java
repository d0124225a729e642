package dev.zhengxiang.multiplexer;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an asynchronous operation: either a value or the error that prevented it.
 *
 * @param <T> value type
 */
public final class Result<T> {

    private final T value;
    private final Throwable error;

    private Result(T value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(Throwable error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the value, or throws if this is a failure. Checked errors are wrapped in
     * {@link CompletionException}.
     */
    public T get() {
        if (error == null) {
            return value;
        }
        if (error instanceof RuntimeException) {
            throw (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        throw new CompletionException(error);
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Throwable getError() {
        if (error == null) {
            throw new NoSuchElementException("Result is a success");
        }
        return error;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public void ifSuccess(Consumer<? super T> onSuccess, Consumer<? super Throwable> onFailure) {
        if (error == null) {
            onSuccess.accept(value);
        } else {
            onFailure.accept(error);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result)) {
            return false;
        }
        Result<?> other = (Result<?>) o;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
