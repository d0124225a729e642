package dev.zhengxiang.multiplexer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Producer of a single value, typically a network request.
 * <p>
 * Implementations must eventually call {@code onResult} exactly once. A producer that never
 * calls back leaves its cache entry in the fetching state for good, and every later request
 * for that entry queues behind it.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface Fetcher<T> {

    void fetch(Consumer<Result<T>> onResult);

    /**
     * Adapts a future-returning call to the callback contract.
     */
    static <T> Fetcher<T> fromFuture(Supplier<? extends CompletableFuture<T>> call) {
        return onResult -> call.get().whenComplete((value, e) -> {
            if (e != null) {
                onResult.accept(Result.failure(unwrap(e)));
            } else {
                onResult.accept(Result.success(value));
            }
        });
    }

    static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
