package dev.zhengxiang.multiplexer;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Producer of a value identified by a key. Same exactly-once callback contract as {@link Fetcher}.
 *
 * @param <K> key type
 * @param <T> value type
 */
@FunctionalInterface
public interface KeyFetcher<K, T> {

    void fetch(K key, Consumer<Result<T>> onResult);

    static <K, T> KeyFetcher<K, T> fromFuture(Function<? super K, ? extends CompletableFuture<T>> call) {
        return (key, onResult) -> Fetcher.fromFuture(() -> call.apply(key)).fetch(onResult);
    }
}
