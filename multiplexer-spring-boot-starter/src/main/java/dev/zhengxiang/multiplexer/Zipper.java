package dev.zhengxiang.multiplexer;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Runs several asynchronous operations in parallel and delivers all their results at once, in
 * the order they were added. Failures do not short-circuit: every operation runs to completion.
 * <p>
 * Operations are stored, not consumed, so the same zipper can be synced repeatedly.
 * <pre>{@code
 * new Zipper()
 *         .add(profile)
 *         .add("u1", users)
 *         .add(onResult -> onResult.accept(Result.success("hello")))
 *         .sync(results -> ...);
 * }</pre>
 */
public class Zipper {

    @FunctionalInterface
    public interface TriConsumer<A, B, C> {
        void accept(A a, B b, C c);
    }

    private final List<Fetcher<Object>> fetchers = new ArrayList<>();

    @SuppressWarnings("unchecked")
    public <T> Zipper add(Fetcher<T> fetcher) {
        fetchers.add(onResult -> fetcher.fetch(result -> onResult.accept((Result<Object>) result)));
        return this;
    }

    public <T> Zipper add(Multiplexer<T> multiplexer) {
        return add((Fetcher<T>) multiplexer::request);
    }

    public <K, T> Zipper add(K key, MultiplexerMap<K, T> multiplexerMap) {
        return add((Fetcher<T>) onResult -> multiplexerMap.request(key, onResult));
    }

    public <T> Zipper add(URI uri, CachingLoader<T> loader) {
        return add((Fetcher<T>) onResult -> loader.request(uri, onResult));
    }

    public int size() {
        return fetchers.size();
    }

    /**
     * Starts all operations and calls {@code completion} once, on the thread of the last one to
     * finish, with one result per operation in {@code add} order.
     */
    public void sync(Consumer<List<Result<Object>>> completion) {
        List<Fetcher<Object>> snapshot = List.copyOf(fetchers);
        if (snapshot.isEmpty()) {
            completion.accept(Collections.emptyList());
            return;
        }
        @SuppressWarnings("unchecked")
        Result<Object>[] results = new Result[snapshot.size()];
        AtomicInteger remaining = new AtomicInteger(snapshot.size());
        for (int i = 0; i < snapshot.size(); i++) {
            int index = i;
            AtomicInteger calls = new AtomicInteger();
            Consumer<Result<Object>> onResult = result -> {
                if (calls.getAndIncrement() > 0) {
                    return;
                }
                results[index] = result;
                if (remaining.decrementAndGet() == 0) {
                    completion.accept(Collections.unmodifiableList(Arrays.asList(results)));
                }
            };
            try {
                snapshot.get(i).fetch(onResult);
            } catch (RuntimeException e) {
                onResult.accept(Result.failure(e));
            }
        }
    }

    public CompletableFuture<List<Result<Object>>> sync() {
        CompletableFuture<List<Result<Object>>> future = new CompletableFuture<>();
        sync(future::complete);
        return future;
    }

    @SuppressWarnings("unchecked")
    public static <A, B> void sync(Fetcher<A> a, Fetcher<B> b, BiConsumer<Result<A>, Result<B>> onResults) {
        new Zipper().add(a).add(b).sync(results -> onResults.accept(
                (Result<A>) (Result<?>) results.get(0),
                (Result<B>) (Result<?>) results.get(1)));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C> void sync(Fetcher<A> a, Fetcher<B> b, Fetcher<C> c,
                                      TriConsumer<Result<A>, Result<B>, Result<C>> onResults) {
        new Zipper().add(a).add(b).add(c).sync(results -> onResults.accept(
                (Result<A>) (Result<?>) results.get(0),
                (Result<B>) (Result<?>) results.get(1),
                (Result<C>) (Result<?>) results.get(2)));
    }
}
