package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Single-flight cache for one value, e.g. the current user's profile.
 * <p>
 * Concurrent {@link #request} calls share one producer call; the result is kept in memory for
 * the configured TTL and, when the producer fails with a transient error, the last known value
 * (from memory or from the persistent store) is returned instead of the error. The value is
 * persisted under the cache identifier on {@link #flush()}.
 *
 * @param <T> value type
 */
@Slf4j
public class Multiplexer<T> implements MuxCache {

    private final String cacheId;
    private final FetchCoordinator<T> coordinator;

    public Multiplexer(String cacheId, Fetcher<T> fetcher) {
        this(cacheId, fetcher, NoOpStore.instance(), MuxConfig.defaults());
    }

    public Multiplexer(String cacheId, Fetcher<T> fetcher, PersistentStore<T> store, MuxConfig config) {
        this.cacheId = StoreKeys.requireKey(cacheId);
        this.coordinator = new FetchCoordinator<>(new Object(), cacheId, cacheId, null, fetcher, store, config);
        log.info("Multiplexer created: id={}, ttl={}", cacheId, config.getTimeToLive());
    }

    @Override
    public String getCacheId() {
        return cacheId;
    }

    public void request(Consumer<Result<T>> completion) {
        request(false, completion);
    }

    /**
     * Returns the memoized value if fresh, otherwise fetches it, joining a fetch already in
     * flight. The completion is called on the caller's thread for a memory hit and on the
     * producer's thread otherwise.
     *
     * @param refresh fetch even if the memoized value is still fresh
     */
    public void request(boolean refresh, Consumer<Result<T>> completion) {
        coordinator.request(refresh, completion);
    }

    public CompletableFuture<T> request() {
        CompletableFuture<T> future = new CompletableFuture<>();
        request(false, result -> result.ifSuccess(future::complete, future::completeExceptionally));
        return future;
    }

    /**
     * Soft refresh: the next request fetches even if the value is fresh. A failed refresh still
     * falls back to the cached value on transient errors.
     */
    public Multiplexer<T> refresh() {
        coordinator.refresh();
        return this;
    }

    @Override
    public Multiplexer<T> flush() {
        coordinator.flush();
        return this;
    }

    @Override
    public Multiplexer<T> clearMemory() {
        coordinator.clearMemory();
        return this;
    }

    @Override
    public Multiplexer<T> clear() {
        log.debug("Clearing multiplexer: id={}", cacheId);
        coordinator.clear();
        return this;
    }

    /**
     * Adds this cache to the repository's bulk operations. The repository keeps a strong
     * reference until {@link #unregister(MuxRepository)}.
     */
    public Multiplexer<T> register(MuxRepository repository) {
        repository.register(this);
        return this;
    }

    public void unregister(MuxRepository repository) {
        repository.unregister(this);
    }
}
