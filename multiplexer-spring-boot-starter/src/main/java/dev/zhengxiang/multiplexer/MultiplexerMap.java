package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Single-flight cache for a collection of values of the same type, e.g. user profiles by ID.
 * <p>
 * Each key gets its own fetch state, created on first use, so there is at most one producer call
 * per key at a time. Values are persisted in the store domain named after the cache, one entry
 * per key (its {@code toString()} form).
 *
 * @param <K> key type; needs a stable, non-empty {@code toString()} and consistent equality
 * @param <T> value type
 */
@Slf4j
public class MultiplexerMap<K, T> implements MuxCache {

    private final String cacheId;
    private final KeyFetcher<K, T> fetcher;
    private final PersistentStore<T> store;
    private final MuxConfig config;
    private final Object lock = new Object();
    private final Map<K, FetchCoordinator<T>> coordinators = new HashMap<>();

    public MultiplexerMap(String cacheId, KeyFetcher<K, T> fetcher) {
        this(cacheId, fetcher, NoOpStore.instance(), MuxConfig.defaults());
    }

    public MultiplexerMap(String cacheId, KeyFetcher<K, T> fetcher, PersistentStore<T> store, MuxConfig config) {
        this.cacheId = StoreKeys.requireKey(cacheId);
        this.fetcher = fetcher;
        this.store = store;
        this.config = config.validate();
        log.info("MultiplexerMap created: id={}, ttl={}", cacheId, config.getTimeToLive());
    }

    @Override
    public String getCacheId() {
        return cacheId;
    }

    public void request(K key, Consumer<Result<T>> completion) {
        request(false, key, completion);
    }

    /**
     * Returns the memoized value for the key if fresh, otherwise fetches it, joining a fetch for
     * the same key already in flight.
     *
     * @throws IllegalArgumentException if the key is null or its string form is empty
     */
    public void request(boolean refresh, K key, Consumer<Result<T>> completion) {
        // a coordinator discarded between lookup and request refuses it; look up again
        while (!coordinatorFor(key).request(refresh, completion)) {
            log.debug("Key state discarded concurrently, retrying: cache={}, key={}", cacheId, key);
        }
    }

    public CompletableFuture<T> request(K key) {
        CompletableFuture<T> future = new CompletableFuture<>();
        request(false, key, result -> result.ifSuccess(future::complete, future::completeExceptionally));
        return future;
    }

    public MultiplexerMap<K, T> refresh(K key) {
        coordinatorFor(key).refresh();
        return this;
    }

    /**
     * Fresh memoized value for the key, without triggering a fetch.
     */
    public Optional<T> storedValue(K key) {
        StoreKeys.requireKey(key);
        FetchCoordinator<T> coordinator;
        synchronized (lock) {
            coordinator = coordinators.get(key);
        }
        return coordinator == null ? Optional.empty() : coordinator.storedValue();
    }

    /**
     * Memoizes a value obtained elsewhere, e.g. from a multi-key request, as if it had been
     * fetched for this key.
     */
    public MultiplexerMap<K, T> storeSuccess(T value, K key) {
        coordinatorFor(key).storeSuccess(value);
        return this;
    }

    /**
     * Applies the fallback policy for an error obtained elsewhere and returns the cached value
     * that should be served for the key, if any.
     */
    public Optional<T> storeFailure(Throwable error, K key) {
        return coordinatorFor(key).storeFailure(error);
    }

    public MultiplexerMap<K, T> clearMemory(K key) {
        StoreKeys.requireKey(key);
        synchronized (lock) {
            FetchCoordinator<T> coordinator = coordinators.get(key);
            if (coordinator != null) {
                discard(key, coordinator);
            }
        }
        return this;
    }

    public MultiplexerMap<K, T> clear(K key) {
        String keyStr = StoreKeys.requireKey(key);
        clearMemory(key);
        store.deleteOne(keyStr, cacheId);
        return this;
    }

    @Override
    public MultiplexerMap<K, T> clearMemory() {
        synchronized (lock) {
            for (Map.Entry<K, FetchCoordinator<T>> entry : new ArrayList<>(coordinators.entrySet())) {
                discard(entry.getKey(), entry.getValue());
            }
        }
        return this;
    }

    @Override
    public MultiplexerMap<K, T> clear() {
        log.debug("Clearing multiplexer map: id={}", cacheId);
        clearMemory();
        store.deleteDomain(cacheId);
        return this;
    }

    @Override
    public MultiplexerMap<K, T> flush() {
        List<FetchCoordinator<T>> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(coordinators.values());
        }
        for (FetchCoordinator<T> coordinator : snapshot) {
            coordinator.flush();
        }
        return this;
    }

    /**
     * Number of keys with fetch state in memory.
     */
    public int size() {
        synchronized (lock) {
            return coordinators.size();
        }
    }

    public MultiplexerMap<K, T> register(MuxRepository repository) {
        repository.register(this);
        return this;
    }

    public void unregister(MuxRepository repository) {
        repository.unregister(this);
    }

    private FetchCoordinator<T> coordinatorFor(K key) {
        String keyStr = StoreKeys.requireKey(key);
        synchronized (lock) {
            return coordinators.computeIfAbsent(key, k -> new FetchCoordinator<>(
                    lock, cacheId, keyStr, cacheId, onResult -> fetcher.fetch(k, onResult), store, config));
        }
    }

    /**
     * Resets a key's state and drops it unless a fetch is in flight, in which case it is kept so
     * that requests keep joining that fetch. Called with the lock held.
     */
    private void discard(K key, FetchCoordinator<T> coordinator) {
        coordinator.clearMemory();
        if (coordinator.isIdle()) {
            coordinator.retire();
            coordinators.remove(key);
        }
    }
}
