package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Single-flight state machine for one cache entry.
 * <p>
 * Holds the memoized value with its completion time, the callbacks waiting for an in-flight
 * fetch, the soft-refresh flag and the dirty flag. At most one producer call is outstanding at a
 * time: requests arriving while it runs are queued and all of them receive its result, in
 * arrival order.
 * <p>
 * State is guarded by a lock supplied by the owning cache. The producer, the persistent store
 * and the callbacks are always called outside that lock.
 * <p>
 * Clearing memory while a fetch is in flight does not cancel it. The queued callers still get
 * its result, but the result is not memoized: every clear bumps a generation counter and a
 * resolution carrying an older generation leaves the state alone.
 */
@Slf4j
final class FetchCoordinator<T> {

    private final Object lock;
    private final String name;
    private final String key;
    @Nullable
    private final String domain;
    private final Fetcher<T> fetcher;
    private final PersistentStore<T> store;
    private final MuxConfig config;
    private final long ttlNanos;

    private final List<Consumer<Result<T>>> pending = new ArrayList<>();
    private T storedValue;
    private long completionTime;
    private boolean completed;
    private boolean refreshRequested;
    private boolean dirty;
    private long generation;
    private boolean retired;

    FetchCoordinator(Object lock,
                     String name,
                     String key,
                     @Nullable String domain,
                     Fetcher<T> fetcher,
                     PersistentStore<T> store,
                     MuxConfig config) {
        this.lock = lock;
        this.name = name;
        this.key = key;
        this.domain = domain;
        this.fetcher = fetcher;
        this.store = store;
        this.config = config;
        this.ttlNanos = config.timeToLiveNanos();
    }

    /**
     * @return {@code false} if this coordinator was retired by its owner and did not take the
     * request
     */
    boolean request(boolean forceRefresh, Consumer<Result<T>> completion) {
        T cached = null;
        boolean startFetch = false;
        long fetchGeneration;
        synchronized (lock) {
            if (retired) {
                return false;
            }
            fetchGeneration = generation;
            if (!forceRefresh && !refreshRequested && isFresh()) {
                cached = storedValue;
            } else {
                refreshRequested = false;
                pending.add(completion);
                startFetch = pending.size() == 1;
            }
        }
        if (cached != null) {
            log.debug("Memory hit: cache={}, key={}", name, key);
            completion.accept(Result.success(cached));
            return true;
        }
        if (!startFetch) {
            log.debug("Fetch in progress, queued: cache={}, key={}", name, key);
            return true;
        }
        log.debug("Fetching: cache={}, key={}", name, key);
        startFetch(fetchGeneration);
        return true;
    }

    void refresh() {
        synchronized (lock) {
            refreshRequested = true;
        }
    }

    void clearMemory() {
        synchronized (lock) {
            storedValue = null;
            completed = false;
            dirty = false;
            refreshRequested = false;
            generation++;
        }
    }

    void clear() {
        clearMemory();
        store.deleteOne(key, domain);
    }

    /**
     * Writes the memoized value if it has not been written yet.
     *
     * @throws StorageException if the store rejects the write; the value stays dirty
     */
    void flush() {
        T value;
        synchronized (lock) {
            if (!dirty || storedValue == null) {
                return;
            }
            value = storedValue;
        }
        store.save(value, key, domain);
        synchronized (lock) {
            if (storedValue == value) {
                dirty = false;
            }
        }
    }

    /**
     * Marks this coordinator as dropped by its owner; later requests are refused. Called with the
     * lock held.
     */
    void retire() {
        retired = true;
    }

    boolean isIdle() {
        synchronized (lock) {
            return pending.isEmpty();
        }
    }

    /**
     * Value that would be served without a fetch, if any.
     */
    Optional<T> storedValue() {
        synchronized (lock) {
            return isFresh() ? Optional.of(storedValue) : Optional.empty();
        }
    }

    /**
     * Memoizes a value obtained outside this coordinator as if it had been fetched.
     */
    void storeSuccess(T value) {
        synchronized (lock) {
            memoize(value);
        }
    }

    /**
     * Applies the failure policy to an error obtained outside this coordinator and returns the
     * fallback value, if one is served.
     */
    Optional<T> storeFailure(Throwable error) {
        T fallback = fallbackFor(error);
        synchronized (lock) {
            applyFailure(fallback);
        }
        return Optional.ofNullable(fallback);
    }

    private void startFetch(long fetchGeneration) {
        AtomicBoolean resolved = new AtomicBoolean();
        Consumer<Result<T>> onResult = result -> {
            if (!resolved.compareAndSet(false, true)) {
                log.warn("Producer called back more than once, ignoring: cache={}, key={}", name, key);
                return;
            }
            complete(fetchGeneration, result);
        };
        try {
            fetcher.fetch(onResult);
        } catch (RuntimeException e) {
            log.warn("Producer threw instead of calling back: cache={}, key={}", name, key, e);
            onResult.accept(Result.failure(e));
        }
    }

    private void complete(long fetchGeneration, Result<T> result) {
        Result<T> delivered = result;
        T fallback = null;
        if (result.isFailure()) {
            fallback = fallbackFor(result.getError());
            if (fallback != null) {
                log.warn("Fetch failed with a transient error, serving cached value: cache={}, key={}, error={}",
                        name, key, result.getError().toString());
                delivered = Result.success(fallback);
            } else {
                log.debug("Fetch failed: cache={}, key={}", name, key, result.getError());
            }
        }
        List<Consumer<Result<T>>> waiters;
        synchronized (lock) {
            if (fetchGeneration != generation) {
                log.debug("Memory cleared during fetch, result not memoized: cache={}, key={}", name, key);
            } else if (result.isSuccess()) {
                memoize(result.get());
            } else {
                applyFailure(fallback);
            }
            waiters = new ArrayList<>(pending);
            pending.clear();
        }
        for (Consumer<Result<T>> waiter : waiters) {
            try {
                waiter.accept(delivered);
            } catch (RuntimeException e) {
                log.error("Completion callback failed: cache={}, key={}", name, key, e);
            }
        }
    }

    /**
     * Fallback for a failed fetch: the memoized value, else the persisted one. {@code null} if
     * the error is not transient or nothing is cached.
     */
    @Nullable
    private T fallbackFor(Throwable error) {
        if (!config.getTransientErrorPolicy().isTransient(error)) {
            return null;
        }
        synchronized (lock) {
            if (storedValue != null) {
                return storedValue;
            }
        }
        return store.load(key, domain).orElse(null);
    }

    private void memoize(T value) {
        storedValue = value;
        completionTime = config.getTicker().read();
        completed = true;
        dirty = true;
    }

    private void applyFailure(@Nullable T fallback) {
        completed = false;
        if (fallback != null) {
            if (storedValue != fallback) {
                storedValue = fallback;
                dirty = false;
            }
        } else {
            storedValue = null;
            dirty = false;
        }
    }

    private boolean isFresh() {
        return completed && storedValue != null
                && config.getTicker().read() - completionTime <= ttlNanos;
    }
}
