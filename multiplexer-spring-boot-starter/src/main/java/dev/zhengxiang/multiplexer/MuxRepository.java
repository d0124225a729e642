package dev.zhengxiang.multiplexer;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Table of caches by identifier, for bulk operations such as clearing everything on sign-out or
 * flushing everything on shutdown.
 * <p>
 * The repository keeps strong references: caches that are not application singletons should be
 * unregistered before they are dropped.
 */
@Slf4j
public class MuxRepository implements AutoCloseable {

    private final Map<String, MuxCache> caches = new ConcurrentHashMap<>();

    /**
     * Flush all caches when the repository is closed.
     */
    @Getter
    @Setter
    private volatile boolean automaticFlush;

    /**
     * @throws IllegalStateException if a cache with the same identifier is already registered
     */
    public void register(MuxCache cache) {
        String id = StoreKeys.requireKey(cache.getCacheId());
        MuxCache existing = caches.putIfAbsent(id, cache);
        if (existing != null) {
            throw new IllegalStateException("MuxRepository: duplicate registration (ID: " + id + ")");
        }
        log.debug("Cache registered: id={}, type={}", id, cache.getClass().getSimpleName());
    }

    public void unregister(MuxCache cache) {
        if (caches.remove(cache.getCacheId(), cache)) {
            log.debug("Cache unregistered: id={}", cache.getCacheId());
        }
    }

    public Optional<MuxCache> get(String id) {
        return Optional.ofNullable(caches.get(id));
    }

    public boolean contains(String id) {
        return caches.containsKey(id);
    }

    public int size() {
        return caches.size();
    }

    /**
     * Writes the unsaved values of all caches to their persistent stores.
     */
    public void flushAll() {
        log.info("Flushing {} registered caches", caches.size());
        forEach("flush", MuxCache::flush);
    }

    /**
     * Drops memory and persisted values of all caches.
     */
    public void clearAll() {
        log.info("Clearing {} registered caches", caches.size());
        forEach("clear", MuxCache::clear);
    }

    /**
     * Drops memoized values of all caches, e.g. under memory pressure.
     */
    public void clearMemoryAll() {
        log.info("Clearing memory of {} registered caches", caches.size());
        forEach("clearMemory", MuxCache::clearMemory);
    }

    @Override
    public void close() {
        if (automaticFlush) {
            flushAll();
        }
        caches.clear();
    }

    private void forEach(String operation, Consumer<MuxCache> action) {
        List<MuxCache> snapshot = new ArrayList<>(caches.values());
        for (MuxCache cache : snapshot) {
            try {
                action.accept(cache);
            } catch (RuntimeException e) {
                log.error("Bulk {} failed for cache: id={}", operation, cache.getCacheId(), e);
            }
        }
    }
}
