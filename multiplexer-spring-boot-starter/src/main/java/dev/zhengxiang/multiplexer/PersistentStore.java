package dev.zhengxiang.multiplexer;

import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Storage for memoized values, addressed by a key within a domain. The domain is the logical
 * collection name, e.g. the name of a {@link MultiplexerMap}; a {@code null} domain is the root
 * namespace used by single-value caches.
 * <p>
 * Reads never throw: a value that cannot be read or decoded is a miss. Writes may throw
 * {@link StorageException}. Implementations must tolerate concurrent calls for different keys.
 *
 * @param <T> value type
 */
public interface PersistentStore<T> {

    Optional<T> load(String key, @Nullable String domain);

    void save(T value, String key, @Nullable String domain);

    void deleteOne(String key, @Nullable String domain);

    void deleteDomain(String domain);
}
