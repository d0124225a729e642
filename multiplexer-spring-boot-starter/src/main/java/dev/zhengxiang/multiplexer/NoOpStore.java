package dev.zhengxiang.multiplexer;

import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Store for memory-only caching: every load misses and writes are dropped.
 */
public final class NoOpStore<T> implements PersistentStore<T> {

    private static final NoOpStore<?> INSTANCE = new NoOpStore<>();

    private NoOpStore() {
    }

    @SuppressWarnings("unchecked")
    public static <T> NoOpStore<T> instance() {
        return (NoOpStore<T>) INSTANCE;
    }

    @Override
    public Optional<T> load(String key, @Nullable String domain) {
        return Optional.empty();
    }

    @Override
    public void save(T value, String key, @Nullable String domain) {
    }

    @Override
    public void deleteOne(String key, @Nullable String domain) {
    }

    @Override
    public void deleteDomain(String domain) {
    }
}
