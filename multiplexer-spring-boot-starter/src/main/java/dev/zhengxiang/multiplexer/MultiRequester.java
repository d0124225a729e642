package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Combines multi-key backend requests (e.g. {@code /profiles/[id1,id2]}) with the per-key caching
 * of a {@link MultiplexerMap}. Keys with a fresh value in the map are answered from memory and
 * only the rest are fetched, in one call; fetched values are stored back into the map so that
 * single-key requests benefit from them too.
 *
 * @param <K> key type
 * @param <T> value type
 */
@Slf4j
public class MultiRequester<K, T> {

    /**
     * Producer for several keys at once. The result may hold fewer values than keys requested,
     * in any order.
     */
    @FunctionalInterface
    public interface MultiFetcher<K, T> {
        void fetch(List<K> keys, Consumer<Result<List<T>>> onResult);
    }

    private final MultiplexerMap<K, T> map;
    private final Function<? super T, ? extends K> keyOf;
    private final MultiFetcher<K, T> fetcher;

    /**
     * @param keyOf extracts the key of a fetched value
     */
    public MultiRequester(MultiplexerMap<K, T> map, Function<? super T, ? extends K> keyOf, MultiFetcher<K, T> fetcher) {
        this.map = map;
        this.keyOf = keyOf;
        this.fetcher = fetcher;
    }

    /**
     * Retrieves values for the keys. The completion receives the values found, keyed and in
     * request order where possible, plus the producer error if the fetch failed; on a failure
     * the map's fallback policy decides which previously cached values are still returned.
     */
    public void request(List<K> keys, BiConsumer<Map<K, T>, Throwable> completion) {
        Map<K, T> values = new LinkedHashMap<>();
        List<K> remaining = new ArrayList<>();
        for (K key : keys) {
            Optional<T> cached = map.storedValue(key);
            if (cached.isPresent()) {
                values.put(key, cached.get());
            } else if (!remaining.contains(key)) {
                remaining.add(key);
            }
        }
        if (remaining.isEmpty()) {
            log.debug("All keys served from memory: cache={}, keys={}", map.getCacheId(), keys.size());
            completion.accept(values, null);
            return;
        }
        log.debug("Fetching keys: cache={}, cached={}, remaining={}", map.getCacheId(), values.size(), remaining.size());
        fetcher.fetch(List.copyOf(remaining), result -> {
            Throwable error = null;
            if (result.isSuccess()) {
                storeSuccess(result.get(), values);
            } else {
                error = result.getError();
                for (K key : remaining) {
                    map.storeFailure(error, key).ifPresent(value -> values.put(key, value));
                }
            }
            completion.accept(values, error);
        });
    }

    /**
     * Stores values obtained elsewhere into the map.
     */
    public void storeSuccess(List<T> fetched) {
        storeSuccess(fetched, null);
    }

    private void storeSuccess(@Nullable List<T> fetched, @Nullable Map<K, T> into) {
        if (fetched == null) {
            return;
        }
        for (T value : fetched) {
            K key = keyOf.apply(value);
            map.storeSuccess(value, key);
            if (into != null) {
                into.put(key, value);
            }
        }
    }
}
