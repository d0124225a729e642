package dev.zhengxiang.multiplexer;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.zhengxiang.multiplexer.MuxProperties.CacheStrategy;
import dev.zhengxiang.multiplexer.MuxProperties.StorageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Creates named caches configured from {@link MuxProperties} and registers them with the
 * repository.
 */
@Slf4j
public class MuxManager {

    private final MuxRepository repository;
    private final MuxProperties properties;
    private final ObjectMapper objectMapper;
    private final BlobDownloader downloader;
    private final MuxConfig baseConfig;
    private final Map<StorageType, StoreProvider> storeProviders = new EnumMap<>(StorageType.class);

    public MuxManager(MuxRepository repository,
                      MuxProperties properties,
                      ObjectMapper objectMapper,
                      BlobDownloader downloader,
                      Collection<StoreProvider> storeProviders) {
        this(repository, properties, objectMapper, downloader, storeProviders, MuxConfig.defaults());
    }

    /**
     * @param baseConfig error policy and clock shared by the caches created here; the TTL is
     *                   replaced by each cache's configured one
     */
    public MuxManager(MuxRepository repository,
                      MuxProperties properties,
                      ObjectMapper objectMapper,
                      BlobDownloader downloader,
                      Collection<StoreProvider> storeProviders,
                      MuxConfig baseConfig) {
        this.repository = repository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.downloader = downloader;
        this.baseConfig = baseConfig;
        for (StoreProvider provider : storeProviders) {
            this.storeProviders.put(provider.getType(), provider);
        }
        log.info("MuxManager initialized: storage={}, defaultTtl={}, providers={}",
                properties.getStorage().getType(), properties.getDefaultTtl(), this.storeProviders.keySet());
    }

    public <T> Multiplexer<T> multiplexer(String name, Class<T> type, Fetcher<T> fetcher) {
        return multiplexer(name, objectMapper.constructType(type), fetcher);
    }

    public <T> Multiplexer<T> multiplexer(String name, JavaType type, Fetcher<T> fetcher) {
        CacheStrategy strategy = properties.getEffectiveStrategy(name);
        PersistentStore<T> store = storeFor(strategy, type);
        Multiplexer<T> multiplexer = new Multiplexer<>(name, fetcher, store, configFor(strategy));
        log.info("Created multiplexer: name={}, ttl={}, storage={}", name, strategy.getTtl(), strategy.getStorage());
        return multiplexer.register(repository);
    }

    public <K, T> MultiplexerMap<K, T> multiplexerMap(String name, Class<T> type, KeyFetcher<K, T> fetcher) {
        return multiplexerMap(name, objectMapper.constructType(type), fetcher);
    }

    public <K, T> MultiplexerMap<K, T> multiplexerMap(String name, JavaType type, KeyFetcher<K, T> fetcher) {
        CacheStrategy strategy = properties.getEffectiveStrategy(name);
        PersistentStore<T> store = storeFor(strategy, type);
        MultiplexerMap<K, T> map = new MultiplexerMap<>(name, fetcher, store, configFor(strategy));
        log.info("Created multiplexer map: name={}, ttl={}, storage={}", name, strategy.getTtl(), strategy.getStorage());
        return map.register(repository);
    }

    /**
     * Blob caches always keep their files under the storage directory, whatever the storage type.
     */
    public <T> CachingLoader<T> cachingLoader(String name, BlobTransformer<T> transformer) {
        CachingLoader<T> loader = new CachingLoader<>(name, properties.getStorage().getDirectoryPath(), downloader,
                transformer, properties.getBlob().getMemoryCapacity());
        return loader.register(repository);
    }

    @Nullable
    public MuxCache getCache(String name) {
        return repository.get(name).orElse(null);
    }

    public MuxRepository getRepository() {
        return repository;
    }

    public List<StorageType> getStorageTypes() {
        return List.copyOf(storeProviders.keySet());
    }

    private MuxConfig configFor(CacheStrategy strategy) {
        return baseConfig.toBuilder().timeToLive(strategy.getTtl()).build();
    }

    private <T> PersistentStore<T> storeFor(CacheStrategy strategy, JavaType type) {
        StoreProvider provider = storeProviders.get(strategy.getStorage());
        if (provider == null) {
            throw new IllegalStateException("No store available for storage type " + strategy.getStorage()
                    + "; available: " + storeProviders.keySet());
        }
        return provider.create(type);
    }
}
