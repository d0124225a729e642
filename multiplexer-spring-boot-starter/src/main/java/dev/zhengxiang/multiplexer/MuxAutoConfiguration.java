package dev.zhengxiang.multiplexer;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.zhengxiang.multiplexer.MuxProperties.StorageType;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.List;

/**
 * Multiplexer auto-configuration.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "mux", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MuxProperties.class)
public class MuxAutoConfiguration {

    /**
     * Mapper for persisted values, kept apart from the application's own mapper.
     */
    private final ObjectMapper objectMapper = JsonCodec.createObjectMapper();

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public MuxRepository muxRepository(MuxProperties properties) {
        MuxRepository repository = new MuxRepository();
        repository.setAutomaticFlush(properties.isAutomaticFlush());
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean
    public BlobDownloader blobDownloader(MuxProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(properties.getBlob().getDownloadTimeout())
                .build();
        return new HttpBlobDownloader(httpClient, properties.getBlob().getDownloadTimeout());
    }

    @Bean
    public StoreProvider fileStoreProvider(MuxProperties properties) {
        return new StoreProvider() {
            @Override
            public StorageType getType() {
                return StorageType.FILE;
            }

            @Override
            public <T> PersistentStore<T> create(JavaType valueType) {
                return new JsonFileStore<>(properties.getStorage().getDirectoryPath(), new JsonCodec<>(objectMapper, valueType));
            }
        };
    }

    @Bean
    public StoreProvider noOpStoreProvider() {
        return new StoreProvider() {
            @Override
            public StorageType getType() {
                return StorageType.NONE;
            }

            @Override
            public <T> PersistentStore<T> create(JavaType valueType) {
                return NoOpStore.instance();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public MuxManager muxManager(MuxRepository repository,
                                 MuxProperties properties,
                                 BlobDownloader blobDownloader,
                                 List<StoreProvider> storeProviders,
                                 ObjectProvider<TransientErrorPolicy> transientErrorPolicy) {
        MuxConfig baseConfig = MuxConfig.builder()
                .transientErrorPolicy(transientErrorPolicy.getIfAvailable(TransientErrorPolicy::connectivity))
                .build();
        return new MuxManager(repository, properties, objectMapper, blobDownloader, storeProviders, baseConfig);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RedissonClient.class)
    static class RedisStoreConfiguration {

        private final ObjectMapper objectMapper = JsonCodec.createObjectMapper();

        /**
         * The Redis client is looked up when a Redis-backed cache is created, so its own
         * auto-configuration may run after this one.
         */
        @Bean
        public StoreProvider redisStoreProvider(MuxProperties properties,
                                                ObjectProvider<RedissonClient> redissonClient) {
            return new StoreProvider() {
                @Override
                public StorageType getType() {
                    return StorageType.REDIS;
                }

                @Override
                public <T> PersistentStore<T> create(JavaType valueType) {
                    RedissonClient client = redissonClient.getIfAvailable();
                    if (client == null) {
                        throw new IllegalStateException("Redis storage requested but no RedissonClient bean is available");
                    }
                    return new RedissonStore<>(client, new JsonCodec<>(objectMapper, valueType),
                            properties.getStorage().getRedisPrefix());
                }
            };
        }
    }
}
