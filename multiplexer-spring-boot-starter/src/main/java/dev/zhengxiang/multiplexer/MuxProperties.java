package dev.zhengxiang.multiplexer;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for multiplexer caches.
 * Global defaults can be overridden per cache name.
 */
@Data
@ConfigurationProperties(prefix = "mux")
public class MuxProperties {

    /**
     * Whether to enable multiplexer auto-configuration.
     */
    private boolean enabled = true;

    /**
     * How long a fetched value is served from memory before it is fetched again.
     */
    private Duration defaultTtl = MuxConfig.DEFAULT_TTL;

    /**
     * Flush all registered caches when the application context shuts down.
     */
    private boolean automaticFlush = false;

    /**
     * Persistent storage configuration.
     */
    private StorageConfig storage = new StorageConfig();

    /**
     * Blob (download) cache configuration.
     */
    private BlobConfig blob = new BlobConfig();

    /**
     * Per-cache overrides.
     */
    private Map<String, CacheStrategy> caches = new HashMap<>();

    @Data
    public static class StorageConfig {
        private StorageType type = StorageType.FILE;
        private String directory = Paths.get(System.getProperty("java.io.tmpdir"), "Mux").toString();
        private String redisPrefix = "mux:";

        public Path getDirectoryPath() {
            return Paths.get(directory);
        }
    }

    @Data
    public static class BlobConfig {
        private int memoryCapacity = CachingLoader.DEFAULT_MEMORY_CAPACITY;
        private Duration downloadTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class CacheStrategy {
        private Duration ttl;
        private StorageType storage;
    }

    public enum StorageType {
        NONE,
        FILE,
        REDIS
    }

    public CacheStrategy getEffectiveStrategy(String cacheName) {
        CacheStrategy strategy = caches.get(cacheName);
        CacheStrategy effective = new CacheStrategy();

        if (strategy != null) {
            effective.setTtl(strategy.getTtl());
            effective.setStorage(strategy.getStorage());
        }

        if (effective.getTtl() == null) {
            effective.setTtl(defaultTtl);
        }
        if (effective.getStorage() == null) {
            effective.setStorage(storage.getType());
        }

        return effective;
    }
}
