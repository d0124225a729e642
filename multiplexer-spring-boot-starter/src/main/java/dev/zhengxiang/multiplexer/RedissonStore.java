package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RMap;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.Codec;
import org.redisson.client.codec.StringCodec;
import org.redisson.codec.CompositeCodec;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.util.Optional;

/**
 * Redis-backed store. Entities of a domain live in one hash, {@code <prefix><domain>}, with the
 * entity key as the field; root-domain entities are plain buckets {@code <prefix><key>}. Values
 * are the same JSON bytes the file store writes.
 */
@Slf4j
public class RedissonStore<T> implements PersistentStore<T> {

    /**
     * String fields, raw byte values.
     */
    private static final Codec DOMAIN_CODEC =
            new CompositeCodec(StringCodec.INSTANCE, ByteArrayCodec.INSTANCE, ByteArrayCodec.INSTANCE);

    private final RedissonClient redissonClient;
    private final JsonCodec<T> codec;
    private final String prefix;
    private volatile Boolean supportsUnlink;

    public RedissonStore(RedissonClient redissonClient, JsonCodec<T> codec, String prefix) {
        this.redissonClient = redissonClient;
        this.codec = codec;
        this.prefix = prefix;
    }

    @Override
    public Optional<T> load(String key, @Nullable String domain) {
        String keyStr = StoreKeys.requireKey(key);
        byte[] bytes;
        try {
            bytes = domain == null ? bucket(keyStr).get() : map(domain).get(keyStr);
        } catch (RuntimeException e) {
            log.warn("Redis read failed, treating as miss: domain={}, key={}", domain, keyStr, e);
            return Optional.empty();
        }
        if (bytes == null) {
            return Optional.empty();
        }
        try {
            log.debug("Loaded from Redis: domain={}, key={}", domain, keyStr);
            return Optional.ofNullable(codec.decode(bytes));
        } catch (IOException e) {
            log.warn("Undecodable Redis entry, treating as miss: domain={}, key={}", domain, keyStr, e);
            return Optional.empty();
        }
    }

    @Override
    public void save(T value, String key, @Nullable String domain) {
        String keyStr = StoreKeys.requireKey(key);
        byte[] bytes = codec.encode(value);
        try {
            if (domain == null) {
                bucket(keyStr).set(bytes);
            } else {
                map(domain).fastPut(keyStr, bytes);
            }
            log.debug("Stored to Redis: domain={}, key={}, bytes={}", domain, keyStr, bytes.length);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to write Redis entry " + domain + "/" + keyStr, e);
        }
    }

    @Override
    public void deleteOne(String key, @Nullable String domain) {
        String keyStr = StoreKeys.requireKey(key);
        try {
            if (domain == null) {
                bucket(keyStr).delete();
            } else {
                map(domain).fastRemove(keyStr);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to delete Redis entry: domain={}, key={}", domain, keyStr, e);
        }
    }

    @Override
    public void deleteDomain(String domain) {
        String name = prefix + StoreKeys.requireKey(domain);
        try {
            if (supportsUnlink()) {
                redissonClient.getKeys().unlink(name);
                log.info("Redis domain removed (UNLINK): {}", name);
            } else {
                redissonClient.getKeys().delete(name);
                log.info("Redis domain removed (DEL): {}", name);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to remove Redis domain: {}", name, e);
        }
    }

    private RBucket<byte[]> bucket(String key) {
        return redissonClient.getBucket(prefix + key, ByteArrayCodec.INSTANCE);
    }

    private RMap<String, byte[]> map(String domain) {
        return redissonClient.getMap(prefix + domain, DOMAIN_CODEC);
    }

    private boolean supportsUnlink() {
        if (supportsUnlink == null) {
            synchronized (this) {
                if (supportsUnlink == null) {
                    supportsUnlink = detectUnlinkSupport();
                }
            }
        }
        return supportsUnlink;
    }

    private boolean detectUnlinkSupport() {
        try {
            String serverInfo = redissonClient.getScript().eval(
                    RScript.Mode.READ_ONLY,
                    "return redis.call('INFO', 'server')",
                    RScript.ReturnType.VALUE
            );
            int majorVersion = parseRedisMajorVersion(serverInfo);
            boolean supports = majorVersion >= 4;
            log.info("Redis version detected: majorVersion={}, supportsUnlink={}", majorVersion, supports);
            return supports;
        } catch (Exception e) {
            log.warn("Redis version detection failed, falling back to DEL: {}", e.getMessage());
            return false;
        }
    }

    static int parseRedisMajorVersion(@Nullable String serverInfo) {
        if (serverInfo == null || serverInfo.isEmpty()) {
            return 0;
        }
        for (String line : serverInfo.split("\n")) {
            line = line.trim();
            if (line.startsWith("redis_version:")) {
                String version = line.substring("redis_version:".length()).trim();
                int dotIndex = version.indexOf('.');
                String majorStr = dotIndex > 0 ? version.substring(0, dotIndex) : version;
                try {
                    return Integer.parseInt(majorStr);
                } catch (NumberFormatException e) {
                    log.warn("Unparseable Redis version: {}", version);
                    return 0;
                }
            }
        }
        return 0;
    }
}
