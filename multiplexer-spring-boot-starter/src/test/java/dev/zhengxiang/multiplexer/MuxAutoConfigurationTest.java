package dev.zhengxiang.multiplexer;

import dev.zhengxiang.multiplexer.MuxProperties.StorageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.FilteredClassLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MuxAutoConfiguration")
class MuxAutoConfigurationTest {

    @TempDir
    Path storage;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(MuxAutoConfiguration.class))
                .withPropertyValues("mux.storage.directory=" + storage);
    }

    @Test
    @DisplayName("should create the repository, manager and store providers")
    void shouldCreateBeans() {
        runner().run(context -> {
            assertThat(context).hasSingleBean(MuxRepository.class);
            assertThat(context).hasSingleBean(MuxManager.class);
            assertThat(context).hasSingleBean(BlobDownloader.class);
            assertThat(context.getBean(MuxManager.class).getStorageTypes())
                    .containsExactlyInAnyOrder(StorageType.NONE, StorageType.FILE, StorageType.REDIS);
        });
    }

    @Test
    @DisplayName("should back off when disabled")
    void shouldBackOffWhenDisabled() {
        runner().withPropertyValues("mux.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(MuxManager.class));
    }

    @Test
    @DisplayName("should skip the Redis store without Redisson on the classpath")
    void shouldSkipRedisWithoutRedisson() {
        runner().withClassLoader(new FilteredClassLoader(RedissonClient.class))
                .run(context -> assertThat(context.getBean(MuxManager.class).getStorageTypes())
                        .containsExactlyInAnyOrder(StorageType.NONE, StorageType.FILE));
    }

    @Test
    @DisplayName("should bind global defaults and per-cache overrides")
    void shouldBindProperties() {
        runner().withPropertyValues(
                        "mux.default-ttl=5m",
                        "mux.automatic-flush=true",
                        "mux.caches.profile.ttl=10s",
                        "mux.caches.profile.storage=none")
                .run(context -> {
                    MuxProperties properties = context.getBean(MuxProperties.class);
                    assertThat(properties.getDefaultTtl()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(properties.getEffectiveStrategy("profile").getTtl()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(properties.getEffectiveStrategy("profile").getStorage()).isEqualTo(StorageType.NONE);
                    assertThat(properties.getEffectiveStrategy("users").getTtl()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(properties.getEffectiveStrategy("users").getStorage()).isEqualTo(StorageType.FILE);
                    assertThat(context.getBean(MuxRepository.class).isAutomaticFlush()).isTrue();
                });
    }

    @Test
    @DisplayName("should create registered caches persisting under the storage directory")
    void shouldCreateFileBackedCaches() {
        runner().run(context -> {
            MuxManager manager = context.getBean(MuxManager.class);
            Multiplexer<Obj> profile = manager.multiplexer("profile", Obj.class,
                    onResult -> onResult.accept(Result.success(new Obj("me", "Alice"))));
            MultiplexerMap<String, Obj> users = manager.multiplexerMap("users", Obj.class,
                    (key, onResult) -> onResult.accept(Result.success(new Obj(key, null))));

            profile.request(result -> { });
            users.request("u1", result -> { });
            context.getBean(MuxRepository.class).flushAll();

            assertThat(manager.getCache("profile")).isSameAs(profile);
            assertThat(manager.getRepository().size()).isEqualTo(2);
            assertThat(storage.resolve("profile.json")).exists();
            assertThat(storage.resolve("users").resolve("u1.json")).exists();
        });
    }

    @Test
    @DisplayName("should apply a transient error policy bean to managed caches")
    void shouldApplyTransientErrorPolicyBean() {
        runner().withBean(TransientErrorPolicy.class, TransientErrorPolicy::always)
                .withPropertyValues("mux.caches.feed.storage=none")
                .run(context -> {
                    AtomicInteger calls = new AtomicInteger();
                    Multiplexer<String> feed = context.getBean(MuxManager.class).multiplexer("feed", String.class,
                            onResult -> onResult.accept(calls.getAndIncrement() == 0
                                    ? Result.success("first")
                                    : Result.failure(new IllegalStateException("backend down"))));
                    RecordingCallback<String> callback = new RecordingCallback<>();

                    feed.request(result -> { });
                    feed.refresh();
                    feed.request(callback);

                    assertThat(calls).hasValue(2);
                    assertThat(callback.single()).isEqualTo(Result.success("first"));
                });
    }

    @Test
    @DisplayName("should refuse a second cache with the same name")
    void shouldRefuseDuplicateNames() {
        runner().run(context -> {
            MuxManager manager = context.getBean(MuxManager.class);
            manager.cachingLoader("images", BlobTransformer.bytes());

            assertThatThrownBy(() -> manager.cachingLoader("images", BlobTransformer.path()))
                    .isInstanceOf(IllegalStateException.class);
        });
    }

    @Test
    @DisplayName("should fail to create a Redis-backed cache without a Redis client")
    void shouldFailForRedisWithoutClient() {
        runner().withPropertyValues("mux.caches.sessions.storage=redis")
                .run(context -> assertThatThrownBy(() -> context.getBean(MuxManager.class)
                        .multiplexer("sessions", String.class, onResult -> onResult.accept(Result.success("s"))))
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("RedissonClient"));
    }
}
