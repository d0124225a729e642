package dev.zhengxiang.multiplexer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.ConnectException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Multiplexer")
class MultiplexerTest {

    private static final Duration TTL = Duration.ofSeconds(1);

    private FakeTicker ticker;
    private ManualFetcher<String> fetcher;
    private PersistentStore<String> store;
    private Multiplexer<String> multiplexer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ticker = new FakeTicker();
        fetcher = new ManualFetcher<>();
        store = mock(PersistentStore.class);
        multiplexer = new Multiplexer<>("profile", fetcher, store, config());
    }

    private MuxConfig config() {
        return MuxConfig.builder().timeToLive(TTL).ticker(ticker).build();
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlight {

        @Test
        @DisplayName("should share one producer call between concurrent requests, in arrival order")
        void shouldShareOneProducerCall() {
            List<String> order = new CopyOnWriteArrayList<>();
            multiplexer.request(result -> order.add("first:" + result.get()));
            multiplexer.request(result -> order.add("second:" + result.get()));
            multiplexer.request(result -> order.add("third:" + result.get()));

            assertThat(fetcher.invocations()).isEqualTo(1);
            assertThat(order).isEmpty();

            fetcher.succeed("v1");

            assertThat(order).containsExactly("first:v1", "second:v1", "third:v1");
        }

        @Test
        @DisplayName("should call the producer once for requests from many threads")
        void shouldCallProducerOnceAcrossThreads() throws InterruptedException {
            AtomicInteger calls = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                Multiplexer<String> slow = new Multiplexer<>("slow", onResult -> {
                    calls.incrementAndGet();
                    executor.execute(() -> {
                        sleep(50);
                        onResult.accept(Result.success("value"));
                    });
                });
                RecordingCallback<String> callback = new RecordingCallback<>();
                CountDownLatch start = new CountDownLatch(1);
                for (int i = 0; i < 6; i++) {
                    executor.execute(() -> {
                        awaitLatch(start);
                        slow.request(callback);
                    });
                }
                start.countDown();

                await().atMost(Duration.ofSeconds(5)).until(() -> callback.results.size() == 6);
                assertThat(calls.get()).isEqualTo(1);
                assertThat(callback.results).allMatch(result -> "value".equals(result.get()));
            } finally {
                executor.shutdownNow();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        }

        @Test
        @DisplayName("should complete the future form")
        void shouldCompleteFuture() {
            CompletableFuture<String> future = multiplexer.request();

            fetcher.succeed("v1");

            assertThat(future).isCompletedWithValue("v1");
        }

        @Test
        @DisplayName("should ignore a second callback from the producer")
        void shouldIgnoreSecondCallback() {
            RecordingCallback<String> callback = new RecordingCallback<>();
            multiplexer.request(callback);

            fetcher.succeed("v1");
            fetcher.succeed("v2");

            assertThat(callback.single().get()).isEqualTo("v1");
        }

        @Test
        @DisplayName("should turn a throwing producer into a failure")
        void shouldReportThrowingProducer() {
            Multiplexer<String> broken = new Multiplexer<>("broken", onResult -> {
                throw new IllegalStateException("boom");
            });
            RecordingCallback<String> callback = new RecordingCallback<>();

            broken.request(callback);

            assertThat(callback.single().getError()).hasMessage("boom");
        }

        @Test
        @DisplayName("should deliver to all waiters even if one callback throws")
        void shouldIsolateFailingCallbacks() {
            RecordingCallback<String> callback = new RecordingCallback<>();
            multiplexer.request(result -> {
                throw new IllegalStateException("callback failure");
            });
            multiplexer.request(callback);

            fetcher.succeed("v1");

            assertThat(callback.single().get()).isEqualTo("v1");
        }
    }

    @Nested
    @DisplayName("Expiry and refresh")
    class ExpiryAndRefresh {

        @Test
        @DisplayName("should serve from memory within the TTL")
        void shouldServeFromMemoryWithinTtl() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");
            ticker.advance(TTL);

            RecordingCallback<String> callback = new RecordingCallback<>();
            multiplexer.request(callback);

            assertThat(callback.single().get()).isEqualTo("v1");
            assertThat(fetcher.invocations()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fetch again once the TTL has passed")
        void shouldFetchAfterTtl() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");
            ticker.advance(TTL.plusMillis(1));

            RecordingCallback<String> callback = new RecordingCallback<>();
            multiplexer.request(callback);
            assertThat(fetcher.invocations()).isEqualTo(2);

            fetcher.succeed("v2");
            assertThat(callback.single().get()).isEqualTo("v2");
        }

        @Test
        @DisplayName("should bypass a fresh value on a forced request")
        void shouldBypassOnForcedRequest() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");

            multiplexer.request(true, result -> { });

            assertThat(fetcher.invocations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fetch once after a soft refresh")
        void shouldFetchOnceAfterRefresh() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");

            multiplexer.refresh();
            multiplexer.request(result -> { });
            fetcher.succeed("v2");
            RecordingCallback<String> callback = new RecordingCallback<>();
            multiplexer.request(callback);

            assertThat(fetcher.invocations()).isEqualTo(2);
            assertThat(callback.single().get()).isEqualTo("v2");
        }

        @Test
        @DisplayName("should apply a refresh requested during a fetch to the next request")
        void shouldKeepRefreshRequestedDuringFetch() {
            multiplexer.request(result -> { });
            multiplexer.refresh();
            fetcher.succeed("v1");

            multiplexer.request(result -> { });

            assertThat(fetcher.invocations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject a negative TTL")
        void shouldRejectNegativeTtl() {
            MuxConfig negative = MuxConfig.builder().timeToLive(Duration.ofSeconds(-1)).build();

            assertThatThrownBy(() -> new Multiplexer<>("negative", fetcher, store, negative))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should serve the memoized value on a transient error and fetch again next time")
        void shouldFallBackToMemoryOnTransientError() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");
            ticker.advance(TTL.multipliedBy(2));

            RecordingCallback<String> callback = new RecordingCallback<>();
            multiplexer.request(callback);
            fetcher.fail(new ConnectException("offline"));

            assertThat(callback.single().get()).isEqualTo("v1");

            multiplexer.request(result -> { });
            assertThat(fetcher.invocations()).isEqualTo(3);
        }

        @Test
        @DisplayName("should serve the persisted value on a transient error with an empty memory")
        void shouldFallBackToStoreOnTransientError() {
            when(store.load("profile", null)).thenReturn(Optional.of("persisted"));
            RecordingCallback<String> callback = new RecordingCallback<>();

            multiplexer.request(callback);
            fetcher.fail(new ConnectException("offline"));
            multiplexer.flush();

            assertThat(callback.single().get()).isEqualTo("persisted");
            verify(store, never()).save(any(), anyString(), any());
        }

        @Test
        @DisplayName("should report a transient error when nothing is cached")
        void shouldReportTransientErrorWithoutCache() {
            RecordingCallback<String> callback = new RecordingCallback<>();

            multiplexer.request(callback);
            fetcher.fail(new ConnectException("offline"));

            assertThat(callback.single().getError()).isInstanceOf(ConnectException.class);
        }

        @Test
        @DisplayName("should discard the memoized value on a terminal error")
        void shouldDiscardValueOnTerminalError() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");
            ticker.advance(TTL.multipliedBy(2));

            RecordingCallback<String> failed = new RecordingCallback<>();
            multiplexer.request(failed);
            fetcher.fail(new IllegalStateException("HTTP 404"));

            assertThat(failed.single().getError()).hasMessage("HTTP 404");

            RecordingCallback<String> offline = new RecordingCallback<>();
            multiplexer.request(offline);
            fetcher.fail(new ConnectException("offline"));

            assertThat(offline.single().isFailure()).isTrue();
        }
    }

    @Nested
    @DisplayName("Clearing")
    class Clearing {

        @Test
        @DisplayName("should deliver but not memoize a result that arrives after clearMemory")
        void shouldNotMemoizeResultAfterClearMemory() {
            RecordingCallback<String> before = new RecordingCallback<>();
            RecordingCallback<String> after = new RecordingCallback<>();
            multiplexer.request(before);

            multiplexer.clearMemory();
            multiplexer.request(after);
            fetcher.succeed("stale");

            assertThat(fetcher.invocations()).isEqualTo(1);
            assertThat(before.single().get()).isEqualTo("stale");
            assertThat(after.single().get()).isEqualTo("stale");

            multiplexer.request(result -> { });
            assertThat(fetcher.invocations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fetch after clearMemory")
        void shouldFetchAfterClearMemory() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");

            multiplexer.clearMemory().request(result -> { });

            assertThat(fetcher.invocations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should delete the persisted value on clear")
        void shouldDeletePersistedValueOnClear() {
            multiplexer.clear();

            verify(store).deleteOne("profile", null);
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @TempDir
        Path root;

        @Test
        @DisplayName("should write a fetched value once on flush")
        void shouldWriteDirtyValueOnce() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");

            multiplexer.flush();
            multiplexer.flush();

            verify(store, times(1)).save("v1", "profile", null);
        }

        @Test
        @DisplayName("should write nothing before a value was fetched")
        void shouldWriteNothingWhenEmpty() {
            multiplexer.flush();

            verify(store, never()).save(any(), anyString(), any());
        }

        @Test
        @DisplayName("should keep the value dirty when the write fails")
        void shouldStayDirtyWhenWriteFails() {
            multiplexer.request(result -> { });
            fetcher.succeed("v1");
            doThrow(new StorageException("disk full"))
                    .doNothing()
                    .when(store).save("v1", "profile", null);

            assertThatThrownBy(() -> multiplexer.flush()).isInstanceOf(StorageException.class);
            multiplexer.flush();

            verify(store, times(2)).save("v1", "profile", null);
        }

        @Test
        @DisplayName("should serve a flushed value from disk when a new instance is offline")
        void shouldSurviveRestart() {
            JsonFileStore<Obj> fileStore = new JsonFileStore<>(root, JsonCodec.of(Obj.class));
            Multiplexer<Obj> online = new Multiplexer<>("profile",
                    onResult -> onResult.accept(Result.success(new Obj("u1", "Alice"))), fileStore, MuxConfig.defaults());
            online.request(result -> { });
            online.flush();

            Multiplexer<Obj> offline = new Multiplexer<>("profile",
                    onResult -> onResult.accept(Result.failure(new ConnectException("offline"))), fileStore,
                    MuxConfig.defaults());

            assertThat(offline.request()).isCompletedWithValue(new Obj("u1", "Alice"));
            assertThat(root.resolve("profile.json")).exists();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
