package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Downloading cache for large immutable objects such as images or media files.
 * <p>
 * A blob is downloaded once per URI, kept in {@code <root>/<cacheId>} for good and decoded by a
 * {@link BlobTransformer}; the most recently used decoded objects are held in memory. Concurrent
 * requests for the same URI share one download. There is no expiry: a blob at a given URI is
 * assumed never to change, so only {@link #clear()} invalidates it. {@code file:} URIs skip the
 * download and are decoded directly.
 *
 * @param <T> in-memory type
 */
@Slf4j
public class CachingLoader<T> implements MuxCache {

    public static final int DEFAULT_MEMORY_CAPACITY = 50;

    private final String cacheId;
    private final Path directory;
    private final BlobDownloader downloader;
    private final BlobTransformer<T> transformer;
    private final Object lock = new Object();
    private final LruCache<String, T> memoryCache;
    private final Map<String, List<Consumer<Result<T>>>> pending = new HashMap<>();
    private final Consumer<Result<T>> prefetch = result -> {
    };

    public CachingLoader(String cacheId, Path root, BlobDownloader downloader, BlobTransformer<T> transformer) {
        this(cacheId, root, downloader, transformer, DEFAULT_MEMORY_CAPACITY);
    }

    public CachingLoader(String cacheId,
                         Path root,
                         BlobDownloader downloader,
                         BlobTransformer<T> transformer,
                         int memoryCapacity) {
        this.cacheId = StoreKeys.requireKey(cacheId);
        this.directory = root.resolve(StoreKeys.fileName(cacheId));
        this.downloader = downloader;
        this.transformer = transformer;
        this.memoryCache = new LruCache<>(memoryCapacity);
        log.info("CachingLoader created: id={}, directory={}, memoryCapacity={}", cacheId, directory, memoryCapacity);
    }

    @Override
    public String getCacheId() {
        return cacheId;
    }

    public void request(URI uri, @Nullable Consumer<Result<T>> completion) {
        request(uri, null, completion);
    }

    /**
     * Retrieves the object for a URI, downloading it on first use. A {@code null} completion
     * prefetches: the blob is downloaded if needed but not decoded.
     *
     * @param progress optional download progress listener, {@code (bytesReceived, bytesExpected)}
     */
    public void request(URI uri, @Nullable BiConsumer<Long, Long> progress, @Nullable Consumer<Result<T>> completion) {
        String key = uri.toString();
        T cached;
        synchronized (lock) {
            cached = memoryCache.touch(key);
        }
        if (cached != null) {
            log.debug("Memory hit: cache={}, uri={}", cacheId, key);
            if (completion != null) {
                completion.accept(Result.success(cached));
            }
            return;
        }

        if (isLocal(uri)) {
            if (completion != null) {
                loadLocal(uri, completion);
            }
            return;
        }

        boolean first;
        synchronized (lock) {
            List<Consumer<Result<T>>> waiters = pending.computeIfAbsent(key, k -> new ArrayList<>());
            waiters.add(completion != null ? completion : prefetch);
            first = waiters.size() == 1;
        }
        if (first) {
            fetch(uri, progress);
        } else {
            log.debug("Download in progress, queued: cache={}, uri={}", cacheId, key);
        }
    }

    public CompletableFuture<T> request(URI uri) {
        CompletableFuture<T> future = new CompletableFuture<>();
        request(uri, null, result -> result.ifSuccess(future::complete, future::completeExceptionally));
        return future;
    }

    /**
     * Whether the next request for the URI will have to download it.
     */
    public boolean willRefresh(URI uri) {
        synchronized (lock) {
            if (memoryCache.has(uri.toString())) {
                return false;
            }
        }
        if (isLocal(uri)) {
            return false;
        }
        return !Files.exists(cacheFileFor(uri));
    }

    /**
     * Blobs are written to disk when downloaded; nothing to flush.
     */
    @Override
    public CachingLoader<T> flush() {
        return this;
    }

    @Override
    public CachingLoader<T> clearMemory() {
        synchronized (lock) {
            memoryCache.removeAll();
        }
        return this;
    }

    /**
     * Deletes the downloaded blobs and the decoded objects. Downloads in flight still complete.
     */
    @Override
    public CachingLoader<T> clear() {
        try {
            if (FileSystemUtils.deleteRecursively(directory)) {
                log.info("Blob directory removed: {}", directory);
            }
        } catch (IOException e) {
            log.warn("Failed to remove blob directory: {}", directory, e);
        }
        return clearMemory();
    }

    public CachingLoader<T> register(MuxRepository repository) {
        repository.register(this);
        return this;
    }

    public void unregister(MuxRepository repository) {
        repository.unregister(this);
    }

    Path cacheFileFor(URI uri) {
        String name = StoreKeys.urlSafeHash(uri.toString(), StoreKeys.HASH_LENGTH);
        return directory.resolve(name + extensionOf(uri));
    }

    private void loadLocal(URI uri, Consumer<Result<T>> completion) {
        Path file;
        try {
            file = Paths.get(uri);
        } catch (IllegalArgumentException e) {
            log.warn("Not a local file path: cache={}, uri={}", cacheId, uri);
            completion.accept(Result.failure(new CachingLoaderException("Failed to load file from disk: " + uri, e)));
            return;
        }
        Optional<T> object = transform(file);
        if (object.isPresent()) {
            synchronized (lock) {
                memoryCache.set(uri.toString(), object.get());
            }
            completion.accept(Result.success(object.get()));
        } else {
            completion.accept(Result.failure(new CachingLoaderException("Failed to load file from disk: " + uri)));
        }
    }

    private void fetch(URI uri, @Nullable BiConsumer<Long, Long> progress) {
        Path cacheFile = cacheFileFor(uri);
        if (Files.exists(cacheFile)) {
            log.debug("Memory miss, found on disk: cache={}, file={}", cacheId, cacheFile.getFileName());
            fetchCompleted(uri, Result.success(cacheFile));
            return;
        }
        log.debug("Downloading: cache={}, uri={}", cacheId, uri);
        try {
            downloader.download(uri, progress, result -> {
                if (result.isFailure()) {
                    fetchCompleted(uri, result);
                    return;
                }
                try {
                    Files.createDirectories(directory);
                    moveAtomically(result.get(), cacheFile);
                    fetchCompleted(uri, Result.success(cacheFile));
                } catch (IOException e) {
                    fetchCompleted(uri, Result.failure(new CachingLoaderException("File download failed: " + uri, e)));
                }
            });
        } catch (RuntimeException e) {
            log.warn("Downloader threw instead of calling back: cache={}, uri={}", cacheId, uri, e);
            fetchCompleted(uri, Result.failure(e));
        }
    }

    private void fetchCompleted(URI uri, Result<Path> result) {
        String key = uri.toString();
        if (result.isFailure()) {
            complete(key, Result.failure(result.getError()));
            return;
        }
        synchronized (lock) {
            List<Consumer<Result<T>>> waiters = pending.get(key);
            if (waiters == null || waiters.stream().allMatch(w -> w == prefetch)) {
                log.debug("Prefetched: cache={}, uri={}", cacheId, key);
                pending.remove(key);
                return;
            }
        }
        Path cacheFile = result.get();
        Optional<T> object = transform(cacheFile);
        if (object.isPresent()) {
            synchronized (lock) {
                memoryCache.set(key, object.get());
            }
            complete(key, Result.success(object.get()));
        } else {
            synchronized (lock) {
                memoryCache.remove(key);
            }
            deleteQuietly(cacheFile);
            complete(key, Result.failure(new CachingLoaderException("Failed to load cache file from disk: " + uri)));
        }
    }

    private void complete(String key, Result<T> result) {
        List<Consumer<Result<T>>> waiters;
        synchronized (lock) {
            waiters = pending.remove(key);
        }
        if (waiters == null) {
            return;
        }
        for (Consumer<Result<T>> waiter : waiters) {
            try {
                waiter.accept(result);
            } catch (RuntimeException e) {
                log.error("Completion callback failed: cache={}, uri={}", cacheId, key, e);
            }
        }
    }

    private Optional<T> transform(Path file) {
        try {
            return transformer.transform(file);
        } catch (IOException | RuntimeException e) {
            log.warn("Blob could not be decoded: cache={}, file={}", cacheId, file, e);
            return Optional.empty();
        }
    }

    private static boolean isLocal(URI uri) {
        return "file".equalsIgnoreCase(uri.getScheme());
    }

    private static String extensionOf(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1 || dot == path.length() - 1) {
            return "";
        }
        String ext = path.substring(dot);
        return ext.length() <= 10 && ext.substring(1).chars().allMatch(Character::isLetterOrDigit) ? ext : "";
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete blob: {}", file, e);
        }
    }
}
