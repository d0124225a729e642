package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * {@link BlobDownloader} on the JDK HTTP client. Progress is reported once, when the body has
 * been written.
 */
@Slf4j
public class HttpBlobDownloader implements BlobDownloader {

    private final HttpClient httpClient;
    private final Duration timeout;
    @Nullable
    private final Path tempDirectory;

    public HttpBlobDownloader(HttpClient httpClient, Duration timeout) {
        this(httpClient, timeout, null);
    }

    /**
     * @param tempDirectory where downloads are written before the cache takes them over;
     *                      {@code null} for the system temporary directory
     */
    public HttpBlobDownloader(HttpClient httpClient, Duration timeout, @Nullable Path tempDirectory) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.tempDirectory = tempDirectory;
    }

    @Override
    public void download(URI source, @Nullable BiConsumer<Long, Long> progress, Consumer<Result<Path>> onResult) {
        Path temp;
        try {
            temp = tempDirectory == null
                    ? Files.createTempFile("mux-download-", ".tmp")
                    : Files.createTempFile(tempDirectory, "mux-download-", ".tmp");
        } catch (IOException e) {
            onResult.accept(Result.failure(e));
            return;
        }
        CompletableFuture<HttpResponse<Path>> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(source).timeout(timeout).GET().build();
            log.debug("Downloading: {}", source);
            response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(temp));
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            onResult.accept(Result.failure(e));
            return;
        }
        response.whenComplete((r, e) -> {
            if (e != null) {
                deleteQuietly(temp);
                onResult.accept(Result.failure(Fetcher.unwrap(e)));
                return;
            }
            int status = r.statusCode();
            if (status < 200 || status >= 300) {
                deleteQuietly(temp);
                onResult.accept(Result.failure(new CachingLoaderException("HTTP " + status + " for " + source)));
                return;
            }
            reportProgress(source, progress, sizeOf(temp));
            onResult.accept(Result.success(temp));
        });
    }

    private static void reportProgress(URI source, @Nullable BiConsumer<Long, Long> progress, long size) {
        if (progress == null) {
            return;
        }
        try {
            progress.accept(size, size);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: {}", source, e);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary download: {}", file, e);
        }
    }
}
