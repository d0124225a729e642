package dev.zhengxiang.multiplexer;

import org.springframework.lang.Nullable;

import java.net.URI;
import java.nio.file.Path;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Downloads a remote blob into a temporary file. The caller takes ownership of the file and moves
 * it into its cache directory.
 */
@FunctionalInterface
public interface BlobDownloader {

    /**
     * @param progress optional listener for {@code (bytesReceived, bytesExpected)}; expected is
     *                 -1 when unknown
     * @param onResult called exactly once with the temporary file or the error
     */
    void download(URI source, @Nullable BiConsumer<Long, Long> progress, Consumer<Result<Path>> onResult);
}
