package dev.zhengxiang.multiplexer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns a cached blob file into the object kept in memory. An empty result marks the file as
 * corrupt: it is deleted and the request fails.
 *
 * @param <T> in-memory type
 */
@FunctionalInterface
public interface BlobTransformer<T> {

    Optional<T> transform(Path file) throws IOException;

    /**
     * The file itself, for media that is streamed from disk.
     */
    static BlobTransformer<Path> path() {
        return Optional::of;
    }

    static BlobTransformer<byte[]> bytes() {
        return file -> Optional.of(Files.readAllBytes(file));
    }

    /**
     * Decoded image; files {@link ImageIO} cannot decode are treated as corrupt.
     */
    static BlobTransformer<BufferedImage> image() {
        return file -> Optional.ofNullable(ImageIO.read(file.toFile()));
    }
}
