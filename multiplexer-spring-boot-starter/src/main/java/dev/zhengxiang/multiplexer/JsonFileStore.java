package dev.zhengxiang.multiplexer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File-based store: one JSON file per entity, {@code <root>/<domain>/<key>.json}, or
 * {@code <root>/<key>.json} for the root domain. Keys and domains are made file-system safe by
 * {@link StoreKeys#fileName(String)}.
 * <p>
 * Writes go to a temporary file in the target directory which is then moved over the target, so
 * readers see either the old or the new file, never a partial one.
 */
@Slf4j
public class JsonFileStore<T> implements PersistentStore<T> {

    static final String EXTENSION = ".json";

    private final Path root;
    private final JsonCodec<T> codec;

    public JsonFileStore(Path root, JsonCodec<T> codec) {
        this.root = root;
        this.codec = codec;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Optional<T> load(String key, @Nullable String domain) {
        Path file = fileFor(key, domain);
        try {
            byte[] bytes = Files.readAllBytes(file);
            log.debug("Loaded from disk: key={}, domain={}", key, domain);
            return Optional.ofNullable(codec.decode(bytes));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable cache file, treating as miss: file={}", file, e);
            return Optional.empty();
        }
    }

    @Override
    public void save(T value, String key, @Nullable String domain) {
        byte[] bytes = codec.encode(value);
        Path file = fileFor(key, domain);
        Path dir = file.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, ".", ".tmp");
            Files.write(temp, bytes);
            moveAtomically(temp, file);
            log.debug("Stored to disk: file={}, bytes={}", file, bytes.length);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Failed to write cache file " + file, e);
        }
    }

    @Override
    public void deleteOne(String key, @Nullable String domain) {
        Path file = fileFor(key, domain);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache file: {}", file, e);
        }
    }

    @Override
    public void deleteDomain(String domain) {
        Path dir = domainDirectory(domain);
        try {
            if (FileSystemUtils.deleteRecursively(dir)) {
                log.info("Cache directory removed: {}", dir);
            }
        } catch (IOException e) {
            log.warn("Failed to remove cache directory: {}", dir, e);
        }
    }

    Path fileFor(String key, @Nullable String domain) {
        Path dir = domain == null ? root : domainDirectory(domain);
        return dir.resolve(StoreKeys.fileName(key) + EXTENSION);
    }

    /**
     * Domain directories share the root with root-domain files, so a domain name never keeps the
     * file extension: {@code profile.json} becomes {@code profile%2Ejson}.
     */
    Path domainDirectory(String domain) {
        String name = StoreKeys.fileName(domain);
        if (name.endsWith(EXTENSION)) {
            int dot = name.length() - EXTENSION.length();
            name = name.substring(0, dot) + "%2E" + name.substring(dot + 1);
        }
        return root.resolve(name);
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(@Nullable Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file: {}", path, e);
        }
    }
}
