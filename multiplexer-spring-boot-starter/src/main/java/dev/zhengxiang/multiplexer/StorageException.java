package dev.zhengxiang.multiplexer;

/**
 * Thrown when a persistent store cannot write or encode a value.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
