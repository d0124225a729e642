package dev.zhengxiang.multiplexer;

/**
 * Failure of a {@link CachingLoader} request that is not a download error: a blob that could not
 * be stored or decoded.
 */
public class CachingLoaderException extends RuntimeException {

    public CachingLoaderException(String message) {
        super(message);
    }

    public CachingLoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
