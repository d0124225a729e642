package dev.zhengxiang.multiplexer;

/**
 * A cache that can take part in {@link MuxRepository} bulk operations.
 */
public interface MuxCache {

    /**
     * Stable identifier, unique within a repository.
     */
    String getCacheId();

    /**
     * Writes memoized values that have not been persisted yet.
     */
    MuxCache flush();

    /**
     * Drops memoized values; the next request for any entry triggers a fetch.
     */
    MuxCache clearMemory();

    /**
     * Drops memoized and persisted values.
     */
    MuxCache clear();
}
