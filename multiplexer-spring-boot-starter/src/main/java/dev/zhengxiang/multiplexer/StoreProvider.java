package dev.zhengxiang.multiplexer;

import com.fasterxml.jackson.databind.JavaType;

/**
 * Creates the persistent store for a cache, one implementation per {@link MuxProperties.StorageType}.
 */
public interface StoreProvider {

    MuxProperties.StorageType getType();

    <T> PersistentStore<T> create(JavaType valueType);
}
