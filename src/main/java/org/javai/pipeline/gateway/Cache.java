package org.javai.pipeline.gateway;

import java.util.Optional;

/**
 * A secondary store consulted by the fallback strategies in {@link FetchStrategies}.
 *
 * <p>The pipeline assumes nothing beyond one value per key, overwritten on every write,
 * and that implementations are safe under concurrent reads and writes. The most recently
 * completed write must eventually be visible to subsequent reads.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface Cache<K, V> {

    /**
     * @return the stored value, or empty when nothing was written for {@code key}
     * @throws CacheException if the store cannot be read
     */
    Optional<V> read(K key) throws CacheException;

    /**
     * Stores {@code value}, replacing any previous value for {@code key}.
     *
     * @throws CacheException if the store cannot be written
     */
    void write(K key, V value) throws CacheException;
}
