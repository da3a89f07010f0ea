package org.javai.pipeline.gateway;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link Cache} backed by a {@link ConcurrentHashMap}. Last write wins; nothing is ever evicted.
 */
public final class InMemoryCache<K, V> implements Cache<K, V> {

    private final Map<K, V> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<V> read(K key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(K key, V value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        entries.put(key, value);
    }

    public int size() {
        return entries.size();
    }
}
