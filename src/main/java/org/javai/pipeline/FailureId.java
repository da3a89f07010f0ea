package org.javai.pipeline;

import java.util.Locale;
import java.util.Objects;

/**
 * A namespaced, stable identifier for a kind of failure, rendered {@code namespace:name}.
 *
 * @param namespace The failing layer (e.g., "transport", "cache")
 * @param name The specific failure within that layer (e.g., "timeout", "read_failed")
 */
public record FailureId(String namespace, String name) {

    public FailureId {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureId of(String namespace, String name) {
        return new FailureId(namespace, name);
    }

    /**
     * Creates a FailureId namespaced by the lower-cased failure type.
     */
    public static FailureId of(FailureType type, String name) {
        Objects.requireNonNull(type, "type must not be null");
        return new FailureId(type.name().toLowerCase(Locale.ROOT), name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
