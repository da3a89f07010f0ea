package org.javai.pipeline.gateway;

import java.util.Objects;

/**
 * Identifies a logical query instance, rendered {@code popular-items} or {@code item-details:42}.
 * Gateways use it as the cache key. Identical keys in flight at the same time are not collapsed.
 *
 * @param name the query name
 * @param argument the query argument, or null for parameterless queries
 */
public record QueryKey(String name, String argument) {

    public QueryKey {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static QueryKey of(String name) {
        return new QueryKey(name, null);
    }

    public static QueryKey of(String name, Object argument) {
        return new QueryKey(name, String.valueOf(Objects.requireNonNull(argument, "argument must not be null")));
    }

    @Override
    public String toString() {
        return argument == null ? name : name + ":" + argument;
    }
}
