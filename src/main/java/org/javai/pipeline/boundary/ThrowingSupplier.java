package org.javai.pipeline.boundary;

/**
 * A blocking call into an external collaborator (remote API, cache) that may throw.
 * The pipeline treats every such call as an opaque suspension point.
 *
 * @param <T> The type of value supplied
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

    T get() throws Exception;
}
