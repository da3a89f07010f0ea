package org.javai.pipeline.operation;

import org.javai.pipeline.Outcome;
import reactor.core.publisher.Flux;

/**
 * A unit of business logic producing a stream of outcomes for the given parameters.
 *
 * <p>The stream emits {@link Outcome.Pending} first and then its results; it never
 * terminates with an error. Each invocation is independent: invoking twice with the
 * same parameters yields two streams that share nothing.
 *
 * @param <P> parameter type
 * @param <T> result type
 */
@FunctionalInterface
public interface Operation<P, T> {

    Flux<Outcome<T>> invoke(P params);
}
