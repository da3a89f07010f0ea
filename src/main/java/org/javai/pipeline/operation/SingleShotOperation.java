package org.javai.pipeline.operation;

import org.javai.pipeline.Outcome;
import reactor.core.publisher.Mono;

/**
 * An operation with exactly one logical response: the returned {@link Mono} emits a single
 * {@link Outcome.Ok} or {@link Outcome.Fail}, never {@link Outcome.Pending}, and never errors.
 *
 * @param <P> parameter type
 * @param <T> result type
 */
@FunctionalInterface
public interface SingleShotOperation<P, T> {

    Mono<Outcome<T>> invoke(P params);
}
