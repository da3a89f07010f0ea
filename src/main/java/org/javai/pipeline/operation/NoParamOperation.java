package org.javai.pipeline.operation;

import org.javai.pipeline.Outcome;
import reactor.core.publisher.Flux;

/**
 * An {@link Operation} that takes no parameters.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface NoParamOperation<T> {

    Flux<Outcome<T>> invoke();
}
