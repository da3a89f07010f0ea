package org.javai.pipeline.operation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.pipeline.Outcome;
import org.javai.pipeline.PipelineConfig;
import org.javai.pipeline.boundary.Boundary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Builds operations by wrapping raw result-producing functions with the behaviour every
 * operation shares:
 * <ul>
 *   <li>exactly one {@link Outcome.Pending}, emitted first;</li>
 *   <li>any exception, thrown while building the stream or signalled by it, becomes a
 *       reported {@link Outcome.Fail};</li>
 *   <li>a stream that completes without a result becomes a {@link Outcome.Fail};</li>
 *   <li>subscription on the configured background scheduler.</li>
 * </ul>
 *
 * <pre>{@code
 * Operations operations = Operations.from(config);
 * NoParamOperation<List<Item>> popular = operations.noParams("GetPopularItems", gateway::popularItems);
 * }</pre>
 */
public final class Operations {

    private static final Logger logger = LogManager.getLogger(Operations.class);

    private final Scheduler scheduler;
    private final Boundary boundary;

    public static Operations from(PipelineConfig config) {
        return new Operations(config.background(), config.boundary());
    }

    public static Operations on(Scheduler scheduler, Boundary boundary) {
        return new Operations(scheduler, boundary);
    }

    private Operations(Scheduler scheduler, Boundary boundary) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
    }

    public <P, T> Operation<P, T> streaming(String name, Function<? super P, ? extends Flux<Outcome<T>>> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return params -> guard(name, () -> body.apply(params));
    }

    public <T> NoParamOperation<T> noParams(String name, Supplier<? extends Flux<Outcome<T>>> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return () -> guard(name, body);
    }

    public <P, T> SingleShotOperation<P, T> singleShot(String name, Function<? super P, ? extends Mono<Outcome<T>>> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return params -> Mono.defer(() -> body.apply(params))
                .filter(outcome -> !outcome.isPending())
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(name + " completed without a result")))
                .onErrorResume(error -> Mono.just(Outcome.<T>fail(boundary.reportFailure(name, error))))
                .subscribeOn(scheduler);
    }

    private <T> Flux<Outcome<T>> guard(String name, Supplier<? extends Flux<Outcome<T>>> body) {
        Flux<Outcome<T>> results = Flux.defer(body)
                .filter(outcome -> !outcome.isPending())
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(name + " completed without a result")))
                .onErrorResume(error -> Mono.just(Outcome.<T>fail(boundary.reportFailure(name, error))));

        return Flux.concat(Mono.just(Outcome.<T>pending()), results)
                .doOnSubscribe(subscription -> logger.debug("{} started", name))
                .subscribeOn(scheduler);
    }
}
