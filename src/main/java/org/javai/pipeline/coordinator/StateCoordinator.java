package org.javai.pipeline.coordinator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.pipeline.Failure;
import org.javai.pipeline.FailureId;
import org.javai.pipeline.FailureType;
import org.javai.pipeline.PipelineConfig;
import org.javai.pipeline.ops.OpReporter;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Folds the outcome streams of one screen into a single current state, and carries
 * one-shot events (navigation, messages) on a separate channel.
 *
 * <p>State:
 * <ul>
 *   <li>starts at the value passed to the constructor;</li>
 *   <li>is replaced wholesale under a lock, so observers never see a partial update;</li>
 *   <li>is replayed to each new {@link #states()} subscriber (latest value only).</li>
 * </ul>
 *
 * <p>Events sent with {@link #sendEvent} are delivered only to subscribers attached at that
 * moment: nothing is buffered or replayed, and sending an event never changes the state.
 *
 * <p>Work started with {@link #launch} is owned by the coordinator. An exception anywhere in
 * it is reported as a {@link FailureType#COORDINATOR} failure and the state moves to
 * {@link #faultState}. {@link #close()} cancels all of it; afterwards neither the state nor
 * the event channel changes again.
 *
 * @param <S> state type
 * @param <E> one-shot event type
 */
public abstract class StateCoordinator<S, E> implements AutoCloseable {

    protected final Logger logger = LogManager.getLogger(getClass());

    private final Object lock = new Object();
    private final Sinks.Many<S> stateSink;
    private final Sinks.Many<E> eventSink = Sinks.many().multicast().directBestEffort();
    private final Disposable.Composite subscriptions = Disposables.composite();
    private final Scheduler foreground;
    private final OpReporter reporter;

    private volatile S state;
    private volatile boolean closed;

    protected StateCoordinator(S initialState, PipelineConfig config) {
        this(initialState, config.foreground(), config.reporter());
    }

    protected StateCoordinator(S initialState, Scheduler foreground, OpReporter reporter) {
        this.state = Objects.requireNonNull(initialState, "initialState must not be null");
        this.foreground = Objects.requireNonNull(foreground, "foreground must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.stateSink = Sinks.many().replay().latestOrDefault(initialState);
    }

    /**
     * The state the coordinator moves to after a fault in its own reaction logic.
     */
    protected abstract S faultState(Failure failure);

    public Flux<S> states() {
        return stateSink.asFlux();
    }

    public Flux<E> events() {
        return eventSink.asFlux();
    }

    public S currentState() {
        return state;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Replaces the state with the reducer's result. Ignored once the coordinator is closed.
     */
    protected final void setState(UnaryOperator<S> reducer) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            S next = Objects.requireNonNull(reducer.apply(state), "reducer must not return null");
            state = next;
            Sinks.EmitResult result = stateSink.tryEmitNext(next);
            if (result.isFailure()) {
                logger.warn("State {} not delivered to observers: {}", next, result);
            }
        }
    }

    /**
     * Delivers a one-shot event to the subscribers attached right now.
     */
    protected final void sendEvent(E event) {
        Objects.requireNonNull(event, "event must not be null");
        synchronized (lock) {
            if (closed) {
                return;
            }
            Sinks.EmitResult result = eventSink.tryEmitNext(event);
            if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                logger.debug("Event {} dropped, nobody listening", event);
            } else if (result.isFailure()) {
                logger.warn("Event {} not delivered: {}", event, result);
            }
        }
    }

    /**
     * Subscribes to the publisher built by {@code source}, handing each element to
     * {@code reaction} on the foreground scheduler.
     *
     * @return a handle that cancels this piece of work only
     */
    protected final <T> Disposable launch(Supplier<? extends Publisher<T>> source, Consumer<? super T> reaction) {
        Disposable.Swap slot = Disposables.swap();
        if (closed || !subscriptions.add(slot)) {
            return Disposables.disposed();
        }

        Disposable subscription = Flux.defer(source)
                .publishOn(foreground)
                .doOnNext(reaction)
                .doFinally(signal -> subscriptions.remove(slot))
                .subscribe(ignored -> {}, this::onFault);
        slot.update(subscription);
        return slot;
    }

    private void onFault(Throwable error) {
        Failure failure = Failure.builder(
                        FailureId.of(FailureType.COORDINATOR, "reaction_failed"),
                        FailureType.COORDINATOR,
                        getClass().getSimpleName())
                .message(error.getMessage())
                .exception(error)
                .build();
        reporter.report(failure);

        try {
            setState(current -> faultState(failure));
        } catch (RuntimeException e) {
            logger.error("Could not move {} to its fault state", getClass().getSimpleName(), e);
        }
    }

    /**
     * Cancels all launched work and completes the state and event streams.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            stateSink.tryEmitComplete();
            eventSink.tryEmitComplete();
        }
        subscriptions.dispose();
        logger.debug("{} closed", getClass().getSimpleName());
    }
}
