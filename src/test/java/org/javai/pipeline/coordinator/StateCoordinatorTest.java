package org.javai.pipeline.coordinator;

import org.javai.pipeline.Failure;
import org.javai.pipeline.FailureType;
import org.javai.pipeline.ops.RecordingOpReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

class StateCoordinatorTest {

    private static final int FAULT = -1;

    private RecordingOpReporter reporter;
    private CounterCoordinator coordinator;

    /**
     * Integer state, String events; exposes the protected API.
     */
    private static final class CounterCoordinator extends StateCoordinator<Integer, String> {

        CounterCoordinator(RecordingOpReporter reporter) {
            super(0, Schedulers.immediate(), reporter);
        }

        void increment() {
            setState(n -> n + 1);
        }

        void set(int value) {
            setState(ignored -> value);
        }

        void send(String event) {
            sendEvent(event);
        }

        <T> Disposable run(Supplier<? extends Publisher<T>> source, Consumer<? super T> reaction) {
            return launch(source, reaction);
        }

        @Override
        protected Integer faultState(Failure failure) {
            return FAULT;
        }
    }

    @BeforeEach
    void setUp() {
        reporter = new RecordingOpReporter();
        coordinator = new CounterCoordinator(reporter);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Test
    void states_replayInitialState() {
        StepVerifier.create(coordinator.states())
                .expectNext(0)
                .thenCancel()
                .verify();
    }

    @Test
    void states_lateSubscriberSeesLatestOnly() {
        coordinator.set(1);
        coordinator.set(2);

        StepVerifier.create(coordinator.states())
                .expectNext(2)
                .then(() -> coordinator.set(3))
                .expectNext(3)
                .thenCancel()
                .verify();
        assertThat(coordinator.currentState()).isEqualTo(3);
    }

    @Test
    void setState_concurrentUpdatesAreNotLost() throws Exception {
        int threads = 8;
        int incrementsPerThread = 1_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < incrementsPerThread; i++) {
                        coordinator.increment();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }

        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(coordinator.currentState()).isEqualTo(threads * incrementsPerThread);
    }

    @Test
    void events_notReplayedToLateSubscribers() {
        coordinator.send("missed");

        List<String> received = new ArrayList<>();
        Disposable subscription = coordinator.events().subscribe(received::add);
        coordinator.send("seen");
        subscription.dispose();

        assertThat(received).containsExactly("seen");
    }

    @Test
    void events_doNotChangeState() {
        coordinator.set(5);

        coordinator.send("navigate");

        assertThat(coordinator.currentState()).isEqualTo(5);
    }

    @Test
    void events_deliveredToEverySubscriber() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        Disposable a = coordinator.events().subscribe(first::add);
        Disposable b = coordinator.events().subscribe(second::add);

        coordinator.send("hello");
        a.dispose();
        b.dispose();

        assertThat(first).containsExactly("hello");
        assertThat(second).containsExactly("hello");
    }

    @Test
    void launch_reactionReceivesEachElement() {
        coordinator.run(() -> Flux.just(1, 2, 3), value -> coordinator.set(value * 10));

        assertThat(coordinator.currentState()).isEqualTo(30);
        assertThat(reporter.reported()).isEmpty();
    }

    @Test
    void launch_reactionThrows_movesToFaultStateAndReports() {
        coordinator.run(() -> Flux.just(1), value -> {
            throw new IllegalStateException("render failed");
        });

        assertThat(coordinator.currentState()).isEqualTo(FAULT);
        assertThat(reporter.reported()).singleElement().satisfies(failure -> {
            assertThat(failure.type()).isEqualTo(FailureType.COORDINATOR);
            assertThat(failure.id()).hasToString("coordinator:reaction_failed");
            assertThat(failure.operation()).isEqualTo("CounterCoordinator");
            assertThat(failure.message()).isEqualTo("render failed");
        });
    }

    @Test
    void launch_upstreamErrors_movesToFaultState() {
        coordinator.run(() -> Flux.<Integer>error(new IllegalStateException("upstream broke")), coordinator::set);

        assertThat(coordinator.currentState()).isEqualTo(FAULT);
        assertThat(reporter.reported()).hasSize(1);
    }

    @Test
    void launch_sourceSupplierThrows_movesToFaultState() {
        coordinator.<Integer>run(() -> {
            throw new IllegalStateException("no source");
        }, coordinator::set);

        assertThat(coordinator.currentState()).isEqualTo(FAULT);
    }

    @Test
    void close_cancelsInFlightWork() {
        Sinks.Many<Integer> upstream = Sinks.many().unicast().onBackpressureBuffer();
        AtomicBoolean cancelled = new AtomicBoolean();
        coordinator.run(() -> upstream.asFlux().doOnCancel(() -> cancelled.set(true)), coordinator::set);
        upstream.tryEmitNext(1);

        coordinator.close();

        assertThat(cancelled).isTrue();
        assertThat(coordinator.currentState()).isEqualTo(1);
    }

    @Test
    void close_completesStreamsAndIgnoresLaterUpdates() {
        StepVerifier states = StepVerifier.create(coordinator.states())
                .expectNext(0)
                .expectComplete()
                .verifyLater();
        StepVerifier events = StepVerifier.create(coordinator.events())
                .expectComplete()
                .verifyLater();

        coordinator.close();
        coordinator.set(7);
        coordinator.send("late");

        states.verify(Duration.ofSeconds(1));
        events.verify(Duration.ofSeconds(1));
        assertThat(coordinator.isClosed()).isTrue();
        assertThat(coordinator.currentState()).isZero();
    }

    @Test
    void launch_afterClose_doesNothing() {
        coordinator.close();

        Disposable handle = coordinator.run(() -> Flux.just(9), coordinator::set);

        assertThat(handle.isDisposed()).isTrue();
        assertThat(coordinator.currentState()).isZero();
    }

    @Test
    void launch_handleCancelsOnlyItsOwnWork() {
        Sinks.Many<Integer> first = Sinks.many().unicast().onBackpressureBuffer();
        Sinks.Many<Integer> second = Sinks.many().unicast().onBackpressureBuffer();
        Disposable firstHandle = coordinator.run(first::asFlux, coordinator::set);
        coordinator.run(second::asFlux, coordinator::set);

        firstHandle.dispose();
        first.tryEmitNext(1);
        second.tryEmitNext(2);

        assertThat(coordinator.currentState()).isEqualTo(2);
    }
}
