package org.javai.pipeline.operation;

import org.javai.pipeline.Failure;
import org.javai.pipeline.FailureId;
import org.javai.pipeline.FailureType;
import org.javai.pipeline.Outcome;
import org.javai.pipeline.boundary.Boundary;
import org.javai.pipeline.ops.RecordingOpReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class OperationsTest {

    private RecordingOpReporter reporter;
    private Operations operations;

    @BeforeEach
    void setUp() {
        reporter = new RecordingOpReporter();
        operations = Operations.on(Schedulers.immediate(), Boundary.withReporter(reporter));
    }

    @Test
    void streaming_prependsSinglePending() {
        Operation<String, Integer> length = operations.streaming("Length",
                text -> Flux.just(Outcome.pending(), Outcome.ok(text.length())));

        StepVerifier.create(length.invoke("hello"))
                .expectNext(Outcome.pending(), Outcome.ok(5))
                .verifyComplete();
    }

    @Test
    void streaming_bodyThrows_becomesReportedFail() {
        Operation<String, Integer> broken = operations.streaming("Broken", text -> {
            throw new IllegalStateException("no stream for " + text);
        });

        StepVerifier.create(broken.invoke("x"))
                .expectNext(Outcome.pending())
                .assertNext(outcome -> {
                    assertThat(outcome.isFail()).isTrue();
                    Failure failure = ((Outcome.Fail<Integer>) outcome).failure();
                    assertThat(failure.operation()).isEqualTo("Broken");
                    assertThat(failure.message()).isEqualTo("no stream for x");
                })
                .verifyComplete();

        assertThat(reporter.reported()).hasSize(1);
    }

    @Test
    void streaming_streamErrors_becomesFail() {
        Operation<Void, String> broken = operations.streaming("Broken",
                ignored -> Flux.error(new UncheckedIOException(new IOException("socket closed"))));

        StepVerifier.create(broken.invoke(null))
                .expectNext(Outcome.pending())
                .assertNext(outcome -> assertThat(outcome.isFail()).isTrue())
                .verifyComplete();
    }

    @Test
    void streaming_emptyStream_becomesFail() {
        Operation<Void, String> silent = operations.streaming("Silent", ignored -> Flux.empty());

        StepVerifier.create(silent.invoke(null))
                .expectNext(Outcome.pending())
                .assertNext(outcome -> assertThat(((Outcome.Fail<String>) outcome).failure().message())
                        .isEqualTo("Silent completed without a result"))
                .verifyComplete();
    }

    @Test
    void streaming_passesThroughFailFromBody() {
        Failure failure = Failure.of(FailureId.of(FailureType.TRANSPORT, "io_error"), "offline",
                FailureType.TRANSPORT, "ItemGateway.popularItems", null);
        Operation<Void, String> failing = operations.streaming("Failing",
                ignored -> Flux.just(Outcome.pending(), Outcome.fail(failure)));

        StepVerifier.create(failing.invoke(null))
                .expectNext(Outcome.pending(), Outcome.fail(failure))
                .verifyComplete();

        assertThat(reporter.reported()).as("already reported where it was caught").isEmpty();
    }

    @Test
    void streaming_eachInvocationRunsBodyAgain() {
        AtomicInteger calls = new AtomicInteger();
        NoParamOperation<Integer> counting = operations.noParams("Counting",
                () -> Flux.just(Outcome.ok(calls.incrementAndGet())));

        StepVerifier.create(counting.invoke()).expectNext(Outcome.pending(), Outcome.ok(1)).verifyComplete();
        StepVerifier.create(counting.invoke()).expectNext(Outcome.pending(), Outcome.ok(2)).verifyComplete();
    }

    @Test
    void streaming_bodyNotRunUntilSubscribed() {
        AtomicInteger calls = new AtomicInteger();
        NoParamOperation<Integer> counting = operations.noParams("Counting",
                () -> Flux.just(Outcome.ok(calls.incrementAndGet())));

        counting.invoke();

        assertThat(calls).hasValue(0);
    }

    @Test
    void streaming_subscribesOnConfiguredScheduler() {
        Operations background = Operations.on(Schedulers.newSingle("pipeline-test", true), Boundary.silent());
        AtomicReference<String> threadName = new AtomicReference<>();
        NoParamOperation<String> recordThread = background.noParams("RecordThread", () -> {
            threadName.set(Thread.currentThread().getName());
            return Flux.just(Outcome.ok("done"));
        });

        StepVerifier.create(recordThread.invoke())
                .expectNext(Outcome.pending(), Outcome.ok("done"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(threadName.get()).startsWith("pipeline-test");
    }

    @Test
    void singleShot_emitsOneOutcomeWithoutPending() {
        SingleShotOperation<Integer, Integer> twice = operations.singleShot("Twice",
                n -> Mono.just(Outcome.ok(n * 2)));

        StepVerifier.create(twice.invoke(21))
                .expectNext(Outcome.ok(42))
                .verifyComplete();
    }

    @Test
    void singleShot_errorAndEmpty_becomeFail() {
        SingleShotOperation<Void, String> broken = operations.singleShot("Broken",
                ignored -> Mono.error(new IOException("offline")));
        SingleShotOperation<Void, String> silent = operations.singleShot("Silent", ignored -> Mono.empty());

        StepVerifier.create(broken.invoke(null))
                .assertNext(outcome -> assertThat(outcome.isFail()).isTrue())
                .verifyComplete();
        StepVerifier.create(silent.invoke(null))
                .assertNext(outcome -> assertThat(outcome.isFail()).isTrue())
                .verifyComplete();

        assertThat(reporter.reported()).hasSize(2);
    }
}
