package org.javai.pipeline.boundary;

import org.javai.pipeline.Failure;
import org.javai.pipeline.FailureKind;
import org.javai.pipeline.Outcome;
import org.javai.pipeline.ops.OpReporter;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The single point where exceptions thrown by external collaborators are translated
 * into {@link Failure} values.
 *
 * <p>Unlike a classic fail-fast wrapper, a Boundary catches every {@link Exception},
 * checked or not: a result stream must never terminate with an error, so anything the
 * fetch function throws becomes a {@link Outcome.Fail}. {@link Error}s still propagate.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Outcome<ItemPage> page = boundary.call("ItemApi.popular", () -> api.popular(1));
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new DefaultFailureClassifier();

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     *
     * @return a Boundary with default classification and no reporting
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, OpReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     *
     * @param reporter the reporter for failure notifications
     * @return a Boundary with default classification and custom reporting
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes a blocking call, translating any exception into a reported failure.
     * A null result is treated as a failure as well, since {@link Outcome.Ok} never carries null.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            T value = work.get();
            if (value == null) {
                throw new IllegalStateException(operation + " returned no value");
            }
            return Outcome.ok(value);
        } catch (Exception e) {
            return Outcome.fail(reportFailure(operation, e));
        }
    }

    /**
     * Classifies an exception without reporting it. Callers that may still recover
     * (fallback strategies) decide later whether to report or suppress the result.
     */
    public Failure classify(String operation, Throwable throwable) {
        return classify(operation, Map.of(), throwable);
    }

    public Failure classify(String operation, Map<String, String> tags, Throwable throwable) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(throwable, "throwable must not be null");

        FailureKind kind = classifier.classify(operation, throwable);
        return new Failure(
                kind.id(),
                kind.message(),
                kind.type(),
                throwable,
                operation,
                Instant.now(),
                tags
        );
    }

    /**
     * Classifies an exception and reports it as a surfaced failure.
     */
    public Failure reportFailure(String operation, Throwable throwable) {
        Failure failure = classify(operation, throwable);
        reporter.report(failure);
        return failure;
    }

    public OpReporter reporter() {
        return reporter;
    }
}
