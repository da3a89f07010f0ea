package org.javai.pipeline.ops;

import org.javai.pipeline.Failure;

/**
 * Reports failures for observability.
 * Implementations might write structured logs or emit metrics.
 */
public interface OpReporter {

    /**
     * Reports a failure that reached, or is about to reach, a consumer.
     */
    void report(Failure failure);

    /**
     * Reports a failure that was absorbed by a fallback and never surfaced to the consumer,
     * e.g. a remote error hidden behind a cached value.
     *
     * @param failure The absorbed failure
     * @param resolution How the pipeline recovered (e.g., "served cached value for popular-items")
     */
    default void reportSuppressed(Failure failure, String resolution) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
