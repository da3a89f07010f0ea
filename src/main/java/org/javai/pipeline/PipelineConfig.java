package org.javai.pipeline;

import org.javai.pipeline.boundary.Boundary;
import org.javai.pipeline.boundary.DefaultFailureClassifier;
import org.javai.pipeline.boundary.FailureClassifier;
import org.javai.pipeline.ops.OpReporter;
import org.javai.pipeline.ops.log4j.Log4jOpReporter;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Execution settings shared by operations, gateways and coordinators.
 *
 * <p>Every setting has a default, so {@code PipelineConfig.defaults()} is a working configuration:
 * <ul>
 *   <li>background scheduler: {@link Schedulers#boundedElastic()}, where blocking fetches run</li>
 *   <li>foreground scheduler: {@link Schedulers#single()}, where coordinators observe results</li>
 *   <li>reporter: {@link Log4jOpReporter}</li>
 *   <li>classifier: {@link DefaultFailureClassifier}</li>
 *   <li>fetch timeout: none, a remote call that never answers keeps its stream pending</li>
 * </ul>
 *
 * <pre>{@code
 * PipelineConfig config = PipelineConfig.builder()
 *     .fetchTimeout(Duration.ofSeconds(30))
 *     .reporter(OpReporter.composite(new Log4jOpReporter(), new MetricsOpReporter("catalog")))
 *     .build();
 * }</pre>
 */
public final class PipelineConfig {

    private final Scheduler background;
    private final Scheduler foreground;
    private final OpReporter reporter;
    private final FailureClassifier classifier;
    private final Duration fetchTimeout;

    private PipelineConfig(Builder builder) {
        this.background = builder.background;
        this.foreground = builder.foreground;
        this.reporter = builder.reporter;
        this.classifier = builder.classifier;
        this.fetchTimeout = builder.fetchTimeout;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Scheduler background() {
        return background;
    }

    public Scheduler foreground() {
        return foreground;
    }

    public OpReporter reporter() {
        return reporter;
    }

    public FailureClassifier classifier() {
        return classifier;
    }

    /**
     * The limit applied to each remote fetch, if any.
     */
    public Optional<Duration> fetchTimeout() {
        return Optional.ofNullable(fetchTimeout);
    }

    /**
     * A boundary using this configuration's classifier and reporter.
     */
    public Boundary boundary() {
        return Boundary.of(classifier, reporter);
    }

    public static final class Builder {
        private Scheduler background = Schedulers.boundedElastic();
        private Scheduler foreground = Schedulers.single();
        private OpReporter reporter = new Log4jOpReporter();
        private FailureClassifier classifier = new DefaultFailureClassifier();
        private Duration fetchTimeout;

        private Builder() {}

        public Builder background(Scheduler background) {
            this.background = Objects.requireNonNull(background, "background must not be null");
            return this;
        }

        public Builder foreground(Scheduler foreground) {
            this.foreground = Objects.requireNonNull(foreground, "foreground must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the limit for each remote fetch. A fetch exceeding it fails as a transport
         * timeout and takes part in fallback like any other remote failure.
         *
         * @param fetchTimeout a positive duration, or null for no limit
         */
        public Builder fetchTimeout(Duration fetchTimeout) {
            if (fetchTimeout != null && (fetchTimeout.isNegative() || fetchTimeout.isZero())) {
                throw new IllegalArgumentException("fetchTimeout must be positive");
            }
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
