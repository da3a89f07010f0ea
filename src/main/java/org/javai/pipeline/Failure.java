package org.javai.pipeline;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Describes why an operation did not produce a value.
 *
 * <p>Failures are created where an exception is caught (see
 * {@link org.javai.pipeline.boundary.Boundary}) and travel up the pipeline inside
 * {@link Outcome.Fail}. The rendering layer only ever reads them.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description; null when the underlying exception carried none
 * @param type The layer that failed
 * @param exception The underlying exception (may be null)
 * @param operation The operation that failed (e.g., "ItemGateway.popularItems")
 * @param occurredAt When the failure happened
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        String operation,
        Instant occurredAt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Creates a failure stamped with the current time and no tags.
     */
    public static Failure of(FailureId id, String message, FailureType type, String operation, Throwable exception) {
        return new Failure(id, message, type, exception, operation, Instant.now(), null);
    }

    public static Builder builder(FailureId id, FailureType type, String operation) {
        return new Builder(id, type, operation);
    }

    /**
     * Returns the message, or {@code fallback} when there is none.
     */
    public String messageOrElse(String fallback) {
        return message == null || message.isBlank() ? fallback : message;
    }

    public Failure withTags(Map<String, String> tags) {
        return new Failure(id, message, type, exception, operation, occurredAt, tags);
    }

    public static class Builder {
        private final FailureId id;
        private final FailureType type;
        private final String operation;
        private String message;
        private Throwable exception;
        private Instant occurredAt = Instant.now();
        private Map<String, String> tags;

        private Builder(FailureId id, FailureType type, String operation) {
            this.id = Objects.requireNonNull(id);
            this.type = Objects.requireNonNull(type);
            this.operation = Objects.requireNonNull(operation);
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder exception(Throwable exception) {
            this.exception = exception;
            return this;
        }

        public Builder occurredAt(Instant instant) {
            this.occurredAt = instant;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Failure build() {
            return new Failure(id, message, type, exception, operation, occurredAt, tags);
        }
    }
}
