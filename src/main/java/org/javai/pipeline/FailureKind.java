package org.javai.pipeline;

import java.util.Objects;

/**
 * Describes a failure without operational context.
 * This is what classifiers produce; the Boundary adds operation, time and exception to create a full Failure.
 *
 * @param id Namespaced failure identifier
 * @param message Human-readable description (may be null)
 * @param type The layer that failed
 */
public record FailureKind(FailureId id, String message, FailureType type) {

    public FailureKind {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static FailureKind of(FailureType type, String name, String message) {
        return new FailureKind(FailureId.of(type, name), message, type);
    }
}
