package org.javai.pipeline;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on an outcome without a value.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isOk()} first or used pattern matching.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed: " + failure.messageOrElse(failure.id().toString()), failure.exception());
        this.failure = failure;
    }

    OutcomeFailedException(String message) {
        super(message);
        this.failure = null;
    }

    /**
     * Returns the failure carried by the outcome, or null when the outcome was still pending.
     */
    public Failure failure() {
        return failure;
    }
}
