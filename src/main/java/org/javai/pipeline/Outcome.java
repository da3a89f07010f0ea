package org.javai.pipeline;

import java.util.Objects;
import java.util.function.Function;

/**
 * One element of an operation's result stream.
 * Either {@link Pending} while work is in flight, {@link Ok} carrying a value,
 * or {@link Fail} carrying a {@link Failure}.
 *
 * <p>Outcomes are immutable. A stream produced by an operation always starts with
 * {@code Pending} and ends with an {@code Ok} or a {@code Fail}.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Pending, Outcome.Ok, Outcome.Fail {

    /**
     * Work has started and no result is available yet.
     */
    record Pending<T>() implements Outcome<T> {

        @Override
        public boolean isPending() {
            return true;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException("Outcome is still pending");
        }

        @Override
        public T getOrNull() {
            return null;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Pending<>();
        }
    }

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value, never null
     */
    record Ok<T>(T value) implements Outcome<T> {

        public Ok {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isPending() {
            return false;
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrNull() {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details, never null
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isPending() {
            return false;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrNull() {
            return null;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }
    }

    boolean isPending();
    boolean isOk();
    boolean isFail();

    /**
     * Returns the value of an {@code Ok}.
     *
     * @throws OutcomeFailedException if this outcome is pending or failed
     */
    T getOrThrow();

    /**
     * Returns the value of an {@code Ok}, or null for the other variants.
     */
    T getOrNull();

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    static <T> Outcome<T> pending() {
        return new Pending<>();
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
