package org.javai.pipeline.coordinator;

import org.javai.pipeline.Outcome;

import java.util.Collection;
import java.util.Objects;

/**
 * The renderable state of a screen backed by a single query.
 *
 * @param <T> type of the data shown on success
 */
public sealed interface ScreenState<T>
        permits ScreenState.Loading, ScreenState.Success, ScreenState.Error, ScreenState.Empty {

    String DEFAULT_ERROR_MESSAGE = "An error occurred";
    String DEFAULT_EMPTY_MESSAGE = "No data available";

    record Loading<T>() implements ScreenState<T> {}

    record Success<T>(T data) implements ScreenState<T> {
        public Success {
            Objects.requireNonNull(data, "data must not be null");
        }
    }

    record Error<T>(String message) implements ScreenState<T> {
        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    record Empty<T>(String message) implements ScreenState<T> {
        public Empty {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    static <T> ScreenState<T> loading() {
        return new Loading<>();
    }

    static <T> ScreenState<T> success(T data) {
        return new Success<>(data);
    }

    static <T> ScreenState<T> error(String message) {
        return new Error<>(message);
    }

    static <T> ScreenState<T> empty() {
        return new Empty<>(DEFAULT_EMPTY_MESSAGE);
    }

    /**
     * Reduces one outcome to the state it should produce. An {@code Ok} holding an empty
     * collection becomes {@link Empty}; that is the only rule that splits on the value.
     */
    static <T> ScreenState<T> from(Outcome<T> outcome) {
        if (outcome instanceof Outcome.Ok<T> ok) {
            if (ok.value() instanceof Collection<?> collection && collection.isEmpty()) {
                return empty();
            }
            return success(ok.value());
        }
        if (outcome instanceof Outcome.Fail<T> fail) {
            return error(fail.failure().messageOrElse(DEFAULT_ERROR_MESSAGE));
        }
        return loading();
    }
}
