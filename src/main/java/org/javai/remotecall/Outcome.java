package org.javai.remotecall;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a remote call made through a {@link org.javai.remotecall.boundary.Boundary}:
 * either {@link Ok} with the response, or {@link Fail} with the classified {@link Failure}
 * of the final attempt.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Outcome<List<Notification>> outcome = notifications.attempt("Notifications.list", api::list);
 *
 * if (outcome.isCircuitOpen()) {
 *     banner.show("Notifications are temporarily unavailable");
 * } else if (outcome.isRetryable()) {
 *     scheduler.refreshLater();
 * }
 * List<Notification> shown = outcome.getOrElse(List.of());
 * }</pre>
 *
 * @param <T> The type of the response
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * @param value the response of the call
     */
    record Ok<T>(T value) implements Outcome<T> {}

    /**
     * @param failure the classified failure of the final attempt
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * The failure, if the call failed.
     */
    default Optional<Failure> findFailure() {
        if (this instanceof Fail<T> fail) {
            return Optional.of(fail.failure());
        }
        return Optional.empty();
    }

    /**
     * True when the call was rejected by an open circuit without reaching the dependency.
     */
    default boolean isCircuitOpen() {
        return findFailure().map(Failure::isCircuitOpen).orElse(false);
    }

    /**
     * True when the call failed with a failure judged transient, so a later call may succeed.
     */
    default boolean isRetryable() {
        return findFailure().map(Failure::retryable).orElse(false);
    }

    /**
     * @throws OutcomeFailedException if the call failed; the original exception is its cause
     */
    default T getOrThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new OutcomeFailedException(((Fail<T>) this).failure());
    }

    default T getOrElse(T fallback) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        return fallback;
    }
}
