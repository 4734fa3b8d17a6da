package org.javai.remotecall;

import org.javai.remotecall.boundary.Boundary;
import org.javai.remotecall.circuit.CircuitBreaker;
import org.javai.remotecall.retry.Retrier;

import java.util.Objects;

/**
 * Composes a {@link CircuitBreaker} around a {@link Retrier}.
 *
 * <p>The breaker decides whether to attempt the call at all; the retrier handles the
 * per-attempt policy inside it. A whole retry sequence therefore counts as one success or
 * one failure for the breaker, and a rejected call is never retried.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResilientCall notifications = ResilientCall.of(
 *     registry.breaker("notifications"),
 *     Retrier.builder().reporter(reporter).build());
 *
 * Outcome<List<Notification>> result = notifications.attempt("Notifications.list", api::list);
 * }</pre>
 */
public final class ResilientCall {

    private final CircuitBreaker breaker;
    private final Retrier retrier;
    private final Boundary boundary;

    private ResilientCall(CircuitBreaker breaker, Retrier retrier, Boundary boundary) {
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
    }

    public static ResilientCall of(CircuitBreaker breaker, Retrier retrier) {
        return new ResilientCall(breaker, retrier, Boundary.silent());
    }

    public static ResilientCall of(CircuitBreaker breaker, Retrier retrier, Boundary boundary) {
        return new ResilientCall(breaker, retrier, boundary);
    }

    /**
     * @throws org.javai.remotecall.circuit.CircuitOpenException if the breaker rejected the call
     * @throws Exception the original failure of the final attempt
     */
    public <T> T execute(String operation, RemoteOperation<T> work) throws Exception {
        return breaker.execute(() -> retrier.execute(operation, work));
    }

    /**
     * Executes the call and returns the final checked failure as {@link Outcome.Fail}.
     * A rejection surfaces as a failed outcome whose {@link Outcome#isCircuitOpen()} is true.
     */
    public <T> Outcome<T> attempt(String operation, RemoteOperation<T> work) {
        return boundary.call(operation, () -> execute(operation, work));
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}
