package org.javai.remotecall.ops;

import org.javai.remotecall.Failure;
import org.javai.remotecall.circuit.CircuitState;

import java.time.Duration;

/**
 * Receives events from the remote-call layer for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporters are invoked on the calling thread after the circuit breaker has released
 * its lock, and should return quickly. A reporter that throws is logged and ignored; it
 * never changes the result of the call being reported.
 */
public interface CallReporter {

    /**
     * Reports a failure that reached a {@link org.javai.remotecall.boundary.Boundary}.
     */
    void report(Failure failure);

    /**
     * Reports that a failed attempt will be retried.
     *
     * @param operation The operation name
     * @param error The failure of the attempt
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The wait before the next attempt
     */
    default void reportRetryAttempt(String operation, Throwable error, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the retry loop gave up and the error is propagated.
     *
     * @param operation The operation name
     * @param error The final failure
     * @param totalAttempts The total number of attempts made
     * @param reason Why retrying stopped
     */
    default void reportRetryExhausted(String operation, Throwable error, int totalAttempts, String reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker state change.
     */
    default void reportStateTransition(String breaker, CircuitState from, CircuitState to) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a call rejected by an open circuit without being invoked.
     */
    default void reportCallRejected(String breaker, Duration remainingOpen) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static CallReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static CallReporter composite(CallReporter... reporters) {
        return CompositeCallReporter.of(reporters);
    }
}
