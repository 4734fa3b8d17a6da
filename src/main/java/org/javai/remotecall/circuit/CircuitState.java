package org.javai.remotecall.circuit;

/**
 * State of a {@link CircuitBreaker}.
 *
 * <pre>
 * CLOSED
 *   |  failureThreshold consecutive failures
 *   v
 * OPEN  &lt;-------------------+
 *   |  resetTimeout elapsed  | any failure
 *   v                        |
 * HALF_OPEN -----------------+
 *   |  successThreshold consecutive successes
 *   v
 * CLOSED
 * </pre>
 */
public enum CircuitState {

    /**
     * Calls pass through; consecutive failures are counted.
     */
    CLOSED,

    /**
     * Calls are rejected with {@link CircuitOpenException} without being invoked.
     */
    OPEN,

    /**
     * One trial call at a time is let through to check whether the dependency recovered.
     */
    HALF_OPEN
}
