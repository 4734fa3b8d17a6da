package org.javai.remotecall.circuit;

import org.javai.remotecall.NetworkError;

import java.time.Duration;

/**
 * Raised by a {@link CircuitBreaker} when it rejects a call without invoking it.
 *
 * <p>Thrown while the circuit is OPEN and the reset timeout has not elapsed, and while a
 * HALF_OPEN trial call is still in flight. The error is explicitly non-retryable, so a
 * retry loop wrapped around a breaker stops at once.
 */
public class CircuitOpenException extends NetworkError {

    private final String breakerName;
    private final Duration remainingOpen;

    public CircuitOpenException(String breakerName, Duration remainingOpen) {
        super("Circuit breaker is open: " + breakerName, true, null, Boolean.FALSE, null);
        this.breakerName = breakerName;
        this.remainingOpen = remainingOpen;
    }

    public String breakerName() {
        return breakerName;
    }

    /**
     * Time until the breaker admits a trial call; zero while a trial is in flight.
     */
    public Duration remainingOpen() {
        return remainingOpen;
    }
}
