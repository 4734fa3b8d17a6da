package org.javai.remotecall.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration of a {@link CircuitBreaker}.
 *
 * @param failureThreshold Consecutive failures that open a closed circuit
 * @param resetTimeout How long the circuit stays open before a trial call
 * @param successThreshold Consecutive trial successes that close a half-open circuit
 */
public record CircuitBreakerConfig(int failureThreshold, Duration resetTimeout, int successThreshold) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;

    public CircuitBreakerConfig {
        Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must not be negative, was: " + resetTimeout);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, was: " + successThreshold);
        }
    }

    /**
     * 5 failures, 60s reset timeout, 3 successes.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT, DEFAULT_SUCCESS_THRESHOLD);
    }
}
