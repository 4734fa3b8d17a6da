package org.javai.remotecall.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a retry loop.
 *
 * @param maxAttempts Total attempts including the first call (at least 1)
 * @param baseDelay Delay before the first retry
 * @param maxDelay Upper bound on any computed delay, applied before jitter
 * @param backoffFactor Multiplicative growth per retry (greater than 1)
 * @param jitter Whether computed delays are spread with {@link BackoffCalculator#addJitter(Duration)}
 */
public record RetryOptions(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffFactor,
        boolean jitter
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(30000);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;

    /**
     * Largest accepted {@code maxDelay}; a jittered delay of twice this still fits in a long of nanoseconds.
     */
    public static final Duration MAX_DELAY_LIMIT = Duration.ofNanos(Long.MAX_VALUE / 4);

    public RetryOptions {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative, was: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
        }
        if (maxDelay.compareTo(MAX_DELAY_LIMIT) > 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be <= " + MAX_DELAY_LIMIT + ", was: " + maxDelay);
        }
        if (!(backoffFactor > 1.0) || Double.isInfinite(backoffFactor)) {
            throw new IllegalArgumentException("backoffFactor must be > 1, was: " + backoffFactor);
        }
    }

    /**
     * 3 attempts, 1s base delay, 30s cap, factor 2, with jitter.
     */
    public static RetryOptions defaults() {
        return new RetryOptions(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY,
                DEFAULT_BACKOFF_FACTOR, true);
    }

    public RetryOptions withMaxAttempts(int maxAttempts) {
        return new RetryOptions(maxAttempts, baseDelay, maxDelay, backoffFactor, jitter);
    }

    public RetryOptions withBaseDelay(Duration baseDelay) {
        return new RetryOptions(maxAttempts, baseDelay, maxDelay, backoffFactor, jitter);
    }

    public RetryOptions withMaxDelay(Duration maxDelay) {
        return new RetryOptions(maxAttempts, baseDelay, maxDelay, backoffFactor, jitter);
    }

    public RetryOptions withBackoffFactor(double backoffFactor) {
        return new RetryOptions(maxAttempts, baseDelay, maxDelay, backoffFactor, jitter);
    }

    public RetryOptions withJitter(boolean jitter) {
        return new RetryOptions(maxAttempts, baseDelay, maxDelay, backoffFactor, jitter);
    }
}
