package org.javai.remotecall.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter.
 *
 * <pre>
 * delay(n)  = min(baseDelay * backoffFactor^(n-1), maxDelay)
 * jitter(d) = d + random(0, d)
 * </pre>
 *
 * <p>Example (baseDelay=1000ms, factor=2, maxDelay=30000ms):</p>
 * <ul>
 *   <li>attempt 1: 1000ms, jittered 1000-2000ms</li>
 *   <li>attempt 2: 2000ms, jittered 2000-4000ms</li>
 *   <li>attempt 3: 4000ms, jittered 4000-8000ms</li>
 *   <li>attempt 6: 30000ms (capped), jittered 30000-60000ms</li>
 * </ul>
 */
public final class BackoffCalculator {

    private BackoffCalculator() {
        // Utility class
    }

    /**
     * Computes the undelayed backoff before the retry that follows attempt {@code attemptNumber}.
     *
     * @param attemptNumber the attempt that just failed (1-based)
     * @param options the retry configuration
     * @return the delay, never more than {@code options.maxDelay()}
     * @throws IllegalArgumentException if attemptNumber is not positive
     */
    public static Duration calculateDelay(int attemptNumber, RetryOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
        if (attemptNumber == 1) {
            return options.baseDelay();
        }

        long maxNanos = options.maxDelay().toNanos();
        double grown = options.baseDelay().toNanos() * Math.pow(options.backoffFactor(), attemptNumber - 1);
        // pow may overflow to infinity for large attempt numbers; the cap handles it
        if (grown >= maxNanos) {
            return options.maxDelay();
        }
        return Duration.ofNanos(Math.round(grown));
    }

    /**
     * Adds a uniformly random amount between zero and {@code delay} to {@code delay}.
     *
     * @return a duration in {@code [delay, 2 * delay]}
     */
    public static Duration addJitter(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isZero() || delay.isNegative()) {
            return delay;
        }
        long nanos = delay.toNanos();
        long jitter = ThreadLocalRandom.current().nextLong(nanos + 1);
        return delay.plusNanos(jitter);
    }
}
