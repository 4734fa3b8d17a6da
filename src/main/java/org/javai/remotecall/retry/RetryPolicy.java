package org.javai.remotecall.retry;

import org.javai.remotecall.classify.RetryClassifier;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failure.
 */
public interface RetryPolicy {

    /**
     * The total number of attempts this policy allows, including the first.
     */
    int maxAttempts();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param attemptNumber The attempt that just failed (1-based)
     * @param error The failure that occurred
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(int attemptNumber, Throwable error);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public int maxAttempts() {
                return 1;
            }

            @Override
            public RetryDecision decide(int attemptNumber, Throwable error) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Creates a policy with exponential backoff that retries only what the classifier deems retryable.
     */
    static RetryPolicy of(RetryOptions options, RetryClassifier classifier) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");

        return new RetryPolicy() {
            @Override
            public int maxAttempts() {
                return options.maxAttempts();
            }

            @Override
            public RetryDecision decide(int attemptNumber, Throwable error) {
                if (!classifier.isRetryable(error)) {
                    return RetryDecision.GiveUp.because("failure is not retryable");
                }
                if (attemptNumber >= options.maxAttempts()) {
                    return RetryDecision.GiveUp.because("max attempts reached");
                }
                Duration delay = BackoffCalculator.calculateDelay(attemptNumber, options);
                if (options.jitter()) {
                    delay = BackoffCalculator.addJitter(delay);
                }
                return RetryDecision.Retry.after(delay);
            }
        };
    }
}
