package org.javai.remotecall.retry;

import org.javai.remotecall.Outcome;
import org.javai.remotecall.RemoteOperation;
import org.javai.remotecall.boundary.Boundary;
import org.javai.remotecall.classify.RetryClassifier;
import org.javai.remotecall.ops.CallReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Executes remote operations with retry, exponential backoff and jitter.
 *
 * <p>Attempts are strictly sequential: attempt n+1 starts only after attempt n has failed
 * and the full backoff delay has elapsed. On final failure the original exception is
 * rethrown unchanged.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .options(RetryOptions.defaults().withMaxAttempts(5))
 *     .reporter(new Log4jCallReporter())
 *     .build();
 *
 * Response response = retrier.execute("NotificationApi.fetch", () -> api.fetch(userId));
 * }</pre>
 */
public final class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    static final String DEFAULT_OPERATION = "remote-call";

    private final RetryPolicy policy;
    private final CallReporter reporter;
    private final Sleeper sleeper;
    private final Executor executor;

    private Retrier(RetryPolicy policy, CallReporter reporter, Sleeper sleeper, Executor executor) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retries {@code operation} with {@link RetryOptions#defaults()}.
     */
    public static <T> T withRetry(RemoteOperation<T> operation) throws Exception {
        return withRetry(operation, RetryOptions.defaults());
    }

    /**
     * Retries {@code operation} with the given options and the default classifier.
     */
    public static <T> T withRetry(RemoteOperation<T> operation, RetryOptions options) throws Exception {
        return builder().options(options).build().execute(operation);
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryOptions options = RetryOptions.defaults();
        private RetryClassifier classifier = RetryClassifier.defaults();
        private RetryPolicy policy;
        private CallReporter reporter = CallReporter.noOp();
        private Sleeper sleeper = Thread::sleep;
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {}

        /**
         * Sets the retry options (optional, defaults to {@link RetryOptions#defaults()}).
         */
        public Builder options(RetryOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        /**
         * Sets the classifier deciding which failures are retried (optional).
         */
        public Builder classifier(RetryClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Replaces the policy built from options and classifier.
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(CallReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the executor that runs asynchronous retries (optional, defaults to the common pool).
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Retrier build() {
            RetryPolicy effectivePolicy = policy != null ? policy : RetryPolicy.of(options, classifier);
            return new Retrier(effectivePolicy, reporter, sleeper, executor);
        }
    }

    public <T> T execute(RemoteOperation<T> operation) throws Exception {
        return execute(DEFAULT_OPERATION, operation);
    }

    /**
     * Executes an operation, retrying retryable failures according to the policy.
     *
     * @param operation The operation name for reporting
     * @param work The remote call
     * @return The result of the first successful attempt
     * @throws InterruptedException if the thread is interrupted while waiting between attempts;
     *         the last failure of the call is attached as suppressed
     * @throws Exception the failure of the final attempt, unchanged
     */
    public <T> T execute(String operation, RemoteOperation<T> work) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        int attemptNumber = 1;
        while (true) {
            try {
                return work.call();
            } catch (Exception e) {
                RetryDecision decision = policy.decide(attemptNumber, e);
                int attempts = attemptNumber;

                if (decision instanceof RetryDecision.GiveUp giveUp) {
                    notifyReporter(() -> reporter.reportRetryExhausted(operation, e, attempts, giveUp.reason()));
                    throw e;
                }

                Duration delay = ((RetryDecision.Retry) decision).delay();
                notifyReporter(() -> reporter.reportRetryAttempt(operation, e, attempts, delay));
                sleep(delay, e);
                attemptNumber++;
            }
        }
    }

    /**
     * Executes the operation and translates a final checked failure into {@link Outcome.Fail}.
     *
     * @param operation The operation name for reporting
     * @param boundary The boundary that classifies and reports the final failure
     * @param work The remote call
     */
    public <T> Outcome<T> attempt(String operation, Boundary boundary, RemoteOperation<T> work) {
        return boundary.call(operation, () -> execute(operation, work));
    }

    /**
     * Executes an asynchronous operation with retry.
     *
     * <p>Retries are scheduled on the configured executor after the backoff delay; no thread
     * is blocked while waiting. Cancelling the returned future stops further attempts.
     *
     * @param operation The operation name for reporting
     * @param work Starts one attempt of the remote call
     * @return A future completed with the first successful result, or exceptionally
     *         with the original failure of the final attempt
     */
    public <T> CompletableFuture<T> executeAsync(String operation, Supplier<? extends CompletionStage<T>> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(operation, work, 1, result);
        return result;
    }

    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> work) {
        return executeAsync(DEFAULT_OPERATION, work);
    }

    private <T> void attemptAsync(
            String operation,
            Supplier<? extends CompletionStage<T>> work,
            int attemptNumber,
            CompletableFuture<T> result
    ) {
        if (result.isDone()) {
            // Cancelled by the caller
            return;
        }

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(work.get(), "work returned null");
        } catch (Throwable t) {
            stage = CompletableFuture.failedFuture(t);
        }

        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            if (result.isDone()) {
                return;
            }
            Throwable cause = unwrap(error);
            try {
                scheduleNext(operation, work, attemptNumber, result, cause);
            } catch (Throwable t) {
                // The future must complete even when the policy or the executor fails
                if (t != cause) {
                    t.addSuppressed(cause);
                }
                result.completeExceptionally(t);
            }
        });
    }

    private <T> void scheduleNext(
            String operation,
            Supplier<? extends CompletionStage<T>> work,
            int attemptNumber,
            CompletableFuture<T> result,
            Throwable cause
    ) {
        RetryDecision decision = policy.decide(attemptNumber, cause);
        if (decision instanceof RetryDecision.GiveUp giveUp) {
            notifyReporter(() -> reporter.reportRetryExhausted(operation, cause, attemptNumber, giveUp.reason()));
            result.completeExceptionally(cause);
            return;
        }

        Duration delay = ((RetryDecision.Retry) decision).delay();
        notifyReporter(() -> reporter.reportRetryAttempt(operation, cause, attemptNumber, delay));
        Executor delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor);
        delayed.execute(() -> attemptAsync(operation, work, attemptNumber + 1, result));
    }

    private void sleep(Duration duration, Exception lastFailure) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            if (Thread.interrupted()) {
                InterruptedException e = new InterruptedException("interrupted before retry");
                e.addSuppressed(lastFailure);
                throw e;
            }
            return;
        }
        try {
            // Round up so that the full computed delay elapses
            sleeper.sleep((duration.toNanos() + 999_999) / 1_000_000);
        } catch (InterruptedException e) {
            e.addSuppressed(lastFailure);
            throw e;
        }
    }

    // A failing reporter is logged and never replaces the outcome of the call
    private void notifyReporter(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.warn("CallReporter failed while reporting a retry event", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
