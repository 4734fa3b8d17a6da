package org.javai.remotecall.circuit;

import org.javai.remotecall.RemoteOperation;
import org.javai.remotecall.ops.CallReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guards a single remote dependency, refusing calls while it appears to be down.
 *
 * <p>One instance is created per logical dependency and lives as long as the client that owns it.
 * All state transitions are applied under one lock per instance, so the breaker may be shared
 * by any number of concurrent callers of the same dependency.
 *
 * <p>While HALF_OPEN exactly one trial call is in flight at a time; concurrent callers are
 * rejected with {@link CircuitOpenException} until the trial resolves. A call that completes
 * after the breaker has since changed state (for example, a slow CLOSED call finishing after
 * another failure opened the circuit) does not affect the counters.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofSeconds(30), 2);
 *
 * try {
 *     List<Notification> notifications = breaker.execute(() -> api.fetchNotifications());
 * } catch (CircuitOpenException e) {
 *     // show "service unavailable" instead of a generic failure
 * }
 * }</pre>
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);
    private static final String DEFAULT_NAME = "default";

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CallReporter reporter;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;
    private long generation;

    /**
     * Creates a breaker with the given thresholds.
     *
     * @param failureThreshold consecutive failures that open the circuit
     * @param resetTimeout how long the circuit stays open before a trial call
     * @param successThreshold consecutive trial successes that close the circuit
     */
    public CircuitBreaker(int failureThreshold, Duration resetTimeout, int successThreshold) {
        this(DEFAULT_NAME, new CircuitBreakerConfig(failureThreshold, resetTimeout, successThreshold),
                Clock.systemUTC(), CallReporter.noOp());
    }

    private CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, CallReporter reporter) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Creates a builder for a breaker protecting the named dependency.
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private CircuitBreakerConfig config = CircuitBreakerConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private CallReporter reporter = CallReporter.noOp();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder config(CircuitBreakerConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the clock used to measure the reset timeout (optional, defaults to UTC system clock).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the reporter for state transitions and rejections (optional, defaults to no-op).
         */
        public Builder reporter(CallReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(name, config, clock, reporter);
        }
    }

    /**
     * Invokes the operation unless the circuit is open.
     *
     * @return the result of the operation
     * @throws CircuitOpenException if the call was rejected without invoking the operation
     * @throws Exception the failure of the operation, unchanged
     */
    public <T> T execute(RemoteOperation<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        Permit permit = acquire();
        T result;
        try {
            result = operation.call();
        } catch (Throwable t) {
            onFailure(permit);
            throw t;
        }
        onSuccess(permit);
        return result;
    }

    /**
     * Asynchronous form of {@link #execute(RemoteOperation)}.
     *
     * <p>A rejected call yields a future failed with {@link CircuitOpenException}; the
     * supplier is not invoked.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        Permit permit;
        try {
            permit = acquire();
        } catch (CircuitOpenException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(operation.get(), "operation returned null");
        } catch (RuntimeException e) {
            onFailure(permit);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                onSuccess(permit);
                result.complete(value);
            } else {
                onFailure(permit);
                result.completeExceptionally(unwrap(error));
            }
        });
        return result;
    }

    /**
     * Current state. Never causes a transition: an OPEN circuit whose reset timeout has
     * elapsed still reports OPEN until the next call.
     */
    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the circuit CLOSED with all counters zeroed, regardless of the current state.
     */
    public void reset() {
        List<Runnable> events = new ArrayList<>(1);
        lock.lock();
        try {
            transitionTo(CircuitState.CLOSED, events);
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public int failureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public int successCount() {
        lock.lock();
        try {
            return successCount;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> lastFailureTime() {
        lock.lock();
        try {
            return Optional.ofNullable(lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    private Permit acquire() throws CircuitOpenException {
        List<Runnable> events = new ArrayList<>(2);
        Duration rejectedFor = null;
        Permit permit = null;
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                Duration elapsed = Duration.between(lastFailureTime, clock.instant());
                if (elapsed.compareTo(config.resetTimeout()) < 0) {
                    rejectedFor = config.resetTimeout().minus(elapsed);
                } else {
                    transitionTo(CircuitState.HALF_OPEN, events);
                    failureCount = 0;
                    successCount = 0;
                }
            }

            if (rejectedFor == null && state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    rejectedFor = Duration.ZERO;
                } else {
                    trialInFlight = true;
                }
            }
            if (rejectedFor == null) {
                permit = new Permit(generation);
            }
        } finally {
            lock.unlock();
        }

        if (rejectedFor != null) {
            Duration remaining = rejectedFor;
            events.add(() -> reporter.reportCallRejected(name, remaining));
            publish(events);
            throw new CircuitOpenException(name, remaining);
        }
        publish(events);
        return permit;
    }

    private void onSuccess(Permit permit) {
        List<Runnable> events = new ArrayList<>(1);
        lock.lock();
        try {
            if (permit.generation() != generation) {
                return;
            }
            if (state == CircuitState.CLOSED) {
                failureCount = 0;
            } else if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
                successCount++;
                if (successCount >= config.successThreshold()) {
                    transitionTo(CircuitState.CLOSED, events);
                    failureCount = 0;
                    successCount = 0;
                }
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    private void onFailure(Permit permit) {
        List<Runnable> events = new ArrayList<>(1);
        lock.lock();
        try {
            if (permit.generation() != generation) {
                return;
            }
            if (state == CircuitState.CLOSED) {
                failureCount++;
                lastFailureTime = clock.instant();
                if (failureCount >= config.failureThreshold()) {
                    transitionTo(CircuitState.OPEN, events);
                }
            } else if (state == CircuitState.HALF_OPEN) {
                lastFailureTime = clock.instant();
                transitionTo(CircuitState.OPEN, events);
                failureCount = 0;
                successCount = 0;
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    // Caller holds the lock; the transition is reported by publish once it is released
    private void transitionTo(CircuitState next, List<Runnable> events) {
        CircuitState previous = state;
        state = next;
        trialInFlight = false;
        generation++;
        if (previous != next) {
            events.add(() -> reporter.reportStateTransition(name, previous, next));
        }
    }

    // Reporter failures never change the result of the call being reported
    private void publish(List<Runnable> events) {
        for (Runnable event : events) {
            try {
                event.run();
            } catch (RuntimeException e) {
                log.warn("CallReporter failed for circuit breaker [{}]", name, e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Admission ticket tying a call's outcome to the state it was admitted under.
     */
    private record Permit(long generation) {}

    @Override
    public String toString() {
        return "CircuitBreaker[" + name + ", " + getState() + "]";
    }
}
