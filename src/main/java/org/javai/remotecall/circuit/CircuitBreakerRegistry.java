package org.javai.remotecall.circuit;

import org.javai.remotecall.ops.CallReporter;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Hands out one {@link CircuitBreaker} per dependency name.
 *
 * <p>Breakers are created lazily on first request and never shared between names.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
 *     .defaults(new CircuitBreakerConfig(3, Duration.ofSeconds(30), 2))
 *     .reporter(new Log4jCallReporter())
 *     .build();
 *
 * registry.breaker("notifications").execute(() -> api.fetchNotifications());
 * Map<String, CircuitState> health = registry.states();
 * }</pre>
 */
public final class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Function<String, CircuitBreakerConfig> configResolver;
    private final Clock clock;
    private final CallReporter reporter;

    private CircuitBreakerRegistry(Function<String, CircuitBreakerConfig> configResolver, Clock clock, CallReporter reporter) {
        this.configResolver = configResolver;
        this.clock = clock;
        this.reporter = reporter;
    }

    /**
     * Creates a registry whose breakers all use {@link CircuitBreakerConfig#defaults()}.
     */
    public static CircuitBreakerRegistry ofDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CircuitBreakerConfig defaults = CircuitBreakerConfig.defaults();
        private final Map<String, CircuitBreakerConfig> overrides = new ConcurrentHashMap<>();
        private Clock clock = Clock.systemUTC();
        private CallReporter reporter = CallReporter.noOp();

        private Builder() {}

        /**
         * Sets the configuration for dependencies without an override.
         */
        public Builder defaults(CircuitBreakerConfig defaults) {
            this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
            return this;
        }

        /**
         * Sets the configuration for one dependency.
         */
        public Builder override(String name, CircuitBreakerConfig config) {
            overrides.put(Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(config, "config must not be null"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder reporter(CallReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public CircuitBreakerRegistry build() {
            Map<String, CircuitBreakerConfig> configs = Map.copyOf(overrides);
            CircuitBreakerConfig fallback = defaults;
            return new CircuitBreakerRegistry(name -> configs.getOrDefault(name, fallback), clock, reporter);
        }
    }

    /**
     * Returns the breaker for the dependency, creating it on first use.
     */
    public CircuitBreaker breaker(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return breakers.computeIfAbsent(name, n -> CircuitBreaker.builder(n)
                .config(configResolver.apply(n))
                .clock(clock)
                .reporter(reporter)
                .build());
    }

    /**
     * Returns the breaker for the dependency if one has been created.
     */
    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * Snapshot of every known breaker's state, ordered by name.
     */
    public Map<String, CircuitState> states() {
        Map<String, CircuitState> snapshot = new LinkedHashMap<>();
        breakers.keySet().stream()
                .sorted()
                .forEach(name -> snapshot.put(name, breakers.get(name).getState()));
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Forces every known breaker CLOSED.
     */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public int size() {
        return breakers.size();
    }
}
