package org.javai.remotecall.config;

import org.javai.remotecall.circuit.CircuitBreakerConfig;
import org.javai.remotecall.retry.RetryOptions;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Resolves retry and circuit breaker configuration from system properties or environment variables.
 *
 * <p>Each key is looked up first as a system property, then as an environment variable
 * whose name is the key upper-cased with dots and dashes turned into underscores
 * ({@code remotecall.retry.max-attempts} → {@code REMOTECALL_RETRY_MAX_ATTEMPTS}).
 * Unset keys fall back to the library defaults.
 *
 * <table>
 *   <caption>Recognized keys</caption>
 *   <tr><td>{@value #MAX_ATTEMPTS}</td><td>3</td></tr>
 *   <tr><td>{@value #BASE_DELAY_MS}</td><td>1000</td></tr>
 *   <tr><td>{@value #MAX_DELAY_MS}</td><td>30000</td></tr>
 *   <tr><td>{@value #BACKOFF_FACTOR}</td><td>2</td></tr>
 *   <tr><td>{@value #JITTER}</td><td>true</td></tr>
 *   <tr><td>{@value #FAILURE_THRESHOLD}</td><td>5</td></tr>
 *   <tr><td>{@value #RESET_TIMEOUT_MS}</td><td>60000</td></tr>
 *   <tr><td>{@value #SUCCESS_THRESHOLD}</td><td>3</td></tr>
 * </table>
 */
public final class RemoteCallSettings {

    public static final String MAX_ATTEMPTS = "remotecall.retry.max-attempts";
    public static final String BASE_DELAY_MS = "remotecall.retry.base-delay-ms";
    public static final String MAX_DELAY_MS = "remotecall.retry.max-delay-ms";
    public static final String BACKOFF_FACTOR = "remotecall.retry.backoff-factor";
    public static final String JITTER = "remotecall.retry.jitter";
    public static final String FAILURE_THRESHOLD = "remotecall.circuit.failure-threshold";
    public static final String RESET_TIMEOUT_MS = "remotecall.circuit.reset-timeout-ms";
    public static final String SUCCESS_THRESHOLD = "remotecall.circuit.success-threshold";

    private final UnaryOperator<String> systemProperties;
    private final UnaryOperator<String> environment;

    RemoteCallSettings(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * Settings backed by {@link System#getProperty(String)} and {@link System#getenv(String)}.
     */
    public static RemoteCallSettings fromEnvironment() {
        return new RemoteCallSettings(System::getProperty, System::getenv);
    }

    public RetryOptions retryOptions() {
        RetryOptions defaults = RetryOptions.defaults();
        return build(() -> new RetryOptions(
                resolve(MAX_ATTEMPTS, Integer::parseInt, defaults.maxAttempts()),
                resolve(BASE_DELAY_MS, RemoteCallSettings::millis, defaults.baseDelay()),
                resolve(MAX_DELAY_MS, RemoteCallSettings::millis, defaults.maxDelay()),
                resolve(BACKOFF_FACTOR, Double::parseDouble, defaults.backoffFactor()),
                resolve(JITTER, RemoteCallSettings::bool, defaults.jitter())));
    }

    public CircuitBreakerConfig circuitBreakerConfig() {
        CircuitBreakerConfig defaults = CircuitBreakerConfig.defaults();
        return build(() -> new CircuitBreakerConfig(
                resolve(FAILURE_THRESHOLD, Integer::parseInt, defaults.failureThreshold()),
                resolve(RESET_TIMEOUT_MS, RemoteCallSettings::millis, defaults.resetTimeout()),
                resolve(SUCCESS_THRESHOLD, Integer::parseInt, defaults.successThreshold())));
    }

    /**
     * Resolves a raw value, system property first.
     *
     * @return the value, or null if neither source sets it
     */
    String lookup(String key) {
        String value = systemProperties.apply(key);
        if (value == null || value.isBlank()) {
            value = environment.apply(environmentName(key));
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private <T> T resolve(String key, Function<String, T> parser, T defaultValue) {
        String raw = lookup(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Invalid value for '" + key + "' (or " + environmentName(key) + "): " + raw, e);
        }
    }

    private static <T> T build(Supplier<T> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Inconsistent remote call configuration: " + e.getMessage(), e);
        }
    }

    private static Duration millis(String raw) {
        return Duration.ofMillis(Long.parseLong(raw));
    }

    private static Boolean bool(String raw) {
        if (raw.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (raw.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("expected true or false");
    }
}
