package org.javai.remotecall;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A failure raised by, or on behalf of, a remote call.
 *
 * <p>Carries the metadata the retry classifier consults:
 * <ul>
 *   <li>{@code networkError} - true when the failure originated in the transport
 *       rather than in the application</li>
 *   <li>{@code status} - an HTTP-like status code, when one applies</li>
 *   <li>{@code retryable} - an explicit verdict that overrides every heuristic</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * if (response.statusCode() == 429) {
 *     throw NetworkError.of("Rate limited", 429, true);
 * }
 * throw NetworkError.builder("Invalid JSON response")
 *     .status(response.statusCode())
 *     .retryable(false)
 *     .build();
 * }</pre>
 */
public class NetworkError extends Exception {

    private final boolean networkError;
    private final Integer status;
    private final Boolean retryable;

    protected NetworkError(String message, boolean networkError, Integer status, Boolean retryable, Throwable cause) {
        super(Objects.requireNonNull(message, "message must not be null"), cause);
        this.networkError = networkError;
        this.status = status;
        this.retryable = retryable;
    }

    /**
     * Creates a network-originated error without a status that is retryable.
     */
    public static NetworkError of(String message) {
        return new NetworkError(message, true, null, Boolean.TRUE, null);
    }

    /**
     * Creates a retryable network-originated error with the given status.
     */
    public static NetworkError of(String message, Integer status) {
        return new NetworkError(message, true, status, Boolean.TRUE, null);
    }

    /**
     * Creates a network-originated error with an explicit retry verdict.
     *
     * @param message Human-readable cause
     * @param status HTTP-like status code (may be null)
     * @param retryable Whether retrying is worthwhile
     */
    public static NetworkError of(String message, Integer status, boolean retryable) {
        return new NetworkError(message, true, status, retryable, null);
    }

    public static Builder builder(String message) {
        return new Builder(message);
    }

    public boolean isNetworkError() {
        return networkError;
    }

    public OptionalInt status() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    /**
     * The explicit retry verdict, empty when classification is left to heuristics.
     */
    public Optional<Boolean> retryable() {
        return Optional.ofNullable(retryable);
    }

    public static class Builder {
        private final String message;
        private boolean networkError = true;
        private Integer status;
        private Boolean retryable;
        private Throwable cause;

        private Builder(String message) {
            this.message = Objects.requireNonNull(message, "message must not be null");
        }

        public Builder networkError(boolean networkError) {
            this.networkError = networkError;
            return this;
        }

        public Builder status(Integer status) {
            this.status = status;
            return this;
        }

        public Builder retryable(Boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public NetworkError build() {
            return new NetworkError(message, networkError, status, retryable, cause);
        }
    }
}
