package org.javai.remotecall;

import org.javai.remotecall.circuit.CircuitOpenException;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a type of failure.
 *
 * @param namespace The domain or subsystem (e.g., "http", "network", "circuit")
 * @param name The specific failure type within that namespace (e.g., "503", "open")
 */
public record FailureCode(String namespace, String name) {

    public FailureCode {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureCode of(String namespace, String name) {
        return new FailureCode(namespace, name);
    }

    /**
     * Derives a code from the exception that ended a call.
     */
    public static FailureCode forThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        if (t instanceof CircuitOpenException) {
            return of("circuit", "open");
        }
        if (t instanceof NetworkError networkError) {
            if (networkError.status().isPresent()) {
                return of("http", String.valueOf(networkError.status().getAsInt()));
            }
            return of(networkError.isNetworkError() ? "network" : "remote", "error");
        }
        if (t instanceof InterruptedException) {
            return of("call", "interrupted");
        }
        return of("exception", t.getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
