package org.javai.remotecall;

import java.time.Instant;
import java.util.Objects;

/**
 * A classified failure of a remote call, ready for reporting.
 *
 * @param code The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param retryable Whether the classifier judged the failure transient
 * @param operation The call that failed (e.g., "NotificationApi.fetch")
 * @param occurredAt When the failure happened
 * @param exception The original exception (never wrapped)
 */
public record Failure(
        FailureCode code,
        String message,
        boolean retryable,
        String operation,
        Instant occurredAt,
        Throwable exception
) {

    public Failure {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    /**
     * Creates a failure from the exception that ended a call.
     */
    public static Failure of(String operation, Throwable exception, boolean retryable) {
        Objects.requireNonNull(exception, "exception must not be null");
        String message = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
        return new Failure(FailureCode.forThrowable(exception), message, retryable,
                operation, Instant.now(), exception);
    }

    public boolean isCircuitOpen() {
        return code.namespace().equals("circuit");
    }
}
