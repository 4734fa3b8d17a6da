package org.javai.remotecall;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * The original exception of the call is kept as the cause.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed: " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
