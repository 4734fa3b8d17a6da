package org.javai.remotecall.classify;

/**
 * Decides whether a failed remote call is worth retrying.
 * Implementations must be pure and must not throw.
 */
@FunctionalInterface
public interface RetryClassifier {

    /**
     * @param error The failure raised by the call (may be null)
     * @return true if the failure is transient and a retry may succeed
     */
    boolean isRetryable(Throwable error);

    /**
     * The default classifier, see {@link DefaultRetryClassifier}.
     */
    static RetryClassifier defaults() {
        return DefaultRetryClassifier.INSTANCE;
    }
}
