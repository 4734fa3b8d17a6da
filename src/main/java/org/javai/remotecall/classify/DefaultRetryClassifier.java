package org.javai.remotecall.classify;

import org.javai.remotecall.NetworkError;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures of remote calls as transient or permanent.
 *
 * <p>Rules are applied in order, first match wins:
 * <ol>
 *   <li>an explicit retry verdict on a {@link NetworkError} is returned verbatim</li>
 *   <li>an HTTP-like status is retryable only for 408, 429, 500, 502, 503 and 504</li>
 *   <li>transport failures (connection refused, socket errors, timeouts) are retryable,
 *       including errors whose message reports a failed fetch or a timeout</li>
 *   <li>everything else is not retryable</li>
 * </ol>
 *
 * <p>Cancellation ({@link InterruptedException}, {@link CancellationException}) is
 * never retryable: a cancelled call ends the retry loop.
 */
public class DefaultRetryClassifier implements RetryClassifier {

    static final DefaultRetryClassifier INSTANCE = new DefaultRetryClassifier();

    /**
     * Status codes that indicate a temporary condition on the server side.
     */
    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private static final String[] TRANSIENT_MESSAGE_MARKERS = {
            "fetch failed", "connection refused", "timeout", "timed out"
    };

    /**
     * Classifies with the default rules.
     */
    public static boolean isRetryableError(Throwable error) {
        return INSTANCE.isRetryable(error);
    }

    @Override
    public boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        Throwable t = unwrap(error);

        if (t instanceof InterruptedException || t instanceof CancellationException) {
            return false;
        }

        if (t instanceof NetworkError networkError) {
            if (networkError.retryable().isPresent()) {
                return networkError.retryable().get();
            }
            if (networkError.status().isPresent()) {
                return RETRYABLE_STATUSES.contains(networkError.status().getAsInt());
            }
            if (networkError.isNetworkError()) {
                return true;
            }
        }

        if (isTransportFailure(t)) {
            return true;
        }

        return hasTransientMessage(t);
    }

    protected boolean isTransportFailure(Throwable t) {
        // SocketException covers connection resets; ConnectException and NoRouteToHost extend it
        return t instanceof SocketException
                || t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof TimeoutException;
    }

    private static boolean hasTransientMessage(Throwable t) {
        String message = t.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : TRANSIENT_MESSAGE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
