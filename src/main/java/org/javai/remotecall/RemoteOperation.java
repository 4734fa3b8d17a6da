package org.javai.remotecall;

/**
 * A fallible, possibly slow call to a remote dependency.
 * Used by {@link org.javai.remotecall.retry.Retrier} and
 * {@link org.javai.remotecall.circuit.CircuitBreaker}, which both accept this shape
 * and can therefore be nested in either order.
 *
 * @param <T> The type of value returned by the call
 */
@FunctionalInterface
public interface RemoteOperation<T> {

    T call() throws Exception;
}
