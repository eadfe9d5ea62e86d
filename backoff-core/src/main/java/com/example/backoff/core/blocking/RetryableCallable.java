package com.example.backoff.core.blocking;

/**
 * An operation that returns a value or throws.
 *
 * <p>Used as the functional interface for operations retried by {@link BlockingRetry}.
 *
 * <pre>{@code
 * RetryableCallable<String, IOException> fetch = () -> client.get("/status");
 * }</pre>
 *
 * @param <T> result type
 * @param <E> checked exception type
 */
@FunctionalInterface
public interface RetryableCallable<T, E extends Exception> {

  /**
   * Runs one attempt of the operation.
   *
   * @return result of the attempt
   * @throws E on failure
   */
  T call() throws E;
}
