package com.example.backoff.core.blocking;

/**
 * An operation receiving a caller-owned context on every attempt.
 *
 * @param <T> result type
 * @param <C> context type
 * @param <E> checked exception type
 * @see BlockingRetryWithContext
 */
@FunctionalInterface
public interface ContextualCallable<T, C, E extends Exception> {

  /**
   * Runs one attempt of the operation.
   *
   * @param context the same context instance on every attempt
   * @return result of the attempt
   * @throws E on failure
   */
  T call(final C context) throws E;
}
