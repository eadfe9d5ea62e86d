package com.example.backoff.core;

/**
 * Signals that a reactive retry loop stopped because its cancellation signal fired while waiting
 * for the next attempt.
 *
 * <p>The cause is the error of the last attempt.
 */
public class RetryCancelledException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for a retry cancelled after the given error.
   *
   * @param lastError the error of the last attempt
   */
  public RetryCancelledException(final Throwable lastError) {
    super("Retry cancelled after error: " + lastError, lastError);
  }
}
