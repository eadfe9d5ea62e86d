package com.example.backoff.core;

import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;

/**
 * Listener notified right before each retry sleep, useful for logging, metrics and debugging.
 *
 * <p>The listener fires once per sleep actually performed. It is never called for the failure that
 * ends the retry loop, whether the loop ends because the error was rejected, the backoff was
 * exhausted or the retry was cancelled.
 *
 * <h3>Logging Example</h3>
 *
 * <pre>{@code
 * final var content = BlockingRetry.of(this::fetch, new ExponentialBuilder())
 *     .notify(RetryListener.logging())
 *     .call();
 * }</pre>
 *
 * <h3>Metrics Example</h3>
 *
 * <pre>{@code
 * final RetryListener listener = (error, delay) ->
 *     metrics.increment("fetch.retries", "error", error.getClass().getSimpleName());
 * }</pre>
 */
@FunctionalInterface
public interface RetryListener {

  /**
   * Returns a listener that does nothing.
   *
   * @return no-op listener
   */
  static RetryListener noOp() {
    return (error, delay) -> {};
  }

  /**
   * Returns a listener that logs every retry at WARNING level.
   *
   * <p>Example output:
   *
   * <pre>
   * WARNING: Retrying in PT0.2S after error: Connection refused
   * </pre>
   *
   * @return logging listener
   */
  static RetryListener logging() {
    final var logger = System.getLogger(RetryListener.class.getName());
    return (error, delay) ->
        logger.log(WARNING, "Retrying in {0} after error: {1}", delay, error.getMessage());
  }

  /**
   * Called before sleeping ahead of the next attempt.
   *
   * @param error the error that triggered the retry
   * @param delay the delay about to be slept
   */
  void onRetry(final Throwable error, final Duration delay);

  /**
   * Returns a listener notifying this listener and then {@code other}.
   *
   * @param other listener to notify second
   * @return combined listener
   */
  default RetryListener andThen(final RetryListener other) {
    return (error, delay) -> {
      this.onRetry(error, delay);
      other.onRetry(error, delay);
    };
  }
}
