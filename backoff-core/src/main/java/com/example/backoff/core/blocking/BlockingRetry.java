package com.example.backoff.core.blocking;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.DelayAdjuster;
import com.example.backoff.core.RetryListener;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retries a blocking operation on the calling thread, sleeping between attempts as dictated by a
 * backoff policy.
 *
 * <p>The loop runs as follows:
 *
 * <ol>
 *   <li>Invoke the operation. A returned value is returned immediately.
 *   <li>If it throws, test the error against {@link #when(Predicate)}. A rejected error is rethrown
 *       without consulting the backoff.
 *   <li>Ask the backoff (through the {@link #adjust(DelayAdjuster) adjuster}) for the next delay.
 *       If there is none, the error is rethrown.
 *   <li>Notify the {@link #notify(RetryListener) listener}, sleep, and go back to 1.
 * </ol>
 *
 * <p>Errors are rethrown as the same instance the operation threw. {@link Error}s are never caught.
 * Each {@link #call()} builds a fresh backoff, so a configured instance can be reused.
 *
 * <h3>Basic Usage</h3>
 *
 * <pre>{@code
 * final var content = BlockingRetry.of(() -> fetch(url), new ExponentialBuilder())
 *     .when(e -> e instanceof IOException)
 *     .notify((e, delay) -> LOGGER.log(WARNING, "retrying in {0}", delay))
 *     .call();
 * }</pre>
 *
 * <h3>Fixed Delay Example</h3>
 *
 * <pre>{@code
 * final var rows = BlockingRetry.of(
 *         () -> repository.findPending(),
 *         new ConstantBuilder().withDelay(Duration.ofMillis(200)).withMaxTimes(5))
 *     .call();
 * }</pre>
 *
 * @param <T> result type
 * @param <E> exception type declared by the operation
 * @see BlockingRetryWithContext
 */
public final class BlockingRetry<T, E extends Exception> {

  private static final System.Logger LOGGER = System.getLogger(BlockingRetry.class.getName());

  private final RetryableCallable<T, E> operation;
  private final BackoffBuilder backoff;
  private Predicate<? super Throwable> retryable = e -> true;
  private RetryListener listener = RetryListener.noOp();
  private DelayAdjuster adjuster = DelayAdjuster.identity();
  private Sleeper sleeper = Sleeper.defaultSleeper();

  private BlockingRetry(final RetryableCallable<T, E> operation, final BackoffBuilder backoff) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  /**
   * Creates a retry for the given operation and backoff.
   *
   * @param operation operation to retry
   * @param backoff builder producing a fresh backoff for each call
   * @param <T> result type
   * @param <E> exception type declared by the operation
   * @return new retry with default settings
   */
  public static <T, E extends Exception> BlockingRetry<T, E> of(
      final RetryableCallable<T, E> operation, final BackoffBuilder backoff) {
    return new BlockingRetry<>(operation, backoff);
  }

  /**
   * Sets the predicate deciding whether an error is retried.
   *
   * <p>Default: every exception is retried.
   *
   * @param retryable predicate returning true for retryable errors
   * @return this retry
   */
  public BlockingRetry<T, E> when(final Predicate<? super Throwable> retryable) {
    this.retryable = Objects.requireNonNull(retryable, "retryable");
    return this;
  }

  /**
   * Sets the listener notified before each sleep.
   *
   * <p>Default: {@link RetryListener#noOp()}
   *
   * @param listener retry listener
   * @return this retry
   */
  public BlockingRetry<T, E> notify(final RetryListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
    return this;
  }

  /**
   * Sets the adjuster applied to every delay proposed by the backoff.
   *
   * <p>Default: {@link DelayAdjuster#identity()}
   *
   * @param adjuster delay adjuster
   * @return this retry
   */
  public BlockingRetry<T, E> adjust(final DelayAdjuster adjuster) {
    this.adjuster = Objects.requireNonNull(adjuster, "adjuster");
    return this;
  }

  /**
   * Sets the sleeper used between attempts.
   *
   * <p>Default: {@link Sleeper#defaultSleeper()}
   *
   * @param sleeper sleeper
   * @return this retry
   */
  public BlockingRetry<T, E> sleeper(final Sleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    return this;
  }

  /**
   * Runs the operation until it succeeds, its error is rejected, or the backoff is exhausted.
   *
   * <p>If the thread is interrupted while sleeping, the interrupt flag is restored and the last
   * error is thrown.
   *
   * @return the operation result
   * @throws E the last error of the operation
   */
  public T call() throws E {
    final var delays = backoff.build();
    var attempt = 0;

    while (true) {
      attempt++;
      try {
        return operation.call();
      } catch (final Exception ex) {
        @SuppressWarnings("unchecked")
        final E error = (E) ex;

        if (ex instanceof InterruptedException) {
          LOGGER.log(WARNING, "Attempt {0} was interrupted, not retrying", attempt);
          Thread.currentThread().interrupt();
          throw error;
        }

        if (!retryable.test(error)) {
          LOGGER.log(DEBUG, "Attempt {0} failed with non-retryable error", attempt);
          throw error;
        }

        final var delay = adjuster.adjust(error, delays.next());
        if (delay.isEmpty()) {
          LOGGER.log(WARNING, "All {0} attempts failed", attempt);
          throw error;
        }

        notifyListener(error, delay.get());
        LOGGER.log(DEBUG, "Attempt {0} failed, retrying in {1}", attempt, delay.get());

        try {
          sleeper.sleep(delay.get());
        } catch (final InterruptedException ie) {
          LOGGER.log(WARNING, "Interrupted while waiting to retry attempt {0}", attempt + 1);
          Thread.currentThread().interrupt();
          throw error;
        }
      }
    }
  }

  private void notifyListener(final Throwable error, final Duration delay) {
    try {
      listener.onRetry(error, delay);
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Retry listener failed, continuing", e);
    }
  }
}
