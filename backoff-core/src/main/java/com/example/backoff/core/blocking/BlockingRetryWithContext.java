package com.example.backoff.core.blocking;

import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.DelayAdjuster;
import com.example.backoff.core.RetryListener;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Blocking retry whose operation receives a caller-owned, mutable context on every attempt.
 *
 * <p>Useful when an attempt must record progress (a cursor, a partially written buffer) that the
 * next attempt resumes from. The same context instance is passed to every attempt, in order, and
 * is never copied. Retry semantics are those of {@link BlockingRetry}.
 *
 * <h3>Resuming a Paged Read</h3>
 *
 * <pre>{@code
 * final var cursor = new Cursor();
 *
 * final var rows = BlockingRetryWithContext.of(
 *         (Cursor c) -> {
 *             while (c.hasMore()) c.advance(client.page(c.position()));
 *             return c.rows();
 *         },
 *         new ExponentialBuilder())
 *     .context(cursor)
 *     .call();
 * }</pre>
 *
 * @param <T> result type
 * @param <C> context type
 * @param <E> exception type declared by the operation
 */
public final class BlockingRetryWithContext<T, C, E extends Exception> {

  private final ContextualCallable<T, C, E> operation;
  private final BackoffBuilder backoff;
  private C context;
  private Predicate<? super Throwable> retryable = e -> true;
  private RetryListener listener = RetryListener.noOp();
  private DelayAdjuster adjuster = DelayAdjuster.identity();
  private Sleeper sleeper = Sleeper.defaultSleeper();

  private BlockingRetryWithContext(
      final ContextualCallable<T, C, E> operation, final BackoffBuilder backoff) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  /**
   * Creates a context-carrying retry for the given operation and backoff.
   *
   * @param operation operation to retry
   * @param backoff builder producing a fresh backoff for each call
   * @param <T> result type
   * @param <C> context type
   * @param <E> exception type declared by the operation
   * @return new retry; a context must be set before {@link #call()}
   */
  public static <T, C, E extends Exception> BlockingRetryWithContext<T, C, E> of(
      final ContextualCallable<T, C, E> operation, final BackoffBuilder backoff) {
    return new BlockingRetryWithContext<>(operation, backoff);
  }

  /**
   * Sets the context passed to every attempt (required).
   *
   * @param context mutable context
   * @return this retry
   */
  public BlockingRetryWithContext<T, C, E> context(final C context) {
    this.context = Objects.requireNonNull(context, "context");
    return this;
  }

  /**
   * Returns the context, as left by the last attempt.
   *
   * @return the context, or null if none was set
   */
  public C context() {
    return context;
  }

  /**
   * Sets the predicate deciding whether an error is retried.
   *
   * @param retryable predicate returning true for retryable errors
   * @return this retry
   * @see BlockingRetry#when(Predicate)
   */
  public BlockingRetryWithContext<T, C, E> when(final Predicate<? super Throwable> retryable) {
    this.retryable = Objects.requireNonNull(retryable, "retryable");
    return this;
  }

  /**
   * Sets the listener notified before each sleep.
   *
   * @param listener retry listener
   * @return this retry
   * @see BlockingRetry#notify(RetryListener)
   */
  public BlockingRetryWithContext<T, C, E> notify(final RetryListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
    return this;
  }

  /**
   * Sets the adjuster applied to every delay proposed by the backoff.
   *
   * @param adjuster delay adjuster
   * @return this retry
   * @see BlockingRetry#adjust(DelayAdjuster)
   */
  public BlockingRetryWithContext<T, C, E> adjust(final DelayAdjuster adjuster) {
    this.adjuster = Objects.requireNonNull(adjuster, "adjuster");
    return this;
  }

  /**
   * Sets the sleeper used between attempts.
   *
   * @param sleeper sleeper
   * @return this retry
   */
  public BlockingRetryWithContext<T, C, E> sleeper(final Sleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    return this;
  }

  /**
   * Runs the operation with the context until it succeeds, its error is rejected, or the backoff is
   * exhausted.
   *
   * @return the operation result
   * @throws E the last error of the operation
   * @throws IllegalStateException if no context has been set
   */
  public T call() throws E {
    if (context == null) throw new IllegalStateException("context is required");
    final var ctx = context;
    return BlockingRetry.<T, E>of(() -> operation.call(ctx), backoff)
        .when(retryable)
        .notify(listener)
        .adjust(adjuster)
        .sleeper(sleeper)
        .call();
  }
}
