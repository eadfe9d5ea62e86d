package com.example.backoff.core.reactive;

import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.DelayAdjuster;
import com.example.backoff.core.RetryListener;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

/**
 * Reactive retry whose operation receives a caller-owned, mutable context on every attempt.
 *
 * <p>The same context instance is handed to every attempt, in order, and is never copied. Because
 * attempts never overlap, the operation may mutate the context without synchronization. Retry and
 * cancellation semantics are those of {@link ReactiveRetry}.
 *
 * <h3>Example</h3>
 *
 * <pre>{@code
 * final var progress = new UploadProgress();
 *
 * ReactiveRetryWithContext.of(
 *         (UploadProgress p) -> storage.upload(file, p.offset()).doOnNext(p::advance).then(),
 *         new ExponentialBuilder())
 *     .context(progress)
 *     .execute()
 *     .block();
 * }</pre>
 *
 * @param <T> result type
 * @param <C> context type
 */
public final class ReactiveRetryWithContext<T, C> {

  private final Function<? super C, ? extends Publisher<? extends T>> operation;
  private final BackoffBuilder backoff;
  private C context;
  private Predicate<? super Throwable> retryable = e -> true;
  private RetryListener listener = RetryListener.noOp();
  private DelayAdjuster adjuster = DelayAdjuster.identity();
  private ReactiveSleeper sleeper = ReactiveSleeper.defaultSleeper();
  private Publisher<?> cancellation;

  private ReactiveRetryWithContext(
      final Function<? super C, ? extends Publisher<? extends T>> operation,
      final BackoffBuilder backoff) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  /**
   * Creates a context-carrying retry for the given operation and backoff.
   *
   * @param operation function producing one attempt from the context
   * @param backoff builder producing a fresh backoff for each subscription
   * @param <T> result type
   * @param <C> context type
   * @return new retry; a context must be set before {@link #execute()}
   */
  public static <T, C> ReactiveRetryWithContext<T, C> of(
      final Function<? super C, ? extends Publisher<? extends T>> operation,
      final BackoffBuilder backoff) {
    return new ReactiveRetryWithContext<>(operation, backoff);
  }

  /**
   * Sets the context passed to every attempt (required).
   *
   * @param context mutable context
   * @return this retry
   */
  public ReactiveRetryWithContext<T, C> context(final C context) {
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
   */
  public ReactiveRetryWithContext<T, C> when(final Predicate<? super Throwable> retryable) {
    this.retryable = Objects.requireNonNull(retryable, "retryable");
    return this;
  }

  /**
   * Sets the listener notified before each wait.
   *
   * @param listener retry listener
   * @return this retry
   */
  public ReactiveRetryWithContext<T, C> notify(final RetryListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
    return this;
  }

  /**
   * Sets the adjuster applied to every delay proposed by the backoff.
   *
   * @param adjuster delay adjuster
   * @return this retry
   */
  public ReactiveRetryWithContext<T, C> adjust(final DelayAdjuster adjuster) {
    this.adjuster = Objects.requireNonNull(adjuster, "adjuster");
    return this;
  }

  /**
   * Sets the sleeper used between attempts.
   *
   * @param sleeper reactive sleeper
   * @return this retry
   */
  public ReactiveRetryWithContext<T, C> sleeper(final ReactiveSleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    return this;
  }

  /**
   * Stops retrying once {@code signal} emits, completes or fails.
   *
   * @param signal cancellation signal
   * @return this retry
   */
  public ReactiveRetryWithContext<T, C> cancelOn(final Publisher<?> signal) {
    this.cancellation = Objects.requireNonNull(signal, "signal");
    return this;
  }

  /**
   * Stops retrying once {@code stage} completes, normally or exceptionally.
   *
   * <p>The stage is only observed, never cancelled. One completion callback is registered per
   * call of this method and is shared by every subscription of {@link #execute()}.
   *
   * @param stage cancellation signal
   * @return this retry
   */
  public ReactiveRetryWithContext<T, C> cancelOn(final CompletionStage<?> stage) {
    Objects.requireNonNull(stage, "stage");
    return cancelOn(CancellationWatch.signalOf(stage));
  }

  /**
   * Returns a lazy {@link Mono} running the retry loop with the context on every subscription.
   *
   * @return retrying Mono
   * @throws IllegalStateException if no context has been set
   */
  public Mono<T> execute() {
    if (context == null) throw new IllegalStateException("context is required");
    final var ctx = context;
    final var retry =
        ReactiveRetry.<T>of(() -> operation.apply(ctx), backoff)
            .when(retryable)
            .notify(listener)
            .adjust(adjuster)
            .sleeper(sleeper);
    if (cancellation != null) retry.cancelOn(cancellation);
    return retry.execute();
  }

  /**
   * Subscribes and exposes the outcome as a {@link CompletableFuture}.
   *
   * @return future completed with the result, or exceptionally with the final error
   */
  public CompletableFuture<T> toFuture() {
    return execute().toFuture();
  }
}
