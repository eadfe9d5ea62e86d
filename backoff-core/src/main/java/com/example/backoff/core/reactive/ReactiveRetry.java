package com.example.backoff.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.backoff.core.Backoff;
import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.DelayAdjuster;
import com.example.backoff.core.RetryCancelledException;
import com.example.backoff.core.RetryListener;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.Retry.RetrySignal;

/**
 * Retries a reactive operation, waiting between attempts without blocking a thread.
 *
 * <p>Same loop as {@link com.example.backoff.core.blocking.BlockingRetry}: an accepted error asks
 * the backoff for a delay, notifies the listener, waits on the {@link ReactiveSleeper} and
 * resubscribes to a fresh publisher from the operation. Attempts never overlap.
 *
 * <p>An optional cancellation signal is honoured only while waiting between attempts, never while
 * an attempt is running. If it fires before or during the wait, the returned {@link Mono} fails
 * with {@link RetryCancelledException} carrying the last error; when the wait and the signal
 * complete together, cancellation wins.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * final Mono<String> content =
 *     ReactiveRetry.of(() -> client.get("/status"), new ExponentialBuilder())
 *         .when(e -> e instanceof TimeoutException)
 *         .notify((e, delay) -> LOGGER.log(DEBUG, "retrying in {0}", delay))
 *         .execute();
 * }</pre>
 *
 * <h2>Cancellation</h2>
 *
 * <pre>{@code
 * final var shutdown = Sinks.empty();
 *
 * ReactiveRetry.of(() -> publisher.send(event), new ConstantBuilder().withoutMaxTimes())
 *     .cancelOn(shutdown.asMono())
 *     .execute()
 *     .subscribe();
 *
 * shutdown.tryEmitEmpty(); // stops at the next wait
 * }</pre>
 *
 * @param <T> result type
 * @see ReactiveRetryWithContext
 */
public final class ReactiveRetry<T> {

  private static final System.Logger LOGGER = System.getLogger(ReactiveRetry.class.getName());

  private final Supplier<? extends Publisher<? extends T>> operation;
  private final BackoffBuilder backoff;
  private Predicate<? super Throwable> retryable = e -> true;
  private RetryListener listener = RetryListener.noOp();
  private DelayAdjuster adjuster = DelayAdjuster.identity();
  private ReactiveSleeper sleeper = ReactiveSleeper.defaultSleeper();
  private Publisher<?> cancellation;

  private ReactiveRetry(
      final Supplier<? extends Publisher<? extends T>> operation, final BackoffBuilder backoff) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  /**
   * Creates a retry for the given operation and backoff.
   *
   * <p>The supplier is called once per attempt; each call must return a new publisher for that
   * attempt. A supplier that throws counts as a failed attempt.
   *
   * @param operation supplier of one attempt
   * @param backoff builder producing a fresh backoff for each subscription
   * @param <T> result type
   * @return new retry with default settings
   */
  public static <T> ReactiveRetry<T> of(
      final Supplier<? extends Publisher<? extends T>> operation, final BackoffBuilder backoff) {
    return new ReactiveRetry<>(operation, backoff);
  }

  /**
   * Sets the predicate deciding whether an error is retried.
   *
   * <p>Default: every error is retried.
   *
   * @param retryable predicate returning true for retryable errors
   * @return this retry
   */
  public ReactiveRetry<T> when(final Predicate<? super Throwable> retryable) {
    this.retryable = Objects.requireNonNull(retryable, "retryable");
    return this;
  }

  /**
   * Sets the listener notified before each wait.
   *
   * <p>Default: {@link RetryListener#noOp()}
   *
   * @param listener retry listener
   * @return this retry
   */
  public ReactiveRetry<T> notify(final RetryListener listener) {
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
  public ReactiveRetry<T> adjust(final DelayAdjuster adjuster) {
    this.adjuster = Objects.requireNonNull(adjuster, "adjuster");
    return this;
  }

  /**
   * Sets the sleeper used between attempts.
   *
   * <p>Default: {@link ReactiveSleeper#defaultSleeper()}
   *
   * @param sleeper reactive sleeper
   * @return this retry
   */
  public ReactiveRetry<T> sleeper(final ReactiveSleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    return this;
  }

  /**
   * Stops retrying once {@code signal} emits, completes or fails.
   *
   * @param signal cancellation signal
   * @return this retry
   */
  public ReactiveRetry<T> cancelOn(final Publisher<?> signal) {
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
  public ReactiveRetry<T> cancelOn(final CompletionStage<?> stage) {
    Objects.requireNonNull(stage, "stage");
    return cancelOn(CancellationWatch.signalOf(stage));
  }

  /**
   * Returns a lazy {@link Mono} running the retry loop on every subscription.
   *
   * <p>The Mono emits the first successful result (or completes empty if the successful attempt
   * was empty), fails with the last operation error if the error is rejected or the backoff is
   * exhausted, or fails with {@link RetryCancelledException} when cancelled.
   *
   * @return retrying Mono
   */
  public Mono<T> execute() {
    return Mono.using(
        () -> CancellationWatch.watch(cancellation),
        watch -> {
          final var delays = backoff.build();
          return Mono.defer(() -> Mono.<T>from(operation.get()))
              .retryWhen(
                  Retry.from(
                      signals ->
                          signals.concatMap(signal -> onFailure(signal.copy(), delays, watch))));
        },
        CancellationWatch::dispose);
  }

  /**
   * Subscribes and exposes the outcome as a {@link CompletableFuture}.
   *
   * @return future completed with the result, or exceptionally with the final error
   */
  public CompletableFuture<T> toFuture() {
    return execute().toFuture();
  }

  private Mono<Long> onFailure(
      final RetrySignal signal, final Backoff delays, final CancellationWatch watch) {
    final var error = signal.failure();
    final var attempt = signal.totalRetries() + 1;

    if (!retryable.test(error)) {
      LOGGER.log(DEBUG, "Attempt {0} failed with non-retryable error", attempt);
      return Mono.error(error);
    }

    final var delay = adjuster.adjust(error, delays.next());
    if (delay.isEmpty()) {
      LOGGER.log(WARNING, "All {0} attempts failed", attempt);
      return Mono.error(error);
    }

    if (watch.isCancelled()) return cancelled(error, attempt);

    notifyListener(error, delay.get());
    LOGGER.log(DEBUG, "Attempt {0} failed, retrying in {1}", attempt, delay.get());

    // cancellation is subscribed first so an already-fired signal wins the race
    return Mono.firstWithSignal(
        watch.whenCancelled().then(Mono.defer(() -> cancelled(error, attempt))),
        sleeper
            .sleep(delay.get())
            .then(
                Mono.defer(
                    () -> watch.isCancelled() ? cancelled(error, attempt) : Mono.just(attempt))));
  }

  private static Mono<Long> cancelled(final Throwable error, final long attempt) {
    LOGGER.log(DEBUG, "Retry cancelled after attempt {0}", attempt);
    return Mono.error(new RetryCancelledException(error));
  }

  private void notifyListener(final Throwable error, final Duration delay) {
    try {
      listener.onRetry(error, delay);
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Retry listener failed, continuing", e);
    }
  }
}
