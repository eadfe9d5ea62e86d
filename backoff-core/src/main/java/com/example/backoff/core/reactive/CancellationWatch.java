package com.example.backoff.core.reactive;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Latches the first signal of a cancellation publisher for the lifetime of one retry loop.
 *
 * <p>Any element, completion or error of the publisher counts as cancellation.
 */
final class CancellationWatch implements Disposable {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final Sinks.Empty<Void> signal = Sinks.empty();
  private final Disposable subscription;

  private CancellationWatch(final Publisher<?> source) {
    this.subscription =
        source == null
            ? Disposables.disposed()
            : Flux.from(source).take(1).subscribe(v -> fire(), e -> fire(), this::fire);
  }

  static CancellationWatch watch(final Publisher<?> source) {
    return new CancellationWatch(source);
  }

  /**
   * Adapts a stage to a replaying cancellation signal. The stage gets a single callback no matter
   * how many loops watch the result.
   */
  static Mono<Void> signalOf(final CompletionStage<?> stage) {
    final Sinks.Empty<Void> completed = Sinks.empty();
    stage.whenComplete((v, e) -> completed.tryEmitEmpty());
    return completed.asMono();
  }

  boolean isCancelled() {
    return cancelled.get();
  }

  /** Completes when cancellation fires; completes immediately if it already has. */
  Mono<Void> whenCancelled() {
    return signal.asMono();
  }

  private void fire() {
    if (cancelled.compareAndSet(false, true)) signal.tryEmitEmpty();
  }

  @Override
  public void dispose() {
    subscription.dispose();
  }

  @Override
  public boolean isDisposed() {
    return subscription.isDisposed();
  }
}
