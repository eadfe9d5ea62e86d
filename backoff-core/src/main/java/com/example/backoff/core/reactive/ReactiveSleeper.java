package com.example.backoff.core.reactive;

import java.time.Duration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Waits between attempts of a {@link ReactiveRetry} without blocking a thread.
 *
 * <p>The returned {@link Mono} completes once the duration has elapsed. Cancelling it must stop
 * the wait.
 */
@FunctionalInterface
public interface ReactiveSleeper {

  /**
   * Returns the default sleeper, timing on {@link Schedulers#parallel()}.
   *
   * @return non-blocking sleeper
   */
  static ReactiveSleeper defaultSleeper() {
    return on(Schedulers.parallel());
  }

  /**
   * Returns a sleeper timing on the given scheduler. Zero durations complete immediately.
   *
   * @param scheduler time-capable scheduler
   * @return non-blocking sleeper
   */
  static ReactiveSleeper on(final Scheduler scheduler) {
    return duration ->
        duration.isZero() || duration.isNegative()
            ? Mono.empty()
            : Mono.delay(duration, scheduler).then();
  }

  /**
   * Returns a publisher completing after the given duration.
   *
   * @param duration how long to wait
   * @return completion signal
   */
  Mono<Void> sleep(final Duration duration);
}
