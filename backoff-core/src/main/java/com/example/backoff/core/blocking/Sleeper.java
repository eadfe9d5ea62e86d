package com.example.backoff.core.blocking;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread between attempts of a {@link BlockingRetry}.
 *
 * <p>Replace the default to control time in tests or to sleep on a custom clock.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Returns the default sleeper, backed by {@link TimeUnit#sleep(long)}. Zero durations return
   * immediately without checking the interrupt flag.
   *
   * @return thread-blocking sleeper
   */
  static Sleeper defaultSleeper() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) return;
      TimeUnit.NANOSECONDS.sleep(saturatedNanos(duration));
    };
  }

  private static long saturatedNanos(final Duration duration) {
    try {
      return duration.toNanos();
    } catch (final ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  /**
   * Blocks for the given duration.
   *
   * @param duration how long to sleep
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(final Duration duration) throws InterruptedException;
}
