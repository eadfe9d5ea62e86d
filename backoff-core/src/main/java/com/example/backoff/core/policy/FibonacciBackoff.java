package com.example.backoff.core.policy;

import com.example.backoff.core.JitterSource;
import java.time.Duration;

/** Backoff whose delay is the sum of its two previous delays. */
public final class FibonacciBackoff extends AbstractBackoff {

  private final Duration maxDelay;

  private Duration previous = Duration.ZERO;
  private Duration current;

  FibonacciBackoff(
      final Duration minDelay,
      final Duration maxDelay,
      final int maxTimes,
      final Duration totalDelay,
      final JitterSource jitter) {
    super(maxTimes, totalDelay, jitter);
    this.maxDelay = maxDelay;
    this.current = minDelay;
  }

  @Override
  Duration nextDelay() {
    final var delay = Durations.cap(current, maxDelay);
    // stop growing once capped so the sum cannot run away
    if (delay.equals(current)) {
      final var following = Durations.plus(previous, current);
      previous = current;
      current = following;
    }
    return delay;
  }
}
