package com.example.backoff.core.policy;

import com.example.backoff.core.JitterSource;
import java.time.Duration;

/** Backoff multiplying its delay by a constant factor at every step. */
public final class ExponentialBackoff extends AbstractBackoff {

  private final Duration minDelay;
  private final double factor;
  private final Duration maxDelay;
  private final boolean resetAfterMaxDelay;

  private Duration current;

  ExponentialBackoff(
      final Duration minDelay,
      final double factor,
      final Duration maxDelay,
      final boolean resetAfterMaxDelay,
      final int maxTimes,
      final Duration totalDelay,
      final JitterSource jitter) {
    super(maxTimes, totalDelay, jitter);
    this.minDelay = Durations.cap(minDelay, maxDelay);
    this.factor = factor;
    this.maxDelay = maxDelay;
    this.resetAfterMaxDelay = resetAfterMaxDelay;
    this.current = this.minDelay;
  }

  @Override
  Duration nextDelay() {
    final var delay = current;
    if (resetAfterMaxDelay && maxDelay != null && delay.compareTo(maxDelay) >= 0) {
      current = minDelay;
    } else {
      current = Durations.cap(Durations.multiply(current, factor), maxDelay);
    }
    return delay;
  }
}
