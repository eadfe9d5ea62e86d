package com.example.backoff.core.policy;

import com.example.backoff.core.JitterSource;
import java.time.Duration;

/** Backoff returning the same delay at every step. Built by {@link ConstantBuilder}. */
public final class ConstantBackoff extends AbstractBackoff {

  private final Duration delay;

  ConstantBackoff(
      final Duration delay,
      final int maxTimes,
      final Duration totalDelay,
      final JitterSource jitter) {
    super(maxTimes, totalDelay, jitter);
    this.delay = delay;
  }

  @Override
  Duration nextDelay() {
    return delay;
  }
}
