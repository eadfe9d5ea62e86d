package com.example.backoff.core.policy;

import com.example.backoff.core.Backoff;
import com.example.backoff.core.JitterSource;
import java.time.Duration;
import java.util.Optional;

/**
 * Base for the built-in sequences. Enforces the retry limit, applies jitter and charges the
 * total-delay budget; subclasses only compute the unjittered delay of each step.
 */
abstract class AbstractBackoff implements Backoff {

  static final int UNLIMITED = -1;

  private final int maxTimes;
  private final Duration totalDelay;
  private final JitterSource jitter;

  private int attempts;
  private Duration spent = Duration.ZERO;
  private boolean exhausted;

  AbstractBackoff(final int maxTimes, final Duration totalDelay, final JitterSource jitter) {
    this.maxTimes = maxTimes;
    this.totalDelay = totalDelay;
    this.jitter = jitter;
  }

  @Override
  public final Optional<Duration> next() {
    if (exhausted) return Optional.empty();
    if (maxTimes != UNLIMITED && attempts >= maxTimes) {
      exhausted = true;
      return Optional.empty();
    }

    var delay = nextDelay();
    if (jitter != null) delay = Durations.jitter(delay, jitter.nextDouble());

    if (totalDelay != null) {
      final var spentAfter = Durations.plus(spent, delay);
      if (spentAfter.compareTo(totalDelay) > 0) {
        exhausted = true;
        return Optional.empty();
      }
      spent = spentAfter;
    }

    attempts++;
    return Optional.of(delay);
  }

  /**
   * Number of delays produced so far.
   *
   * @return produced delays
   */
  public final int attempts() {
    return attempts;
  }

  /** Computes the unjittered delay of the current step and advances to the next one. */
  abstract Duration nextDelay();
}
