package com.example.backoff.core.policy;

import static com.example.backoff.core.policy.AbstractBackoff.UNLIMITED;

import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.BackoffDefaults;
import com.example.backoff.core.JitterSource;
import java.time.Duration;

/**
 * Builder for {@link FibonacciBackoff}: delays following the Fibonacci recurrence seeded by the min
 * delay, so {@code 1s, 1s, 2s, 3s, 5s, 8s, ...} for a min delay of one second, capped at the max
 * delay.
 *
 * <p>Defaults (see {@link BackoffDefaults}): min delay 1 second, max delay 60 seconds, at most 3
 * retries, no jitter, no total-delay budget.
 *
 * <p>Instances are immutable; every {@code with*} method returns a new builder.
 */
public final class FibonacciBuilder implements BackoffBuilder {

  private final Duration minDelay;
  private final Duration maxDelay;
  private final int maxTimes;
  private final Duration totalDelay;
  private final JitterSettings jitter;

  /** Creates a builder with the current {@link BackoffDefaults}. */
  public FibonacciBuilder() {
    this(BackoffDefaults.resolve());
  }

  /**
   * Creates a builder with the given defaults.
   *
   * @param defaults defaults to start from
   */
  public FibonacciBuilder(final BackoffDefaults defaults) {
    this(defaults.minDelay(), defaults.maxDelay(), defaults.maxTimes(), null, JitterSettings.NONE);
  }

  private FibonacciBuilder(
      final Duration minDelay,
      final Duration maxDelay,
      final int maxTimes,
      final Duration totalDelay,
      final JitterSettings jitter) {
    this.minDelay = Durations.requireNonNegative(minDelay, "minDelay");
    this.maxDelay = maxDelay;
    this.maxTimes = maxTimes;
    this.totalDelay = totalDelay;
    this.jitter = jitter;
  }

  /**
   * Sets the first two delays.
   *
   * @param minDelay non-negative initial delay
   * @return new builder
   */
  public FibonacciBuilder withMinDelay(final Duration minDelay) {
    return new FibonacciBuilder(minDelay, maxDelay, maxTimes, totalDelay, jitter);
  }

  /**
   * Caps every delay at {@code maxDelay}.
   *
   * @param maxDelay non-negative cap
   * @return new builder
   */
  public FibonacciBuilder withMaxDelay(final Duration maxDelay) {
    return new FibonacciBuilder(
        minDelay, Durations.requireNonNegative(maxDelay, "maxDelay"), maxTimes, totalDelay, jitter);
  }

  /**
   * Removes the delay cap; delays saturate at {@code Long.MAX_VALUE} nanoseconds.
   *
   * @return new builder
   */
  public FibonacciBuilder withoutMaxDelay() {
    return new FibonacciBuilder(minDelay, null, maxTimes, totalDelay, jitter);
  }

  /**
   * Sets the maximum number of retries.
   *
   * @param maxTimes non-negative retry count; 0 disables retrying
   * @return new builder
   */
  public FibonacciBuilder withMaxTimes(final int maxTimes) {
    return new FibonacciBuilder(
        minDelay, maxDelay, Durations.requireNonNegative(maxTimes, "maxTimes"), totalDelay, jitter);
  }

  /**
   * Removes the retry limit. Unless a total delay is set, the sequence is infinite.
   *
   * @return new builder
   */
  public FibonacciBuilder withoutMaxTimes() {
    return new FibonacciBuilder(minDelay, maxDelay, UNLIMITED, totalDelay, jitter);
  }

  /**
   * Ends the sequence once the cumulative delay would exceed {@code totalDelay}.
   *
   * @param totalDelay non-negative budget
   * @return new builder
   */
  public FibonacciBuilder withTotalDelay(final Duration totalDelay) {
    return new FibonacciBuilder(
        minDelay,
        maxDelay,
        maxTimes,
        Durations.requireNonNegative(totalDelay, "totalDelay"),
        jitter);
  }

  /**
   * Enables random jitter: each delay is scaled by a random factor in {@code [0, 1]}.
   *
   * @return new builder
   */
  public FibonacciBuilder withJitter() {
    return new FibonacciBuilder(minDelay, maxDelay, maxTimes, totalDelay, JitterSettings.RANDOM);
  }

  /**
   * Enables jitter with a reproducible sequence; every built backoff starts from the same seed.
   *
   * @param seed random seed
   * @return new builder
   */
  public FibonacciBuilder withJitterSeed(final long seed) {
    return new FibonacciBuilder(
        minDelay, maxDelay, maxTimes, totalDelay, JitterSettings.seeded(seed));
  }

  /**
   * Enables jitter drawing from the given source, shared by every built backoff.
   *
   * @param source jitter source
   * @return new builder
   */
  public FibonacciBuilder withJitterSource(final JitterSource source) {
    return new FibonacciBuilder(
        minDelay, maxDelay, maxTimes, totalDelay, JitterSettings.of(source));
  }

  @Override
  public FibonacciBackoff build() {
    return new FibonacciBackoff(minDelay, maxDelay, maxTimes, totalDelay, jitter.open());
  }

  @Override
  public String toString() {
    return "FibonacciBuilder{minDelay="
        + minDelay
        + ", maxDelay="
        + maxDelay
        + ", maxTimes="
        + (maxTimes == UNLIMITED ? "unlimited" : maxTimes)
        + ", totalDelay="
        + totalDelay
        + ", jitter="
        + jitter.enabled()
        + '}';
  }
}
