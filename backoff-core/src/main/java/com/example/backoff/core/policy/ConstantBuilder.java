package com.example.backoff.core.policy;

import static com.example.backoff.core.policy.AbstractBackoff.UNLIMITED;

import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.BackoffDefaults;
import com.example.backoff.core.JitterSource;
import java.time.Duration;

/**
 * Builder for {@link ConstantBackoff}: the same delay before every retry.
 *
 * <p>Defaults (see {@link BackoffDefaults}): delay 1 second, at most 3 retries, no jitter, no
 * total-delay budget.
 *
 * <h3>Example</h3>
 *
 * <pre>{@code
 * final var builder = new ConstantBuilder()
 *     .withDelay(Duration.ofMillis(200))
 *     .withMaxTimes(5)
 *     .withJitter();
 * }</pre>
 *
 * <p>Instances are immutable; every {@code with*} method returns a new builder.
 */
public final class ConstantBuilder implements BackoffBuilder {

  private final Duration delay;
  private final int maxTimes;
  private final Duration totalDelay;
  private final JitterSettings jitter;

  /** Creates a builder with the current {@link BackoffDefaults}. */
  public ConstantBuilder() {
    this(BackoffDefaults.resolve());
  }

  /**
   * Creates a builder with the given defaults.
   *
   * @param defaults defaults to start from
   */
  public ConstantBuilder(final BackoffDefaults defaults) {
    this(defaults.minDelay(), defaults.maxTimes(), null, JitterSettings.NONE);
  }

  private ConstantBuilder(
      final Duration delay,
      final int maxTimes,
      final Duration totalDelay,
      final JitterSettings jitter) {
    this.delay = Durations.requireNonNegative(delay, "delay");
    this.maxTimes = maxTimes;
    this.totalDelay = totalDelay;
    this.jitter = jitter;
  }

  /**
   * Sets the delay between attempts.
   *
   * @param delay non-negative delay
   * @return new builder
   */
  public ConstantBuilder withDelay(final Duration delay) {
    return new ConstantBuilder(delay, maxTimes, totalDelay, jitter);
  }

  /**
   * Sets the maximum number of retries.
   *
   * @param maxTimes non-negative retry count; 0 disables retrying
   * @return new builder
   */
  public ConstantBuilder withMaxTimes(final int maxTimes) {
    return new ConstantBuilder(
        delay, Durations.requireNonNegative(maxTimes, "maxTimes"), totalDelay, jitter);
  }

  /**
   * Removes the retry limit. Unless a total delay is set, the sequence is infinite.
   *
   * @return new builder
   */
  public ConstantBuilder withoutMaxTimes() {
    return new ConstantBuilder(delay, UNLIMITED, totalDelay, jitter);
  }

  /**
   * Ends the sequence once the cumulative delay would exceed {@code totalDelay}.
   *
   * @param totalDelay non-negative budget
   * @return new builder
   */
  public ConstantBuilder withTotalDelay(final Duration totalDelay) {
    return new ConstantBuilder(
        delay, maxTimes, Durations.requireNonNegative(totalDelay, "totalDelay"), jitter);
  }

  /**
   * Enables random jitter: each delay is scaled by a random factor in {@code [0, 1]}.
   *
   * @return new builder
   */
  public ConstantBuilder withJitter() {
    return new ConstantBuilder(delay, maxTimes, totalDelay, JitterSettings.RANDOM);
  }

  /**
   * Enables jitter with a reproducible sequence; every built backoff starts from the same seed.
   *
   * @param seed random seed
   * @return new builder
   */
  public ConstantBuilder withJitterSeed(final long seed) {
    return new ConstantBuilder(delay, maxTimes, totalDelay, JitterSettings.seeded(seed));
  }

  /**
   * Enables jitter drawing from the given source, shared by every built backoff.
   *
   * @param source jitter source
   * @return new builder
   */
  public ConstantBuilder withJitterSource(final JitterSource source) {
    return new ConstantBuilder(delay, maxTimes, totalDelay, JitterSettings.of(source));
  }

  @Override
  public ConstantBackoff build() {
    return new ConstantBackoff(delay, maxTimes, totalDelay, jitter.open());
  }

  @Override
  public String toString() {
    return "ConstantBuilder{delay="
        + delay
        + ", maxTimes="
        + (maxTimes == UNLIMITED ? "unlimited" : maxTimes)
        + ", totalDelay="
        + totalDelay
        + ", jitter="
        + jitter.enabled()
        + '}';
  }
}
