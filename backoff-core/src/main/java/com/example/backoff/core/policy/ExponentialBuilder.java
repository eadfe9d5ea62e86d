package com.example.backoff.core.policy;

import static com.example.backoff.core.policy.AbstractBackoff.UNLIMITED;

import com.example.backoff.core.BackoffBuilder;
import com.example.backoff.core.BackoffDefaults;
import com.example.backoff.core.JitterSource;
import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link ExponentialBackoff}: delays growing by a constant factor up to a cap.
 *
 * <p>The unjittered delay before retry {@code n} (0-based) is {@code min(minDelay * factor^n,
 * maxDelay)}. The cap bounds the delay but does not end the sequence; only the retry limit and the
 * total-delay budget do.
 *
 * <p>Defaults (see {@link BackoffDefaults}): min delay 1 second, factor 2, max delay 60 seconds,
 * at most 3 retries, no jitter, no total-delay budget.
 *
 * <h3>Example</h3>
 *
 * <pre>{@code
 * // 100ms, 200ms, 400ms, 800ms, 1s
 * final var builder = new ExponentialBuilder()
 *     .withMinDelay(Duration.ofMillis(100))
 *     .withFactor(2.0)
 *     .withMaxDelay(Duration.ofSeconds(1))
 *     .withMaxTimes(5);
 * }</pre>
 *
 * <h3>Decorrelated Retries</h3>
 *
 * <pre>{@code
 * final var builder = new ExponentialBuilder()
 *     .withJitter()
 *     .withoutMaxTimes()
 *     .withTotalDelay(Duration.ofMinutes(5));
 * }</pre>
 *
 * <p>Instances are immutable; every {@code with*} method returns a new builder.
 */
public final class ExponentialBuilder implements BackoffBuilder {

  private final Duration minDelay;
  private final double factor;
  private final Duration maxDelay;
  private final int maxTimes;
  private final Duration totalDelay;
  private final JitterSettings jitter;
  private final boolean resetAfterMaxDelay;

  /** Creates a builder with the current {@link BackoffDefaults}. */
  public ExponentialBuilder() {
    this(BackoffDefaults.resolve());
  }

  /**
   * Creates a builder with the given defaults.
   *
   * @param defaults defaults to start from
   */
  public ExponentialBuilder(final BackoffDefaults defaults) {
    this(
        defaults.minDelay(),
        defaults.factor(),
        defaults.maxDelay(),
        defaults.maxTimes(),
        null,
        JitterSettings.NONE,
        false);
  }

  private ExponentialBuilder(
      final Duration minDelay,
      final double factor,
      final Duration maxDelay,
      final int maxTimes,
      final Duration totalDelay,
      final JitterSettings jitter,
      final boolean resetAfterMaxDelay) {
    this.minDelay = Durations.requireNonNegative(minDelay, "minDelay");
    if (!(factor >= 1.0) || Double.isInfinite(factor))
      throw new IllegalArgumentException("factor must be >= 1.0 and finite");
    this.factor = factor;
    this.maxDelay = maxDelay;
    this.maxTimes = maxTimes;
    this.totalDelay = totalDelay;
    this.jitter = Objects.requireNonNull(jitter, "jitter");
    this.resetAfterMaxDelay = resetAfterMaxDelay;
  }

  /**
   * Sets the first delay.
   *
   * @param minDelay non-negative initial delay
   * @return new builder
   */
  public ExponentialBuilder withMinDelay(final Duration minDelay) {
    return new ExponentialBuilder(
        minDelay, factor, maxDelay, maxTimes, totalDelay, jitter, resetAfterMaxDelay);
  }

  /**
   * Sets the growth factor.
   *
   * @param factor multiplier applied after each step, must be >= 1.0
   * @return new builder
   */
  public ExponentialBuilder withFactor(final double factor) {
    return new ExponentialBuilder(
        minDelay, factor, maxDelay, maxTimes, totalDelay, jitter, resetAfterMaxDelay);
  }

  /**
   * Caps every delay at {@code maxDelay}. A cap below the min delay caps the first delay too.
   *
   * @param maxDelay non-negative cap
   * @return new builder
   */
  public ExponentialBuilder withMaxDelay(final Duration maxDelay) {
    return new ExponentialBuilder(
        minDelay,
        factor,
        Durations.requireNonNegative(maxDelay, "maxDelay"),
        maxTimes,
        totalDelay,
        jitter,
        resetAfterMaxDelay);
  }

  /**
   * Removes the delay cap; delays saturate at {@code Long.MAX_VALUE} nanoseconds.
   *
   * @return new builder
   */
  public ExponentialBuilder withoutMaxDelay() {
    return new ExponentialBuilder(
        minDelay, factor, null, maxTimes, totalDelay, jitter, resetAfterMaxDelay);
  }

  /**
   * Sets the maximum number of retries.
   *
   * @param maxTimes non-negative retry count; 0 disables retrying
   * @return new builder
   */
  public ExponentialBuilder withMaxTimes(final int maxTimes) {
    return new ExponentialBuilder(
        minDelay,
        factor,
        maxDelay,
        Durations.requireNonNegative(maxTimes, "maxTimes"),
        totalDelay,
        jitter,
        resetAfterMaxDelay);
  }

  /**
   * Removes the retry limit. Unless a total delay is set, the sequence is infinite.
   *
   * @return new builder
   */
  public ExponentialBuilder withoutMaxTimes() {
    return new ExponentialBuilder(
        minDelay, factor, maxDelay, UNLIMITED, totalDelay, jitter, resetAfterMaxDelay);
  }

  /**
   * Ends the sequence once the cumulative delay would exceed {@code totalDelay}.
   *
   * @param totalDelay non-negative budget
   * @return new builder
   */
  public ExponentialBuilder withTotalDelay(final Duration totalDelay) {
    return new ExponentialBuilder(
        minDelay,
        factor,
        maxDelay,
        maxTimes,
        Durations.requireNonNegative(totalDelay, "totalDelay"),
        jitter,
        resetAfterMaxDelay);
  }

  /**
   * Enables random jitter: each delay is scaled by a random factor in {@code [0, 1]}.
   *
   * @return new builder
   */
  public ExponentialBuilder withJitter() {
    return new ExponentialBuilder(
        minDelay,
        factor,
        maxDelay,
        maxTimes,
        totalDelay,
        JitterSettings.RANDOM,
        resetAfterMaxDelay);
  }

  /**
   * Enables jitter with a reproducible sequence; every built backoff starts from the same seed.
   *
   * @param seed random seed
   * @return new builder
   */
  public ExponentialBuilder withJitterSeed(final long seed) {
    return new ExponentialBuilder(
        minDelay,
        factor,
        maxDelay,
        maxTimes,
        totalDelay,
        JitterSettings.seeded(seed),
        resetAfterMaxDelay);
  }

  /**
   * Enables jitter drawing from the given source, shared by every built backoff.
   *
   * @param source jitter source
   * @return new builder
   */
  public ExponentialBuilder withJitterSource(final JitterSource source) {
    return new ExponentialBuilder(
        minDelay,
        factor,
        maxDelay,
        maxTimes,
        totalDelay,
        JitterSettings.of(source),
        resetAfterMaxDelay);
  }

  /**
   * Restarts growth from the min delay once the max delay has been used.
   *
   * <p>With {@code minDelay=1s, factor=2, maxDelay=4s} the delays become {@code 1s, 2s, 4s, 1s, 2s,
   * 4s, ...}. Retry limit and total-delay budget keep counting across restarts. Has no effect
   * without a max delay.
   *
   * @return new builder
   */
  public ExponentialBuilder withResetAfterMaxDelay() {
    return new ExponentialBuilder(minDelay, factor, maxDelay, maxTimes, totalDelay, jitter, true);
  }

  @Override
  public ExponentialBackoff build() {
    return new ExponentialBackoff(
        minDelay, factor, maxDelay, resetAfterMaxDelay, maxTimes, totalDelay, jitter.open());
  }

  @Override
  public String toString() {
    return "ExponentialBuilder{minDelay="
        + minDelay
        + ", factor="
        + factor
        + ", maxDelay="
        + maxDelay
        + ", maxTimes="
        + (maxTimes == UNLIMITED ? "unlimited" : maxTimes)
        + ", totalDelay="
        + totalDelay
        + ", jitter="
        + jitter.enabled()
        + ", resetAfterMaxDelay="
        + resetAfterMaxDelay
        + '}';
  }
}
