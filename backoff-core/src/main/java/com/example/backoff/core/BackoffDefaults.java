package com.example.backoff.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Default backoff parameters used by the built-in builders.
 *
 * <p>Defaults can be overridden via system properties or environment variables:
 *
 * <ul>
 *   <li>backoff.min.delay.millis / BACKOFF_MIN_DELAY_MILLIS (default 1000)
 *   <li>backoff.max.delay.millis / BACKOFF_MAX_DELAY_MILLIS (default 60000)
 *   <li>backoff.factor / BACKOFF_FACTOR (default 2.0)
 *   <li>backoff.max.times / BACKOFF_MAX_TIMES (default 3)
 * </ul>
 *
 * <p>Blank, unparsable and out-of-range values are ignored. Values are resolved every time a
 * builder is created.
 *
 * @param minDelay initial delay
 * @param maxDelay delay cap
 * @param factor exponential growth factor
 * @param maxTimes maximum number of retries
 */
public record BackoffDefaults(Duration minDelay, Duration maxDelay, double factor, int maxTimes) {

  static final long DEFAULT_MIN_DELAY_MILLIS = 1_000L;
  static final long DEFAULT_MAX_DELAY_MILLIS = 60_000L;
  static final double DEFAULT_FACTOR = 2.0;
  static final int DEFAULT_MAX_TIMES = 3;

  /**
   * Resolves the defaults from the environment.
   *
   * @return current defaults
   */
  public static BackoffDefaults resolve() {
    return new BackoffDefaults(
        Duration.ofMillis(
            lookup("backoff.min.delay.millis", "BACKOFF_MIN_DELAY_MILLIS")
                .flatMap(BackoffDefaults::parseLong)
                .filter(v -> v >= 0)
                .orElse(DEFAULT_MIN_DELAY_MILLIS)),
        Duration.ofMillis(
            lookup("backoff.max.delay.millis", "BACKOFF_MAX_DELAY_MILLIS")
                .flatMap(BackoffDefaults::parseLong)
                .filter(v -> v >= 0)
                .orElse(DEFAULT_MAX_DELAY_MILLIS)),
        lookup("backoff.factor", "BACKOFF_FACTOR")
            .flatMap(BackoffDefaults::parseDouble)
            .filter(v -> v >= 1.0)
            .orElse(DEFAULT_FACTOR),
        lookup("backoff.max.times", "BACKOFF_MAX_TIMES")
            .flatMap(BackoffDefaults::parseLong)
            .filter(v -> v >= 0 && v <= Integer.MAX_VALUE)
            .map(Long::intValue)
            .orElse(DEFAULT_MAX_TIMES));
  }

  private static Optional<String> lookup(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim);
  }

  private static Optional<Long> parseLong(final String val) {
    try {
      return Optional.of(Long.parseLong(val));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static Optional<Double> parseDouble(final String val) {
    try {
      return Optional.of(Double.parseDouble(val)).filter(Double::isFinite);
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }
}
