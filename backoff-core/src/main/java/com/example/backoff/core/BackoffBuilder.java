package com.example.backoff.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration producing fresh {@link Backoff} sequences.
 *
 * <p>Retry drivers call {@link #build()} once per retry loop, so a single builder can be shared by
 * any number of drivers and invocations without them observing each other's progress.
 *
 * <h3>Example</h3>
 *
 * <pre>{@code
 * final BackoffBuilder builder = new ExponentialBuilder()
 *     .withMinDelay(Duration.ofMillis(100))
 *     .withMaxTimes(5)
 *     .withJitter();
 *
 * final var first = builder.build();
 * final var second = builder.build(); // independent of first
 * }</pre>
 */
@FunctionalInterface
public interface BackoffBuilder {

  /**
   * Builds a new, independently stateful backoff sequence.
   *
   * @return new backoff
   */
  Backoff build();

  /**
   * Creates a builder replaying the given delays, with a fresh iterator for every built sequence.
   *
   * @param delays delays to replay, in order
   * @return builder over the iterable
   */
  static BackoffBuilder fromIterable(final Iterable<Duration> delays) {
    Objects.requireNonNull(delays, "delays");
    return () -> Backoff.fromIterator(delays.iterator());
  }
}
