package com.example.backoff.core;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * A stateful sequence of delays to wait between attempts of a retried operation.
 *
 * <p>Each call to {@link #next()} consumes one step of the sequence. A present value means "wait
 * this long, then try again"; an empty value means the sequence is exhausted and no further attempt
 * should be made. Exhaustion is terminal for an instance: to start over, build a new sequence from
 * the same {@link BackoffBuilder}.
 *
 * <p>Implementations are not required to be thread safe. A sequence is owned by exactly one retry
 * loop.
 *
 * <h3>Custom Sequence Example</h3>
 *
 * <pre>{@code
 * final var delays = List.of(Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(1));
 * final var backoff = Backoff.fromIterator(delays.iterator());
 *
 * backoff.next(); // Optional[PT0.01S]
 * }</pre>
 *
 * @see BackoffBuilder
 */
@FunctionalInterface
public interface Backoff {

  /**
   * Returns the delay to wait before the next attempt, or empty if no further attempt should be
   * made.
   *
   * @return next delay, or empty once exhausted
   */
  Optional<Duration> next();

  /**
   * Adapts an iterator of durations to a backoff sequence.
   *
   * <p>The sequence ends when the iterator has no more elements. Null elements are rejected.
   *
   * @param delays iterator supplying the delays
   * @return backoff backed by the iterator
   */
  static Backoff fromIterator(final Iterator<Duration> delays) {
    Objects.requireNonNull(delays, "delays");
    return () ->
        delays.hasNext()
            ? Optional.of(Objects.requireNonNull(delays.next(), "delay"))
            : Optional.empty();
  }
}
