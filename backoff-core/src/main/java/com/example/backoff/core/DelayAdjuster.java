package com.example.backoff.core;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Adjusts the delay proposed by the backoff for a given error.
 *
 * <p>Invoked once per accepted failure, after the backoff has been advanced. Returning empty stops
 * retrying and surfaces the error; returning a value replaces the proposed delay, even when the
 * backoff itself is exhausted.
 *
 * <h3>Honouring a Server Hint</h3>
 *
 * <pre>{@code
 * final DelayAdjuster retryAfter = (error, proposed) ->
 *     error instanceof ThrottledException throttled
 *         ? Optional.of(throttled.retryAfter())
 *         : proposed;
 * }</pre>
 */
@FunctionalInterface
public interface DelayAdjuster {

  /**
   * Returns the adjuster keeping the backoff's proposal.
   *
   * @return identity adjuster
   */
  static DelayAdjuster identity() {
    return (error, proposed) -> proposed;
  }

  /**
   * Creates an adjuster that only transforms present delays.
   *
   * @param mapper delay transformation
   * @return adjuster mapping present delays
   */
  static DelayAdjuster mapping(final Function<Duration, Duration> mapper) {
    return (error, proposed) -> proposed.map(mapper);
  }

  /**
   * Computes the delay to use before the next attempt.
   *
   * @param error the error being retried
   * @param proposed delay proposed by the backoff, empty if exhausted
   * @return delay to use, or empty to stop retrying
   */
  Optional<Duration> adjust(final Throwable error, final Optional<Duration> proposed);
}
