package com.example.backoff.core;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of randomness for jittered backoff.
 *
 * <p>Values outside {@code [0, 1]} are clamped by the policies consuming them.
 */
@FunctionalInterface
public interface JitterSource {

  /**
   * Returns the next multiplier in {@code [0, 1]}.
   *
   * @return jitter multiplier
   */
  double nextDouble();

  /**
   * Returns a source backed by {@link ThreadLocalRandom}.
   *
   * @return shared random source
   */
  static JitterSource random() {
    return () -> ThreadLocalRandom.current().nextDouble();
  }

  /**
   * Returns a reproducible source. Not thread safe; create one per sequence.
   *
   * @param seed random seed
   * @return seeded source
   */
  static JitterSource seeded(final long seed) {
    return new SplittableRandom(seed)::nextDouble;
  }
}
