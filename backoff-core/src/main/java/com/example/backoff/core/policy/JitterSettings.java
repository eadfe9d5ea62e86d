package com.example.backoff.core.policy;

import com.example.backoff.core.JitterSource;

/**
 * Jitter configuration shared by the built-in builders.
 *
 * @param enabled whether delays are jittered
 * @param seed seed for a per-sequence reproducible source, or null
 * @param source explicit source shared by every built sequence, or null
 */
record JitterSettings(boolean enabled, Long seed, JitterSource source) {

  static final JitterSettings NONE = new JitterSettings(false, null, null);
  static final JitterSettings RANDOM = new JitterSettings(true, null, null);

  static JitterSettings seeded(final long seed) {
    return new JitterSettings(true, seed, null);
  }

  static JitterSettings of(final JitterSource source) {
    if (source == null) throw new NullPointerException("source");
    return new JitterSettings(true, null, source);
  }

  /** Returns the source for a newly built sequence, or null when jitter is disabled. */
  JitterSource open() {
    if (!enabled) return null;
    if (source != null) return source;
    if (seed != null) return JitterSource.seeded(seed);
    return JitterSource.random();
  }
}
