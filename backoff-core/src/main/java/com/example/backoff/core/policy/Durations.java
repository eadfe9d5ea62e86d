package com.example.backoff.core.policy;

import java.time.Duration;
import java.util.Objects;

/** Saturating duration arithmetic, bounded by {@link #MAX}. */
final class Durations {

  /** Largest duration the policies produce: {@code Long.MAX_VALUE} nanoseconds. */
  static final Duration MAX = Duration.ofNanos(Long.MAX_VALUE);

  private Durations() {}

  static long nanos(final Duration d) {
    return d.compareTo(MAX) >= 0 ? Long.MAX_VALUE : d.toNanos();
  }

  static Duration multiply(final Duration d, final double factor) {
    final var product = nanos(d) * factor;
    if (product >= Long.MAX_VALUE) return MAX;
    return Duration.ofNanos((long) product);
  }

  static Duration plus(final Duration a, final Duration b) {
    final var x = nanos(a);
    final var y = nanos(b);
    if (x > Long.MAX_VALUE - y) return MAX;
    return Duration.ofNanos(x + y);
  }

  /** Caps {@code d} at {@code max}; a null {@code max} means uncapped. */
  static Duration cap(final Duration d, final Duration max) {
    if (max == null) return d;
    return d.compareTo(max) > 0 ? max : d;
  }

  /** Scales {@code d} by {@code r} clamped to {@code [0, 1]}, never exceeding {@code d}. */
  static Duration jitter(final Duration d, final double r) {
    final var clamped = Double.isNaN(r) ? 0.0 : Math.max(0.0, Math.min(1.0, r));
    final var nanos = nanos(d);
    return Duration.ofNanos(Math.min(nanos, (long) (nanos * clamped)));
  }

  static Duration requireNonNegative(final Duration d, final String name) {
    Objects.requireNonNull(d, name);
    if (d.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
    return d;
  }

  static int requireNonNegative(final int value, final String name) {
    if (value < 0) throw new IllegalArgumentException(name + " must be >= 0");
    return value;
  }
}
