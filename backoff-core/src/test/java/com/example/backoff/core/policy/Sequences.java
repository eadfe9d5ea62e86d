package com.example.backoff.core.policy;

import com.example.backoff.core.Backoff;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Test helper draining a backoff into a list. */
final class Sequences {

  private Sequences() {}

  static List<Duration> take(final Backoff backoff, final int limit) {
    final var delays = new ArrayList<Duration>();
    for (var i = 0; i < limit; i++) {
      final var next = backoff.next();
      if (next.isEmpty()) break;
      delays.add(next.get());
    }
    return delays;
  }

  static List<Duration> millis(final long... values) {
    final var delays = new ArrayList<Duration>();
    for (final var value : values) delays.add(Duration.ofMillis(value));
    return delays;
  }
}
