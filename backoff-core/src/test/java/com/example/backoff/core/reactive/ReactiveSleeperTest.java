package com.example.backoff.core.reactive;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.*;
import reactor.core.scheduler.Schedulers;

class ReactiveSleeperTest {

  @Test
  @DisplayName("Should complete immediately for zero and negative durations")
  void shouldSkipNonPositiveDurations() {
    final var sleeper = ReactiveSleeper.defaultSleeper();

    assertNull(sleeper.sleep(Duration.ZERO).block(Duration.ofMillis(100)));
    assertNull(sleeper.sleep(Duration.ofSeconds(-1)).block(Duration.ofMillis(100)));
  }

  @Test
  @DisplayName("Should complete after the requested duration")
  void shouldWaitForDuration() {
    final var scheduler = Schedulers.newSingle("sleeper-test");
    try {
      final var start = System.nanoTime();

      ReactiveSleeper.on(scheduler).sleep(Duration.ofMillis(20)).block(Duration.ofSeconds(5));

      assertTrue(System.nanoTime() - start >= Duration.ofMillis(20).toNanos());
    } finally {
      scheduler.dispose();
    }
  }
}
