package com.example.backoff.core.policy;

import static com.example.backoff.core.policy.Sequences.millis;
import static com.example.backoff.core.policy.Sequences.take;
import static org.junit.jupiter.api.Assertions.*;

import com.example.backoff.core.BackoffDefaults;
import java.time.Duration;
import org.junit.jupiter.api.*;

class FibonacciBackoffTest {

  private final BackoffDefaults defaults =
      new BackoffDefaults(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, 3);

  @Test
  @DisplayName("Should follow the fibonacci sequence scaled by the min delay")
  void shouldFollowFibonacci() {
    final var backoff =
        new FibonacciBuilder(defaults)
            .withMinDelay(Duration.ofMillis(100))
            .withoutMaxDelay()
            .withMaxTimes(7)
            .build();

    assertEquals(millis(100, 100, 200, 300, 500, 800, 1300), take(backoff, 10));
    assertTrue(backoff.next().isEmpty());
  }

  @Test
  @DisplayName("Should produce one-second fibonacci steps under the default cap")
  void shouldProduceSecondSteps() {
    final var backoff = new FibonacciBuilder(defaults).withMaxTimes(6).build();

    assertEquals(millis(1000, 1000, 2000, 3000, 5000, 8000), take(backoff, 10));
  }

  @Test
  @DisplayName("Should hold at the cap")
  void shouldHoldAtCap() {
    final var backoff =
        new FibonacciBuilder(defaults)
            .withMinDelay(Duration.ofSeconds(1))
            .withMaxDelay(Duration.ofSeconds(6))
            .withMaxTimes(8)
            .build();

    assertEquals(millis(1000, 1000, 2000, 3000, 5000, 6000, 6000, 6000), take(backoff, 10));
  }

  @Test
  @DisplayName("Should start from the defaults")
  void shouldUseDefaults() {
    assertEquals(millis(1000, 1000, 2000), take(new FibonacciBuilder(defaults).build(), 10));
  }

  @Test
  @DisplayName("Should saturate instead of overflowing without a cap")
  void shouldSaturateWithoutCap() {
    final var backoff =
        new FibonacciBuilder(defaults)
            .withMinDelay(Duration.ofDays(1))
            .withoutMaxDelay()
            .withoutMaxTimes()
            .build();

    final var delays = take(backoff, 200);

    assertEquals(200, delays.size());
    assertEquals(Duration.ofNanos(Long.MAX_VALUE), delays.get(199));
  }

  @Test
  @DisplayName("Should end once the total delay is spent")
  void shouldRespectTotalDelay() {
    final var backoff =
        new FibonacciBuilder(defaults)
            .withMinDelay(Duration.ofMillis(100))
            .withoutMaxTimes()
            .withTotalDelay(Duration.ofMillis(500))
            .build();

    assertEquals(millis(100, 100, 200), take(backoff, 10));
  }

  @Test
  @DisplayName("Should apply jitter to each delay")
  void shouldApplyJitter() {
    final var backoff =
        new FibonacciBuilder(defaults)
            .withMinDelay(Duration.ofMillis(100))
            .withJitterSource(() -> 0.5)
            .withMaxTimes(4)
            .build();

    assertEquals(millis(50, 50, 100, 150), take(backoff, 10));
  }

  @Test
  @DisplayName("Should reject negative values")
  void shouldRejectNegativeValues() {
    final var builder = new FibonacciBuilder(defaults);

    assertThrows(
        IllegalArgumentException.class, () -> builder.withMinDelay(Duration.ofMillis(-1)));
    assertThrows(
        IllegalArgumentException.class, () -> builder.withMaxDelay(Duration.ofMillis(-1)));
    assertThrows(IllegalArgumentException.class, () -> builder.withMaxTimes(-1));
  }
}
