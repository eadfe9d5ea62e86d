package com.example.backoff.core.policy;

import static com.example.backoff.core.policy.Sequences.millis;
import static com.example.backoff.core.policy.Sequences.take;
import static org.junit.jupiter.api.Assertions.*;

import com.example.backoff.core.BackoffDefaults;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ExponentialBackoffTest {

  private final BackoffDefaults defaults =
      new BackoffDefaults(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, 3);

  private ExponentialBuilder builder() {
    return new ExponentialBuilder(defaults)
        .withMinDelay(Duration.ofMillis(100))
        .withFactor(2.0)
        .withMaxDelay(Duration.ofSeconds(1));
  }

  @Nested
  @DisplayName("Growth")
  class GrowthTests {

    @Test
    @DisplayName("Should double up to the cap and stop after maxTimes")
    void shouldGrowUpToCap() {
      final var backoff = builder().withMaxTimes(5).build();

      assertEquals(millis(100, 200, 400, 800, 1000), take(backoff, 10));
      assertTrue(backoff.next().isEmpty());
    }

    @Test
    @DisplayName("Should keep emitting the cap once reached")
    void shouldStayAtCap() {
      final var backoff = builder().withMaxTimes(8).build();

      assertEquals(millis(100, 200, 400, 800, 1000, 1000, 1000, 1000), take(backoff, 10));
    }

    @Test
    @DisplayName("Should start from the defaults")
    void shouldUseDefaults() {
      final var backoff = new ExponentialBuilder(defaults).build();

      assertEquals(millis(1000, 2000, 4000), take(backoff, 10));
    }

    @Test
    @DisplayName("Should repeat the min delay with factor one")
    void shouldRepeatWithFactorOne() {
      final var backoff = builder().withFactor(1.0).withMaxTimes(3).build();

      assertEquals(millis(100, 100, 100), take(backoff, 10));
    }

    @Test
    @DisplayName("Should support fractional factors")
    void shouldSupportFractionalFactors() {
      final var backoff = builder().withFactor(1.5).withMaxTimes(3).build();

      assertEquals(millis(100, 150, 225), take(backoff, 10));
    }

    @Test
    @DisplayName("Should cap the first delay when the cap is below the min delay")
    void shouldCapFirstDelay() {
      final var backoff = builder().withMaxDelay(Duration.ofMillis(50)).withMaxTimes(2).build();

      assertEquals(millis(50, 50), take(backoff, 10));
    }

    @Test
    @DisplayName("Should saturate instead of overflowing without a cap")
    void shouldSaturateWithoutCap() {
      final var backoff =
          builder()
              .withMinDelay(Duration.ofSeconds(1))
              .withFactor(10.0)
              .withoutMaxDelay()
              .withoutMaxTimes()
              .build();

      final List<Duration> delays = take(backoff, 40);

      assertEquals(40, delays.size());
      assertEquals(Duration.ofSeconds(10), delays.get(1));
      assertEquals(Duration.ofNanos(Long.MAX_VALUE), delays.get(39));
    }
  }

  @Nested
  @DisplayName("Reset After Max Delay")
  class ResetTests {

    @Test
    @DisplayName("Should restart from the min delay after the cap")
    void shouldRestartAfterCap() {
      final var backoff =
          builder()
              .withMinDelay(Duration.ofSeconds(1))
              .withMaxDelay(Duration.ofSeconds(4))
              .withResetAfterMaxDelay()
              .withoutMaxTimes()
              .build();

      assertEquals(millis(1000, 2000, 4000, 1000, 2000, 4000, 1000), take(backoff, 7));
    }

    @Test
    @DisplayName("Should keep counting maxTimes across restarts")
    void shouldCountAcrossRestarts() {
      final var backoff =
          builder()
              .withMinDelay(Duration.ofSeconds(1))
              .withMaxDelay(Duration.ofSeconds(2))
              .withResetAfterMaxDelay()
              .withMaxTimes(5)
              .build();

      assertEquals(millis(1000, 2000, 1000, 2000, 1000), take(backoff, 10));
    }

    @Test
    @DisplayName("Should have no effect without a cap")
    void shouldIgnoreResetWithoutCap() {
      final var backoff =
          builder().withoutMaxDelay().withResetAfterMaxDelay().withMaxTimes(5).build();

      assertEquals(millis(100, 200, 400, 800, 1600), take(backoff, 10));
    }
  }

  @Nested
  @DisplayName("Jitter")
  class JitterTests {

    @Test
    @DisplayName("Should apply jitter after the cap")
    void shouldJitterAfterCap() {
      final var backoff = builder().withJitterSource(() -> 0.5).withMaxTimes(6).build();

      assertEquals(millis(50, 100, 200, 400, 500, 500), take(backoff, 10));
    }

    @Test
    @DisplayName("Should produce the same sequence for the same seed")
    void shouldRepeatSeededSequence() {
      final var seeded = builder().withJitterSeed(42L).withoutMaxTimes();

      final var first = take(seeded.build(), 20);
      final var second = take(seeded.build(), 20);

      assertEquals(first, second);
      for (final var delay : first) assertTrue(delay.compareTo(Duration.ofSeconds(1)) <= 0);
    }

    @Test
    @DisplayName("Should not change growth when jitter is applied")
    void shouldNotFeedJitterBack() {
      final var backoff = builder().withJitterSource(() -> 0.0).withMaxTimes(3).build();

      assertEquals(millis(0, 0, 0), take(backoff, 10));
      assertEquals(millis(100, 200, 400), take(builder().withMaxTimes(3).build(), 10));
    }
  }

  @Nested
  @DisplayName("Validation")
  class ValidationTests {

    @Test
    @DisplayName("Should reject factors below one or not finite")
    void shouldRejectBadFactors() {
      assertThrows(IllegalArgumentException.class, () -> builder().withFactor(0.5));
      assertThrows(IllegalArgumentException.class, () -> builder().withFactor(Double.NaN));
      assertThrows(
          IllegalArgumentException.class, () -> builder().withFactor(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Should reject negative durations and counts")
    void shouldRejectNegativeValues() {
      assertThrows(
          IllegalArgumentException.class, () -> builder().withMinDelay(Duration.ofMillis(-1)));
      assertThrows(
          IllegalArgumentException.class, () -> builder().withMaxDelay(Duration.ofMillis(-1)));
      assertThrows(IllegalArgumentException.class, () -> builder().withMaxTimes(-2));
    }

    @Test
    @DisplayName("Should describe its settings")
    void shouldDescribeSettings() {
      final var description = builder().withoutMaxTimes().toString();

      assertTrue(description.contains("factor=2.0"));
      assertTrue(description.contains("maxTimes=unlimited"));
    }
  }
}
