package com.example.backoff.core;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BackoffTest {

  @Nested
  @DisplayName("Custom Sequences")
  class CustomSequences {

    @Test
    @DisplayName("Should emit the iterator elements and then stop")
    void shouldEmitIteratorElements() {
      final var backoff =
          Backoff.fromIterator(List.of(Duration.ofMillis(10), Duration.ofMillis(50)).iterator());

      assertEquals(Optional.of(Duration.ofMillis(10)), backoff.next());
      assertEquals(Optional.of(Duration.ofMillis(50)), backoff.next());
      assertEquals(Optional.empty(), backoff.next());
    }

    @Test
    @DisplayName("Should start a fresh iteration for every build")
    void shouldStartFreshIteration() {
      final var builder = BackoffBuilder.fromIterable(List.of(Duration.ofSeconds(1)));

      final var first = builder.build();
      assertTrue(first.next().isPresent());
      assertTrue(first.next().isEmpty());

      assertEquals(Optional.of(Duration.ofSeconds(1)), builder.build().next());
    }

    @Test
    @DisplayName("Should reject null delays")
    void shouldRejectNullDelays() {
      final var backoff = Backoff.fromIterator(Arrays.asList((Duration) null).iterator());

      assertThrows(NullPointerException.class, backoff::next);
      assertThrows(NullPointerException.class, () -> Backoff.fromIterator(null));
    }
  }

  @Nested
  @DisplayName("Delay Adjusters")
  class DelayAdjusters {

    @Test
    @DisplayName("Identity should return the proposed delay")
    void identityShouldPassThrough() {
      final var proposed = Optional.of(Duration.ofSeconds(2));

      assertEquals(proposed, DelayAdjuster.identity().adjust(new RuntimeException(), proposed));
    }

    @Test
    @DisplayName("Mapping should transform present delays and keep empty ones")
    void mappingShouldTransformPresentDelays() {
      final var doubling = DelayAdjuster.mapping(d -> d.multipliedBy(2));

      assertEquals(
          Optional.of(Duration.ofSeconds(4)),
          doubling.adjust(new RuntimeException(), Optional.of(Duration.ofSeconds(2))));
      assertEquals(Optional.empty(), doubling.adjust(new RuntimeException(), Optional.empty()));
    }
  }

  @Nested
  @DisplayName("Jitter Sources")
  class JitterSources {

    @Test
    @DisplayName("Seeded sources should repeat their sequence")
    void seededSourcesShouldRepeat() {
      final var a = JitterSource.seeded(7L);
      final var b = JitterSource.seeded(7L);

      for (var i = 0; i < 50; i++) assertEquals(a.nextDouble(), b.nextDouble());
    }

    @Test
    @DisplayName("Random sources should stay within zero and one")
    void randomSourcesShouldStayInRange() {
      final var source = JitterSource.random();

      for (var i = 0; i < 500; i++) {
        final var value = source.nextDouble();
        assertTrue(value >= 0.0 && value < 1.0);
      }
    }
  }

  @Test
  @DisplayName("RetryCancelledException should carry the last error")
  void cancelledExceptionShouldCarryLastError() {
    final var lastError = new IllegalStateException("boom");

    final var ex = new RetryCancelledException(lastError);

    assertSame(lastError, ex.getCause());
    assertTrue(ex.getMessage().contains("boom"));
  }
}
