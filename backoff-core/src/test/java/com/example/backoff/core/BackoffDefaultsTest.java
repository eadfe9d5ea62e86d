package com.example.backoff.core;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BackoffDefaultsTest {

  private static final String MIN_DELAY = "backoff.min.delay.millis";
  private static final String MAX_DELAY = "backoff.max.delay.millis";
  private static final String FACTOR = "backoff.factor";
  private static final String MAX_TIMES = "backoff.max.times";

  @AfterEach
  void clearProperties() {
    System.clearProperty(MIN_DELAY);
    System.clearProperty(MAX_DELAY);
    System.clearProperty(FACTOR);
    System.clearProperty(MAX_TIMES);
  }

  @Test
  @DisplayName("Should read overrides from system properties")
  void shouldReadSystemProperties() {
    System.setProperty(MIN_DELAY, "250");
    System.setProperty(MAX_DELAY, "5000");
    System.setProperty(FACTOR, "1.5");
    System.setProperty(MAX_TIMES, "10");

    final var defaults = BackoffDefaults.resolve();

    assertEquals(Duration.ofMillis(250), defaults.minDelay());
    assertEquals(Duration.ofSeconds(5), defaults.maxDelay());
    assertEquals(1.5, defaults.factor());
    assertEquals(10, defaults.maxTimes());
  }

  @Test
  @DisplayName("Should trim values before parsing")
  void shouldTrimValues() {
    System.setProperty(MAX_TIMES, " 4 ");

    assertEquals(4, BackoffDefaults.resolve().maxTimes());
  }

  @Test
  @DisplayName("Should ignore malformed or out-of-range values")
  void shouldIgnoreInvalidValues() {
    System.setProperty(MIN_DELAY, "-5");
    System.setProperty(MAX_DELAY, "soon");
    System.setProperty(FACTOR, "0.5");
    System.setProperty(MAX_TIMES, "   ");

    final var defaults = BackoffDefaults.resolve();

    assertEquals(Duration.ofMillis(BackoffDefaults.DEFAULT_MIN_DELAY_MILLIS), defaults.minDelay());
    assertEquals(Duration.ofMillis(BackoffDefaults.DEFAULT_MAX_DELAY_MILLIS), defaults.maxDelay());
    assertEquals(BackoffDefaults.DEFAULT_FACTOR, defaults.factor());
    assertEquals(BackoffDefaults.DEFAULT_MAX_TIMES, defaults.maxTimes());
  }

  @Test
  @DisplayName("Should ignore non-finite factors")
  void shouldIgnoreNonFiniteFactor() {
    System.setProperty(FACTOR, "Infinity");

    assertEquals(BackoffDefaults.DEFAULT_FACTOR, BackoffDefaults.resolve().factor());
  }
}
