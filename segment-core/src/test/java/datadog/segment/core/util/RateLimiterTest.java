package datadog.segment.core.util;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.segment.api.time.ControllableTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RateLimiterTest {
  private ControllableTimeSource timeSource;

  @BeforeEach
  void setUp() {
    timeSource = new ControllableTimeSource();
    timeSource.set(SECONDS.toNanos(100));
  }

  @Test
  @DisplayName("starts with a full bucket")
  void burst() {
    RateLimiter limiter = new RateLimiter(2, timeSource);

    assertTrue(limiter.tryAcquire());
    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
    assertEquals(2.0, limiter.getMaxPerSecond());
  }

  @Test
  @DisplayName("refills continuously")
  void refill() {
    RateLimiter limiter = new RateLimiter(2, timeSource);
    limiter.tryAcquire();
    limiter.tryAcquire();

    timeSource.advance(MILLISECONDS.toNanos(250));
    assertFalse(limiter.tryAcquire());

    timeSource.advance(MILLISECONDS.toNanos(250));
    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
  }

  @Test
  @DisplayName("never holds more than one second of tokens")
  void capacity() {
    RateLimiter limiter = new RateLimiter(3, timeSource);

    timeSource.advance(SECONDS.toNanos(60));

    int allowed = 0;
    for (int i = 0; i < 10; i++) {
      if (limiter.tryAcquire()) {
        allowed++;
      }
    }
    assertEquals(3, allowed);
  }

  @Test
  @DisplayName("fractional rates allow one request per refill")
  void fractionalRate() {
    RateLimiter limiter = new RateLimiter(0.5, timeSource);

    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());

    int allowed = 0;
    for (int i = 0; i < 60; i++) {
      timeSource.advance(SECONDS.toNanos(1));
      if (limiter.tryAcquire()) {
        allowed++;
      }
    }
    assertEquals(30, allowed);

    // an idle minute still leaves a single token
    timeSource.advance(SECONDS.toNanos(60));
    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
  }

  @Test
  @DisplayName("effective rate averages ten windows")
  void effectiveRate() {
    RateLimiter limiter = new RateLimiter(1, timeSource);
    assertEquals(1.0, limiter.effectiveRate(), 1e-9);

    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
    assertEquals((0.25 + 9) / 10, limiter.effectiveRate(), 1e-9);

    // the window closes, the next one starts empty
    timeSource.advance(SECONDS.toNanos(1));
    assertTrue(limiter.tryAcquire());
    assertEquals((0.25 + 1.0 + 8) / 10, limiter.effectiveRate(), 1e-9);
  }

  @Test
  @DisplayName("rejects non positive rates")
  void invalidRate() {
    assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, timeSource));
    assertThrows(IllegalArgumentException.class, () -> new RateLimiter(-1, timeSource));
  }
}
