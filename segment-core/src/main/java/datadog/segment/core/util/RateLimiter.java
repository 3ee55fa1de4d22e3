package datadog.segment.core.util;

import datadog.segment.api.time.SystemTimeSource;
import datadog.segment.api.time.TimeSource;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket rate limiter. The bucket refills continuously at {@code maxPerSecond} and holds at
 * most {@code maxPerSecond} tokens, never less than one so that fractional rates still let
 * requests through. It also tracks the fraction of allowed requests over the last ten one second
 * windows, reported as the {@link #effectiveRate() effective rate}.
 */
public class RateLimiter {
  private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);
  private static final int PREVIOUS_WINDOWS = 9;

  private final TimeSource timeSource;
  private final double maxPerSecond;
  private final double nanosPerToken;
  private final double capacity;

  private double tokens;
  private long lastRefillTicks;

  private final double[] previousRates = new double[PREVIOUS_WINDOWS];
  private int previousRatesHead;
  private long windowStartTicks;
  private int allowedInWindow;
  private int totalInWindow;

  public RateLimiter(double maxPerSecond) {
    this(maxPerSecond, SystemTimeSource.INSTANCE);
  }

  public RateLimiter(double maxPerSecond, TimeSource timeSource) {
    if (maxPerSecond <= 0) {
      throw new IllegalArgumentException("maxPerSecond must be positive: " + maxPerSecond);
    }
    this.timeSource = timeSource;
    this.maxPerSecond = maxPerSecond;
    this.nanosPerToken = WINDOW_NANOS / maxPerSecond;
    this.capacity = Math.max(1.0, maxPerSecond);
    this.tokens = capacity;
    this.lastRefillTicks = timeSource.getNanoTicks();
    this.windowStartTicks = lastRefillTicks;
    for (int i = 0; i < PREVIOUS_WINDOWS; i++) {
      previousRates[i] = 1.0;
    }
  }

  /** Takes a token if one is available. */
  public synchronized boolean tryAcquire() {
    long now = timeSource.getNanoTicks();
    refill(now);
    advanceWindows(now);
    ++totalInWindow;
    if (tokens >= 1) {
      tokens -= 1;
      ++allowedInWindow;
      return true;
    }
    return false;
  }

  /**
   * The fraction of requests allowed, averaged over the current window and the nine previous
   * ones. Windows without any request count as fully allowed.
   */
  public synchronized double effectiveRate() {
    double sum = currentRate();
    for (double rate : previousRates) {
      sum += rate;
    }
    return sum / (PREVIOUS_WINDOWS + 1);
  }

  public double getMaxPerSecond() {
    return maxPerSecond;
  }

  private void refill(long now) {
    long elapsed = now - lastRefillTicks;
    if (elapsed > 0) {
      tokens = Math.min(capacity, tokens + elapsed / nanosPerToken);
      lastRefillTicks = now;
    }
  }

  private void advanceWindows(long now) {
    long elapsedWindows = (now - windowStartTicks) / WINDOW_NANOS;
    if (elapsedWindows <= 0) {
      return;
    }
    pushPreviousRate(currentRate());
    // windows with no traffic at all
    for (long i = 1; i < elapsedWindows && i <= PREVIOUS_WINDOWS; i++) {
      pushPreviousRate(1.0);
    }
    windowStartTicks += elapsedWindows * WINDOW_NANOS;
    allowedInWindow = 0;
    totalInWindow = 0;
  }

  private void pushPreviousRate(double rate) {
    previousRates[previousRatesHead] = rate;
    previousRatesHead = (previousRatesHead + 1) % PREVIOUS_WINDOWS;
  }

  private double currentRate() {
    return totalInWindow == 0 ? 1.0 : (double) allowedInWindow / totalInWindow;
  }
}
