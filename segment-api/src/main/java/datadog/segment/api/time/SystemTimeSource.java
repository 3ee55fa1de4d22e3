package datadog.segment.api.time;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Wall clock nanoseconds derived from {@link System#nanoTime()} ticks relative to an anchor read
 * from the millisecond wall clock. The anchor is moved back in line with the wall clock once the
 * two drift apart by a millisecond or more, checked at most every {@code resyncPeriodSeconds}.
 */
public final class SystemTimeSource implements TimeSource {
  public static final TimeSource INSTANCE = new SystemTimeSource(30);

  private static final long MAX_DRIFT_NANOS = MILLISECONDS.toNanos(1);

  private final long resyncPeriodTicks;

  private static final class Anchor {
    final long epochNanos;
    final long ticks;

    Anchor(long epochNanos, long ticks) {
      this.epochNanos = epochNanos;
      this.ticks = ticks;
    }
  }

  private volatile Anchor anchor;

  SystemTimeSource(long resyncPeriodSeconds) {
    this.resyncPeriodTicks = Math.max(MAX_DRIFT_NANOS, SECONDS.toNanos(resyncPeriodSeconds));
    this.anchor = readAnchor();
  }

  @Override
  public long getNanoTicks() {
    return System.nanoTime();
  }

  @Override
  public long getCurrentTimeNanos() {
    long ticks = getNanoTicks();
    Anchor current = anchor;
    long elapsed = ticks - current.ticks;
    long nanos = current.epochNanos + Math.max(0, elapsed);
    if (elapsed >= resyncPeriodTicks) {
      Anchor fresh = readAnchor();
      long drift = nanos - (fresh.epochNanos + (ticks - fresh.ticks));
      if (Math.abs(drift) >= MAX_DRIFT_NANOS) {
        anchor = fresh;
        return fresh.epochNanos + Math.max(0, ticks - fresh.ticks);
      }
      // keep sub-millisecond precision, but don't check again before the next period
      anchor = new Anchor(current.epochNanos + elapsed, ticks);
    }
    return nanos;
  }

  private static Anchor readAnchor() {
    return new Anchor(MILLISECONDS.toNanos(System.currentTimeMillis()), System.nanoTime());
  }
}
