package datadog.segment.api.time;

/** A {@link TimeSource} that only moves when told to, for tests. Ticks and wall clock agree. */
public class ControllableTimeSource implements TimeSource {
  private volatile long currentTime = 0;

  public void advance(long nanosIncrement) {
    currentTime += nanosIncrement;
  }

  public void set(long nanos) {
    currentTime = nanos;
  }

  @Override
  public long getNanoTicks() {
    return currentTime;
  }

  @Override
  public long getCurrentTimeNanos() {
    return currentTime;
  }
}
