package datadog.segment.api.time;

/** Source of both monotonic ticks, used for durations, and wall clock time, used for starts. */
public interface TimeSource {
  /** Monotonic nanosecond ticks, only meaningful relative to other ticks. */
  long getNanoTicks();

  /** Wall clock time in nanoseconds since the epoch. */
  long getCurrentTimeNanos();
}
