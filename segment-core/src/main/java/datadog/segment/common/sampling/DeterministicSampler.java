package datadog.segment.common.sampling;

import datadog.segment.core.SpanData;

/**
 * This implements the deterministic sampling algorithm used by the Datadog Agent as well as the
 * tracers for other languages
 */
public abstract class DeterministicSampler {

  /** Uses trace-id as a sampling id */
  public static final class TraceSampler extends DeterministicSampler {

    public TraceSampler(double rate) {
      super(rate);
    }

    @Override
    protected long getSamplingId(SpanData span) {
      return span.getTraceId().toLong();
    }
  }

  /** Uses span-id as a sampling id */
  public static final class SpanSampler extends DeterministicSampler {

    public SpanSampler(double rate) {
      super(rate);
    }

    @Override
    protected long getSamplingId(SpanData span) {
      return span.getSpanId();
    }
  }

  private static final long KNUTH_FACTOR = 1111111111111111111L;

  private static final double MAX = Math.pow(2, 64) - 1;

  private final double rate;
  private final long threshold;

  public DeterministicSampler(final double rate) {
    this.rate = rate;
    this.threshold = cutoff(rate);
  }

  public boolean sample(final SpanData span) {
    return sample(getSamplingId(span));
  }

  boolean sample(final long samplingId) {
    if (rate <= 0) {
      return false;
    }
    // unsigned 64 bit comparison with cutoff/threshold
    return samplingId * KNUTH_FACTOR + Long.MIN_VALUE <= threshold;
  }

  protected abstract long getSamplingId(SpanData span);

  public double getSampleRate() {
    return rate;
  }

  public static long cutoff(double rate) {
    if (rate < 0.5) {
      return (long) (rate * MAX) + Long.MIN_VALUE;
    }
    if (rate < 1.0) {
      return (long) ((rate * MAX) + Long.MIN_VALUE);
    }
    return Long.MAX_VALUE;
  }
}
