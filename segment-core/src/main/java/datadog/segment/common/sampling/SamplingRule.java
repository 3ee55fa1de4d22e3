package datadog.segment.common.sampling;

import datadog.segment.api.sampling.PrioritySampling;
import datadog.segment.api.sampling.SamplingMechanism;
import datadog.segment.core.SamplingDecision;
import datadog.segment.core.SpanData;
import datadog.segment.core.util.RateLimiter;

public abstract class SamplingRule {
  private final SpanMatcher matcher;
  private final DeterministicSampler sampler;

  public SamplingRule(final SpanMatcher matcher, final DeterministicSampler sampler) {
    this.matcher = matcher;
    this.sampler = sampler;
  }

  public boolean matches(final SpanData span) {
    return matcher.matches(span);
  }

  public boolean sample(final SpanData span) {
    return sampler.sample(span);
  }

  public SpanMatcher getMatcher() {
    return matcher;
  }

  public double getSampleRate() {
    return sampler.getSampleRate();
  }

  /** Samples whole traces on the trace id. The trace sampler applies its limiter afterwards. */
  public static final class TraceSamplingRule extends SamplingRule {
    public TraceSamplingRule(final SpanMatcher matcher, final double sampleRate) {
      super(matcher, new DeterministicSampler.TraceSampler(sampleRate));
    }
  }

  /** Keeps single spans of dropped traces, sampled on the span id and bounded by a limiter. */
  public static final class SpanSamplingRule extends SamplingRule {
    private final RateLimiter rateLimiter;

    /** @param rateLimiter {@code null} when the rule has no max per second */
    public SpanSamplingRule(
        final SpanMatcher matcher, final double sampleRate, final RateLimiter rateLimiter) {
      super(matcher, new DeterministicSampler.SpanSampler(sampleRate));
      this.rateLimiter = rateLimiter;
    }

    public SamplingDecision decide(final SpanData span) {
      Double maxPerSecond = rateLimiter == null ? null : rateLimiter.getMaxPerSecond();
      boolean keep = sample(span) && (rateLimiter == null || rateLimiter.tryAcquire());
      return new SamplingDecision(
          keep ? PrioritySampling.USER_KEEP : PrioritySampling.USER_DROP,
          (int) SamplingMechanism.SPAN_SAMPLING_RATE,
          SamplingDecision.Origin.LOCAL,
          getSampleRate(),
          null,
          maxPerSecond);
    }

    public RateLimiter getRateLimiter() {
      return rateLimiter;
    }
  }
}
