package datadog.segment.common.sampling;

import datadog.segment.api.sampling.PrioritySampling;
import datadog.segment.api.sampling.SamplingMechanism;
import datadog.segment.api.time.TimeSource;
import datadog.segment.core.SamplingDecision;
import datadog.segment.core.SpanData;
import datadog.segment.core.util.RateLimiter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies the first matching trace sampling rule. Traces kept by a rule then go through a global
 * rate limiter. Traces no rule matches are left to the agent rates.
 */
public class RuleBasedTraceSampler implements TraceSampler {

  private final List<SamplingRule.TraceSamplingRule> samplingRules;
  private final TraceSampler fallbackSampler;
  private final RateLimiter rateLimiter;

  public RuleBasedTraceSampler(
      final List<SamplingRule.TraceSamplingRule> samplingRules,
      final RateLimiter rateLimiter,
      final TraceSampler fallbackSampler) {
    this.samplingRules = samplingRules;
    this.fallbackSampler = fallbackSampler;
    this.rateLimiter = rateLimiter;
  }

  /**
   * @param traceSamplingRules the configured rules, in priority order
   * @param defaultRate the global trace sample rate, applied as a rule matching every trace after
   *     the configured ones, or {@code null}
   * @param rateLimit the maximum number of traces kept by rules per second
   */
  public static RuleBasedTraceSampler build(
      final List<SamplingRule.TraceSamplingRule> traceSamplingRules,
      final Double defaultRate,
      final int rateLimit,
      final TimeSource timeSource) {
    final List<SamplingRule.TraceSamplingRule> samplingRules = new ArrayList<>();
    if (traceSamplingRules != null) {
      samplingRules.addAll(traceSamplingRules);
    }
    if (defaultRate != null) {
      samplingRules.add(new SamplingRule.TraceSamplingRule(SpanMatcher.CATCH_ALL, defaultRate));
    }
    return new RuleBasedTraceSampler(
        samplingRules, new RateLimiter(rateLimit, timeSource), new RateByServiceTraceSampler());
  }

  @Override
  public SamplingDecision decide(final SpanData root) {
    SamplingRule.TraceSamplingRule matchedRule = null;

    for (final SamplingRule.TraceSamplingRule samplingRule : samplingRules) {
      if (samplingRule.matches(root)) {
        matchedRule = samplingRule;
        break;
      }
    }

    if (matchedRule == null) {
      return fallbackSampler.decide(root);
    }

    double rate = matchedRule.getSampleRate();
    if (!matchedRule.sample(root)) {
      return SamplingDecision.local(
          PrioritySampling.USER_DROP, SamplingMechanism.LOCAL_USER_RULE, rate);
    }
    boolean allowed = rateLimiter.tryAcquire();
    return new SamplingDecision(
        allowed ? PrioritySampling.USER_KEEP : PrioritySampling.USER_DROP,
        (int) SamplingMechanism.LOCAL_USER_RULE,
        SamplingDecision.Origin.LOCAL,
        rate,
        rateLimiter.effectiveRate(),
        rateLimiter.getMaxPerSecond());
  }

  @Override
  public void onResponse(String endpoint, Map<String, Map<String, Number>> responseJson) {
    fallbackSampler.onResponse(endpoint, responseJson);
  }
}
