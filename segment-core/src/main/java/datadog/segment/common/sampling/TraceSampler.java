package datadog.segment.common.sampling;

import datadog.segment.api.Config;
import datadog.segment.api.time.SystemTimeSource;
import datadog.segment.api.time.TimeSource;
import datadog.segment.common.writer.RemoteResponseListener;
import datadog.segment.core.SamplingDecision;
import datadog.segment.core.SpanData;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a whole trace is kept. It also listens to the collector responses, which carry
 * the sample rates computed by the agent.
 */
public interface TraceSampler extends RemoteResponseListener {

  /**
   * Decides the sampling priority of the trace rooted at the given span.
   *
   * @param root the local root span of the trace
   * @return a {@link SamplingDecision.Origin#LOCAL local} decision, never {@code null}
   */
  SamplingDecision decide(SpanData root);

  final class Builder {
    private static final Logger log = LoggerFactory.getLogger(Builder.class);

    public static TraceSampler forConfig(final Config config) {
      return forConfig(config, SystemTimeSource.INSTANCE);
    }

    public static TraceSampler forConfig(final Config config, final TimeSource timeSource) {
      List<SamplingRule.TraceSamplingRule> traceSamplingRules = Collections.emptyList();
      if (config.getTraceSamplingRules() != null) {
        traceSamplingRules = SamplingRules.parseTraceRules(config.getTraceSamplingRules());
      }
      Double traceSampleRate = config.getTraceSampleRate();
      if (traceSampleRate != null && (traceSampleRate < 0 || traceSampleRate > 1)) {
        log.error("Ignoring trace sample rate {}, it must be between 0.0 and 1.0", traceSampleRate);
        traceSampleRate = null;
      }
      if (!traceSamplingRules.isEmpty() || traceSampleRate != null) {
        try {
          return RuleBasedTraceSampler.build(
              traceSamplingRules, traceSampleRate, config.getTraceRateLimit(), timeSource);
        } catch (final IllegalArgumentException e) {
          log.error("Invalid sampler configuration. Using agent rates only", e);
        }
      }
      return new RateByServiceTraceSampler();
    }

    private Builder() {}
  }
}
