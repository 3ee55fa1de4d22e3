package datadog.segment.common.sampling;

import static datadog.segment.api.config.TracerConfig.SPAN_SAMPLING_RULES;
import static datadog.segment.api.config.TracerConfig.SPAN_SAMPLING_RULES_FILE;

import datadog.segment.api.Config;
import datadog.segment.api.time.SystemTimeSource;
import datadog.segment.api.time.TimeSource;
import datadog.segment.core.SpanData;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Finds the rule that may keep a single span of a dropped trace. */
public interface SingleSpanSampler {

  /** Returns the first rule matching the span, or {@code null}. */
  SamplingRule.SpanSamplingRule match(SpanData span);

  final class Builder {
    private static final Logger log = LoggerFactory.getLogger(Builder.class);

    /** Returns {@code null} when no valid span sampling rule is configured. */
    public static SingleSpanSampler forConfig(Config config) {
      return forConfig(config, SystemTimeSource.INSTANCE);
    }

    public static SingleSpanSampler forConfig(Config config, TimeSource timeSource) {
      String spanSamplingRules = config.getSpanSamplingRules();
      String spanSamplingRulesFile = config.getSpanSamplingRulesFile();

      boolean spanSamplingRulesDefined = spanSamplingRules != null && !spanSamplingRules.isEmpty();
      boolean spanSamplingRulesFileDefined =
          spanSamplingRulesFile != null && !spanSamplingRulesFile.isEmpty();

      if (spanSamplingRulesDefined && spanSamplingRulesFileDefined) {
        log.warn(
            "Both {} and {} defined. {} will be ignored.",
            SPAN_SAMPLING_RULES,
            SPAN_SAMPLING_RULES_FILE,
            SPAN_SAMPLING_RULES_FILE);
      }

      List<SamplingRule.SpanSamplingRule> rules = Collections.emptyList();
      if (spanSamplingRulesDefined) {
        rules = SamplingRules.parseSpanRules(spanSamplingRules, timeSource);
      } else if (spanSamplingRulesFileDefined) {
        rules = SamplingRules.parseSpanRulesFile(spanSamplingRulesFile, timeSource);
      }
      return rules.isEmpty() ? null : new RuleBasedSingleSpanSampler(rules);
    }

    private Builder() {}
  }

  final class RuleBasedSingleSpanSampler implements SingleSpanSampler {
    private final List<SamplingRule.SpanSamplingRule> spanSamplingRules;

    public RuleBasedSingleSpanSampler(List<SamplingRule.SpanSamplingRule> spanSamplingRules) {
      if (spanSamplingRules == null) {
        throw new NullPointerException("Span sampling rules can't be null.");
      }
      this.spanSamplingRules = spanSamplingRules;
    }

    @Override
    public SamplingRule.SpanSamplingRule match(SpanData span) {
      for (SamplingRule.SpanSamplingRule rule : spanSamplingRules) {
        if (rule.matches(span)) {
          return rule;
        }
      }
      return null;
    }
  }
}
