package datadog.segment.common.sampling;

import static datadog.segment.api.config.TracerConfig.SPAN_SAMPLING_RULES;
import static datadog.segment.api.config.TracerConfig.SPAN_SAMPLING_RULES_FILE;
import static datadog.segment.api.config.TracerConfig.TRACE_RATE_LIMIT;
import static datadog.segment.api.config.TracerConfig.TRACE_SAMPLE_RATE;
import static datadog.segment.api.config.TracerConfig.TRACE_SAMPLING_RULES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import datadog.segment.api.Config;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.sampling.PrioritySampling;
import datadog.segment.api.sampling.SamplingMechanism;
import datadog.segment.api.time.ControllableTimeSource;
import datadog.segment.core.SamplingDecision;
import datadog.segment.core.SpanData;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SamplerBuilderTest {

  static Config config(String... keyValues) {
    Properties properties = new Properties();
    for (int i = 0; i < keyValues.length; i += 2) {
      properties.setProperty(keyValues[i], keyValues[i + 1]);
    }
    return Config.get(properties);
  }

  static SpanData span(String service, String name) {
    return new SpanData(DDTraceId.from(42), 7, 0, name, service, 0, 0);
  }

  @Test
  @DisplayName("trace sampler: agent rates without rules nor rate")
  void agentRatesOnly() {
    assertInstanceOf(
        RateByServiceTraceSampler.class,
        TraceSampler.Builder.forConfig(config(TRACE_RATE_LIMIT, "10")));
  }

  @Test
  @DisplayName("trace sampler: rules from a global rate")
  void globalRate() {
    TraceSampler sampler = TraceSampler.Builder.forConfig(config(TRACE_SAMPLE_RATE, "0"));

    assertInstanceOf(RuleBasedTraceSampler.class, sampler);
    assertEquals(PrioritySampling.USER_DROP, sampler.decide(span("svc", "op")).getPriority());
  }

  @Test
  @DisplayName("trace sampler: rules from JSON")
  void jsonRules() {
    TraceSampler sampler =
        TraceSampler.Builder.forConfig(
            config(TRACE_SAMPLING_RULES, "[{\"name\": \"op\", \"sample_rate\": 1}]"));

    assertInstanceOf(RuleBasedTraceSampler.class, sampler);
    SamplingDecision decision = sampler.decide(span("svc", "op"));
    assertEquals(PrioritySampling.USER_KEEP, decision.getPriority());
    assertEquals(Integer.valueOf(SamplingMechanism.LOCAL_USER_RULE), decision.getMechanism());
  }

  @Test
  @DisplayName("trace sampler: out of range global rate is ignored")
  void invalidGlobalRate() {
    assertInstanceOf(
        RateByServiceTraceSampler.class,
        TraceSampler.Builder.forConfig(config(TRACE_SAMPLE_RATE, "1.5")));
  }

  @Test
  @DisplayName("trace sampler: invalid rate limit falls back to agent rates")
  void invalidRateLimit() {
    assertInstanceOf(
        RateByServiceTraceSampler.class,
        TraceSampler.Builder.forConfig(config(TRACE_SAMPLE_RATE, "0.5", TRACE_RATE_LIMIT, "0")));
  }

  @Test
  @DisplayName("span sampler: none without rules")
  void noSpanSampler() {
    assertNull(SingleSpanSampler.Builder.forConfig(config(TRACE_RATE_LIMIT, "10")));
    assertNull(SingleSpanSampler.Builder.forConfig(config(SPAN_SAMPLING_RULES, "[]")));
  }

  @Test
  @DisplayName("span sampler: first matching rule")
  void spanSamplerMatch() {
    SingleSpanSampler sampler =
        SingleSpanSampler.Builder.forConfig(
            config(
                SPAN_SAMPLING_RULES,
                "[{\"service\": \"db\", \"sample_rate\": 0.5},"
                    + " {\"service\": \"d*\", \"max_per_second\": 1}]"),
            new ControllableTimeSource());

    assertNotNull(sampler);
    SamplingRule.SpanSamplingRule rule = sampler.match(span("db", "query"));
    assertEquals(0.5, rule.getSampleRate());
    assertNull(rule.getRateLimiter());

    SamplingRule.SpanSamplingRule other = sampler.match(span("dns", "lookup"));
    assertEquals(1.0, other.getSampleRate());
    assertEquals(1.0, other.getRateLimiter().getMaxPerSecond());

    assertNull(sampler.match(span("web", "request")));
  }

  @Test
  @DisplayName("span sampler: rule decisions are bounded by the rule's limiter")
  void spanRuleDecision() {
    SingleSpanSampler sampler =
        SingleSpanSampler.Builder.forConfig(
            config(SPAN_SAMPLING_RULES, "[{\"max_per_second\": 1}]"),
            new ControllableTimeSource());
    SpanData span = span("svc", "op");
    SamplingRule.SpanSamplingRule rule = sampler.match(span);

    SamplingDecision kept = rule.decide(span);
    assertEquals(PrioritySampling.USER_KEEP, kept.getPriority());
    assertEquals(Integer.valueOf(SamplingMechanism.SPAN_SAMPLING_RATE), kept.getMechanism());
    assertEquals(Double.valueOf(1.0), kept.getConfiguredRate());
    assertEquals(Double.valueOf(1.0), kept.getLimiterMaxPerSecond());

    assertEquals(PrioritySampling.USER_DROP, rule.decide(span).getPriority());
  }

  @Test
  @DisplayName("span sampler: inline rules win over the rules file")
  void inlineRulesWin(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("rules.json");
    Files.write(file, "[{\"service\": \"file\"}]".getBytes(StandardCharsets.UTF_8));

    SingleSpanSampler sampler =
        SingleSpanSampler.Builder.forConfig(
            config(
                SPAN_SAMPLING_RULES,
                "[{\"service\": \"inline\"}]",
                SPAN_SAMPLING_RULES_FILE,
                file.toString()));

    assertNotNull(sampler.match(span("inline", "op")));
    assertNull(sampler.match(span("file", "op")));
  }

  @Test
  @DisplayName("span sampler: rules file")
  void rulesFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("rules.json");
    Files.write(file, "[{\"service\": \"file\"}]".getBytes(StandardCharsets.UTF_8));

    SingleSpanSampler sampler =
        SingleSpanSampler.Builder.forConfig(config(SPAN_SAMPLING_RULES_FILE, file.toString()));

    assertSame(SingleSpanSampler.RuleBasedSingleSpanSampler.class, sampler.getClass());
    assertNotNull(sampler.match(span("file", "op")));
  }
}
