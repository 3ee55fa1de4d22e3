package datadog.segment.common.sampling;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.segment.api.time.ControllableTimeSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SamplingRulesTest {
  private final ControllableTimeSource timeSource = new ControllableTimeSource();

  @Test
  @DisplayName("trace rules: all fields")
  void traceRules() {
    String json =
        "[{\"service\": \"web*\", \"name\": \"http.request\", \"resource\": \"GET /?\","
            + " \"tags\": {\"region\": \"us-*\"}, \"sample_rate\": 0.25},"
            + " {\"sample_rate\": 1}, {}]";

    List<SamplingRule.TraceSamplingRule> rules = SamplingRules.parseTraceRules(json);

    assertEquals(3, rules.size());
    SamplingRule.TraceSamplingRule first = rules.get(0);
    assertEquals("web*", first.getMatcher().getService());
    assertEquals("http.request", first.getMatcher().getName());
    assertEquals("GET /?", first.getMatcher().getResource());
    assertEquals(Collections.singletonMap("region", "us-*"), first.getMatcher().getTags());
    assertEquals(0.25, first.getSampleRate());
    assertEquals(1.0, rules.get(1).getSampleRate());
    // the sample rate defaults to keeping everything
    assertEquals(1.0, rules.get(2).getSampleRate());
    assertEquals("*", rules.get(2).getMatcher().getService());
  }

  @Test
  @DisplayName("trace rules: invalid rules are skipped")
  void invalidTraceRules() {
    String json =
        "[{\"service\": \"a\", \"sample_rate\": 1.5},"
            + " {\"service\": \"b\", \"sample_rate\": -0.1},"
            + " {\"service\": \"c\", \"sample_rate\": \"often\"},"
            + " {\"service\": \"e\", \"sample_rate\": \"NaN\"},"
            + " null,"
            + " {\"service\": \"d\", \"sample_rate\": 0.5}]";

    List<SamplingRule.TraceSamplingRule> rules = SamplingRules.parseTraceRules(json);

    assertEquals(1, rules.size());
    assertEquals("d", rules.get(0).getMatcher().getService());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "[]",
        "not json",
        "{\"service\": \"a\"}",
        "[{\"service\": \"a\", \"sample_rate\": 2}]"
      })
  @DisplayName("trace rules: unusable input gives no rules")
  void unusableTraceRules(String json) {
    assertTrue(SamplingRules.parseTraceRules(json).isEmpty());
  }

  @Test
  @DisplayName("span rules: max per second")
  void spanRules() {
    String json =
        "[{\"service\": \"db\", \"name\": \"query\", \"sample_rate\": 0.5, \"max_per_second\": 10},"
            + " {\"name\": \"cache.*\"},"
            + " {\"name\": \"bad\", \"max_per_second\": 0},"
            + " {\"name\": \"worse\", \"max_per_second\": \"lots\"}]";

    List<SamplingRule.SpanSamplingRule> rules = SamplingRules.parseSpanRules(json, timeSource);

    assertEquals(2, rules.size());
    assertEquals("db", rules.get(0).getMatcher().getService());
    assertEquals(0.5, rules.get(0).getSampleRate());
    assertEquals(10.0, rules.get(0).getRateLimiter().getMaxPerSecond());
    assertEquals("cache.*", rules.get(1).getMatcher().getName());
    assertEquals(1.0, rules.get(1).getSampleRate());
    assertNull(rules.get(1).getRateLimiter());
  }

  @Test
  @DisplayName("span rules: a fractional max per second keeps a span every other second")
  void fractionalMaxPerSecond() {
    SamplingRule.SpanSamplingRule rule =
        SamplingRules.parseSpanRules("[{\"max_per_second\": 0.5}]", timeSource).get(0);

    int allowed = 0;
    for (int i = 0; i < 60; i++) {
      timeSource.advance(SECONDS.toNanos(1));
      if (rule.getRateLimiter().tryAcquire()) {
        allowed++;
      }
    }

    assertEquals(30, allowed);
    assertEquals(0.5, rule.getRateLimiter().getMaxPerSecond());
  }

  @Test
  @DisplayName("span rules: read from a file")
  void spanRulesFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("span-rules.json");
    Files.write(
        file,
        "[{\"service\": \"svc\", \"sample_rate\": 0.1}]".getBytes(StandardCharsets.UTF_8));

    List<SamplingRule.SpanSamplingRule> rules =
        SamplingRules.parseSpanRulesFile(file.toString(), timeSource);

    assertEquals(1, rules.size());
    assertEquals(0.1, rules.get(0).getSampleRate());
  }

  @Test
  @DisplayName("span rules: missing file gives no rules")
  void missingSpanRulesFile(@TempDir Path dir) {
    assertTrue(
        SamplingRules.parseSpanRulesFile(dir.resolve("missing.json").toString(), timeSource)
            .isEmpty());
  }
}
