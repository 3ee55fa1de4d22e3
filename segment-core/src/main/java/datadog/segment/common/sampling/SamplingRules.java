package datadog.segment.common.sampling;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import datadog.segment.api.time.TimeSource;
import datadog.segment.core.util.RateLimiter;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import okio.Okio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads trace and span sampling rules from their JSON form, a list of objects such as:
 *
 * <pre>
 * [{"service": "web*", "name": "http.request", "resource": "GET /?", "tags": {"region": "us-*"},
 *   "sample_rate": 0.5, "max_per_second": 10}]
 * </pre>
 *
 * <p>Every field is optional. Rules with an invalid rate or limit are logged and skipped, the
 * others keep their order. Trace rules don't have a limit of their own.
 */
public final class SamplingRules {
  private static final Logger log = LoggerFactory.getLogger(SamplingRules.class);

  private static final Moshi MOSHI = new Moshi.Builder().build();
  private static final JsonAdapter<List<JsonRule>> RULES_ADAPTER =
      MOSHI.adapter(Types.newParameterizedType(List.class, JsonRule.class));
  private static final JsonAdapter<JsonRule> RULE_ADAPTER = MOSHI.adapter(JsonRule.class);

  public static List<SamplingRule.TraceSamplingRule> parseTraceRules(String json) {
    List<SamplingRule.TraceSamplingRule> rules = new ArrayList<>();
    for (JsonRule jsonRule : read(json, "trace")) {
      Double sampleRate = sampleRate(jsonRule, "trace");
      if (sampleRate != null) {
        rules.add(new SamplingRule.TraceSamplingRule(matcher(jsonRule), sampleRate));
      }
    }
    return Collections.unmodifiableList(rules);
  }

  public static List<SamplingRule.SpanSamplingRule> parseSpanRules(
      String json, TimeSource timeSource) {
    return spanRules(read(json, "span"), timeSource);
  }

  public static List<SamplingRule.SpanSamplingRule> parseSpanRulesFile(
      String jsonFile, TimeSource timeSource) {
    List<JsonRule> jsonRules = Collections.emptyList();
    try (JsonReader reader = JsonReader.of(Okio.buffer(Okio.source(new File(jsonFile))))) {
      jsonRules = nonNull(RULES_ADAPTER.fromJson(reader));
    } catch (FileNotFoundException e) {
      log.warn("Span sampling rules file {} doesn't exist", jsonFile);
    } catch (IOException | JsonDataException e) {
      log.error("Couldn't read span sampling rules from file {}", jsonFile, e);
    }
    return spanRules(jsonRules, timeSource);
  }

  private static List<SamplingRule.SpanSamplingRule> spanRules(
      List<JsonRule> jsonRules, TimeSource timeSource) {
    List<SamplingRule.SpanSamplingRule> rules = new ArrayList<>();
    for (JsonRule jsonRule : jsonRules) {
      Double sampleRate = sampleRate(jsonRule, "span");
      if (sampleRate == null) {
        continue;
      }
      RateLimiter rateLimiter = null;
      if (jsonRule.max_per_second != null) {
        double maxPerSecond;
        try {
          maxPerSecond = Double.parseDouble(jsonRule.max_per_second);
        } catch (NumberFormatException e) {
          logRuleError(jsonRule, "span", "max_per_second must be a number greater than 0.0");
          continue;
        }
        if (!(maxPerSecond > 0D) || Double.isInfinite(maxPerSecond)) {
          logRuleError(jsonRule, "span", "max_per_second must be greater than 0.0");
          continue;
        }
        rateLimiter = new RateLimiter(maxPerSecond, timeSource);
      }
      rules.add(new SamplingRule.SpanSamplingRule(matcher(jsonRule), sampleRate, rateLimiter));
    }
    return Collections.unmodifiableList(rules);
  }

  private static List<JsonRule> read(String json, String kind) {
    try {
      return nonNull(RULES_ADAPTER.fromJson(json));
    } catch (IOException | JsonDataException e) {
      log.error("Couldn't parse {} sampling rules from JSON: {}", kind, json, e);
      return Collections.emptyList();
    }
  }

  private static List<JsonRule> nonNull(List<JsonRule> jsonRules) {
    if (jsonRules == null) {
      return Collections.emptyList();
    }
    List<JsonRule> result = new ArrayList<>(jsonRules.size());
    for (JsonRule jsonRule : jsonRules) {
      if (jsonRule != null) {
        result.add(jsonRule);
      }
    }
    return result;
  }

  /** The rule's sample rate, 1 when absent, or {@code null} when invalid. */
  private static Double sampleRate(JsonRule jsonRule, String kind) {
    if (jsonRule.sample_rate == null) {
      return 1D;
    }
    double sampleRate;
    try {
      sampleRate = Double.parseDouble(jsonRule.sample_rate);
    } catch (NumberFormatException e) {
      logRuleError(jsonRule, kind, "sample_rate must be a number between 0.0 and 1.0");
      return null;
    }
    if (!(sampleRate >= 0D && sampleRate <= 1D)) {
      logRuleError(jsonRule, kind, "sample_rate must be between 0.0 and 1.0");
      return null;
    }
    return sampleRate;
  }

  private static SpanMatcher matcher(JsonRule jsonRule) {
    return new SpanMatcher(jsonRule.service, jsonRule.name, jsonRule.resource, jsonRule.tags);
  }

  private static void logRuleError(JsonRule jsonRule, String kind, String error) {
    log.error(
        "Skipping invalid {} sampling rule: {} - {}", kind, RULE_ADAPTER.toJson(jsonRule), error);
  }

  static final class JsonRule {
    String service;
    String name;
    String resource;
    Map<String, String> tags;
    // strings so that ints and doubles both map
    String sample_rate;
    String max_per_second;
  }

  private SamplingRules() {}
}
