package datadog.segment.common.sampling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.segment.api.DDTraceId;
import datadog.segment.core.SpanData;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SpanMatcherTest {

  static SpanData span(String service, String name, String resource) {
    SpanData span = new SpanData(DDTraceId.from(1), 2, 0, name, service, 0, 0);
    span.setResourceName(resource);
    return span;
  }

  @Test
  @DisplayName("catch all matches every span")
  void catchAll() {
    assertTrue(SpanMatcher.CATCH_ALL.matches(span("svc", "op", "res")));
    assertTrue(SpanMatcher.CATCH_ALL.matches(span(null, null, null)));
    assertEquals("*", SpanMatcher.CATCH_ALL.getService());
    assertEquals("*", SpanMatcher.CATCH_ALL.getName());
    assertEquals("*", SpanMatcher.CATCH_ALL.getResource());
  }

  @Test
  @DisplayName("every pattern must match")
  void allPatterns() {
    SpanMatcher matcher = new SpanMatcher("web*", "http.request", "GET /?", null);

    assertTrue(matcher.matches(span("web-server", "http.request", "GET /a")));
    assertFalse(matcher.matches(span("db", "http.request", "GET /a")));
    assertFalse(matcher.matches(span("web-server", "http.client", "GET /a")));
    assertFalse(matcher.matches(span("web-server", "http.request", "GET /ab")));
    assertFalse(matcher.matches(span("web-server", "http.request", null)));
  }

  @Test
  @DisplayName("empty patterns match anything")
  void emptyPatterns() {
    SpanMatcher matcher = new SpanMatcher("", null, "", Collections.emptyMap());

    assertTrue(matcher.matches(span("svc", "op", null)));
  }

  @Test
  @DisplayName("tags: verbatim keys, glob values, missing tag never matches")
  void tags() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("http.status_code", "5??");
    tags.put("region", "*");
    SpanMatcher matcher = new SpanMatcher(null, null, null, tags);

    SpanData span = span("svc", "op", "res");
    span.setTag("http.status_code", "503");
    assertFalse(matcher.matches(span));

    span.setTag("region", "us-east-1");
    assertTrue(matcher.matches(span));

    span.setTag("http.status_code", "404");
    assertFalse(matcher.matches(span));
  }
}
