package datadog.segment.common.sampling;

import datadog.segment.core.SpanData;
import datadog.segment.core.util.Matcher;
import datadog.segment.core.util.Matchers;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Selects spans by service, operation name, resource and tags. Each is a glob pattern where
 * <code>*</code> matches any run of characters and <code>?</code> exactly one. Tag keys are
 * compared verbatim, and a span lacking a tag never matches a pattern on it.
 */
public final class SpanMatcher {
  public static final SpanMatcher CATCH_ALL = new SpanMatcher(null, null, null, null);

  private final String service;
  private final String name;
  private final String resource;
  private final Map<String, String> tags;

  private final Matcher serviceMatcher;
  private final Matcher nameMatcher;
  private final Matcher resourceMatcher;
  private final Map<String, Matcher> tagMatchers;

  public SpanMatcher(String service, String name, String resource, Map<String, String> tags) {
    this.service = normalizeGlob(service);
    this.name = normalizeGlob(name);
    this.resource = normalizeGlob(resource);
    this.tags = tags == null ? Collections.emptyMap() : Collections.unmodifiableMap(tags);

    this.serviceMatcher = Matchers.compileGlob(this.service);
    this.nameMatcher = Matchers.compileGlob(this.name);
    this.resourceMatcher = Matchers.compileGlob(this.resource);
    Map<String, Matcher> matchers = new LinkedHashMap<>();
    for (Map.Entry<String, String> tag : this.tags.entrySet()) {
      matchers.put(tag.getKey(), Matchers.compileGlob(normalizeGlob(tag.getValue())));
    }
    this.tagMatchers = matchers;
  }

  /** Missing patterns match anything. */
  static String normalizeGlob(String glob) {
    return glob == null || glob.isEmpty() ? "*" : glob;
  }

  public boolean matches(SpanData span) {
    if (!serviceMatcher.matches(span.getServiceName())
        || !nameMatcher.matches(span.getOperationName())
        || !resourceMatcher.matches(span.getResourceName())) {
      return false;
    }
    for (Map.Entry<String, Matcher> tag : tagMatchers.entrySet()) {
      String value = span.getTag(tag.getKey());
      if (value == null || !tag.getValue().matches(value)) {
        return false;
      }
    }
    return true;
  }

  public String getService() {
    return service;
  }

  public String getName() {
    return name;
  }

  public String getResource() {
    return resource;
  }

  public Map<String, String> getTags() {
    return tags;
  }

  @Override
  public String toString() {
    return "SpanMatcher{"
        + "service='"
        + service
        + '\''
        + ", name='"
        + name
        + '\''
        + ", resource='"
        + resource
        + '\''
        + ", tags="
        + tags
        + '}';
  }
}
