package datadog.segment.core.util;

public interface Matcher {
  boolean matches(String str);
}
