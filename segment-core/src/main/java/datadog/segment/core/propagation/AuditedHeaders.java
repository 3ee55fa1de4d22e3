package datadog.segment.core.propagation;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Records every header found, for extraction diagnostics. */
final class AuditedHeaders implements HeaderLookup {
  private final HeaderLookup delegate;
  private final List<Map.Entry<String, String>> headersExamined = new ArrayList<>(4);

  AuditedHeaders(HeaderLookup delegate) {
    this.delegate = delegate;
  }

  @Override
  public String get(String name) {
    String value = delegate.get(name);
    if (value != null) {
      headersExamined.add(new AbstractMap.SimpleImmutableEntry<>(name, value));
    }
    return value;
  }

  List<Map.Entry<String, String>> headersExamined() {
    return headersExamined;
  }
}
