package datadog.segment.core.propagation;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Reads the carrier once so that every extraction style can look up headers cheaply. */
final class ExtractionCache implements HeaderLookup {
  private final Map<String, String> headers = new HashMap<>();

  <C> ExtractionCache(C carrier, CarrierVisitor<C> visitor) {
    visitor.forEachKeyValue(carrier, this::accept);
  }

  private void accept(String key, String value) {
    if (key == null || value == null) {
      return;
    }
    headers.merge(key.toLowerCase(Locale.ROOT), value, (first, next) -> first + ',' + next);
  }

  @Override
  public String get(String name) {
    return headers.get(name);
  }
}
