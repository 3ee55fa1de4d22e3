package datadog.segment.core.propagation;

import java.util.Map;

/** Writes single valued headers into an outbound carrier. */
@FunctionalInterface
public interface CarrierSetter<C> {
  void set(C carrier, String key, String value);

  static CarrierSetter<Map<String, String>> forMap() {
    return Map::put;
  }
}
