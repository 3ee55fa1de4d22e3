package datadog.segment.core.propagation;

import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Reads the headers of an inbound carrier. A header present several times is visited once per
 * value, in the carrier's order.
 */
@FunctionalInterface
public interface CarrierVisitor<C> {
  void forEachKeyValue(C carrier, BiConsumer<String, String> visitor);

  static CarrierVisitor<Map<String, String>> forMap() {
    return (carrier, visitor) -> carrier.forEach(visitor);
  }
}
