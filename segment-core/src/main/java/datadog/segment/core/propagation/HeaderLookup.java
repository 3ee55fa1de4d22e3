package datadog.segment.core.propagation;

/** Case-insensitive header lookup, used by the extractors of each propagation style. */
public interface HeaderLookup {
  /**
   * Returns the header value, with the values of repeated headers joined with commas, or {@code
   * null} if the header is absent.
   *
   * @param name the lower-case header name
   */
  String get(String name);
}
