package datadog.segment.api;

import datadog.segment.api.internal.util.LongStringUtils;

/**
 * Span ids are unsigned 64 bit values held in a {@code long}. Datadog headers carry them in
 * decimal, B3 and W3C headers in hex.
 */
public final class DDSpanId {
  /** No span, for instance the parent of a root span. */
  public static final long ZERO = 0;

  /** Parses an unsigned decimal id. */
  public static long from(String s) throws NumberFormatException {
    return LongStringUtils.parseUnsignedLong(s);
  }

  /** Parses an unsigned hex id of 1 to 16 digits, in either case. */
  public static long fromHex(String s) throws NumberFormatException {
    return LongStringUtils.parseUnsignedLongHex(s);
  }

  /**
   * Parses the {@code len} hex digits of {@code s} starting at {@code start}.
   *
   * @param lowerCaseOnly whether upper case digits are rejected
   */
  public static long fromHex(String s, int start, int len, boolean lowerCaseOnly)
      throws NumberFormatException {
    return LongStringUtils.parseUnsignedLongHex(s, start, len, lowerCaseOnly);
  }

  public static String toString(long id) {
    return Long.toUnsignedString(id);
  }

  /** Lower case hex without leading zeros. */
  public static String toHexString(long id) {
    return Long.toHexString(id);
  }

  /** Lower case hex, zero padded to 16 digits. */
  public static String toHexStringPadded(long id) {
    return LongStringUtils.toHexStringPadded(id, 16);
  }

  private DDSpanId() {}
}
