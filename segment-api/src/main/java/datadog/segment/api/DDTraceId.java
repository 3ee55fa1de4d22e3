package datadog.segment.api;

import datadog.segment.api.internal.util.LongStringUtils;
import java.util.Locale;

/**
 * Class encapsulating the id used for TraceIds.
 *
 * <p>A TraceId is made of 64 low order bits and optional 64 high order bits. A 64-bit TraceId has
 * its {@link #toHighOrderLong() high order bits} set to <code>0</code>. The string representations
 * are either kept from parsing, or generated on demand and cached.
 */
public final class DDTraceId {
  /** Invalid TraceId value used to denote no TraceId. */
  public static final DDTraceId ZERO = new DDTraceId(0, 0, "0", null);

  private final long highOrderBits;
  private final long lowOrderBits;

  /** The 64-bit only decimal {@link String} representation. */
  private String str;

  /** The lower-case, zero-padded, 32 hexadecimal characters {@link String} representation. */
  private String hexStr;

  private DDTraceId(long highOrderBits, long lowOrderBits, String str, String hexStr) {
    this.highOrderBits = highOrderBits;
    this.lowOrderBits = lowOrderBits;
    this.str = str;
    this.hexStr = hexStr;
  }

  /**
   * Create a new 64-bit TraceId from the given {@code long} interpreted as the bits of the unsigned
   * 64-bit id. This means that values larger than {@link Long#MAX_VALUE} will be represented as
   * negative numbers.
   */
  public static DDTraceId from(long id) {
    return new DDTraceId(0, id, null, null);
  }

  /** Create a new 128-bit TraceId from its high order and low order bits. */
  public static DDTraceId from(long highOrderBits, long lowOrderBits) {
    return new DDTraceId(highOrderBits, lowOrderBits, null, null);
  }

  /**
   * Create a new 64-bit TraceId from the given unsigned decimal {@link String} representation.
   *
   * @throws NumberFormatException If the given {@link String} does not represent a valid number.
   */
  public static DDTraceId from(String s) throws NumberFormatException {
    return new DDTraceId(0, LongStringUtils.parseUnsignedLong(s), s, null);
  }

  /**
   * Create a new TraceId from the given hexadecimal representation of at most 32 characters.
   * Values longer than 16 characters carry high order bits.
   *
   * @throws NumberFormatException If the given {@link String} is not valid hexadecimal.
   */
  public static DDTraceId fromHex(String s) throws NumberFormatException {
    return fromHex(s, 0, s == null ? 0 : s.length(), false);
  }

  /**
   * Create a new TraceId from a hexadecimal section of the given {@link String}.
   *
   * @param s The string containing the hexadecimal representation.
   * @param start The start index of the section to parse.
   * @param length The length of the section, 32 characters maximum.
   * @param lowerCaseOnly Whether the hexadecimal characters must be lower-case.
   * @throws NumberFormatException If the section is not valid hexadecimal.
   */
  public static DDTraceId fromHex(String s, int start, int length, boolean lowerCaseOnly)
      throws NumberFormatException {
    if (s == null) {
      throw new NumberFormatException("s can't be null");
    }
    if (start < 0 || length <= 0 || length > 32 || start + length > s.length()) {
      throw new NumberFormatException("Illegal start or length for trace id " + s);
    }
    long highOrderBits;
    long lowOrderBits;
    if (length > 16) {
      int highOrderLength = length - 16;
      highOrderBits =
          LongStringUtils.parseUnsignedLongHex(s, start, highOrderLength, lowerCaseOnly);
      lowOrderBits =
          LongStringUtils.parseUnsignedLongHex(s, start + highOrderLength, 16, lowerCaseOnly);
    } else {
      highOrderBits = 0;
      lowOrderBits = LongStringUtils.parseUnsignedLongHex(s, start, length, lowerCaseOnly);
    }
    String hexStr = null;
    if (length == 32) {
      hexStr = s.substring(start, start + 32).toLowerCase(Locale.ROOT);
    }
    return new DDTraceId(highOrderBits, lowOrderBits, null, hexStr);
  }

  /** Returns a copy of this TraceId with the given high order bits. */
  public DDTraceId withHighOrderBits(long highOrderBits) {
    return new DDTraceId(highOrderBits, lowOrderBits, str, null);
  }

  public boolean is128Bit() {
    return highOrderBits != 0;
  }

  /**
   * Returns the id as a long representing the bits of the low order unsigned 64 bits. Values larger
   * than {@link Long#MAX_VALUE} are represented as negative numbers.
   */
  public long toLong() {
    return lowOrderBits;
  }

  /** Returns the high order 64 bits, <code>0</code> for a 64-bit TraceId. */
  public long toHighOrderLong() {
    return highOrderBits;
  }

  /** Returns the lower-case non-zero-padded hexadecimal representation of the whole id. */
  public String toHexString() {
    if (highOrderBits == 0) {
      return Long.toHexString(lowOrderBits);
    }
    return Long.toHexString(highOrderBits) + LongStringUtils.toHexStringPadded(lowOrderBits, 16);
  }

  /**
   * Returns the lower-case zero-padded hexadecimal representation. A size up to 16 gives the 16
   * character low order bits, a larger size gives the full 32 character id.
   */
  public String toHexStringPadded(int size) {
    if (size <= 16) {
      return LongStringUtils.toHexStringPadded(lowOrderBits, 16);
    }
    String hexString = this.hexStr;
    // This race condition is intentional and benign.
    // The worst that can happen is that an identical value is produced and written into the field.
    if (hexString == null) {
      this.hexStr = hexString = LongStringUtils.toHexStringPadded(highOrderBits, lowOrderBits, 32);
    }
    return hexString;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DDTraceId)) return false;
    DDTraceId ddId = (DDTraceId) o;
    return this.highOrderBits == ddId.highOrderBits && this.lowOrderBits == ddId.lowOrderBits;
  }

  @Override
  public int hashCode() {
    return (int)
        (this.highOrderBits
            ^ (this.highOrderBits >>> 32)
            ^ this.lowOrderBits
            ^ (this.lowOrderBits >>> 32));
  }

  /** Returns the cached 64-bit only decimal representation. */
  @Override
  public String toString() {
    String s = this.str;
    // This race condition is intentional and benign.
    if (s == null) {
      this.str = s = Long.toUnsignedString(this.lowOrderBits);
    }
    return s;
  }
}
