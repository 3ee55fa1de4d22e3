package datadog.segment.api.internal.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Utility class with common parsing and {@code String} creation methods used for Trace and Span
 * ids.
 */
public final class LongStringUtils {

  // Don't allow instances
  private LongStringUtils() {}

  private static final long MAX_FIRST_PART = 0x1999999999999999L; // Max unsigned 64 bits / 10

  private static final byte[] HEX_DIGITS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  /**
   * Parse the given decimal {@code String} as an unsigned 64 bit value.
   *
   * @param s the decimal representation
   * @return the bits of the unsigned value, values above {@link Long#MAX_VALUE} are negative
   * @throws NumberFormatException if the value is empty, signed, not decimal or out of range
   */
  public static long parseUnsignedLong(String s) throws NumberFormatException {
    if (s == null) {
      throw new NumberFormatException("null");
    }

    int len = s.length();
    if (len == 0) {
      throw new NumberFormatException("Empty input string");
    }
    char firstChar = s.charAt(0);
    if (firstChar == '-' || firstChar == '+') {
      throw new NumberFormatException(
          String.format("Illegal leading sign on unsigned string %s.", s));
    }
    if (len <= 18) { // Signed 64 bits max is 19 digits, so this always fits
      return Long.parseLong(s);
    } else if (len > 20) { // Unsigned 64 bits max is 20 digits, so this always overflows
      throw numberFormatOutOfLongRange(s);
    }
    // Now do the first part and the last character
    long first = 0;
    int ok = 0;
    for (int i = 0; i < len - 1; i++) {
      int d = Character.digit(s.charAt(i), 10);
      ok |= d;
      first = first * 10 + d;
    }
    int last = Character.digit(s.charAt(len - 1), 10);
    ok |= last;
    if (ok < 0) {
      throw new NumberFormatException("Illegal character in " + s);
    }
    if (first < 0 || first > MAX_FIRST_PART) {
      throw numberFormatOutOfLongRange(s);
    }
    long guard = first * 10;
    long result = guard + last;
    if (guard < 0 && result >= 0) {
      throw numberFormatOutOfLongRange(s);
    }
    return result;
  }

  public static long parseUnsignedLongHex(String s) throws NumberFormatException {
    return parseUnsignedLongHex(s, 0, s == null ? 0 : s.length(), false);
  }

  /**
   * Parse a hexadecimal section of the given {@code String} as an unsigned 64 bit value.
   *
   * @param s the string holding the hexadecimal value
   * @param start the start index of the value
   * @param len the number of characters to parse, at most 16
   * @param lowerCaseOnly whether upper case hex digits are rejected
   * @return the bits of the unsigned value
   * @throws NumberFormatException if the section is empty, too long or not hexadecimal
   */
  public static long parseUnsignedLongHex(String s, int start, int len, boolean lowerCaseOnly)
      throws NumberFormatException {
    if (s == null) {
      throw new NumberFormatException("s can't be null");
    }
    if (len <= 0 || len > 16 || start < 0 || start + len > s.length()) {
      throw new NumberFormatException(
          "Illegal start or length for hex value '" + s + "': " + start + ", " + len);
    }
    long result = 0;
    for (int i = start; i < start + len; i++) {
      char c = s.charAt(i);
      int d;
      if (c >= '0' && c <= '9') {
        d = c - '0';
      } else if (c >= 'a' && c <= 'f') {
        d = c - 'a' + 10;
      } else if (!lowerCaseOnly && c >= 'A' && c <= 'F') {
        d = c - 'A' + 10;
      } else {
        throw new NumberFormatException("Illegal character in hex value " + s);
      }
      result = (result << 4) | d;
    }
    return result;
  }

  /**
   * Returns the zero padded lower case hex representation of the given 64 bit value. The size is
   * rounded to 16 or 32 characters.
   */
  public static String toHexStringPadded(long id, int size) {
    return toHexStringPadded(0, id, size);
  }

  /**
   * Returns the zero padded lower case hex representation of the given 128 bit value. The size is
   * rounded to 16 or 32 characters, and the high order bits are ignored for a size of 16.
   */
  public static String toHexStringPadded(long highOrderBits, long lowOrderBits, int size) {
    if (size > 16) {
      size = 32;
    } else {
      size = 16;
    }
    byte[] bytes = new byte[size];
    Arrays.fill(bytes, (byte) '0');
    fillHex(bytes, size, lowOrderBits);
    if (size == 32) {
      fillHex(bytes, 16, highOrderBits);
    }
    return new String(bytes, StandardCharsets.US_ASCII);
  }

  private static void fillHex(byte[] bytes, int end, long value) {
    long remaining = value;
    for (int i = 1; i <= 16 && remaining != 0; i++) {
      bytes[end - i] = HEX_DIGITS[(int) (remaining & 0xF)];
      remaining >>>= 4;
    }
  }

  private static NumberFormatException numberFormatOutOfLongRange(String s) {
    return new NumberFormatException(
        String.format("String value %s exceeds range of unsigned long.", s));
  }
}
