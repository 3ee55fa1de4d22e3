package datadog.segment.api.internal.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LongStringUtilsTest {

  @ParameterizedTest
  @CsvSource({
    "0, 0",
    "f, 15",
    "FF, 255",
    "7fffffffffffffff, 9223372036854775807",
    "ffffffffffffffff, -1"
  })
  void parseUnsignedLongHex(String hex, long expected) {
    assertEquals(expected, LongStringUtils.parseUnsignedLongHex(hex));
  }

  @Test
  void parseUnsignedLongHexRejectsInvalidInput() {
    assertThrows(NumberFormatException.class, () -> LongStringUtils.parseUnsignedLongHex(null));
    assertThrows(NumberFormatException.class, () -> LongStringUtils.parseUnsignedLongHex(""));
    assertThrows(
        NumberFormatException.class,
        () -> LongStringUtils.parseUnsignedLongHex("10000000000000000"));
    assertThrows(
        NumberFormatException.class, () -> LongStringUtils.parseUnsignedLongHex("AB", 0, 2, true));
    assertThrows(
        NumberFormatException.class, () -> LongStringUtils.parseUnsignedLongHex("ab", 1, 2, true));
  }

  @Test
  void parseUnsignedLong() {
    assertEquals(-1L, LongStringUtils.parseUnsignedLong("18446744073709551615"));
    assertEquals(1234L, LongStringUtils.parseUnsignedLong("1234"));
    assertThrows(NumberFormatException.class, () -> LongStringUtils.parseUnsignedLong(null));
    assertThrows(
        NumberFormatException.class,
        () -> LongStringUtils.parseUnsignedLong("99999999999999999999"));
  }

  @Test
  void toHexStringPadded() {
    assertEquals("000000000000002a", LongStringUtils.toHexStringPadded(42, 16));
    assertEquals("ffffffffffffffff", LongStringUtils.toHexStringPadded(-1, 16));
    assertEquals(
        "0000000000000001000000000000002a", LongStringUtils.toHexStringPadded(1, 42, 32));
    assertEquals("000000000000002a", LongStringUtils.toHexStringPadded(1, 42, 16));
  }
}
