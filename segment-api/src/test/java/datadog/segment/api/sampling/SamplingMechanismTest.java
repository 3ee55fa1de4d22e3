package datadog.segment.api.sampling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class SamplingMechanismTest {

  @Test
  @DisplayName("decision maker tag round trip")
  void decisionMaker() {
    assertEquals("-3", SamplingMechanism.toDecisionMaker(SamplingMechanism.LOCAL_USER_RULE));
    assertEquals(Integer.valueOf(4), SamplingMechanism.fromDecisionMaker("-4"));
    assertEquals(Integer.valueOf(0), SamplingMechanism.fromDecisionMaker("-0"));
  }

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "-", "4", "--4", "-x", "-4a"})
  @DisplayName("malformed decision maker")
  void malformedDecisionMaker(String value) {
    assertNull(SamplingMechanism.fromDecisionMaker(value));
  }
}
