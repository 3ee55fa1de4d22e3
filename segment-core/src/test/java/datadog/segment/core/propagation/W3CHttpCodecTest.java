package datadog.segment.core.propagation;

import static datadog.segment.core.propagation.W3CHttpCodec.TRACE_PARENT_KEY;
import static datadog.segment.core.propagation.W3CHttpCodec.TRACE_STATE_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

class W3CHttpCodecTest {
  static final String TRACE_PARENT = "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";

  static ExtractedContext extract(String traceParent, String traceState)
      throws ExtractionException {
    Map<String, String> headers = new HashMap<>();
    if (traceParent != null) {
      headers.put(TRACE_PARENT_KEY, traceParent);
    }
    if (traceState != null) {
      headers.put(TRACE_STATE_KEY, traceState);
    }
    return W3CHttpCodec.newExtractor()
        .extract(new ExtractionCache(headers, CarrierVisitor.forMap()));
  }

  @Test
  @DisplayName("extract: traceparent")
  void extractTraceParent() throws ExtractionException {
    ExtractedContext context = extract(TRACE_PARENT, null);

    assertEquals(TracePropagationStyle.TRACECONTEXT, context.getPropagationStyle());
    assertEquals(DDTraceId.fromHex("4bf92f3577b34da6a3ce929d0e0e4736"), context.getTraceId());
    assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", context.getFullW3CTraceIdHex());
    assertEquals(0x00f067aa0ba902b7L, context.getParentId());
    assertEquals(1, context.getSamplingPriority());
    assertTrue(context.getTags().isEmpty());
  }

  @Test
  @DisplayName("extract: nothing without traceparent")
  void extractNothing() throws ExtractionException {
    ExtractedContext context = extract(null, "dd=s:2");

    assertFalse(context.hasTraceId());
    assertTrue(context.getTags().isEmpty());
  }

  @Test
  @DisplayName("extract: later versions may add fields")
  void extractFutureVersion() throws ExtractionException {
    ExtractedContext context =
        extract("01-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-00-whatever", null);

    assertTrue(context.hasTraceId());
    assertEquals(0, context.getSamplingPriority());
  }

  static Stream<Arguments> invalidTraceParents() {
    return Stream.of(
        Arguments.of(
            "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7", "malformed_traceparent"),
        Arguments.of(
            "00-4BF92F3577B34DA6A3CE929D0E0E4736-00f067aa0ba902b7-01", "malformed_traceparent"),
        Arguments.of(
            "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01x", "malformed_traceparent"),
        Arguments.of(
            "00_4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01", "malformed_traceparent"),
        Arguments.of("garbage", "malformed_traceparent"),
        Arguments.of("ff-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01", "invalid_version"),
        Arguments.of("00-00000000000000000000000000000000-00f067aa0ba902b7-01", "trace_id_zero"),
        Arguments.of("00-4bf92f3577b34da6a3ce929d0e0e4736-0000000000000000-01", "parent_id_zero"));
  }

  @ParameterizedTest
  @MethodSource("invalidTraceParents")
  @DisplayName("extract: invalid traceparent")
  void extractInvalidTraceParent(String traceParent, String error) throws ExtractionException {
    ExtractedContext context = extract(traceParent, "dd=s:2;o:synthetics");

    assertFalse(context.hasTraceId());
    assertNull(context.getOrigin());
    assertEquals(Collections.singletonMap(DDTags.W3C_EXTRACTION_ERROR, error), context.getTags());
  }

  @Test
  @DisplayName("extract: tracestate of other vendors is kept around the dd entry")
  void extractTraceState() throws ExtractionException {
    ExtractedContext context = extract(TRACE_PARENT, "foo=1,dd=s:1;o:synthetics;t.dm:-4,bar=2");

    assertEquals("foo=1,bar=2", context.getAdditionalW3CTracestate());
    assertEquals("synthetics", context.getOrigin());
    assertEquals(1, context.getSamplingPriority());
    assertEquals(Collections.singletonMap("_dd.p.dm", "-4"), context.getTraceTags());
    assertNull(context.getAdditionalDatadogW3CTracestate());
    assertNull(context.getDatadogW3CParentId());
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "dd=s:1,foo=1|foo=1",
        "foo=1,dd=s:1|foo=1",
        "foo=1,bar=2|foo=1,bar=2",
        "dd=s:1|",
        "dd=s:1,dd=s:2|dd=s:2"
      })
  @DisplayName("extract: additional tracestate")
  void extractAdditionalTraceState(String traceState, String expected) throws ExtractionException {
    assertEquals(expected, extract(TRACE_PARENT, traceState).getAdditionalW3CTracestate());
  }

  @Test
  @DisplayName("extract: dd tracestate fields")
  void extractDatadogFields() throws ExtractionException {
    ExtractedContext context =
        extract(TRACE_PARENT, "dd=s:2;p:000000000000002a;t.usr:a~b;x:1;y:2");

    assertEquals(2, context.getSamplingPriority());
    assertEquals("000000000000002a", context.getDatadogW3CParentId());
    assertEquals("a=b", context.getTraceTags().get("_dd.p.usr"));
    assertEquals("x:1;y:2", context.getAdditionalDatadogW3CTracestate());
  }

  @ParameterizedTest
  @CsvSource({
    // the sampled flag wins unless the dd priority agrees with it
    "01, 2, 2",
    "01, -1, 1",
    "00, -1, -1",
    "00, 2, 0",
    "01, junk, 1"
  })
  @DisplayName("extract: sampling priority")
  void extractSamplingPriority(String flags, String priority, int expected)
      throws ExtractionException {
    String traceParent = "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-" + flags;

    assertEquals(expected, extract(traceParent, "dd=s:" + priority).getSamplingPriority());
  }

  @Test
  @DisplayName("inject: 128 bit trace id and dd tracestate")
  void inject() {
    Map<String, String> traceTags = new LinkedHashMap<>();
    traceTags.put("_dd.p.dm", "-4");
    traceTags.put("_dd.p.usr", "a=b");
    traceTags.put("other", "x");
    InjectionContext context =
        new InjectionContext(
            DDTraceId.from(0x640cfd8d00000000L, 1),
            0x00f067aa0ba902b7L,
            2,
            "syn,th=x;y",
            traceTags,
            null,
            null,
            "foo=1",
            "x:1");
    Map<String, String> carrier = new HashMap<>();

    W3CHttpCodec.newInjector().inject(context, carrier, CarrierSetter.forMap());

    assertEquals(
        "00-640cfd8d000000000000000000000001-00f067aa0ba902b7-01", carrier.get(TRACE_PARENT_KEY));
    assertEquals(
        "dd=s:2;p:00f067aa0ba902b7;o:syn_th_x_y;t.dm:-4;t.usr:a~b;x:1,foo=1",
        carrier.get(TRACE_STATE_KEY));
  }

  @Test
  @DisplayName("inject: extracted trace id is kept verbatim")
  void injectFullTraceIdHex() {
    InjectionContext context =
        new InjectionContext(
            DDTraceId.from(42),
            3,
            0,
            null,
            null,
            null,
            "0000000000000000000000000000002a",
            null,
            null);

    assertEquals(
        "00-0000000000000000000000000000002a-0000000000000003-00",
        W3CHttpCodec.encodeTraceParent(context));
    assertEquals("dd=s:0;p:0000000000000003", W3CHttpCodec.encodeTraceState(context));
  }

  @Test
  @DisplayName("inject: dd entry is capped by dropping trailing fields")
  void injectCappedTraceState() {
    StringBuilder big = new StringBuilder();
    for (int i = 0; i < 250; i++) {
      big.append('a');
    }
    Map<String, String> traceTags = new LinkedHashMap<>();
    traceTags.put("_dd.p.dm", "-4");
    traceTags.put("_dd.p.big", big.toString());
    InjectionContext context =
        new InjectionContext(
            DDTraceId.from(42), 3, 1, null, traceTags, null, null, "foo=1", null);

    assertEquals(
        "dd=s:1;p:0000000000000003;t.dm:-4,foo=1", W3CHttpCodec.encodeTraceState(context));
  }

  @Test
  @DisplayName("inject: tilde in a trace tag value is replaced")
  void injectTildeInTagValue() throws ExtractionException {
    InjectionContext context =
        new InjectionContext(
            DDTraceId.from(42),
            2,
            1,
            "o~k",
            Collections.singletonMap("_dd.p.usr", "a~b=c"),
            null,
            null,
            null,
            null);

    String traceState = W3CHttpCodec.encodeTraceState(context);

    assertEquals("dd=s:1;p:0000000000000002;o:o~k;t.usr:a_b~c", traceState);
    ExtractedContext extracted = extract(W3CHttpCodec.encodeTraceParent(context), traceState);
    assertEquals("a_b=c", extracted.getTraceTags().get("_dd.p.usr"));
  }

  @Test
  @DisplayName("inject then extract")
  void roundTrip() throws ExtractionException {
    InjectionContext injected =
        new InjectionContext(
            DDTraceId.from(7, 42),
            99,
            2,
            "rum",
            Collections.singletonMap("_dd.p.dm", "-3"),
            null,
            null,
            "foo=1",
            null);
    Map<String, String> carrier = new HashMap<>();
    W3CHttpCodec.newInjector().inject(injected, carrier, CarrierSetter.forMap());

    ExtractedContext extracted =
        extract(carrier.get(TRACE_PARENT_KEY), carrier.get(TRACE_STATE_KEY));

    assertEquals(DDTraceId.from(7, 42), extracted.getTraceId());
    assertEquals(99L, extracted.getParentId());
    assertEquals(2, extracted.getSamplingPriority());
    assertEquals("rum", extracted.getOrigin());
    assertEquals("-3", extracted.getTraceTags().get("_dd.p.dm"));
    assertEquals("foo=1", extracted.getAdditionalW3CTracestate());
    assertEquals("0000000000000063", extracted.getDatadogW3CParentId());
  }
}
