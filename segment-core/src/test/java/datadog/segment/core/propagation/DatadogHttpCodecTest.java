package datadog.segment.core.propagation;

import static datadog.segment.core.propagation.DatadogHttpCodec.DATADOG_TAGS_KEY;
import static datadog.segment.core.propagation.DatadogHttpCodec.ORIGIN_KEY;
import static datadog.segment.core.propagation.DatadogHttpCodec.SAMPLING_PRIORITY_KEY;
import static datadog.segment.core.propagation.DatadogHttpCodec.SPAN_ID_KEY;
import static datadog.segment.core.propagation.DatadogHttpCodec.TRACE_ID_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.sampling.PrioritySampling;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DatadogHttpCodecTest {

  static ExtractedContext extract(Map<String, String> headers) throws ExtractionException {
    return extract(headers, 512);
  }

  static ExtractedContext extract(Map<String, String> headers, int tagsLimit)
      throws ExtractionException {
    return DatadogHttpCodec.newExtractor(tagsLimit)
        .extract(new ExtractionCache(headers, CarrierVisitor.forMap()));
  }

  @Test
  @DisplayName("extract: every header")
  void extractAll() throws ExtractionException {
    Map<String, String> headers = new HashMap<>();
    headers.put("X-Datadog-Trace-Id", "12345");
    headers.put(SPAN_ID_KEY, "18446744073709551615");
    headers.put(SAMPLING_PRIORITY_KEY, "2");
    headers.put(ORIGIN_KEY, "synthetics");
    headers.put(DATADOG_TAGS_KEY, "_dd.p.dm=-4,_dd.p.tid=640cfd8d00000000,other=x");

    ExtractedContext context = extract(headers);

    assertEquals(TracePropagationStyle.DATADOG, context.getPropagationStyle());
    assertEquals(DDTraceId.from(0x640cfd8d00000000L, 12345), context.getTraceId());
    assertEquals(-1L, context.getParentId());
    assertEquals(2, context.getSamplingPriority());
    assertEquals("synthetics", context.getOrigin());
    Map<String, String> expectedTags = new LinkedHashMap<>();
    expectedTags.put("_dd.p.dm", "-4");
    expectedTags.put("_dd.p.tid", "640cfd8d00000000");
    assertEquals(expectedTags, context.getTraceTags());
    assertTrue(context.getTags().isEmpty());
  }

  @Test
  @DisplayName("extract: nothing without headers")
  void extractNothing() throws ExtractionException {
    ExtractedContext context = extract(Collections.singletonMap("x-other", "1"));

    assertFalse(context.hasTraceId());
    assertEquals(PrioritySampling.UNSET, context.getSamplingPriority());
  }

  @Test
  @DisplayName("extract: zero trace id is no trace")
  void extractZeroTraceId() throws ExtractionException {
    assertFalse(extract(Collections.singletonMap(TRACE_ID_KEY, "0")).hasTraceId());
  }

  @Test
  @DisplayName("extract: malformed ids fail the extraction")
  void extractMalformedIds() {
    assertThrows(
        ExtractionException.class, () -> extract(Collections.singletonMap(TRACE_ID_KEY, "abc")));
    assertThrows(
        ExtractionException.class, () -> extract(Collections.singletonMap(SPAN_ID_KEY, "-1")));
    assertThrows(
        ExtractionException.class,
        () -> extract(Collections.singletonMap(SAMPLING_PRIORITY_KEY, "keep")));
  }

  @Test
  @DisplayName("extract: malformed high order bits are reported")
  void extractMalformedTid() throws ExtractionException {
    Map<String, String> headers = new HashMap<>();
    headers.put(TRACE_ID_KEY, "12345");
    headers.put(DATADOG_TAGS_KEY, "_dd.p.tid=XYZ,_dd.p.dm=-3");

    ExtractedContext context = extract(headers);

    assertEquals(DDTraceId.from(12345), context.getTraceId());
    assertNull(context.getTraceTags().get(DDTags.TRACE_ID_HIGH_ORDER_BITS));
    assertEquals("-3", context.getTraceTags().get(DDTags.DECISION_MAKER));
    assertEquals("malformed_tid XYZ", context.getTags().get(DDTags.PROPAGATION_ERROR));
  }

  @Test
  @DisplayName("extract: oversized tags header is ignored")
  void extractOversizedTags() throws ExtractionException {
    Map<String, String> headers = new HashMap<>();
    headers.put(TRACE_ID_KEY, "12345");
    headers.put(DATADOG_TAGS_KEY, "_dd.p.dm=-4");

    ExtractedContext context = extract(headers, 10);

    assertTrue(context.hasTraceId());
    assertTrue(context.getTraceTags().isEmpty());
    assertEquals("extract_max_size", context.getTags().get(DDTags.PROPAGATION_ERROR));
  }

  @Test
  @DisplayName("extract: undecodable tags header is ignored")
  void extractUndecodableTags() throws ExtractionException {
    Map<String, String> headers = new HashMap<>();
    headers.put(TRACE_ID_KEY, "12345");
    headers.put(DATADOG_TAGS_KEY, "_dd.p.dm");

    ExtractedContext context = extract(headers);

    assertTrue(context.getTraceTags().isEmpty());
    assertEquals("decoding_error", context.getTags().get(DDTags.PROPAGATION_ERROR));
  }

  @Test
  @DisplayName("inject: every header")
  void inject() {
    Map<String, String> carrier = new HashMap<>();
    InjectionContext context =
        new InjectionContext(
            DDTraceId.from(0x640cfd8d00000000L, 12345),
            67890,
            PrioritySampling.USER_KEEP,
            "synthetics",
            Collections.singletonMap("_dd.p.dm", "-4"),
            "_dd.p.dm=-4,_dd.p.tid=640cfd8d00000000",
            null,
            null,
            null);

    DatadogHttpCodec.newInjector().inject(context, carrier, CarrierSetter.forMap());

    Map<String, String> expected = new HashMap<>();
    expected.put(TRACE_ID_KEY, "12345");
    expected.put(SPAN_ID_KEY, "67890");
    expected.put(SAMPLING_PRIORITY_KEY, "2");
    expected.put(ORIGIN_KEY, "synthetics");
    expected.put(DATADOG_TAGS_KEY, "_dd.p.dm=-4,_dd.p.tid=640cfd8d00000000");
    assertEquals(expected, carrier);
  }

  @Test
  @DisplayName("inject: optional headers are omitted")
  void injectMinimal() {
    Map<String, String> carrier = new HashMap<>();
    InjectionContext context =
        new InjectionContext(
            DDTraceId.from(1),
            2,
            PrioritySampling.SAMPLER_DROP,
            null,
            null,
            null,
            null,
            null,
            null);

    DatadogHttpCodec.newInjector().inject(context, carrier, CarrierSetter.forMap());

    assertEquals(3, carrier.size());
    assertEquals("0", carrier.get(SAMPLING_PRIORITY_KEY));
  }
}
