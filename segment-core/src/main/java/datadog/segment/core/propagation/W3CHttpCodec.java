package datadog.segment.core.propagation;

import static datadog.segment.api.TracePropagationStyle.TRACECONTEXT;

import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.internal.util.LongStringUtils;
import datadog.segment.api.sampling.PrioritySampling;
import java.util.Map;

/**
 * A codec designed for HTTP transport via headers using W3C Trace Context.
 *
 * @see <a href="https://www.w3.org/TR/trace-context/">W3C Trace Context</a>
 */
class W3CHttpCodec {

  static final String TRACE_PARENT_KEY = "traceparent";
  static final String TRACE_STATE_KEY = "tracestate";

  static final String ERROR_MALFORMED_TRACEPARENT = "malformed_traceparent";
  static final String ERROR_INVALID_VERSION = "invalid_version";
  static final String ERROR_TRACE_ID_ZERO = "trace_id_zero";
  static final String ERROR_PARENT_ID_ZERO = "parent_id_zero";

  /** Placeholder for the Datadog parent id when the last upstream span was not a Datadog one. */
  static final String ZERO_PARENT_ID = "0000000000000000";

  // <version:2>-<trace-id:32>-<parent-id:16>-<flags:2>
  private static final int TRACE_ID_OFFSET = 3;
  private static final int PARENT_ID_OFFSET = 36;
  private static final int FLAGS_OFFSET = 53;
  private static final int TRACE_PARENT_LENGTH = 55;

  private static final int MAX_DATADOG_TRACESTATE_LENGTH = 256;

  private W3CHttpCodec() {
    // This class should not be created.
  }

  public static HttpCodec.Injector newInjector() {
    return Injector.INSTANCE;
  }

  public static HttpCodec.Extractor newExtractor() {
    return Extractor.INSTANCE;
  }

  private static class Injector implements HttpCodec.Injector {
    static final Injector INSTANCE = new Injector();

    @Override
    public <C> void inject(
        final InjectionContext context, final C carrier, final CarrierSetter<C> setter) {
      setter.set(carrier, TRACE_PARENT_KEY, encodeTraceParent(context));
      setter.set(carrier, TRACE_STATE_KEY, encodeTraceState(context));
    }
  }

  static String encodeTraceParent(InjectionContext context) {
    String traceId = context.getFullW3CTraceIdHex();
    if (traceId == null) {
      traceId = context.getTraceId().toHexStringPadded(32);
    }
    return "00-"
        + traceId
        + '-'
        + DDSpanId.toHexStringPadded(context.getSpanId())
        + (context.getSamplingPriority() > 0 ? "-01" : "-00");
  }

  static String encodeTraceState(InjectionContext context) {
    StringBuilder dd = new StringBuilder(64);
    dd.append("dd=s:")
        .append(context.getSamplingPriority())
        .append(";p:")
        .append(DDSpanId.toHexStringPadded(context.getSpanId()));

    String origin = context.getOrigin();
    if (origin != null) {
      dd.append(";o:");
      appendSanitized(dd, origin, false);
    }

    Map<String, String> traceTags = context.getTraceTags();
    if (traceTags != null) {
      for (Map.Entry<String, String> tag : traceTags.entrySet()) {
        String key = tag.getKey();
        if (!key.startsWith(DDTags.PROPAGATED_TAG_PREFIX)) {
          continue;
        }
        dd.append(";t.");
        appendSanitized(dd, key.substring(DDTags.PROPAGATED_TAG_PREFIX.length()), false);
        dd.append(':');
        appendSanitized(dd, tag.getValue(), true);
      }
    }

    String additionalDatadog = context.getAdditionalDatadogW3CTracestate();
    if (additionalDatadog != null && !additionalDatadog.isEmpty()) {
      dd.append(';').append(additionalDatadog);
    }

    // Drop whole trailing fields until the dd entry fits
    while (dd.length() > MAX_DATADOG_TRACESTATE_LENGTH) {
      int lastSeparator = dd.lastIndexOf(";");
      if (lastSeparator < 0) {
        break;
      }
      dd.setLength(lastSeparator);
    }

    String additional = context.getAdditionalW3CTracestate();
    if (additional != null && !additional.isEmpty()) {
      dd.append(',').append(additional);
    }
    return dd.toString();
  }

  /**
   * Appends the value with the characters that are not allowed in a <code>dd</code> tracestate
   * field replaced by <code>_</code>. Values of trace tags encode <code>=</code> as <code>~</code>,
   * so a <code>~</code> of their own is replaced as well.
   */
  private static void appendSanitized(StringBuilder sb, String value, boolean tagValue) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (tagValue && c == '=') {
        sb.append('~');
      } else if (c < 0x20
          || c > 0x7e
          || c == ','
          || c == ';'
          || c == '='
          || (tagValue && c == '~')) {
        sb.append('_');
      } else {
        sb.append(c);
      }
    }
  }

  private static class Extractor implements HttpCodec.Extractor {
    static final Extractor INSTANCE = new Extractor();

    @Override
    public TracePropagationStyle style() {
      return TRACECONTEXT;
    }

    @Override
    public ExtractedContext extract(HeaderLookup headers) {
      ExtractedContext context = new ExtractedContext(TRACECONTEXT);
      String traceParent = headers.get(TRACE_PARENT_KEY);
      if (traceParent == null) {
        return context;
      }
      String error = extractTraceParent(context, traceParent.trim());
      if (error != null) {
        ExtractedContext failed = new ExtractedContext(TRACECONTEXT);
        failed.putTag(DDTags.W3C_EXTRACTION_ERROR, error);
        return failed;
      }
      String traceState = headers.get(TRACE_STATE_KEY);
      if (traceState != null) {
        extractTraceState(context, traceState.trim());
      }
      return context;
    }
  }

  /**
   * Reads the trace parent into the context.
   *
   * @return the extraction error, or {@code null} on success
   */
  static String extractTraceParent(ExtractedContext context, String traceParent) {
    if (!isWellFormed(traceParent)) {
      return ERROR_MALFORMED_TRACEPARENT;
    }
    if (traceParent.startsWith("ff")) {
      return ERROR_INVALID_VERSION;
    }
    String traceIdHex = traceParent.substring(TRACE_ID_OFFSET, TRACE_ID_OFFSET + 32);
    DDTraceId traceId = DDTraceId.fromHex(traceParent, TRACE_ID_OFFSET, 32, true);
    if (traceId.toLong() == 0 && traceId.toHighOrderLong() == 0) {
      return ERROR_TRACE_ID_ZERO;
    }
    long parentId = DDSpanId.fromHex(traceParent, PARENT_ID_OFFSET, 16, true);
    if (parentId == DDSpanId.ZERO) {
      return ERROR_PARENT_ID_ZERO;
    }
    long flags = LongStringUtils.parseUnsignedLongHex(traceParent, FLAGS_OFFSET, 2, true);
    context.setTraceId(traceId);
    context.setFullW3CTraceIdHex(traceIdHex);
    context.setParentId(parentId);
    context.setSamplingPriority((int) (flags & 1));
    return null;
  }

  /**
   * Checks the fixed grammar of <code>version-traceid-parentid-flags</code>, lower-case hex only.
   * Further fields are allowed after a trailing <code>-</code>.
   */
  private static boolean isWellFormed(String traceParent) {
    int length = traceParent.length();
    if (length < TRACE_PARENT_LENGTH
        || (length > TRACE_PARENT_LENGTH && traceParent.charAt(TRACE_PARENT_LENGTH) != '-')) {
      return false;
    }
    for (int i = 0; i < TRACE_PARENT_LENGTH; i++) {
      char c = traceParent.charAt(i);
      if (i == TRACE_ID_OFFSET - 1 || i == PARENT_ID_OFFSET - 1 || i == FLAGS_OFFSET - 1) {
        if (c != '-') {
          return false;
        }
      } else if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
        return false;
      }
    }
    return true;
  }

  static void extractTraceState(ExtractedContext context, String traceState) {
    int length = traceState.length();
    int pairStart = 0;
    while (pairStart < length) {
      int pairEnd = traceState.indexOf(',', pairStart);
      if (pairEnd < 0) {
        pairEnd = length;
      }
      String pair = traceState.substring(pairStart, pairEnd).trim();
      int separator = pair.indexOf('=');
      if (separator >= 0 && "dd".equals(pair.substring(0, separator))) {
        // Entries of other vendors around the first dd entry, without a stray comma
        String others;
        if (pairStart > 0) {
          others = traceState.substring(0, pairStart - 1) + traceState.substring(pairEnd);
        } else if (pairEnd < length) {
          others = traceState.substring(pairEnd + 1);
        } else {
          others = "";
        }
        if (!others.isEmpty()) {
          context.setAdditionalW3CTracestate(others);
        }
        extractDatadogTraceState(context, pair.substring(separator + 1));
        return;
      }
      pairStart = pairEnd + 1;
    }
    if (!traceState.isEmpty()) {
      context.setAdditionalW3CTracestate(traceState);
    }
  }

  private static void extractDatadogTraceState(ExtractedContext context, String value) {
    StringBuilder additional = null;
    int length = value.length();
    int fieldStart = 0;
    while (fieldStart < length) {
      int fieldEnd = value.indexOf(';', fieldStart);
      if (fieldEnd < 0) {
        fieldEnd = length;
      }
      String field = value.substring(fieldStart, fieldEnd);
      fieldStart = fieldEnd + 1;
      int separator = field.indexOf(':');
      if (separator < 0) {
        continue;
      }
      String key = field.substring(0, separator);
      String fieldValue = field.substring(separator + 1);
      if ("o".equals(key)) {
        context.setOrigin(fieldValue);
      } else if ("s".equals(key)) {
        int priority;
        try {
          priority = Integer.parseInt(fieldValue);
        } catch (NumberFormatException e) {
          continue;
        }
        // traceparent's sampled flag wins unless both agree
        int current = context.getSamplingPriority();
        if (current == PrioritySampling.UNSET
            || (current > 0) == (priority > 0)) {
          context.setSamplingPriority(priority);
        }
      } else if ("p".equals(key)) {
        context.setDatadogW3CParentId(fieldValue);
      } else if (key.startsWith("t.")) {
        context.putTraceTag(
            DDTags.PROPAGATED_TAG_PREFIX + key.substring(2), fieldValue.replace('~', '='));
      } else {
        if (additional == null) {
          additional = new StringBuilder(field.length());
        } else {
          additional.append(';');
        }
        additional.append(field);
      }
    }
    if (additional != null) {
      context.setAdditionalDatadogW3CTracestate(additional.toString());
    }
  }
}
