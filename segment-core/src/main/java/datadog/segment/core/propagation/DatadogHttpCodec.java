package datadog.segment.core.propagation;

import static datadog.segment.api.TracePropagationStyle.DATADOG;

import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.internal.util.LongStringUtils;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A codec designed for HTTP transport via headers using Datadog headers */
class DatadogHttpCodec {
  private static final Logger log = LoggerFactory.getLogger(DatadogHttpCodec.class);

  static final String TRACE_ID_KEY = "x-datadog-trace-id";
  static final String SPAN_ID_KEY = "x-datadog-parent-id";
  static final String SAMPLING_PRIORITY_KEY = "x-datadog-sampling-priority";
  static final String ORIGIN_KEY = "x-datadog-origin";
  static final String DATADOG_TAGS_KEY = "x-datadog-tags";

  static final String PROPAGATION_ERROR_EXTRACT_MAX_SIZE = "extract_max_size";
  static final String PROPAGATION_ERROR_DECODING_ERROR = "decoding_error";
  static final String PROPAGATION_ERROR_MALFORMED_TID = "malformed_tid ";

  private DatadogHttpCodec() {
    // This class should not be created.
  }

  public static HttpCodec.Injector newInjector() {
    return Injector.INSTANCE;
  }

  public static HttpCodec.Extractor newExtractor(int datadogTagsLimit) {
    return new Extractor(datadogTagsLimit);
  }

  private static class Injector implements HttpCodec.Injector {
    static final Injector INSTANCE = new Injector();

    @Override
    public <C> void inject(
        final InjectionContext context, final C carrier, final CarrierSetter<C> setter) {
      setter.set(carrier, TRACE_ID_KEY, context.getTraceId().toString());
      setter.set(carrier, SPAN_ID_KEY, DDSpanId.toString(context.getSpanId()));
      setter.set(carrier, SAMPLING_PRIORITY_KEY, String.valueOf(context.getSamplingPriority()));
      injectOriginAndTags(context, carrier, setter);
    }
  }

  /** Writes the headers Datadog style shares with the B3 style. */
  static <C> void injectOriginAndTags(
      final InjectionContext context, final C carrier, final CarrierSetter<C> setter) {
    final String origin = context.getOrigin();
    if (origin != null) {
      setter.set(carrier, ORIGIN_KEY, origin);
    }
    final String datadogTags = context.getDatadogTagsHeader();
    if (datadogTags != null) {
      setter.set(carrier, DATADOG_TAGS_KEY, datadogTags);
    }
  }

  private static class Extractor implements HttpCodec.Extractor {
    private final int datadogTagsLimit;

    Extractor(int datadogTagsLimit) {
      this.datadogTagsLimit = datadogTagsLimit;
    }

    @Override
    public TracePropagationStyle style() {
      return DATADOG;
    }

    @Override
    public ExtractedContext extract(HeaderLookup headers) throws ExtractionException {
      ExtractedContext context = new ExtractedContext(DATADOG);

      String traceId = headers.get(TRACE_ID_KEY);
      if (traceId != null) {
        try {
          context.setTraceId(DDTraceId.from(traceId.trim()));
        } catch (NumberFormatException e) {
          throw new ExtractionException(
              "Could not extract Datadog-style trace ID from " + TRACE_ID_KEY + ": " + traceId, e);
        }
      }

      String parentId = headers.get(SPAN_ID_KEY);
      if (parentId != null) {
        try {
          context.setParentId(DDSpanId.from(parentId.trim()));
        } catch (NumberFormatException e) {
          throw new ExtractionException(
              "Could not extract Datadog-style parent span ID from "
                  + SPAN_ID_KEY
                  + ": "
                  + parentId,
              e);
        }
      }

      String samplingPriority = headers.get(SAMPLING_PRIORITY_KEY);
      if (samplingPriority != null) {
        try {
          context.setSamplingPriority(Integer.parseInt(samplingPriority.trim()));
        } catch (NumberFormatException e) {
          throw new ExtractionException(
              "Could not extract Datadog-style sampling priority from "
                  + SAMPLING_PRIORITY_KEY
                  + ": "
                  + samplingPriority,
              e);
        }
      }

      String origin = headers.get(ORIGIN_KEY);
      if (origin != null) {
        context.setOrigin(origin);
      }

      String datadogTags = headers.get(DATADOG_TAGS_KEY);
      if (datadogTags != null) {
        extractTraceTags(context, datadogTags);
      }
      return context;
    }

    private void extractTraceTags(ExtractedContext context, String value) {
      if (value.length() > datadogTagsLimit) {
        log.warn(
            "Ignoring {} header of {} characters, the limit is {}",
            DATADOG_TAGS_KEY,
            value.length(),
            datadogTagsLimit);
        context.putTag(DDTags.PROPAGATION_ERROR, PROPAGATION_ERROR_EXTRACT_MAX_SIZE);
        return;
      }
      Map<String, String> decoded;
      try {
        decoded = DatadogTags.decode(value);
      } catch (IllegalArgumentException e) {
        log.warn(e.getMessage());
        context.putTag(DDTags.PROPAGATION_ERROR, PROPAGATION_ERROR_DECODING_ERROR);
        return;
      }
      for (Map.Entry<String, String> entry : decoded.entrySet()) {
        String key = entry.getKey();
        String tagValue = entry.getValue();
        if (!DatadogTags.isPropagated(key)) {
          continue;
        }
        if (DDTags.TRACE_ID_HIGH_ORDER_BITS.equals(key)) {
          Long highOrderBits = parseHighOrderBits(tagValue);
          if (highOrderBits == null) {
            context.putTag(DDTags.PROPAGATION_ERROR, PROPAGATION_ERROR_MALFORMED_TID + tagValue);
            continue;
          }
          // Only applies when the low order bits were already extracted
          if (context.hasTraceId()) {
            context.setTraceId(context.getTraceId().withHighOrderBits(highOrderBits));
          }
        }
        context.putTraceTag(key, tagValue);
      }
    }
  }

  /** Parses exactly 16 hex digits, or returns {@code null}. */
  static Long parseHighOrderBits(String value) {
    if (value.length() != 16) {
      return null;
    }
    try {
      return LongStringUtils.parseUnsignedLongHex(value, 0, 16, false);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
