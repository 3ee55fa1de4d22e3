package datadog.segment.core.propagation;

import static datadog.segment.api.TracePropagationStyle.B3MULTI;

import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.sampling.PrioritySampling;

/**
 * A codec designed for HTTP transport via headers using Zipkin B3 multi headers.
 *
 * @see <a href="https://github.com/openzipkin/b3-propagation#multiple-headers">B3 multiple
 *     headers</a>
 */
class B3HttpCodec {

  static final String TRACE_ID_KEY = "x-b3-traceid";
  static final String SPAN_ID_KEY = "x-b3-spanid";
  static final String SAMPLED_KEY = "x-b3-sampled";

  private B3HttpCodec() {
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
      DDTraceId traceId = context.getTraceId();
      setter.set(
          carrier,
          TRACE_ID_KEY,
          traceId.is128Bit() ? traceId.toHexStringPadded(32) : traceId.toHexString());
      setter.set(carrier, SPAN_ID_KEY, DDSpanId.toHexString(context.getSpanId()));
      setter.set(carrier, SAMPLED_KEY, context.getSamplingPriority() > 0 ? "1" : "0");
      DatadogHttpCodec.injectOriginAndTags(context, carrier, setter);
    }
  }

  private static class Extractor implements HttpCodec.Extractor {
    static final Extractor INSTANCE = new Extractor();

    @Override
    public TracePropagationStyle style() {
      return B3MULTI;
    }

    @Override
    public ExtractedContext extract(HeaderLookup headers) throws ExtractionException {
      ExtractedContext context = new ExtractedContext(B3MULTI);

      String traceId = headers.get(TRACE_ID_KEY);
      if (traceId != null) {
        try {
          context.setTraceId(DDTraceId.fromHex(traceId.trim()));
        } catch (NumberFormatException e) {
          throw new ExtractionException(
              "Could not extract B3-style trace ID from \"" + traceId + "\": " + e.getMessage(),
              e);
        }
      }

      String spanId = headers.get(SPAN_ID_KEY);
      if (spanId != null) {
        try {
          context.setParentId(DDSpanId.fromHex(spanId.trim()));
        } catch (NumberFormatException e) {
          throw new ExtractionException(
              "Could not extract B3-style parent span ID from " + SPAN_ID_KEY + ": " + spanId, e);
        }
      }

      String sampled = headers.get(SAMPLED_KEY);
      if (sampled != null) {
        switch (sampled.trim()) {
          case "1":
            context.setSamplingPriority(PrioritySampling.SAMPLER_KEEP);
            break;
          case "0":
            context.setSamplingPriority(PrioritySampling.SAMPLER_DROP);
            break;
          default:
            throw new ExtractionException(
                "Could not extract B3-style sampling priority from "
                    + SAMPLED_KEY
                    + ": "
                    + sampled);
        }
      }
      return context;
    }
  }
}
