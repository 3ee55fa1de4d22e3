package datadog.segment.core.propagation;

import static datadog.segment.api.TracePropagationStyle.DATADOG;
import static datadog.segment.api.TracePropagationStyle.TRACECONTEXT;

import datadog.segment.api.Config;
import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpCodec {

  private static final Logger log = LoggerFactory.getLogger(HttpCodec.class);

  public interface Injector {
    <C> void inject(final InjectionContext context, final C carrier, final CarrierSetter<C> setter);
  }

  /** Reads the trace context of one propagation style. */
  public interface Extractor {
    TracePropagationStyle style();

    /**
     * Extracts a propagated context from the given headers.
     *
     * @return a context, without trace id if the headers of this style are absent or invalid.
     * @throws ExtractionException if a numeric header can't be decoded.
     */
    ExtractedContext extract(HeaderLookup headers) throws ExtractionException;
  }

  private HttpCodec() {}

  public static Injector createInjector(List<TracePropagationStyle> styles) {
    List<Injector> injectors = new ArrayList<>(styles.size());
    for (TracePropagationStyle style : styles) {
      switch (style) {
        case DATADOG:
          injectors.add(DatadogHttpCodec.newInjector());
          break;
        case B3MULTI:
          injectors.add(B3HttpCodec.newInjector());
          break;
        case TRACECONTEXT:
          injectors.add(W3CHttpCodec.newInjector());
          break;
        case NONE:
          injectors.add(NoneCodec.INJECTOR);
          break;
        default:
          log.debug("No implementation found to inject propagation style: {}", style);
          break;
      }
    }
    return new CompoundInjector(injectors);
  }

  public static CompoundExtractor createExtractor(Config config) {
    return createExtractor(
        config.getTracePropagationStylesToExtract(), config.getxDatadogTagsMaxLength());
  }

  public static CompoundExtractor createExtractor(
      List<TracePropagationStyle> styles, int datadogTagsLimit) {
    List<Extractor> extractors = new ArrayList<>(styles.size());
    for (TracePropagationStyle style : styles) {
      switch (style) {
        case DATADOG:
          extractors.add(DatadogHttpCodec.newExtractor(datadogTagsLimit));
          break;
        case B3MULTI:
          extractors.add(B3HttpCodec.newExtractor());
          break;
        case TRACECONTEXT:
          extractors.add(W3CHttpCodec.newExtractor());
          break;
        case NONE:
          extractors.add(NoneCodec.EXTRACTOR);
          break;
        default:
          log.debug("No implementation found to extract propagation style: {}", style);
          break;
      }
    }
    return new CompoundExtractor(extractors);
  }

  public static class CompoundInjector implements Injector {

    private final List<Injector> injectors;

    public CompoundInjector(final List<Injector> injectors) {
      this.injectors = injectors;
    }

    @Override
    public <C> void inject(
        final InjectionContext context, final C carrier, final CarrierSetter<C> setter) {
      for (final Injector injector : injectors) {
        injector.inject(context, carrier, setter);
      }
    }
  }

  /** Runs every configured extractor over the same headers and merges their results. */
  public static class CompoundExtractor {
    private final List<Extractor> extractors;
    private final List<TracePropagationStyle> styles;

    public CompoundExtractor(final List<Extractor> extractors) {
      this.extractors = extractors;
      this.styles = new ArrayList<>(extractors.size());
      for (Extractor extractor : extractors) {
        styles.add(extractor.style());
      }
    }

    /**
     * Extracts the trace context from the carrier.
     *
     * @return never {@code null}, a context without trace id when no trace is continued.
     */
    public <C> ExtractedContext extract(final C carrier, final CarrierVisitor<C> visitor) {
      // Extract and cache all headers in advance
      ExtractionCache extractionCache = new ExtractionCache(carrier, visitor);
      Map<TracePropagationStyle, ExtractedContext> results =
          new EnumMap<>(TracePropagationStyle.class);
      Map<String, String> spanTags = new LinkedHashMap<>();

      for (final Extractor extractor : extractors) {
        AuditedHeaders headers = new AuditedHeaders(extractionCache);
        ExtractedContext extracted;
        try {
          extracted = extractor.extract(headers);
        } catch (ExtractionException e) {
          log.error(
              "While extracting trace context in the {} propagation style from the following"
                  + " headers: [{}], an error occurred: {}",
              extractor.style(),
              describe(headers.headersExamined()),
              e.getMessage());
          spanTags.put(DDTags.PROPAGATION_ERROR, DatadogHttpCodec.PROPAGATION_ERROR_DECODING_ERROR);
          continue;
        }
        extracted.addHeadersExamined(headers.headersExamined());
        spanTags.putAll(extracted.getTags());
        results.put(extractor.style(), extracted);
      }

      ExtractedContext context = merge(styles, results);
      context.putAllTags(spanTags);
      if (context.hasTraceId()) {
        log.debug("Extract complete context {}", context);
      } else {
        log.debug("Extract no context");
      }
      return context;
    }
  }

  /**
   * Combines the results of several styles. The first style, in configured order, that found a
   * trace id gives the base context. A W3C result for the same trace then contributes its
   * tracestate and its parent id.
   *
   * @param order the configured extraction styles, by precedence
   * @param results the context extracted by each style
   */
  static ExtractedContext merge(
      List<TracePropagationStyle> order, Map<TracePropagationStyle, ExtractedContext> results) {
    ExtractedContext base = null;
    for (TracePropagationStyle style : order) {
      ExtractedContext candidate = results.get(style);
      if (candidate != null && candidate.hasTraceId()) {
        base = candidate;
        break;
      }
    }
    if (base == null) {
      return new ExtractedContext(order.isEmpty() ? TracePropagationStyle.NONE : order.get(0));
    }

    ExtractedContext merged = new ExtractedContext(base.getPropagationStyle());
    merged.copyFrom(base);

    ExtractedContext w3c = results.get(TRACECONTEXT);
    if (w3c == null
        || !w3c.hasTraceId()
        || !traceIdMatch(merged.getTraceId(), w3c.getTraceId())) {
      return merged;
    }
    merged.setAdditionalW3CTracestate(w3c.getAdditionalW3CTracestate());
    merged.setAdditionalDatadogW3CTracestate(w3c.getAdditionalDatadogW3CTracestate());
    if (base != w3c) {
      merged.addHeadersExamined(w3c.getHeadersExamined());
    }

    if (merged.getParentId() != w3c.getParentId()) {
      String datadogParentId = w3c.getDatadogW3CParentId();
      if (datadogParentId != null && !W3CHttpCodec.ZERO_PARENT_ID.equals(datadogParentId)) {
        merged.setDatadogW3CParentId(datadogParentId);
      } else {
        ExtractedContext datadog = results.get(DATADOG);
        // parent id 0 means no parent
        if (datadog != null
            && datadog.hasTraceId()
            && traceIdMatch(datadog.getTraceId(), w3c.getTraceId())
            && datadog.getParentId() != DDSpanId.ZERO) {
          merged.setDatadogW3CParentId(DDSpanId.toHexStringPadded(datadog.getParentId()));
        }
      }
      merged.setParentId(w3c.getParentId());
    }
    return merged;
  }

  /**
   * Checks if trace identifier matches, even if they are not encoded using the same size (64-bit vs
   * 128-bit).
   *
   * @param a A trace identifier to check.
   * @param b Another trace identifier to check.
   * @return {@code true} if the trace identifiers matches, {@code false} otherwise.
   */
  static boolean traceIdMatch(DDTraceId a, DDTraceId b) {
    if (a.is128Bit() == b.is128Bit()) {
      return a.equals(b);
    } else {
      return a.toLong() == b.toLong();
    }
  }

  private static String describe(List<Map.Entry<String, String>> headers) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> header : headers) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(header.getKey()).append(": ").append(header.getValue());
    }
    return sb.toString();
  }
}
