package datadog.segment.core.propagation;

import datadog.segment.api.DDTraceId;
import java.util.Map;

/**
 * What injectors write for one span: a consistent snapshot of the trace segment state taken under
 * its lock.
 */
public final class InjectionContext {
  private final DDTraceId traceId;
  private final long spanId;
  private final int samplingPriority;
  private final String origin;
  private final Map<String, String> traceTags;
  private final String datadogTagsHeader;
  private final String fullW3CTraceIdHex;
  private final String additionalW3CTracestate;
  private final String additionalDatadogW3CTracestate;

  public InjectionContext(
      DDTraceId traceId,
      long spanId,
      int samplingPriority,
      String origin,
      Map<String, String> traceTags,
      String datadogTagsHeader,
      String fullW3CTraceIdHex,
      String additionalW3CTracestate,
      String additionalDatadogW3CTracestate) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.samplingPriority = samplingPriority;
    this.origin = origin;
    this.traceTags = traceTags;
    this.datadogTagsHeader = datadogTagsHeader;
    this.fullW3CTraceIdHex = fullW3CTraceIdHex;
    this.additionalW3CTracestate = additionalW3CTracestate;
    this.additionalDatadogW3CTracestate = additionalDatadogW3CTracestate;
  }

  public DDTraceId getTraceId() {
    return traceId;
  }

  public long getSpanId() {
    return spanId;
  }

  public int getSamplingPriority() {
    return samplingPriority;
  }

  public String getOrigin() {
    return origin;
  }

  public Map<String, String> getTraceTags() {
    return traceTags;
  }

  /**
   * The encoded <code>x-datadog-tags</code> value, {@code null} when there are no trace tags or
   * the encoding is too large to propagate.
   */
  public String getDatadogTagsHeader() {
    return datadogTagsHeader;
  }

  public String getFullW3CTraceIdHex() {
    return fullW3CTraceIdHex;
  }

  public String getAdditionalW3CTracestate() {
    return additionalW3CTracestate;
  }

  public String getAdditionalDatadogW3CTracestate() {
    return additionalDatadogW3CTracestate;
  }
}
