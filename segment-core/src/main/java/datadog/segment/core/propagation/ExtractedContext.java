package datadog.segment.core.propagation;

import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.sampling.PrioritySampling;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trace context read from inbound headers. A context without a {@link #getTraceId() trace id}
 * carries no trace to continue, but may still hold {@link #getTags() span tags} describing
 * extraction errors.
 */
public class ExtractedContext {
  private final TracePropagationStyle style;
  private DDTraceId traceId;
  private long parentId = DDSpanId.ZERO;
  private int samplingPriority = PrioritySampling.UNSET;
  private String origin;
  private final Map<String, String> traceTags = new LinkedHashMap<>();
  private String fullW3CTraceIdHex;
  private String additionalW3CTracestate;
  private String additionalDatadogW3CTracestate;
  private String datadogW3CParentId;
  private final List<Map.Entry<String, String>> headersExamined = new ArrayList<>();
  private final Map<String, String> tags = new LinkedHashMap<>();

  ExtractedContext(TracePropagationStyle style) {
    this.style = style;
  }

  /** The style this context was read with, the base style once merged. */
  public TracePropagationStyle getPropagationStyle() {
    return style;
  }

  public DDTraceId getTraceId() {
    return traceId;
  }

  /** A zero trace id doesn't identify a trace. */
  public boolean hasTraceId() {
    return traceId != null && !DDTraceId.ZERO.equals(traceId);
  }

  void setTraceId(DDTraceId traceId) {
    this.traceId = traceId;
  }

  /** The parent span id, {@link DDSpanId#ZERO} if absent. */
  public long getParentId() {
    return parentId;
  }

  void setParentId(long parentId) {
    this.parentId = parentId;
  }

  /** The upstream sampling priority, {@link PrioritySampling#UNSET} if absent. */
  public int getSamplingPriority() {
    return samplingPriority;
  }

  void setSamplingPriority(int samplingPriority) {
    this.samplingPriority = samplingPriority;
  }

  public String getOrigin() {
    return origin;
  }

  void setOrigin(String origin) {
    this.origin = origin;
  }

  /** The propagated <code>_dd.p.*</code> trace tags. */
  public Map<String, String> getTraceTags() {
    return Collections.unmodifiableMap(traceTags);
  }

  void putTraceTag(String key, String value) {
    traceTags.put(key, value);
  }

  /** The 32 hex digit trace id read from <code>traceparent</code>, kept verbatim. */
  public String getFullW3CTraceIdHex() {
    return fullW3CTraceIdHex;
  }

  void setFullW3CTraceIdHex(String fullW3CTraceIdHex) {
    this.fullW3CTraceIdHex = fullW3CTraceIdHex;
  }

  /** The <code>tracestate</code> entries of other vendors. */
  public String getAdditionalW3CTracestate() {
    return additionalW3CTracestate;
  }

  void setAdditionalW3CTracestate(String additionalW3CTracestate) {
    this.additionalW3CTracestate = additionalW3CTracestate;
  }

  /** The unrecognized fields of the <code>dd</code> <code>tracestate</code> entry. */
  public String getAdditionalDatadogW3CTracestate() {
    return additionalDatadogW3CTracestate;
  }

  void setAdditionalDatadogW3CTracestate(String additionalDatadogW3CTracestate) {
    this.additionalDatadogW3CTracestate = additionalDatadogW3CTracestate;
  }

  /**
   * The 16 hex digit id of the last Datadog span upstream, when it differs from the W3C parent.
   * It is only reported, it doesn't change the local span hierarchy.
   */
  public String getDatadogW3CParentId() {
    return datadogW3CParentId;
  }

  void setDatadogW3CParentId(String datadogW3CParentId) {
    this.datadogW3CParentId = datadogW3CParentId;
  }

  /** The headers read while extracting, as name and value pairs. */
  public List<Map.Entry<String, String>> getHeadersExamined() {
    return Collections.unmodifiableList(headersExamined);
  }

  void addHeadersExamined(List<Map.Entry<String, String>> headers) {
    headersExamined.addAll(headers);
  }

  /** Tags for the local root span, like extraction errors. */
  public Map<String, String> getTags() {
    return Collections.unmodifiableMap(tags);
  }

  void putTag(String key, String value) {
    tags.put(key, value);
  }

  void putAllTags(Map<String, String> values) {
    tags.putAll(values);
  }

  /** Copies every field of the given context except its style. */
  void copyFrom(ExtractedContext other) {
    this.traceId = other.traceId;
    this.parentId = other.parentId;
    this.samplingPriority = other.samplingPriority;
    this.origin = other.origin;
    this.traceTags.putAll(other.traceTags);
    this.fullW3CTraceIdHex = other.fullW3CTraceIdHex;
    this.additionalW3CTracestate = other.additionalW3CTracestate;
    this.additionalDatadogW3CTracestate = other.additionalDatadogW3CTracestate;
    this.datadogW3CParentId = other.datadogW3CParentId;
    this.headersExamined.addAll(other.headersExamined);
    this.tags.putAll(other.tags);
  }

  @Override
  public String toString() {
    return "ExtractedContext{"
        + "style="
        + style
        + ", traceId="
        + traceId
        + ", parentId="
        + DDSpanId.toString(parentId)
        + ", samplingPriority="
        + samplingPriority
        + ", origin='"
        + origin
        + '\''
        + ", traceTags="
        + traceTags
        + ", datadogW3CParentId='"
        + datadogW3CParentId
        + '\''
        + ", tags="
        + tags
        + '}';
  }
}
