package datadog.segment.core;

import datadog.segment.api.DDSpanId;
import datadog.segment.api.DDTraceId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

/**
 * The recorded state of one span. Instances are owned by their {@link TraceSegment} and handed to
 * the collector once every span of the segment is finished.
 *
 * <p>Tag maps are guarded by this instance's monitor: they are written both by the span's own
 * thread and by the segment while it injects or finalizes.
 */
public class SpanData {
  private static final AtomicLongFieldUpdater<SpanData> DURATION_NANO_UPDATER =
      AtomicLongFieldUpdater.newUpdater(SpanData.class, "durationNano");

  private final DDTraceId traceId;
  private final long spanId;
  private final long parentId;

  private volatile String operationName;
  private volatile String serviceName;
  private volatile String spanType;
  private volatile String resourceName;

  /** Wall clock start, in nanoseconds since the epoch. */
  private final long startTimeNano;
  /** Monotonic ticks at start, used to compute the duration. */
  private final long startTicks;

  /**
   * The duration in nanoseconds. A value of 0 means the span isn't finished yet. A finished span's
   * duration is at least 1.
   */
  private volatile long durationNano;

  private volatile boolean error;

  private final Map<String, String> tags = new LinkedHashMap<>();
  private final Map<String, Double> numericTags = new LinkedHashMap<>();

  public SpanData(
      DDTraceId traceId,
      long spanId,
      long parentId,
      String operationName,
      String serviceName,
      long startTimeNano,
      long startTicks) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.parentId = parentId;
    this.operationName = operationName;
    this.serviceName = serviceName;
    this.startTimeNano = startTimeNano;
    this.startTicks = startTicks;
  }

  public DDTraceId getTraceId() {
    return traceId;
  }

  public long getSpanId() {
    return spanId;
  }

  /** The parent span id, {@link DDSpanId#ZERO} when the span has no parent. */
  public long getParentId() {
    return parentId;
  }

  public String getOperationName() {
    return operationName;
  }

  public void setOperationName(String operationName) {
    this.operationName = operationName;
  }

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public String getSpanType() {
    return spanType;
  }

  public void setSpanType(String spanType) {
    this.spanType = spanType;
  }

  /** The resource name, defaulting to the operation name. */
  public String getResourceName() {
    String resource = resourceName;
    return resource == null ? operationName : resource;
  }

  public void setResourceName(String resourceName) {
    this.resourceName = resourceName;
  }

  public long getStartTimeNano() {
    return startTimeNano;
  }

  long getStartTicks() {
    return startTicks;
  }

  public long getDurationNano() {
    return durationNano;
  }

  public boolean isFinished() {
    return durationNano != 0;
  }

  /**
   * Records the duration unless one was already recorded.
   *
   * @return {@code true} if this call finished the span
   */
  boolean finish(long durationNano) {
    return DURATION_NANO_UPDATER.compareAndSet(this, 0, Math.max(1, durationNano));
  }

  public boolean isError() {
    return error;
  }

  public void setError(boolean error) {
    this.error = error;
  }

  public synchronized String getTag(String key) {
    return tags.get(key);
  }

  public synchronized void setTag(String key, String value) {
    if (value == null) {
      tags.remove(key);
    } else {
      tags.put(key, value);
    }
  }

  public synchronized void setAllTags(Map<String, String> values) {
    tags.putAll(values);
  }

  public synchronized void removeTag(String key) {
    tags.remove(key);
  }

  /** A snapshot of the string tags, in insertion order. */
  public synchronized Map<String, String> getTags() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }

  public synchronized Double getMetric(String key) {
    return numericTags.get(key);
  }

  public synchronized void setMetric(String key, double value) {
    numericTags.put(key, value);
  }

  /** A snapshot of the numeric tags, in insertion order. */
  public synchronized Map<String, Double> getMetrics() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(numericTags));
  }

  @Override
  public String toString() {
    return "SpanData{"
        + "traceId="
        + traceId
        + ", spanId="
        + DDSpanId.toString(spanId)
        + ", parentId="
        + DDSpanId.toString(parentId)
        + ", operationName='"
        + operationName
        + '\''
        + ", serviceName='"
        + serviceName
        + '\''
        + ", resourceName='"
        + getResourceName()
        + '\''
        + ", durationNano="
        + durationNano
        + ", error="
        + error
        + '}';
  }
}
