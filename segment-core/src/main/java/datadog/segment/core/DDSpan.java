package datadog.segment.core;

import static java.util.concurrent.TimeUnit.MICROSECONDS;

import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.core.propagation.CarrierSetter;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents a period of time. The recorded state lives in the {@link SpanData}, owned by the
 * span's {@link TraceSegment}.
 *
 * <p>Spans are created by the {@link CoreTracer#buildSpan}. Finishing a span, explicitly or by
 * closing it, reports it to its trace segment exactly once.
 *
 * <p>Tags prefixed with <code>_dd.</code> are reserved for the tracer: they can't be set, read or
 * removed through this class.
 */
public class DDSpan implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DDSpan.class);

  static DDSpan create(
      @Nonnull CoreTracer tracer, @Nonnull SpanData data, @Nonnull TraceSegment segment) {
    final DDSpan span = new DDSpan(tracer, data, segment);
    log.debug("Started span: {}", span);
    return span;
  }

  private final CoreTracer tracer;
  private final SpanData data;
  private final TraceSegment segment;

  private DDSpan(
      @Nonnull CoreTracer tracer, @Nonnull SpanData data, @Nonnull TraceSegment segment) {
    this.tracer = tracer;
    this.data = data;
    this.segment = segment;
  }

  public DDTraceId getTraceId() {
    return data.getTraceId();
  }

  public long getSpanId() {
    return data.getSpanId();
  }

  public long getParentId() {
    return data.getParentId();
  }

  public TraceSegment getTraceSegment() {
    return segment;
  }

  public SpanData getSpanData() {
    return data;
  }

  public boolean isFinished() {
    return data.isFinished();
  }

  /** Starts a child of this span, in the same trace segment, starting now. */
  public DDSpan createChild(String operationName) {
    return buildChild(operationName).start();
  }

  /** Returns a builder for a child of this span, to set its start time, service or tags. */
  public CoreTracer.CoreSpanBuilder buildChild(String operationName) {
    return tracer.buildSpan(operationName).asChildOf(this);
  }

  /** Writes this span's trace context into the carrier, in every configured injection style. */
  public <C> void inject(C carrier, CarrierSetter<C> setter) {
    segment.inject(carrier, setter, data);
  }

  /** Forces the sampling priority of the whole trace. */
  public void setSamplingPriority(int priority) {
    segment.overrideSamplingPriority(priority);
  }

  public String getOperationName() {
    return data.getOperationName();
  }

  public DDSpan setOperationName(String operationName) {
    data.setOperationName(operationName);
    return this;
  }

  public String getServiceName() {
    return data.getServiceName();
  }

  public DDSpan setServiceName(String serviceName) {
    data.setServiceName(serviceName);
    return this;
  }

  public String getResourceName() {
    return data.getResourceName();
  }

  public DDSpan setResourceName(String resourceName) {
    data.setResourceName(resourceName);
    return this;
  }

  public String getSpanType() {
    return data.getSpanType();
  }

  public DDSpan setSpanType(String spanType) {
    data.setSpanType(spanType);
    return this;
  }

  public String getTag(String key) {
    if (isInternal(key)) {
      return null;
    }
    return data.getTag(key);
  }

  /** Sets a tag, or removes it when the value is {@code null}. */
  public DDSpan setTag(String key, String value) {
    if (isInternal(key)) {
      log.debug("Ignoring internal tag {} set on span {}", key, this);
      return this;
    }
    data.setTag(key, value);
    return this;
  }

  public DDSpan removeTag(String key) {
    if (!isInternal(key)) {
      data.removeTag(key);
    }
    return this;
  }

  public Double getMetric(String key) {
    if (isInternal(key)) {
      return null;
    }
    return data.getMetric(key);
  }

  public DDSpan setMetric(String key, double value) {
    if (isInternal(key)) {
      log.debug("Ignoring internal metric {} set on span {}", key, this);
      return this;
    }
    data.setMetric(key, value);
    return this;
  }

  private static boolean isInternal(String key) {
    return key.startsWith(DDTags.INTERNAL_TAG_PREFIX);
  }

  public boolean isError() {
    return data.isError();
  }

  /** Clearing the error flag also removes the error message and type. */
  public DDSpan setError(boolean error) {
    data.setError(error);
    if (!error) {
      data.removeTag(DDTags.ERROR_MSG);
      data.removeTag(DDTags.ERROR_TYPE);
    }
    return this;
  }

  public DDSpan setErrorMessage(String message) {
    data.setError(true);
    data.setTag(DDTags.ERROR_MSG, message);
    return this;
  }

  public DDSpan setErrorType(String type) {
    data.setError(true);
    data.setTag(DDTags.ERROR_TYPE, type);
    return this;
  }

  public DDSpan setErrorStack(String stack) {
    data.setError(true);
    data.setTag(DDTags.ERROR_STACK, stack);
    return this;
  }

  /** Finishes the span now. */
  public void finish() {
    finishAndAddToTrace(tracer.getTimeSource().getNanoTicks() - data.getStartTicks());
  }

  /**
   * Finishes the span at the given wall clock time.
   *
   * @param stopTimeMicros the end time, in microseconds since the epoch
   */
  public void finish(final long stopTimeMicros) {
    finishAndAddToTrace(MICROSECONDS.toNanos(stopTimeMicros) - data.getStartTimeNano());
  }

  private void finishAndAddToTrace(final long durationNano) {
    // ensure a min duration of 1
    if (data.finish(durationNano)) {
      log.debug("Finished span: {}", this);
      segment.spanFinished();
    } else {
      log.debug("Already finished: {}", this);
    }
  }

  /** Finishes the span now, unless it is already finished. */
  @Override
  public void close() {
    finish();
  }

  @Override
  public String toString() {
    return data.toString();
  }
}
