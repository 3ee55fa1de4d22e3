package datadog.segment.core;

import datadog.segment.api.DDTags;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.sampling.SamplingMechanism;
import datadog.segment.common.sampling.SamplingRule;
import datadog.segment.common.sampling.SingleSpanSampler;
import datadog.segment.common.sampling.TraceSampler;
import datadog.segment.common.writer.Collector;
import datadog.segment.common.writer.CollectorException;
import datadog.segment.core.propagation.CarrierSetter;
import datadog.segment.core.propagation.DatadogTags;
import datadog.segment.core.propagation.HttpCodec;
import datadog.segment.core.propagation.InjectionContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The spans of one trace created in this process, shared by all of them.
 *
 * <p>The segment is complete once every registered span is finished. The span finishing last
 * stamps the sampling decision and trace level tags onto the spans, then hands them to the {@link
 * Collector}. That happens exactly once, and no span can be registered afterwards.
 *
 * <p>All the mutable state is guarded by this instance's monitor, except the collector call which
 * runs after releasing it.
 */
public class TraceSegment {
  private static final Logger log = LoggerFactory.getLogger(TraceSegment.class);

  static final String PROPAGATION_ERROR_INJECT_MAX_SIZE = "inject_max_size";

  private final Collector collector;
  private final TraceSampler traceSampler;
  private final SingleSpanSampler spanSampler;
  private final List<TracePropagationStyle> injectionStyles;
  private final HttpCodec.Injector injector;
  private final String hostName;
  private final String origin;
  private final int datadogTagsMaxLength;
  private final String fullW3CTraceIdHex;
  private final String additionalW3CTracestate;
  private final String additionalDatadogW3CTracestate;
  private final SpanData localRootSpan;

  // Guarded by this
  private final List<SpanData> spans = new ArrayList<>();
  private final Map<String, String> traceTags;
  private int finishedSpans;
  private SamplingDecision samplingDecision;
  private boolean sealed;

  TraceSegment(
      @Nonnull Collector collector,
      @Nonnull TraceSampler traceSampler,
      SingleSpanSampler spanSampler,
      @Nonnull List<TracePropagationStyle> injectionStyles,
      @Nonnull HttpCodec.Injector injector,
      String hostName,
      String origin,
      int datadogTagsMaxLength,
      Map<String, String> traceTags,
      SamplingDecision samplingDecision,
      String fullW3CTraceIdHex,
      String additionalW3CTracestate,
      String additionalDatadogW3CTracestate,
      @Nonnull SpanData localRootSpan) {
    this.collector = collector;
    this.traceSampler = traceSampler;
    this.spanSampler = spanSampler;
    this.injectionStyles = injectionStyles;
    this.injector = injector;
    this.hostName = hostName;
    this.origin = origin;
    this.datadogTagsMaxLength = datadogTagsMaxLength;
    this.traceTags = traceTags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(traceTags);
    this.samplingDecision = samplingDecision;
    this.fullW3CTraceIdHex = fullW3CTraceIdHex;
    this.additionalW3CTracestate = additionalW3CTracestate;
    this.additionalDatadogW3CTracestate = additionalDatadogW3CTracestate;
    this.localRootSpan = localRootSpan;
    this.spans.add(localRootSpan);
  }

  /**
   * Adds a span to this segment.
   *
   * @throws IllegalStateException if every span of the segment already finished
   */
  public synchronized void registerSpan(SpanData span) {
    if (sealed) {
      throw new IllegalStateException(
          "Can't register span " + span + " to a finished trace segment");
    }
    spans.add(span);
  }

  /**
   * Called once by every span when it finishes. The call finishing the last span finalizes the
   * segment and sends it.
   *
   * @throws IllegalStateException if there are more calls than registered spans
   */
  void spanFinished() {
    List<SpanData> trace;
    synchronized (this) {
      if (finishedSpans >= spans.size()) {
        throw new IllegalStateException(
            "More spans finished than registered in the trace segment, " + spans.size() + " total");
      }
      if (++finishedSpans < spans.size()) {
        return;
      }
      sealed = true;
      finalizeTrace();
      trace = Collections.unmodifiableList(new ArrayList<>(spans));
    }
    send(trace);
  }

  // Guarded by this
  private void finalizeTrace() {
    SpanData localRoot = localRootSpan;
    makeSamplingDecisionIfNull();
    SamplingDecision decision = samplingDecision;

    if (decision.getPriority() <= 0 && spanSampler != null) {
      for (SpanData span : spans) {
        sampleSpan(span);
      }
    }

    localRoot.setAllTags(traceTags);
    localRoot.setMetric(DDTags.SAMPLING_PRIORITY, decision.getPriority());
    if (hostName != null) {
      localRoot.setTag(DDTags.HOSTNAME, hostName);
    }
    if (decision.getOrigin() == SamplingDecision.Origin.LOCAL && decision.getMechanism() != null) {
      int mechanism = decision.getMechanism();
      Double rate = decision.getConfiguredRate();
      if (mechanism == SamplingMechanism.AGENT_RATE || mechanism == SamplingMechanism.DEFAULT) {
        if (rate != null) {
          localRoot.setMetric(DDTags.AGENT_SAMPLE_RATE, rate);
        }
      } else if (mechanism == SamplingMechanism.LOCAL_USER_RULE) {
        if (rate != null) {
          localRoot.setMetric(DDTags.RULE_SAMPLE_RATE, rate);
        }
        if (decision.getLimiterEffectiveRate() != null) {
          localRoot.setMetric(DDTags.LIMITER_SAMPLE_RATE, decision.getLimiterEffectiveRate());
        }
      }
    }

    if (origin != null) {
      for (SpanData span : spans) {
        span.setTag(DDTags.ORIGIN, origin);
      }
    }
  }

  private void sampleSpan(SpanData span) {
    SamplingRule.SpanSamplingRule rule = spanSampler.match(span);
    if (rule == null) {
      return;
    }
    SamplingDecision decision = rule.decide(span);
    if (!decision.isKeep()) {
      return;
    }
    span.setMetric(DDTags.SPAN_SAMPLING_MECHANISM, decision.getMechanism());
    span.setMetric(DDTags.SPAN_SAMPLING_RULE_RATE, decision.getConfiguredRate());
    if (decision.getLimiterMaxPerSecond() != null) {
      span.setMetric(DDTags.SPAN_SAMPLING_MAX_PER_SECOND, decision.getLimiterMaxPerSecond());
    }
  }

  private void send(List<SpanData> trace) {
    try {
      collector.send(trace, traceSampler);
    } catch (CollectorException e) {
      log.error(
          "Error sending trace segment of {} span(s) with trace id {} to the collector",
          trace.size(),
          trace.get(0).getTraceId(),
          e);
    } catch (RuntimeException e) {
      log.error(
          "Unexpected error sending trace segment of {} span(s) with trace id {} to the collector",
          trace.size(),
          trace.get(0).getTraceId(),
          e);
    }
  }

  // Guarded by this
  private void makeSamplingDecisionIfNull() {
    if (samplingDecision == null) {
      samplingDecision = traceSampler.decide(localRootSpan);
      updateDecisionMaker();
    }
  }

  // Guarded by this
  private void updateDecisionMaker() {
    SamplingDecision decision = samplingDecision;
    if (decision.getPriority() > 0) {
      if (decision.getMechanism() != null) {
        traceTags.put(
            DDTags.DECISION_MAKER, SamplingMechanism.toDecisionMaker(decision.getMechanism()));
      }
    } else {
      traceTags.remove(DDTags.DECISION_MAKER);
    }
  }

  /** Returns the current sampling decision, {@code null} until one is made. */
  public synchronized SamplingDecision getSamplingDecision() {
    return samplingDecision;
  }

  /** Forces the sampling priority of the trace. The last call wins. */
  public synchronized void overrideSamplingPriority(int priority) {
    samplingDecision = SamplingDecision.manual(priority);
    updateDecisionMaker();
  }

  /**
   * Writes the trace context of the given span into the carrier, in every configured injection
   * style. A sampling decision is made first if there is none yet.
   */
  public <C> void inject(C carrier, CarrierSetter<C> setter, SpanData span) {
    if (injectsNothing()) {
      return;
    }
    InjectionContext context;
    synchronized (this) {
      makeSamplingDecisionIfNull();
      String datadogTagsHeader = null;
      if (injectionStyles.contains(TracePropagationStyle.DATADOG)
          || injectionStyles.contains(TracePropagationStyle.B3MULTI)) {
        datadogTagsHeader = encodeDatadogTags();
      }
      context =
          new InjectionContext(
              span.getTraceId(),
              span.getSpanId(),
              samplingDecision.getPriority(),
              origin,
              new LinkedHashMap<>(traceTags),
              datadogTagsHeader,
              fullW3CTraceIdHex,
              additionalW3CTracestate,
              additionalDatadogW3CTracestate);
    }
    injector.inject(context, carrier, setter);
  }

  private boolean injectsNothing() {
    for (TracePropagationStyle style : injectionStyles) {
      if (style != TracePropagationStyle.NONE) {
        return false;
      }
    }
    return true;
  }

  // Guarded by this
  private String encodeDatadogTags() {
    String encoded = DatadogTags.encode(traceTags);
    if (encoded.isEmpty()) {
      return null;
    }
    if (encoded.length() > datadogTagsMaxLength) {
      log.error(
          "Serialized x-datadog-tags header value is too large. The configured maximum size is {}"
              + " bytes, but the encoded value is {} bytes.",
          datadogTagsMaxLength,
          encoded.length());
      localRootSpan.setTag(DDTags.PROPAGATION_ERROR, PROPAGATION_ERROR_INJECT_MAX_SIZE);
      return null;
    }
    return encoded;
  }

  public SpanData getLocalRootSpan() {
    return localRootSpan;
  }

  /** A snapshot of the spans, local root first. */
  public synchronized List<SpanData> getSpans() {
    return Collections.unmodifiableList(new ArrayList<>(spans));
  }

  public synchronized int getFinishedSpanCount() {
    return finishedSpans;
  }

  /** A snapshot of the propagated trace tags. */
  public synchronized Map<String, String> getTraceTags() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(traceTags));
  }

  public String getOrigin() {
    return origin;
  }

  @Override
  public synchronized String toString() {
    return "TraceSegment{"
        + "traceId="
        + localRootSpan.getTraceId()
        + ", spans="
        + spans.size()
        + ", finished="
        + finishedSpans
        + ", samplingDecision="
        + samplingDecision
        + '}';
  }
}
