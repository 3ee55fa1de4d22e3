package datadog.segment.core;

import static java.util.concurrent.TimeUnit.MICROSECONDS;

import datadog.segment.api.Config;
import datadog.segment.api.DDTags;
import datadog.segment.api.DDTraceId;
import datadog.segment.api.IdGenerationStrategy;
import datadog.segment.api.TracePropagationStyle;
import datadog.segment.api.internal.util.LongStringUtils;
import datadog.segment.api.sampling.PrioritySampling;
import datadog.segment.api.sampling.SamplingMechanism;
import datadog.segment.api.time.SystemTimeSource;
import datadog.segment.api.time.TimeSource;
import datadog.segment.common.sampling.SingleSpanSampler;
import datadog.segment.common.sampling.TraceSampler;
import datadog.segment.common.writer.AgentUrl;
import datadog.segment.common.writer.Collector;
import datadog.segment.core.propagation.CarrierVisitor;
import datadog.segment.core.propagation.ExtractedContext;
import datadog.segment.core.propagation.HttpCodec;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entrypoint into the tracer implementation. It creates the root spans of trace segments,
 * either for new traces or for traces continued from extracted headers.
 */
public class CoreTracer {
  private static final Logger log = LoggerFactory.getLogger(CoreTracer.class);

  /** Default service name if none provided on the trace or span */
  final String serviceName;

  private final String env;
  private final String version;
  private final String hostName;
  private final Collector collector;
  private final TraceSampler traceSampler;
  private final SingleSpanSampler singleSpanSampler;
  private final IdGenerationStrategy idGenerationStrategy;
  private final TimeSource timeSource;
  private final List<TracePropagationStyle> injectionStyles;
  private final HttpCodec.Injector injector;
  private final HttpCodec.CompoundExtractor extractor;
  private final int datadogTagsMaxLength;

  public static CoreTracerBuilder builder() {
    return new CoreTracerBuilder();
  }

  public static class CoreTracerBuilder {

    private Config config;
    private String serviceName;
    private Collector collector;
    private TraceSampler traceSampler;
    private SingleSpanSampler singleSpanSampler;
    private IdGenerationStrategy idGenerationStrategy;
    private TimeSource timeSource;

    public CoreTracerBuilder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public CoreTracerBuilder collector(Collector collector) {
      this.collector = collector;
      return this;
    }

    public CoreTracerBuilder traceSampler(TraceSampler traceSampler) {
      this.traceSampler = traceSampler;
      return this;
    }

    public CoreTracerBuilder singleSpanSampler(SingleSpanSampler singleSpanSampler) {
      this.singleSpanSampler = singleSpanSampler;
      return this;
    }

    public CoreTracerBuilder idGenerationStrategy(IdGenerationStrategy idGenerationStrategy) {
      this.idGenerationStrategy = idGenerationStrategy;
      return this;
    }

    public CoreTracerBuilder timeSource(TimeSource timeSource) {
      this.timeSource = timeSource;
      return this;
    }

    public CoreTracerBuilder withProperties(final Properties properties) {
      return config(Config.get(properties));
    }

    public CoreTracerBuilder config(Config config) {
      this.config = config;
      return this;
    }

    private Config config() {
      return config == null ? Config.get() : config;
    }

    /** Returns the first configuration problem found, or {@code null} if there is none. */
    public ConfigError validate() {
      Config config = config();
      ConfigError urlError = AgentUrl.validate(config.getAgentUrl());
      if (urlError != null) {
        return urlError;
      }
      if (collector == null) {
        return new ConfigError(ConfigError.Code.NULL_COLLECTOR, "Collector must not be null.");
      }
      if (!(config.getTraceFlushIntervalSeconds() > 0)) {
        return new ConfigError(
            ConfigError.Code.INVALID_FLUSH_INTERVAL,
            "Flush interval must be a positive number of seconds, got "
                + config.getTraceFlushIntervalSeconds());
      }
      if (config.getxDatadogTagsMaxLength() < 0) {
        return new ConfigError(
            ConfigError.Code.INVALID_TAGS_HEADER_MAX_SIZE,
            "The x-datadog-tags maximum length must not be negative, got "
                + config.getxDatadogTagsMaxLength());
      }
      return null;
    }

    /**
     * Builds the tracer.
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    public CoreTracer build() {
      ConfigError error = validate();
      if (error != null) {
        throw new ConfigurationException(error);
      }
      return new CoreTracer(
          config(),
          serviceName,
          collector,
          traceSampler,
          singleSpanSampler,
          idGenerationStrategy,
          timeSource);
    }
  }

  private CoreTracer(
      final Config config,
      final String serviceName,
      final Collector collector,
      final TraceSampler traceSampler,
      final SingleSpanSampler singleSpanSampler,
      final IdGenerationStrategy idGenerationStrategy,
      final TimeSource timeSource) {
    this.timeSource = timeSource == null ? SystemTimeSource.INSTANCE : timeSource;
    this.serviceName = serviceName == null ? config.getServiceName() : serviceName;
    this.env = config.getEnv();
    this.version = config.getVersion();
    this.hostName = config.getHostName();
    this.collector = collector;
    this.traceSampler =
        traceSampler == null
            ? TraceSampler.Builder.forConfig(config, this.timeSource)
            : traceSampler;
    this.singleSpanSampler =
        singleSpanSampler == null
            ? SingleSpanSampler.Builder.forConfig(config, this.timeSource)
            : singleSpanSampler;
    this.idGenerationStrategy =
        idGenerationStrategy == null ? config.getIdGenerationStrategy() : idGenerationStrategy;
    this.injectionStyles = config.getTracePropagationStylesToInject();
    this.injector = HttpCodec.createInjector(injectionStyles);
    this.extractor = HttpCodec.createExtractor(config);
    this.datadogTagsMaxLength = config.getxDatadogTagsMaxLength();

    log.debug(
        "New instance: service={}, injection={}, extraction={}",
        this.serviceName,
        injectionStyles,
        config.getTracePropagationStylesToExtract());
  }

  TimeSource getTimeSource() {
    return timeSource;
  }

  public CoreSpanBuilder buildSpan(final String operationName) {
    return new CoreSpanBuilder(this, operationName);
  }

  /** Starts the root span of a new trace. */
  public DDSpan startSpan(final String operationName) {
    return buildSpan(operationName).start();
  }

  /**
   * Reads the trace context from the carrier in every configured extraction style.
   *
   * @return the merged context, without trace id when there is no trace to continue
   */
  public <C> ExtractedContext extract(final C carrier, final CarrierVisitor<C> visitor) {
    return extractor.extract(carrier, visitor);
  }

  /**
   * Starts the local root span of a trace continued from the carrier.
   *
   * @return {@code null} if the carrier holds no trace context
   */
  public <C> DDSpan extractSpan(
      final C carrier, final CarrierVisitor<C> visitor, final String operationName) {
    ExtractedContext context = extract(carrier, visitor);
    if (!context.hasTraceId()) {
      log.debug("No trace context to continue: {}", context);
      return null;
    }
    return buildSpan(operationName).asChildOf(context).start();
  }

  /**
   * Starts the local root span of a trace continued from the carrier, or of a new trace if the
   * carrier holds no trace context.
   */
  public <C> DDSpan extractOrCreateSpan(
      final C carrier, final CarrierVisitor<C> visitor, final String operationName) {
    return buildSpan(operationName).asChildOf(extract(carrier, visitor)).start();
  }

  private DDSpan startRootSpan(final CoreSpanBuilder builder, final ExtractedContext extracted) {
    DDTraceId traceId;
    long parentId = 0;
    String origin = null;
    Map<String, String> traceTags = new LinkedHashMap<>();
    SamplingDecision samplingDecision = null;
    String fullW3CTraceIdHex = null;
    String additionalW3CTracestate = null;
    String additionalDatadogW3CTracestate = null;

    if (extracted != null && extracted.hasTraceId()) {
      traceId = extracted.getTraceId();
      parentId = extracted.getParentId();
      origin = extracted.getOrigin();
      traceTags.putAll(extracted.getTraceTags());
      if (extracted.getSamplingPriority() != PrioritySampling.UNSET) {
        samplingDecision =
            SamplingDecision.extracted(
                extracted.getSamplingPriority(),
                SamplingMechanism.fromDecisionMaker(traceTags.get(DDTags.DECISION_MAKER)));
      }
      fullW3CTraceIdHex = extracted.getFullW3CTraceIdHex();
      additionalW3CTracestate = extracted.getAdditionalW3CTracestate();
      additionalDatadogW3CTracestate = extracted.getAdditionalDatadogW3CTracestate();
    } else {
      traceId = idGenerationStrategy.generateTraceId();
    }
    if (traceId.is128Bit()) {
      traceTags.put(
          DDTags.TRACE_ID_HIGH_ORDER_BITS,
          LongStringUtils.toHexStringPadded(traceId.toHighOrderLong(), 16));
    }

    SpanData data = builder.newSpanData(traceId, parentId, serviceName);
    if (extracted != null) {
      data.setAllTags(extracted.getTags());
      if (extracted.getDatadogW3CParentId() != null) {
        data.setTag(DDTags.PARENT_ID, extracted.getDatadogW3CParentId());
      }
    }

    TraceSegment segment =
        new TraceSegment(
            collector,
            traceSampler,
            singleSpanSampler,
            injectionStyles,
            injector,
            hostName,
            origin,
            datadogTagsMaxLength,
            traceTags,
            samplingDecision,
            fullW3CTraceIdHex,
            additionalW3CTracestate,
            additionalDatadogW3CTracestate,
            data);
    return DDSpan.create(this, data, segment);
  }

  /** Spans are built using this builder */
  public static final class CoreSpanBuilder {
    private final CoreTracer tracer;
    private final String operationName;

    private final Map<String, String> tags = new LinkedHashMap<>();
    private long timestampMicro;
    private DDSpan parent;
    private ExtractedContext extracted;
    private String serviceName;
    private String resourceName;
    private String spanType;
    private boolean errorFlag;

    CoreSpanBuilder(final CoreTracer tracer, final String operationName) {
      this.tracer = tracer;
      this.operationName = operationName;
    }

    /** Makes the span a child of the given span, in the same trace segment. */
    public CoreSpanBuilder asChildOf(final DDSpan parent) {
      this.parent = parent;
      this.extracted = null;
      return this;
    }

    /**
     * Makes the span the local root of the extracted trace. A context without trace id starts a
     * new trace, still carrying the context's extraction tags.
     */
    public CoreSpanBuilder asChildOf(final ExtractedContext extracted) {
      this.extracted = extracted;
      this.parent = null;
      return this;
    }

    public CoreSpanBuilder withServiceName(final String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public CoreSpanBuilder withResourceName(final String resourceName) {
      this.resourceName = resourceName;
      return this;
    }

    public CoreSpanBuilder withSpanType(final String spanType) {
      this.spanType = spanType;
      return this;
    }

    public CoreSpanBuilder withErrorFlag() {
      this.errorFlag = true;
      return this;
    }

    /** Internal <code>_dd.</code> tags are ignored. */
    public CoreSpanBuilder withTag(final String tag, final String value) {
      if (tag.startsWith(DDTags.INTERNAL_TAG_PREFIX)) {
        return this;
      }
      if (value == null || value.isEmpty()) {
        tags.remove(tag);
      } else {
        tags.put(tag, value);
      }
      return this;
    }

    /** @param timestampMicro the start time in microseconds since the epoch */
    public CoreSpanBuilder withStartTimestamp(final long timestampMicro) {
      this.timestampMicro = timestampMicro;
      return this;
    }

    public DDSpan start() {
      if (parent == null) {
        return tracer.startRootSpan(this, extracted);
      }
      SpanData data =
          newSpanData(parent.getTraceId(), parent.getSpanId(), parent.getServiceName());
      if (data.getSpanType() == null) {
        data.setSpanType(parent.getSpanType());
      }
      TraceSegment segment = parent.getTraceSegment();
      segment.registerSpan(data);
      return DDSpan.create(tracer, data, segment);
    }

    private SpanData newSpanData(
        final DDTraceId traceId, final long parentId, final String defaultServiceName) {
      final TimeSource timeSource = tracer.timeSource;
      final long startTimeNano;
      final long startTicks;
      if (timestampMicro <= 0L) {
        startTimeNano = timeSource.getCurrentTimeNanos();
        startTicks = timeSource.getNanoTicks();
      } else {
        // Shift the monotonic start so that durations are measured from the given time
        startTimeNano = MICROSECONDS.toNanos(timestampMicro);
        startTicks = timeSource.getNanoTicks() - (timeSource.getCurrentTimeNanos() - startTimeNano);
      }
      SpanData data =
          new SpanData(
              traceId,
              tracer.idGenerationStrategy.generateSpanId(),
              parentId,
              operationName,
              serviceName == null ? defaultServiceName : serviceName,
              startTimeNano,
              startTicks);
      data.setResourceName(resourceName);
      data.setSpanType(spanType);
      data.setError(errorFlag);
      if (tracer.env != null) {
        data.setTag(DDTags.ENV, tracer.env);
      }
      if (tracer.version != null) {
        data.setTag(DDTags.VERSION, tracer.version);
      }
      data.setAllTags(tags);
      return data;
    }
  }
}
