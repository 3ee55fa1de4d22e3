package datadog.segment.api.config;

/**
 * A list of keys to be used with {@link datadog.segment.api.Config}. Each key is read from the
 * system property <code>dd.&lt;key&gt;</code>, then from the environment variable <code>
 * DD_&lt;KEY&gt;</code> (dots and dashes replaced by underscores).
 */
public final class TracerConfig {
  public static final String SERVICE_NAME = "service";
  public static final String ENV = "env";
  public static final String VERSION = "version";
  public static final String TRACE_REPORT_HOSTNAME = "trace.report-hostname";

  public static final String ID_GENERATION_STRATEGY = "id.generation.strategy";
  public static final String TRACE_128_BIT_TRACEID_GENERATION_ENABLED =
      "trace.128.bit.traceid.generation.enabled";

  public static final String TRACE_AGENT_URL = "trace.agent.url";
  public static final String TRACE_FLUSH_INTERVAL = "trace.flush.interval";

  public static final String TRACE_PROPAGATION_STYLE = "trace.propagation.style";
  public static final String TRACE_PROPAGATION_STYLE_EXTRACT = "trace.propagation.style.extract";
  public static final String TRACE_PROPAGATION_STYLE_INJECT = "trace.propagation.style.inject";
  public static final String TRACE_X_DATADOG_TAGS_MAX_LENGTH = "trace.x-datadog-tags.max.length";

  // JSON rules
  public static final String TRACE_SAMPLING_RULES = "trace.sampling.rules";
  public static final String SPAN_SAMPLING_RULES = "span.sampling.rules";
  public static final String SPAN_SAMPLING_RULES_FILE = "span.sampling.rules.file";
  // a global rate used for all services (that don't have a dedicated rule defined).
  public static final String TRACE_SAMPLE_RATE = "trace.sample.rate";
  public static final String TRACE_RATE_LIMIT = "trace.rate.limit";

  private TracerConfig() {}
}
