package datadog.segment.api;

/** Names of the tags the tracer itself writes on spans. */
public class DDTags {
  /** Prefix of the internal tag namespace that user code can't access. */
  public static final String INTERNAL_TAG_PREFIX = "_dd.";

  /** Prefix of the trace tags propagated across processes. */
  public static final String PROPAGATED_TAG_PREFIX = "_dd.p.";

  public static final String DECISION_MAKER = "_dd.p.dm";
  public static final String TRACE_ID_HIGH_ORDER_BITS = "_dd.p.tid";

  public static final String SAMPLING_PRIORITY = "_sampling_priority_v1";
  public static final String AGENT_SAMPLE_RATE = "_dd.agent_psr";
  public static final String RULE_SAMPLE_RATE = "_dd.rule_psr";
  public static final String LIMITER_SAMPLE_RATE = "_dd.limit_psr";

  public static final String SPAN_SAMPLING_MECHANISM = "_dd.span_sampling.mechanism";
  public static final String SPAN_SAMPLING_RULE_RATE = "_dd.span_sampling.rule_rate";
  public static final String SPAN_SAMPLING_MAX_PER_SECOND = "_dd.span_sampling.max_per_second";

  public static final String ORIGIN = "_dd.origin";
  public static final String HOSTNAME = "_dd.hostname";
  public static final String PARENT_ID = "_dd.parent_id";

  public static final String PROPAGATION_ERROR = "_dd.propagation_error";
  public static final String W3C_EXTRACTION_ERROR = "_dd.w3c_extraction_error";

  public static final String ENV = "env";
  public static final String VERSION = "version";
  public static final String ERROR_MSG = "error.message";
  public static final String ERROR_TYPE = "error.type";
  public static final String ERROR_STACK = "error.stack";

  private DDTags() {}
}
