package datadog.segment.api;

import static datadog.segment.api.TracePropagationStyle.DATADOG;
import static datadog.segment.api.TracePropagationStyle.TRACECONTEXT;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ConfigDefaults {

  static final String DEFAULT_SERVICE_NAME = "unnamed-java-app";
  static final String DEFAULT_AGENT_URL = "http://localhost:8126";
  static final double DEFAULT_TRACE_FLUSH_INTERVAL = 2.0;
  static final boolean DEFAULT_TRACE_REPORT_HOSTNAME = false;
  static final String DEFAULT_ID_GENERATION_STRATEGY = "RANDOM";
  static final boolean DEFAULT_TRACE_128_BIT_TRACEID_GENERATION_ENABLED = true;

  static final List<TracePropagationStyle> DEFAULT_TRACE_PROPAGATION_STYLE =
      Collections.unmodifiableList(Arrays.asList(DATADOG, TRACECONTEXT));
  public static final int DEFAULT_TRACE_X_DATADOG_TAGS_MAX_LENGTH = 512;

  public static final int DEFAULT_TRACE_RATE_LIMIT = 100;

  private ConfigDefaults() {}
}
